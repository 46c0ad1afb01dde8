package com.autonomous.scanner.service;

import com.autonomous.scanner.model.ScanProfile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class ScanProfileService {

    static final String BUNDLED_PROFILES = "/scan-profiles.yaml";

    @Value("${scanner.profiles.path:}")
    private String profilesPath;

    private final Map<String, ScanProfile> profiles = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper;

    public ScanProfileService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void setProfilesPath(String path) {
        this.profilesPath = path;
    }

    @PostConstruct
    public void loadProfiles() {
        profiles.clear();

        ProfileFile file = null;
        if (profilesPath != null && !profilesPath.isBlank()) {
            File external = new File(profilesPath);
            if (external.isFile()) {
                try {
                    file = yamlMapper.readValue(external, ProfileFile.class);
                    log.info("Loaded scan profiles from {}", external);
                } catch (IOException e) {
                    log.error("Failed to load scan profiles from {}: {}", external, e.getMessage());
                }
            } else {
                log.warn("Scan profile file not found: {}, using bundled profiles", profilesPath);
            }
        }

        if (file == null) {
            file = loadBundled();
        }

        for (ScanProfile profile : file.getProfiles()) {
            if (profile.getName() == null || profile.getName().isBlank()) {
                log.warn("Ignoring scan profile without a name");
                continue;
            }
            if (profile.getMinWaitSeconds() > profile.getMaxWaitSeconds()) {
                log.warn("Ignoring scan profile {}: min wait {}s exceeds max wait {}s",
                    profile.getName(), profile.getMinWaitSeconds(), profile.getMaxWaitSeconds());
                continue;
            }
            profiles.put(profile.getName().toLowerCase(), profile);
        }
        log.info("Scan profiles available: {}", profiles.keySet());
    }

    public Optional<ScanProfile> getProfile(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(name.toLowerCase()));
    }

    public Map<String, ScanProfile> getAllProfiles() {
        return Map.copyOf(profiles);
    }

    private ProfileFile loadBundled() {
        try (InputStream in = ScanProfileService.class.getResourceAsStream(BUNDLED_PROFILES)) {
            if (in == null) {
                throw new IllegalStateException("Bundled scan profiles missing: " + BUNDLED_PROFILES);
            }
            return yamlMapper.readValue(in, ProfileFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Bundled scan profiles unreadable: " + e.getMessage(), e);
        }
    }

    @Data
    static class ProfileFile {
        private List<ScanProfile> profiles = new ArrayList<>();
    }
}
