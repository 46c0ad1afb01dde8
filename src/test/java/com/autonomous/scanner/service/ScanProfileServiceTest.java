package com.autonomous.scanner.service;

import com.autonomous.scanner.model.ScanProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScanProfileServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBundledProfiles() {
        ScanProfileService service = new ScanProfileService();
        service.loadProfiles();

        assertEquals(3, service.getAllProfiles().size());

        ScanProfile quick = service.getProfile("quick").orElseThrow();
        assertTrue(quick.getArguments().containsAll(List.of("-F", "-oX")));
        assertEquals(5, quick.getMinWaitSeconds());
        assertEquals(300, quick.getMaxWaitSeconds());
        assertFalse(quick.isCustom());

        ScanProfile full = service.getProfile("FULL").orElseThrow();
        assertTrue(full.getArguments().contains("1-65535"));
        assertEquals(600, full.getMaxWaitSeconds());

        ScanProfile custom = service.getProfile("custom").orElseThrow();
        assertTrue(custom.isCustom());
        assertTrue(custom.isKeepRawOutput());
        assertFalse(quick.isKeepRawOutput());
        assertTrue(service.getProfile("stealth").isEmpty());
        assertTrue(service.getProfile(null).isEmpty());
    }

    @Test
    void shouldLoadExternalProfilesAndSkipInvalidOnes() throws Exception {
        Path file = tempDir.resolve("profiles.yaml");
        Files.writeString(file, String.join("\n",
            "profiles:",
            "  - name: Ping",
            "    description: host discovery only",
            "    arguments: [\"-sn\", \"-oX\", \"-\"]",
            "    min_wait_seconds: 1",
            "    max_wait_seconds: 60",
            "  - name: broken",
            "    min_wait_seconds: 100",
            "    max_wait_seconds: 10",
            "  - description: no name",
            ""));

        ScanProfileService service = new ScanProfileService();
        service.setProfilesPath(file.toString());
        service.loadProfiles();

        assertEquals(1, service.getAllProfiles().size());
        ScanProfile ping = service.getProfile("ping").orElseThrow();
        assertEquals(List.of("-sn", "-oX", "-"), ping.getArguments());
        assertEquals(1, ping.getMinWaitSeconds());
        assertEquals(60, ping.getMaxWaitSeconds());
    }

    @Test
    void shouldFallBackToBundledProfilesWhenFileMissing() {
        ScanProfileService service = new ScanProfileService();
        service.setProfilesPath(tempDir.resolve("absent.yaml").toString());
        service.loadProfiles();

        assertTrue(service.getProfile("quick").isPresent());
    }
}
