package com.autonomous.scanner.service;

import com.autonomous.scanner.model.ScanProfile;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Service
public class ScanCommandBuilder {

    private static final String XML_OUTPUT_FLAG = "-oX";
    private static final String STDOUT = "-";

    @Value("${scanner.nmap-path:nmap}")
    private String nmapPath;

    @Value("${scanner.sync-timeout:30}")
    private int defaultWaitSeconds;

    public void setNmapPath(String nmapPath) {
        this.nmapPath = nmapPath;
    }

    public void setDefaultWaitSeconds(int defaultWaitSeconds) {
        this.defaultWaitSeconds = defaultWaitSeconds;
    }

    public List<String> buildProfileCommand(ScanProfile profile, String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Target must not be empty");
        }
        String trimmed = target.trim();
        // a leading dash would be read by nmap as an option, not a host
        if (trimmed.startsWith("-") || trimmed.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid target: " + target);
        }

        List<String> command = new ArrayList<>();
        command.add(nmapPath);
        command.addAll(profile.getArguments());
        command.add(trimmed);
        return command;
    }

    /**
     * Builds the vector for a free-form nmap command line. A leading {@code nmap} is
     * replaced by the configured executable (or the executable is prepended), and the
     * XML report is always routed to stdout so the result can be parsed.
     */
    public List<String> buildCustomCommand(String commandLine) {
        List<String> parts = tokenize(commandLine);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }

        String first = parts.get(0);
        if (first.equals("nmap") || first.equals(nmapPath)) {
            parts.set(0, nmapPath);
        } else {
            parts.add(0, nmapPath);
        }
        if (parts.size() == 1) {
            throw new IllegalArgumentException("Command has no nmap arguments");
        }

        int xmlFlag = parts.indexOf(XML_OUTPUT_FLAG);
        if (xmlFlag < 0) {
            parts.add(1, XML_OUTPUT_FLAG);
            parts.add(2, STDOUT);
        } else if (xmlFlag == parts.size() - 1) {
            parts.add(STDOUT);
        } else {
            parts.set(xmlFlag + 1, STDOUT);
        }
        return parts;
    }

    public Duration resolveWaitBudget(ScanProfile profile, Integer requestedSeconds) {
        int seconds = requestedSeconds != null ? requestedSeconds
            : Math.max(profile.getMinWaitSeconds(), Math.min(defaultWaitSeconds, profile.getMaxWaitSeconds()));

        if (seconds < profile.getMinWaitSeconds() || seconds > profile.getMaxWaitSeconds()) {
            throw new IllegalArgumentException(String.format(
                "timeout for %s scans must be between %d and %d seconds, got %d",
                profile.getName(), profile.getMinWaitSeconds(), profile.getMaxWaitSeconds(), seconds));
        }
        return Duration.ofSeconds(seconds);
    }

    // quotes and backslash escapes group words; nothing is expanded
    List<String> tokenize(String commandLine) {
        List<String> tokens = new ArrayList<>();
        if (commandLine == null) {
            return tokens;
        }

        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else if (c == '\\' && quote == '"' && i + 1 < commandLine.length()) {
                    current.append(commandLine.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (c == '\\' && i + 1 < commandLine.length()) {
                current.append(commandLine.charAt(++i));
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }

        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in command: " + commandLine);
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
