package com.autonomous.scanner.exception;

import lombok.Getter;

@Getter
public class ScanParseException extends ScanTaskException {

    private static final int MAX_FRAGMENT = 200;

    private final String fragment;

    public ScanParseException(String message, String output) {
        this(message, output, null);
    }

    public ScanParseException(String message, String output, Throwable cause) {
        super(message + ": " + fragmentOf(output), cause);
        this.fragment = fragmentOf(output);
    }

    private static String fragmentOf(String output) {
        if (output == null || output.isBlank()) {
            return "<empty output>";
        }
        String trimmed = output.strip();
        return trimmed.length() <= MAX_FRAGMENT ? trimmed : trimmed.substring(0, MAX_FRAGMENT) + "...";
    }
}
