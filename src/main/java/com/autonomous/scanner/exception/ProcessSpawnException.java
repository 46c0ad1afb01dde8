package com.autonomous.scanner.exception;

/**
 * The external tool could not be started at all (missing, not executable, ...).
 * Points at a misconfiguration rather than a bad target.
 */
public class ProcessSpawnException extends ScanTaskException {

    public ProcessSpawnException(String executable, Throwable cause) {
        super("Failed to start " + executable + ": " + cause.getMessage(), cause);
    }
}
