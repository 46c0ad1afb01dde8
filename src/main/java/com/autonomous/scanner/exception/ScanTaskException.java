package com.autonomous.scanner.exception;

public class ScanTaskException extends RuntimeException {

    public ScanTaskException(String message) {
        super(message);
    }

    public ScanTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
