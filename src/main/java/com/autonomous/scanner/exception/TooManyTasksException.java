package com.autonomous.scanner.exception;

import lombok.Getter;

/**
 * Admission refused because the concurrency ceiling is reached. Safe to retry later.
 */
@Getter
public class TooManyTasksException extends ScanTaskException {

    private final int limit;

    public TooManyTasksException(int limit) {
        super(String.format("Server busy: %d scan tasks already running, retry later", limit));
        this.limit = limit;
    }
}
