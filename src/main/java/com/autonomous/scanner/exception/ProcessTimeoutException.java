package com.autonomous.scanner.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class ProcessTimeoutException extends ScanTaskException {

    private final Duration timeout;

    public ProcessTimeoutException(Duration timeout) {
        super("Scan timed out after " + describe(timeout));
        this.timeout = timeout;
    }

    private static String describe(Duration timeout) {
        return timeout.toMillis() % 1000 == 0
            ? timeout.toSeconds() + " seconds"
            : timeout.toMillis() + " ms";
    }
}
