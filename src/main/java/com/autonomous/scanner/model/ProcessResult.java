package com.autonomous.scanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class ProcessResult {
    String output;
    String errorOutput;
    int exitCode;
    Duration elapsed;

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String combinedOutput() {
        if (errorOutput == null || errorOutput.isEmpty()) {
            return output;
        }
        return output + errorOutput;
    }
}
