package com.autonomous.scanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One unit of requested scan work, tracked from submission to its terminal outcome.
 * Instances handed out by the store are detached copies; mutating them has no effect
 * on persisted state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Task {
    private String id;
    private List<String> command;
    private TaskStatus status;
    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
    private ScanResult result;  // only when COMPLETED
    private String error;       // only when FAILED
    private Duration duration;
}
