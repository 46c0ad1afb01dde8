package com.autonomous.scanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Task record without the (possibly large) result, for status polling.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskStatusView {
    String id;
    TaskStatus status;
    Instant createdAt;
    Instant startedAt;
    Instant finishedAt;
    String error;

    public static TaskStatusView of(Task task) {
        return TaskStatusView.builder()
            .id(task.getId())
            .status(task.getStatus())
            .createdAt(task.getCreatedAt())
            .startedAt(task.getStartedAt())
            .finishedAt(task.getFinishedAt())
            .error(task.getError())
            .build();
    }
}
