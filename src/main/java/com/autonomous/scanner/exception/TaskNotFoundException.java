package com.autonomous.scanner.exception;

import lombok.Getter;

@Getter
public class TaskNotFoundException extends ScanTaskException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }
}
