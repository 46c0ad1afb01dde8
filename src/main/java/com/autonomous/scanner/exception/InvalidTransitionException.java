package com.autonomous.scanner.exception;

import com.autonomous.scanner.model.TaskStatus;
import lombok.Getter;

@Getter
public class InvalidTransitionException extends ScanTaskException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super(String.format("Task %s cannot move from %s to %s", taskId, from.getValue(), to.getValue()));
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }
}
