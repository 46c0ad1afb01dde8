package com.autonomous.scanner.controller;

import com.autonomous.scanner.exception.InvalidTransitionException;
import com.autonomous.scanner.exception.TaskNotFoundException;
import com.autonomous.scanner.exception.TooManyTasksException;
import com.autonomous.scanner.model.ScanProfile;
import com.autonomous.scanner.model.ScanRequest;
import com.autonomous.scanner.model.Task;
import com.autonomous.scanner.model.TaskStatusView;
import com.autonomous.scanner.service.ScanCommandBuilder;
import com.autonomous.scanner.service.ScanProfileService;
import com.autonomous.scanner.service.TaskExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class ScanController {

    @Autowired
    private TaskExecutorService taskExecutor;

    @Autowired
    private ScanProfileService profileService;

    @Autowired
    private ScanCommandBuilder commandBuilder;

    @PostMapping("/scans/{profile}")
    public ResponseEntity<Task> scan(@PathVariable("profile") String profileName,
                                     @RequestBody ScanRequest request) {
        ScanProfile profile = profileService.getProfile(profileName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown scan profile: " + profileName));

        List<String> command = profile.isCustom()
            ? commandBuilder.buildCustomCommand(request.getCommand())
            : commandBuilder.buildProfileCommand(profile, request.getTarget());
        Duration waitBudget = commandBuilder.resolveWaitBudget(profile, request.getTimeout());

        return ResponseEntity.ok(taskExecutor.submit(command, waitBudget, profile.isKeepRawOutput()));
    }

    @GetMapping("/tasks/{id}/status")
    public ResponseEntity<TaskStatusView> status(@PathVariable("id") String id) {
        return ResponseEntity.ok(TaskStatusView.of(taskExecutor.getResult(id)));
    }

    @GetMapping("/tasks/{id}")
    public ResponseEntity<Task> result(@PathVariable("id") String id) {
        return ResponseEntity.ok(taskExecutor.getResult(id));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "healthy",
            "running_tasks", taskExecutor.runningCount(),
            "max_concurrent_tasks", taskExecutor.getMaxConcurrentTasks()
        ));
    }

    @ExceptionHandler(TooManyTasksException.class)
    public ResponseEntity<Map<String, String>> handleBusy(TooManyTasksException e) {
        return error(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(TaskNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, String>> handleInternal(InvalidTransitionException e) {
        log.error("Illegal task transition surfaced to a caller", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
