package com.autonomous.scanner.service;

import com.autonomous.scanner.exception.InvalidTransitionException;
import com.autonomous.scanner.exception.ProcessSpawnException;
import com.autonomous.scanner.exception.ProcessTimeoutException;
import com.autonomous.scanner.exception.ScanParseException;
import com.autonomous.scanner.exception.TooManyTasksException;
import com.autonomous.scanner.model.ProcessResult;
import com.autonomous.scanner.model.ScanResult;
import com.autonomous.scanner.model.Task;
import com.autonomous.scanner.model.TaskStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs scan commands as supervised tasks. A submission waits at most the caller's
 * budget; a scan that outlasts it keeps running and is found by polling. Submissions
 * over the concurrency ceiling are rejected before any task is recorded.
 */
@Slf4j
@Service
public class TaskExecutorService {

    @Value("${scanner.tasks.max-concurrent:10}")
    private int maxConcurrentTasks;

    private Duration executionTimeout = Duration.ofHours(1);

    private final TaskStore taskStore;
    private final ProcessRunner processRunner;
    private final ScanResultParser resultParser;

    private final AtomicInteger runningTasks = new AtomicInteger();
    private final AtomicInteger workerCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "scan-task-" + workerCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public TaskExecutorService(TaskStore taskStore, ProcessRunner processRunner, ScanResultParser resultParser) {
        this.taskStore = taskStore;
        this.processRunner = processRunner;
        this.resultParser = resultParser;
    }

    public void setMaxConcurrentTasks(int maxConcurrentTasks) {
        this.maxConcurrentTasks = maxConcurrentTasks;
    }

    @Value("${scanner.tasks.execution-timeout:3600}")
    public void setExecutionTimeoutSeconds(long seconds) {
        this.executionTimeout = Duration.ofSeconds(seconds);
    }

    public void setExecutionTimeout(Duration timeout) {
        this.executionTimeout = timeout;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public int runningCount() {
        return runningTasks.get();
    }

    public Task submit(List<String> command, Duration waitBudget) {
        return submit(command, waitBudget, false);
    }

    /**
     * @return the finished task, or the task in {@code running} state when the budget ran out first
     * @throws TooManyTasksException if the concurrency ceiling is already reached
     */
    public Task submit(List<String> command, Duration waitBudget, boolean keepRawOutput) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }
        admit();

        String taskId = UUID.randomUUID().toString();
        CompletableFuture<Task> execution;
        try {
            taskStore.create(taskId, command);
            taskStore.markRunning(taskId);
            execution = CompletableFuture.supplyAsync(() -> execute(taskId, command, keepRawOutput), executor);
        } catch (RuntimeException e) {
            runningTasks.decrementAndGet();
            if (e instanceof RejectedExecutionException) {
                failQuietly(taskId, "Executor unavailable: " + e.getMessage());
            }
            throw e;
        }
        log.info("Task {} admitted ({}/{} running): {}", taskId, runningTasks.get(), maxConcurrentTasks, command);

        try {
            return execution.get(waitBudget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("Task {} still running after {}s, continuing in background", taskId, waitBudget.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for task {}, continuing in background", taskId);
        } catch (ExecutionException e) {
            // execute() records its own failures; this only means the record itself failed
            log.error("Task {} execution errored unexpectedly", taskId, e.getCause());
        }
        return taskStore.get(taskId);
    }

    public TaskStatus getStatus(String taskId) {
        return taskStore.get(taskId).getStatus();
    }

    // unfinished tasks come back without result or error
    public Task getResult(String taskId) {
        return taskStore.get(taskId);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void admit() {
        while (true) {
            int current = runningTasks.get();
            if (current >= maxConcurrentTasks) {
                log.warn("Rejecting scan: {} of {} task slots in use", current, maxConcurrentTasks);
                throw new TooManyTasksException(maxConcurrentTasks);
            }
            if (runningTasks.compareAndSet(current, current + 1)) {
                return;
            }
        }
    }

    // Never throws: nobody may be waiting on this thread, so every failure becomes a failed task
    private Task execute(String taskId, List<String> command, boolean keepRawOutput) {
        try {
            ProcessResult process = processRunner.run(command, executionTimeout);
            if (!process.isSuccess()) {
                log.warn("Task {} scanner exited with code {}", taskId, process.getExitCode());
            }

            ScanResult result;
            try {
                result = resultParser.parse(process.getOutput());
            } catch (ScanParseException e) {
                return finishFailed(taskId, describeParseFailure(process, e));
            }
            if (keepRawOutput) {
                result = result.toBuilder().rawOutput(process.getOutput()).build();
            }

            Task done = taskStore.complete(taskId, result);
            log.info("Task {} completed in {} ({} hosts)", taskId, done.getDuration(), result.getHosts().size());
            return done;
        } catch (ProcessTimeoutException e) {
            return finishFailed(taskId, e.getMessage());
        } catch (ProcessSpawnException e) {
            log.error("Task {} could not start the scanner, check scanner.nmap-path: {}", taskId, e.getMessage());
            return finishFailed(taskId, e.getMessage());
        } catch (InvalidTransitionException e) {
            log.error("Task {} was already finished elsewhere: {}", taskId, e.getMessage());
            return taskStore.get(taskId);
        } catch (RuntimeException e) {
            log.error("Task {} failed unexpectedly", taskId, e);
            return finishFailed(taskId, "Scan execution error: " + e.getMessage());
        } finally {
            runningTasks.decrementAndGet();
        }
    }

    private Task finishFailed(String taskId, String cause) {
        try {
            Task failed = taskStore.fail(taskId, cause);
            log.info("Task {} failed: {}", taskId, cause);
            return failed;
        } catch (InvalidTransitionException e) {
            log.error("Task {} was already finished elsewhere: {}", taskId, e.getMessage());
            return taskStore.get(taskId);
        } catch (RuntimeException e) {
            log.error("Could not persist failure of task {} ({}): {}", taskId, cause, e.getMessage());
            return taskStore.failUnpersisted(taskId, cause);
        }
    }

    private void failQuietly(String taskId, String cause) {
        try {
            taskStore.fail(taskId, cause);
        } catch (RuntimeException e) {
            log.error("Could not record failure of task {}: {}", taskId, e.getMessage());
        }
    }

    private String describeParseFailure(ProcessResult process, ScanParseException e) {
        if (process.isSuccess()) {
            return e.getMessage();
        }
        String diagnostic = process.getErrorOutput() == null ? "" : process.getErrorOutput().strip();
        return String.format("Scanner exited with code %d: %s", process.getExitCode(),
            diagnostic.isEmpty() ? e.getMessage() : diagnostic);
    }
}
