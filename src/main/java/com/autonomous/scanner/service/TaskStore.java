package com.autonomous.scanner.service;

import com.autonomous.scanner.exception.InvalidTransitionException;
import com.autonomous.scanner.exception.ScanTaskException;
import com.autonomous.scanner.exception.TaskNotFoundException;
import com.autonomous.scanner.model.HostInfo;
import com.autonomous.scanner.model.PortInfo;
import com.autonomous.scanner.model.ScanResult;
import com.autonomous.scanner.model.Task;
import com.autonomous.scanner.model.TaskStatus;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable record of every task. Each task lives in its own JSON document
 * ({@code <id>.json}) under the data directory; an in-memory index mirrors the
 * documents and is only updated after a write has reached disk.
 *
 * <p>All mutations of a single task are serialized on a per-id lock, so
 * transitions on different tasks never wait on each other.
 */
@Slf4j
@Service
public class TaskStore {

    static final String INTERRUPTED = "interrupted";
    static final String INTERRUPTED_BEFORE_START = "interrupted before start";

    private static final String SUFFIX = ".json";

    @Value("${scanner.data.path:data/tasks}")
    private String dataPath;

    private final ObjectMapper mapper;
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public TaskStore() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    // Tasks a previous process left unfinished lost their supervisor; they are marked failed
    @PostConstruct
    public void open() {
        tasks.clear();
        Path dir = directory();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ScanTaskException("Cannot create task directory " + dir, e);
        }

        int reconciled = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : files) {
                Task task;
                try {
                    task = mapper.readValue(file.toFile(), Task.class);
                } catch (IOException e) {
                    log.warn("Skipping unreadable task file {}: {}", file.getFileName(), e.getMessage());
                    continue;
                }
                if (task.getId() == null || task.getStatus() == null) {
                    log.warn("Skipping incomplete task file {}", file.getFileName());
                    continue;
                }
                if (task.getCommand() != null) {
                    task.setCommand(List.copyOf(task.getCommand()));
                }
                if (!task.getStatus().isTerminal()) {
                    task = reconcile(task);
                    reconciled++;
                }
                tasks.put(task.getId(), task);
            }
        } catch (IOException e) {
            throw new ScanTaskException("Cannot read task directory " + dir, e);
        }

        log.info("Task store opened at {} with {} tasks ({} reconciled as interrupted)",
            dir, tasks.size(), reconciled);
    }

    public Task create(String id, List<String> command) {
        synchronized (lockFor(id)) {
            if (tasks.containsKey(id)) {
                throw new IllegalArgumentException("Task already exists: " + id);
            }
            Task task = Task.builder()
                .id(id)
                .command(List.copyOf(command))
                .status(TaskStatus.PENDING)
                .createdAt(Instant.now())
                .build();
            persist(task);
            tasks.put(id, task);
            return copyOf(task);
        }
    }

    public Task transition(String id, TaskStatus next, ScanResult result, String error) {
        checkPayload(next, result, error);
        synchronized (lockFor(id)) {
            Task current = tasks.get(id);
            if (current == null) {
                throw new TaskNotFoundException(id);
            }
            if (!current.getStatus().canTransitionTo(next)) {
                throw new InvalidTransitionException(id, current.getStatus(), next);
            }

            Instant now = Instant.now();
            Task.TaskBuilder updated = current.toBuilder().status(next);
            if (next == TaskStatus.RUNNING) {
                updated.startedAt(now);
            } else {
                Instant started = current.getStartedAt() != null ? current.getStartedAt() : now;
                updated.finishedAt(now)
                    .duration(Duration.between(started, now))
                    .result(copyOf(result))
                    .error(error);
            }

            Task task = updated.build();
            persist(task);
            tasks.put(id, task);
            if (next.isTerminal()) {
                // nothing moves a terminal task again
                locks.remove(id);
            }
            return copyOf(task);
        }
    }

    /**
     * Marks a task failed in memory only. Used when the terminal write itself could not
     * reach disk, so pollers still see the failure; the on-disk record stays
     * non-terminal and is reconciled on the next open.
     */
    public Task failUnpersisted(String id, String error) {
        synchronized (lockFor(id)) {
            Task current = tasks.get(id);
            if (current == null) {
                throw new TaskNotFoundException(id);
            }
            if (current.getStatus().isTerminal()) {
                return copyOf(current);
            }

            Instant now = Instant.now();
            Instant started = current.getStartedAt() != null ? current.getStartedAt() : now;
            Task failed = current.toBuilder()
                .status(TaskStatus.FAILED)
                .finishedAt(now)
                .duration(Duration.between(started, now))
                .result(null)
                .error(error)
                .build();
            tasks.put(id, failed);
            locks.remove(id);
            log.warn("Task {} marked failed without persisting: {}", id, error);
            return copyOf(failed);
        }
    }

    public Task markRunning(String id) {
        return transition(id, TaskStatus.RUNNING, null, null);
    }

    public Task complete(String id, ScanResult result) {
        return transition(id, TaskStatus.COMPLETED, result, null);
    }

    public Task fail(String id, String error) {
        return transition(id, TaskStatus.FAILED, null, error);
    }

    public Task get(String id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw new TaskNotFoundException(id);
        }
        return copyOf(task);
    }

    private Task reconcile(Task task) {
        Instant now = Instant.now();
        String reason = task.getStatus() == TaskStatus.RUNNING ? INTERRUPTED : INTERRUPTED_BEFORE_START;
        Instant started = task.getStartedAt() != null ? task.getStartedAt() : now;

        Task failed = task.toBuilder()
            .status(TaskStatus.FAILED)
            .finishedAt(now)
            .duration(Duration.between(started, now))
            .result(null)
            .error(reason)
            .build();
        persist(failed);
        log.warn("Task {} was left {} by a previous run, marked failed ({})",
            task.getId(), task.getStatus().getValue(), reason);
        return failed;
    }

    private void checkPayload(TaskStatus next, ScanResult result, String error) {
        boolean valid = switch (next) {
            case PENDING, RUNNING -> result == null && error == null;
            case COMPLETED -> result != null && error == null;
            case FAILED -> result == null && error != null;
        };
        if (!valid) {
            throw new IllegalArgumentException("Invalid payload for status " + next.getValue());
        }
    }

    private void persist(Task task) {
        Path target = directory().resolve(task.getId() + SUFFIX);
        Path temp = directory().resolve(task.getId() + SUFFIX + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), task);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to persist task {}: {}", task.getId(), e.getMessage());
            throw new ScanTaskException("Failed to persist task " + task.getId(), e);
        }
    }

    private Object lockFor(String id) {
        return locks.computeIfAbsent(id, k -> new Object());
    }

    private Path directory() {
        return Paths.get(dataPath);
    }

    int lockCount() {
        return locks.size();
    }

    private Task copyOf(Task task) {
        return task.toBuilder()
            .command(task.getCommand() != null ? List.copyOf(task.getCommand()) : null)
            .result(copyOf(task.getResult()))
            .build();
    }

    private static ScanResult copyOf(ScanResult result) {
        if (result == null) {
            return null;
        }
        List<HostInfo> hosts = new ArrayList<>();
        if (result.getHosts() != null) {
            for (HostInfo host : result.getHosts()) {
                List<PortInfo> ports = new ArrayList<>();
                if (host.getPorts() != null) {
                    for (PortInfo port : host.getPorts()) {
                        ports.add(port.toBuilder()
                            .scripts(port.getScripts() != null ? new LinkedHashMap<>(port.getScripts()) : null)
                            .build());
                    }
                }
                hosts.add(host.toBuilder().ports(ports).build());
            }
        }
        return result.toBuilder().hosts(hosts).build();
    }
}
