package com.autonomous.scanner.service;

import com.autonomous.scanner.exception.ProcessSpawnException;
import com.autonomous.scanner.exception.ProcessTimeoutException;
import com.autonomous.scanner.exception.ScanTaskException;
import com.autonomous.scanner.model.ProcessResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an external program from an argument vector and waits for it under a hard
 * deadline. Arguments go straight to the OS, never through a shell.
 */
@Slf4j
@Service
public class ProcessRunner {

    // How long to keep draining output after the process itself has exited
    private static final long DRAIN_SECONDS = 5;

    private final AtomicInteger readerCounter = new AtomicInteger();
    private final ExecutorService readers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-reader-" + readerCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    /**
     * Runs {@code command} and returns its captured output. A non-zero exit code is
     * reported in the result, not thrown.
     *
     * @throws ProcessTimeoutException if the process outlives {@code timeout}; the whole
     *         process tree is killed and no partial output is returned
     * @throws ProcessSpawnException if the executable cannot be started
     */
    public ProcessResult run(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }

        ProcessBuilder pb = new ProcessBuilder(command);

        long startNanos = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ProcessSpawnException(command.get(0), e);
        }
        log.debug("Started pid {}: {}", process.pid(), command);
        closeStdin(process);

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyTree(process);
                stdout.cancel(true);
                stderr.cancel(true);
                throw new ProcessTimeoutException(timeout);
            }

            return ProcessResult.builder()
                .output(collect(stdout, process))
                .errorOutput(collect(stderr, process))
                .exitCode(process.exitValue())
                .elapsed(Duration.ofNanos(System.nanoTime() - startNanos))
                .build();
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new ScanTaskException("Interrupted while waiting for " + command.get(0), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        readers.shutdownNow();
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append("\n");
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return output.toString();
        }, readers);
    }

    // a child holding the pipes open after exit is killed so the readers reach EOF
    private String collect(CompletableFuture<String> output, Process process) throws InterruptedException {
        try {
            return output.get(DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Output of pid {} still open after exit, killing leftover children", process.pid());
            destroyTree(process);
            try {
                return output.get(DRAIN_SECONDS, TimeUnit.SECONDS);
            } catch (TimeoutException | ExecutionException again) {
                throw new ScanTaskException("Could not read output of pid " + process.pid(), again);
            }
        } catch (ExecutionException e) {
            throw new ScanTaskException("Could not read output of pid " + process.pid(), e.getCause());
        }
    }

    private void destroyTree(Process process) {
        process.descendants().forEach(child -> {
            log.debug("Killing child pid {} of {}", child.pid(), process.pid());
            child.destroyForcibly();
        });
        process.destroyForcibly();
        log.info("Killed process tree of pid {}", process.pid());
    }

    private void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }
}
