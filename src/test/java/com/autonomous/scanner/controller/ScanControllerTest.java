package com.autonomous.scanner.controller;

import com.autonomous.scanner.exception.TaskNotFoundException;
import com.autonomous.scanner.exception.TooManyTasksException;
import com.autonomous.scanner.model.HostInfo;
import com.autonomous.scanner.model.PortInfo;
import com.autonomous.scanner.model.ScanResult;
import com.autonomous.scanner.model.Task;
import com.autonomous.scanner.model.TaskStatus;
import com.autonomous.scanner.service.ScanCommandBuilder;
import com.autonomous.scanner.service.ScanProfileService;
import com.autonomous.scanner.service.TaskExecutorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScanController.class)
@Import({ScanProfileService.class, ScanCommandBuilder.class})
class ScanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TaskExecutorService taskExecutor;

    @Test
    void shouldReturnResultWhenQuickScanFinishesInTime() throws Exception {
        List<String> expected = List.of("nmap", "-F", "-T4", "-oX", "-", "192.168.1.10");
        when(taskExecutor.submit(expected, Duration.ofSeconds(30), false)).thenReturn(completedTask());

        mockMvc.perform(post("/scans/quick")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"192.168.1.10\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.result.target").value("192.168.1.10"))
            .andExpect(jsonPath("$.result.scan_time").value("2.05s"))
            .andExpect(jsonPath("$.result.hosts[0].ports[0].port").value(22))
            .andExpect(jsonPath("$.result.hosts[0].ports[0].version").value("OpenSSH 9.6p1"))
            .andExpect(jsonPath("$.result.raw_output").doesNotExist())
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void shouldReturnTaskIdWhenScanOutlastsBudget() throws Exception {
        when(taskExecutor.submit(anyList(), eq(Duration.ofSeconds(10)), eq(false))).thenReturn(runningTask());

        mockMvc.perform(post("/scans/full")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"10.0.0.0/24\", \"timeout\": 10}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("task-1"))
            .andExpect(jsonPath("$.status").value("running"))
            .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    void shouldBuildCustomCommandFromCommandLine() throws Exception {
        List<String> expected = List.of("nmap", "-oX", "-", "-sS", "-p", "22", "10.0.0.1");
        Task done = completedTask();
        done.getResult().setRawOutput("<nmaprun/>");
        when(taskExecutor.submit(expected, Duration.ofSeconds(30), true)).thenReturn(done);

        mockMvc.perform(post("/scans/custom")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"command\": \"nmap -sS -p 22 10.0.0.1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.raw_output").value("<nmaprun/>"));

        verify(taskExecutor).submit(expected, Duration.ofSeconds(30), true);
    }

    @Test
    void shouldRejectUnknownProfile() throws Exception {
        mockMvc.perform(post("/scans/stealth")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"10.0.0.1\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown scan profile: stealth"));

        verifyNoInteractions(taskExecutor);
    }

    @Test
    void shouldRejectWaitBudgetOutsideProfileBounds() throws Exception {
        mockMvc.perform(post("/scans/quick")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"10.0.0.1\", \"timeout\": 1000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("timeout for quick scans must be between 5 and 300 seconds, got 1000"));

        verifyNoInteractions(taskExecutor);
    }

    @Test
    void shouldRejectOptionLikeTarget() throws Exception {
        mockMvc.perform(post("/scans/quick")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"--script=evil\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(taskExecutor);
    }

    @Test
    void shouldAnswerBusyWhenCeilingReached() throws Exception {
        when(taskExecutor.submit(anyList(), any(Duration.class), anyBoolean())).thenThrow(new TooManyTasksException(10));

        mockMvc.perform(post("/scans/quick")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"target\": \"10.0.0.1\"}"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.error").value("Server busy: 10 scan tasks already running, retry later"));
    }

    @Test
    void shouldReturnStatusWithoutResult() throws Exception {
        when(taskExecutor.getResult("task-1")).thenReturn(completedTask());

        mockMvc.perform(get("/tasks/task-1/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("task-1"))
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.finished_at").exists())
            .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    void shouldReturnFullTask() throws Exception {
        when(taskExecutor.getResult("task-1")).thenReturn(completedTask());

        mockMvc.perform(get("/tasks/task-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.command[0]").value("nmap"))
            .andExpect(jsonPath("$.result.hosts[0].hostname").value("files.lan"));
    }

    @Test
    void shouldReturnNotFoundForUnknownTask() throws Exception {
        when(taskExecutor.getResult("nope")).thenThrow(new TaskNotFoundException("nope"));

        mockMvc.perform(get("/tasks/nope/status"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Task not found: nope"));
    }

    @Test
    void shouldReportHealth() throws Exception {
        when(taskExecutor.runningCount()).thenReturn(2);
        when(taskExecutor.getMaxConcurrentTasks()).thenReturn(10);

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.running_tasks").value(2))
            .andExpect(jsonPath("$.max_concurrent_tasks").value(10));
    }

    private static Task runningTask() {
        return Task.builder()
            .id("task-1")
            .command(List.of("nmap", "-F", "-oX", "-", "10.0.0.1"))
            .status(TaskStatus.RUNNING)
            .createdAt(Instant.now())
            .startedAt(Instant.now())
            .build();
    }

    private static Task completedTask() {
        Instant now = Instant.now();
        return Task.builder()
            .id("task-1")
            .command(List.of("nmap", "-F", "-T4", "-oX", "-", "192.168.1.10"))
            .status(TaskStatus.COMPLETED)
            .createdAt(now)
            .startedAt(now)
            .finishedAt(now.plusSeconds(2))
            .duration(Duration.ofSeconds(2))
            .result(ScanResult.builder()
                .target("192.168.1.10")
                .scanTime("2.05s")
                .hosts(List.of(HostInfo.builder()
                    .address("192.168.1.10")
                    .status("up")
                    .hostname("files.lan")
                    .ports(List.of(
                        PortInfo.builder().port(22).protocol("tcp").state("open")
                            .service("ssh").version("OpenSSH 9.6p1").build(),
                        PortInfo.builder().port(443).protocol("tcp").state("open")
                            .service("https").build()))
                    .build()))
                .build())
            .build();
    }
}
