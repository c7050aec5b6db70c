package com.example.backupmonitor.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.backupmonitor.model.TaskRunStatus;
import com.example.backupmonitor.service.StoreHealthTracker;
import com.example.backupmonitor.task.TaskSchedulerService;
import com.example.backupmonitor.task.TaskStatus;
import com.example.backupmonitor.task.TriggerResult;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ControlController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class ControlControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TaskSchedulerService schedulerService;
  @MockitoBean private StoreHealthTracker storeHealth;

  @Test
  void statusListsTasksAndUptime() throws Exception {
    when(schedulerService.status())
        .thenReturn(
            List.of(
                new TaskStatus(
                    "overdue-check",
                    Instant.parse("2026-03-10T12:00:00Z"),
                    TaskRunStatus.SUCCEEDED,
                    230L,
                    true,
                    false,
                    300L),
                new TaskStatus("audit-retention", null, null, null, false, false, 86400L)));
    when(schedulerService.uptime()).thenReturn(Duration.ofMinutes(90));

    mockMvc
        .perform(get("/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.uptimeSeconds").value(5400))
        .andExpect(jsonPath("$.tasks[0].name").value("overdue-check"))
        .andExpect(jsonPath("$.tasks[0].lastRunAt").value("2026-03-10T12:00:00Z"))
        .andExpect(jsonPath("$.tasks[0].lastRunStatus").value("SUCCEEDED"))
        .andExpect(jsonPath("$.tasks[0].lastRunDurationMs").value(230))
        .andExpect(jsonPath("$.tasks[0].enabled").value(true))
        .andExpect(jsonPath("$.tasks[1].lastRunAt").doesNotExist())
        .andExpect(jsonPath("$.tasks[1].enabled").value(false));
  }

  @Test
  void triggerAcceptedReturns202WithoutReason() throws Exception {
    when(schedulerService.trigger("overdue-check")).thenReturn(TriggerResult.ACCEPTED);

    mockMvc
        .perform(post("/tasks/overdue-check/trigger"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.accepted").value(true))
        .andExpect(jsonPath("$.reason").doesNotExist());
  }

  @Test
  void triggerWhileRunningReturns409Busy() throws Exception {
    when(schedulerService.trigger("overdue-check")).thenReturn(TriggerResult.BUSY);

    mockMvc
        .perform(post("/tasks/overdue-check/trigger"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.accepted").value(false))
        .andExpect(jsonPath("$.reason").value("busy"));
  }

  @Test
  void triggerUnknownTaskReturns404() throws Exception {
    when(schedulerService.trigger("nope")).thenReturn(TriggerResult.UNKNOWN_TASK);

    mockMvc
        .perform(post("/tasks/nope/trigger"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.reason").value("unknown_task"));
  }

  @Test
  void triggerDuringShutdownReturns503() throws Exception {
    when(schedulerService.trigger("overdue-check")).thenReturn(TriggerResult.SHUTTING_DOWN);

    mockMvc
        .perform(post("/tasks/overdue-check/trigger"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.reason").value("shutting_down"));
  }

  @Test
  void healthReportsDegradedStore() throws Exception {
    when(storeHealth.degraded()).thenReturn(true);
    when(storeHealth.consecutiveFailures()).thenReturn(4);

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DEGRADED"))
        .andExpect(jsonPath("$.consecutiveStoreFailures").value(4));
  }

  @Test
  void statusMapsStoreFailureTo503() throws Exception {
    when(schedulerService.status())
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc
        .perform(get("/status"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
  }
}
