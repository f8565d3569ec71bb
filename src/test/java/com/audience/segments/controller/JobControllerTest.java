package com.audience.segments.controller;

import com.audience.segments.enums.JobState;
import com.audience.segments.enums.TriggerKind;
import com.audience.segments.model.MaterializationJob;
import com.audience.segments.pipeline.scheduler.MaterializationScheduler;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(JobController.class)
class JobControllerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private MaterializationScheduler scheduler;

  @Test
  void jobStatusIsReported() throws Exception {
    MaterializationJob running = MaterializationJob.queued(3L, TriggerKind.MANUAL, NOW).start(NOW);
    given(scheduler.findJob(running.id())).willReturn(Optional.of(running));

    mockMvc.perform(get("/api/v1/jobs/" + running.id()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ruleId").value(3))
        .andExpect(jsonPath("$.state").value("RUNNING"))
        .andExpect(jsonPath("$.attempts").value(1));
  }

  @Test
  void recentJobsAreListed() throws Exception {
    MaterializationJob queued = MaterializationJob.queued(3L, TriggerKind.SCHEDULED, NOW);
    given(scheduler.recentJobs(5)).willReturn(List.of(queued));

    mockMvc.perform(get("/api/v1/jobs").param("limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].trigger").value("SCHEDULED"));
  }

  @Test
  void runningJobsCannotBeCancelled() throws Exception {
    MaterializationJob running = MaterializationJob.queued(3L, TriggerKind.MANUAL, NOW).start(NOW);
    given(scheduler.findJob(running.id())).willReturn(Optional.of(running));
    given(scheduler.cancel(running.id())).willReturn(false);

    mockMvc.perform(post("/api/v1/jobs/" + running.id() + "/cancel"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("JOB_NOT_CANCELLABLE"));
  }

  @Test
  void queuedJobsAreCancelled() throws Exception {
    MaterializationJob queued = MaterializationJob.queued(3L, TriggerKind.MANUAL, NOW);
    MaterializationJob cancelled = queued.cancel(NOW);
    given(scheduler.findJob(queued.id())).willReturn(Optional.of(queued), Optional.of(cancelled));
    given(scheduler.cancel(queued.id())).willReturn(true);

    mockMvc.perform(post("/api/v1/jobs/" + queued.id() + "/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value(JobState.CANCELLED.name()));
  }

  @Test
  void unknownJobReturns404() throws Exception {
    UUID unknown = UUID.randomUUID();
    given(scheduler.findJob(unknown)).willReturn(Optional.empty());

    mockMvc.perform(get("/api/v1/jobs/" + unknown)).andExpect(status().isNotFound());
    mockMvc.perform(post("/api/v1/jobs/" + unknown + "/cancel")).andExpect(status().isNotFound());
  }
}
