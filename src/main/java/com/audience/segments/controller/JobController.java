package com.audience.segments.controller;

import com.audience.segments.model.ErrorResponse;
import com.audience.segments.model.MaterializationJob;
import com.audience.segments.pipeline.scheduler.MaterializationScheduler;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

  private final MaterializationScheduler scheduler;

  public JobController(MaterializationScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @GetMapping
  public ResponseEntity<List<MaterializationJob>> recentJobs(
      @RequestParam(value = "limit", defaultValue = "50") int limit) {
    return ResponseEntity.ok(scheduler.recentJobs(Math.max(limit, 1)));
  }

  @GetMapping("/{jobId}")
  public ResponseEntity<MaterializationJob> getJob(@PathVariable UUID jobId) {
    return scheduler.findJob(jobId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping("/{jobId}/cancel")
  public ResponseEntity<?> cancelJob(@PathVariable UUID jobId) {
    Optional<MaterializationJob> job = scheduler.findJob(jobId);
    if (job.isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    if (!scheduler.cancel(jobId)) {
      return ResponseEntity.status(HttpStatus.CONFLICT)
          .body(new ErrorResponse("JOB_NOT_CANCELLABLE",
              "Job " + jobId + " is " + job.get().state() + " and cannot be cancelled"));
    }
    return ResponseEntity.ok(scheduler.findJob(jobId).orElse(job.get()));
  }
}
