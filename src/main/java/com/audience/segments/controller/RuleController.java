package com.audience.segments.controller;

import com.audience.segments.enums.RuleStatus;
import com.audience.segments.enums.TriggerKind;
import com.audience.segments.model.ErrorResponse;
import com.audience.segments.model.PageResponse;
import com.audience.segments.model.RuleDto;
import com.audience.segments.model.TriggerResponse;
import com.audience.segments.pipeline.scheduler.MaterializationScheduler;
import com.audience.segments.service.RuleService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/api/v1/rules")
public class RuleController {

  private final RuleService ruleService;
  private final MaterializationScheduler scheduler;

  public RuleController(RuleService ruleService, MaterializationScheduler scheduler) {
    this.ruleService = ruleService;
    this.scheduler = scheduler;
  }

  @PostMapping
  public ResponseEntity<RuleDto> createRule(@Valid @RequestBody RuleDto request) {
    RuleDto created = ruleService.createRule(request);
    return ResponseEntity
        .created(URI.create("/api/v1/rules/" + created.id()))
        .body(created);
  }

  @GetMapping
  public ResponseEntity<PageResponse<RuleDto>> listRules(
      @RequestParam(value = "status", required = false) RuleStatus status,
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "per_page", defaultValue = "10") int perPage) {
    return ResponseEntity.ok(PageResponse.of(ruleService.listRules(status, page, perPage)));
  }

  @GetMapping("/{ruleId}")
  public ResponseEntity<RuleDto> getRule(@PathVariable Long ruleId) {
    return ruleService.getRule(ruleId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PutMapping("/{ruleId}")
  public ResponseEntity<RuleDto> updateRule(
      @PathVariable Long ruleId,
      @Valid @RequestBody RuleDto request) {
    return ruleService.updateRule(ruleId, request)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{ruleId}")
  public ResponseEntity<Void> deleteRule(@PathVariable Long ruleId) {
    boolean deleted = ruleService.deleteRule(ruleId);
    return deleted ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @PatchMapping("/{ruleId}/activate")
  public ResponseEntity<RuleDto> activateRule(@PathVariable Long ruleId) {
    return ruleService.setRuleStatus(ruleId, RuleStatus.ACTIVE)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PatchMapping("/{ruleId}/deactivate")
  public ResponseEntity<RuleDto> deactivateRule(@PathVariable Long ruleId) {
    return ruleService.setRuleStatus(ruleId, RuleStatus.INACTIVE)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  /** Queues a manual refresh; repeated calls while a job is in flight return that job. */
  @PostMapping("/{ruleId}/trigger")
  public ResponseEntity<?> triggerRule(@PathVariable Long ruleId) {
    Optional<RuleDto> rule = ruleService.getRule(ruleId);
    if (rule.isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    if (!rule.get().isActive()) {
      return ResponseEntity.status(HttpStatus.CONFLICT)
          .body(new ErrorResponse("RULE_INACTIVE", "Rule " + ruleId + " is inactive"));
    }
    UUID jobId = scheduler.enqueue(ruleId, TriggerKind.MANUAL);
    return ResponseEntity
        .status(HttpStatus.ACCEPTED)
        .body(new TriggerResponse(ruleId, jobId));
  }
}
