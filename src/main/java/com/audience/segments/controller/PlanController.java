package com.audience.segments.controller;

import com.audience.segments.pipeline.plan.ExecutionPlan;
import com.audience.segments.pipeline.plan.ExecutionPlanner;
import com.audience.segments.service.RuleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class PlanController {

  private final RuleService ruleService;
  private final ExecutionPlanner planner;

  public PlanController(RuleService ruleService, ExecutionPlanner planner) {
    this.ruleService = ruleService;
    this.planner = planner;
  }

  /** Materialization order and queries for all active rules. */
  @GetMapping("/plan")
  public ResponseEntity<ExecutionPlan> plan() {
    return ResponseEntity.ok(planner.plan(ruleService.activeRules()));
  }
}
