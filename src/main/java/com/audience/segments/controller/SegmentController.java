package com.audience.segments.controller;

import com.audience.segments.model.PageResponse;
import com.audience.segments.model.SegmentCatalogEntry;
import com.audience.segments.service.SegmentService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/segments")
public class SegmentController {

  private final SegmentService segmentService;

  public SegmentController(SegmentService segmentService) {
    this.segmentService = segmentService;
  }

  @GetMapping
  public ResponseEntity<PageResponse<SegmentCatalogEntry>> listSegments(
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "per_page", defaultValue = "10") int perPage) {
    return ResponseEntity.ok(PageResponse.of(segmentService.listSegments(page, perPage)));
  }

  @GetMapping("/{segmentId}")
  public ResponseEntity<SegmentCatalogEntry> getSegment(@PathVariable Long segmentId) {
    return segmentService.getSegment(segmentId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/by-rule/{ruleId}")
  public ResponseEntity<SegmentCatalogEntry> getSegmentForRule(@PathVariable Long ruleId) {
    return segmentService.getSegmentForRule(ruleId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/{segmentId}/sample")
  public ResponseEntity<List<Map<String, Object>>> sample(
      @PathVariable Long segmentId,
      @RequestParam(value = "limit", defaultValue = "10") int limit) {
    return segmentService.sample(segmentId, limit)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }
}
