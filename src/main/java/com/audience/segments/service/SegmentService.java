package com.audience.segments.service;

import com.audience.segments.model.SegmentCatalogEntry;
import com.audience.segments.pipeline.materialize.SegmentCatalogRepository;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

/** Read access to published segments. */
@Service
public class SegmentService {

  static final int MAX_SAMPLE_ROWS = 1000;

  private final SegmentCatalogRepository catalogRepository;

  public SegmentService(SegmentCatalogRepository catalogRepository) {
    this.catalogRepository = catalogRepository;
  }

  /** One page of the catalog ordered by rule id; {@code page} starts at 1. */
  public Page<SegmentCatalogEntry> listSegments(int page, int perPage) {
    Pageable pageable = Paging.request(page, perPage, Sort.by("rule_id"));
    List<SegmentCatalogEntry> items =
        catalogRepository.findPage(pageable.getOffset(), pageable.getPageSize());
    return new PageImpl<>(items, pageable, catalogRepository.count());
  }

  public Optional<SegmentCatalogEntry> getSegment(Long segmentId) {
    return catalogRepository.findById(segmentId);
  }

  public Optional<SegmentCatalogEntry> getSegmentForRule(Long ruleId) {
    return catalogRepository.findByRuleId(ruleId);
  }

  /** First rows of the segment's output table; empty if the segment does not exist. */
  public Optional<List<Map<String, Object>>> sample(Long segmentId, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    int capped = Math.min(limit, MAX_SAMPLE_ROWS);
    return catalogRepository.findById(segmentId)
        .map(entry -> catalogRepository.sample(entry.tableName(), capped));
  }
}
