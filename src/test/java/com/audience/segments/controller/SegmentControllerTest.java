package com.audience.segments.controller;

import com.audience.segments.enums.SetOperation;
import com.audience.segments.model.SegmentCatalogEntry;
import com.audience.segments.service.SegmentService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SegmentController.class)
class SegmentControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private SegmentService segmentService;

  private final SegmentCatalogEntry entry = new SegmentCatalogEntry(11L, 3L, "segment_3",
      "segment_output_3", 2, "SELECT 1", List.of(1L, 2L), SetOperation.UNION,
      Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-04-01T10:00:00Z"));

  @Test
  void listReturnsAPageEnvelope() throws Exception {
    given(segmentService.listSegments(2, 1))
        .willReturn(new PageImpl<>(List.of(entry), PageRequest.of(1, 1), 3));

    mockMvc.perform(get("/api/v1/segments").param("page", "2").param("per_page", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].ruleId").value(3))
        .andExpect(jsonPath("$.page").value(2))
        .andExpect(jsonPath("$.perPage").value(1))
        .andExpect(jsonPath("$.total").value(3))
        .andExpect(jsonPath("$.pages").value(3));
  }

  @Test
  void listDefaultsToTheFirstPage() throws Exception {
    given(segmentService.listSegments(1, 10))
        .willReturn(new PageImpl<>(List.of(), PageRequest.of(0, 10), 0));

    mockMvc.perform(get("/api/v1/segments"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items").isEmpty())
        .andExpect(jsonPath("$.page").value(1))
        .andExpect(jsonPath("$.total").value(0));
  }

  @Test
  void segmentIsFoundByRule() throws Exception {
    given(segmentService.getSegmentForRule(3L)).willReturn(Optional.of(entry));

    mockMvc.perform(get("/api/v1/segments/by-rule/3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tableName").value("segment_output_3"))
        .andExpect(jsonPath("$.rowCount").value(2))
        .andExpect(jsonPath("$.operation").value("UNION"));
  }

  @Test
  void sampleReturnsRows() throws Exception {
    given(segmentService.sample(11L, 2))
        .willReturn(Optional.of(List.of(Map.of("user_id", "u1"), Map.of("user_id", "u2"))));

    mockMvc.perform(get("/api/v1/segments/11/sample").param("limit", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[1].user_id").value("u2"));
  }

  @Test
  void invalidSampleLimitReturns400() throws Exception {
    given(segmentService.sample(11L, 0)).willThrow(new IllegalArgumentException("limit must be positive"));

    mockMvc.perform(get("/api/v1/segments/11/sample").param("limit", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
  }

  @Test
  void unknownSegmentReturns404() throws Exception {
    given(segmentService.getSegment(99L)).willReturn(Optional.empty());

    mockMvc.perform(get("/api/v1/segments/99")).andExpect(status().isNotFound());
  }
}
