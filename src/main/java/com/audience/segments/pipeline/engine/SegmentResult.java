package com.audience.segments.pipeline.engine;

import java.util.List;

public record SegmentResult(List<String> userIds) {

  public SegmentResult {
    userIds = userIds == null ? List.of() : userIds;
  }

  public long rowCount() {
    return userIds.size();
  }
}
