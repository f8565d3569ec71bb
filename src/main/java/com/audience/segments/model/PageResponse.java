package com.audience.segments.model;

import java.util.List;
import org.springframework.data.domain.Page;

/** One page of a listing; {@code page} starts at 1. */
public record PageResponse<T>(List<T> items, int page, int perPage, long total, int pages) {

  public static <T> PageResponse<T> of(Page<T> page) {
    return new PageResponse<>(page.getContent(), page.getNumber() + 1, page.getSize(),
        page.getTotalElements(), page.getTotalPages());
  }
}
