package com.audience.segments.service;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

/** Bounds for the {@code page} and {@code per_page} listing parameters. */
final class Paging {

  static final int MAX_PER_PAGE = 100;

  private Paging() {
  }

  /**
   * @param page 1-based page number
   * @throws IllegalArgumentException if {@code page} is below 1 or {@code perPage} is
   *     outside 1..{@value #MAX_PER_PAGE}
   */
  static PageRequest request(int page, int perPage, Sort sort) {
    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1");
    }
    if (perPage < 1 || perPage > MAX_PER_PAGE) {
      throw new IllegalArgumentException("per_page must be between 1 and " + MAX_PER_PAGE);
    }
    return PageRequest.of(page - 1, perPage, sort);
  }
}
