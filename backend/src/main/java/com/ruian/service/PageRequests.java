package com.ruian.service;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.time.OffsetDateTime;

/**
 * Paging and range checks for the list endpoints.
 */
final class PageRequests {

    static final int MAX_PAGE_SIZE = 100;

    private PageRequests() {
    }

    /**
     * @param page 1-based page number
     * @param pageSize page size, 1 to 100
     * @throws IllegalArgumentException if either value is out of range
     */
    static PageRequest of(int page, int pageSize, Sort sort) {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be at least 1, got " + page);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException(
                    String.format("Page size must be between 1 and %d, got %d", MAX_PAGE_SIZE, pageSize));
        }
        return PageRequest.of(page - 1, pageSize, sort);
    }

    static void requireOrderedRange(OffsetDateTime start, OffsetDateTime end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("Start date must not be after end date");
        }
    }
}
