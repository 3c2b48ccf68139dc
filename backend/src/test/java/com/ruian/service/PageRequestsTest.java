package com.ruian.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PageRequests Unit Tests")
class PageRequestsTest {

    private static final Sort BY_ID = Sort.by("id");
    private static final OffsetDateTime START = OffsetDateTime.of(2025, 11, 1, 0, 0, 0, 0, ZoneOffset.ofHours(8));

    @Test
    @DisplayName("of should turn a 1-based page into a 0-based request")
    void testOf_ConvertsPageNumber() {
        PageRequest request = PageRequests.of(3, 20, BY_ID);

        assertEquals(2, request.getPageNumber());
        assertEquals(20, request.getPageSize());
        assertEquals(BY_ID, request.getSort());
    }

    @Test
    @DisplayName("of should accept the page size bounds")
    void testOf_PageSizeBounds() {
        assertEquals(1, PageRequests.of(1, 1, BY_ID).getPageSize());
        assertEquals(100, PageRequests.of(1, 100, BY_ID).getPageSize());
    }

    @Test
    @DisplayName("of should reject a page below 1")
    void testOf_PageBelowOne() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> PageRequests.of(0, 10, BY_ID));
        assertTrue(exception.getMessage().contains("Page must be at least 1"));
    }

    @Test
    @DisplayName("of should reject a page size outside 1..100")
    void testOf_PageSizeOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> PageRequests.of(1, 0, BY_ID));
        assertThrows(IllegalArgumentException.class, () -> PageRequests.of(1, 101, BY_ID));
    }

    @Test
    @DisplayName("requireOrderedRange should reject a start after the end and allow open or equal bounds")
    void testRequireOrderedRange() {
        assertThrows(IllegalArgumentException.class,
                () -> PageRequests.requireOrderedRange(START.plusDays(1), START));

        assertDoesNotThrow(() -> PageRequests.requireOrderedRange(START, START));
        assertDoesNotThrow(() -> PageRequests.requireOrderedRange(null, START));
        assertDoesNotThrow(() -> PageRequests.requireOrderedRange(START, null));
    }
}
