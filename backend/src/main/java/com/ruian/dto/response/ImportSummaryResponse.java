package com.ruian.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * End-of-batch summary of an import.
 *
 * <pre>
 * {
 *   "received": 3,
 *   "inserted": 2,
 *   "skipped": 0,
 *   "rejected": 1,
 *   "resultCounts": { "通过": 1, "重复": 1 },
 *   "rejectedRows": [
 *     { "rowNumber": 3, "field": "quantity", "reason": "Quantity must be greater than 0, got 0" }
 *   ]
 * }
 * </pre>
 *
 * skipped counts production rows that were already imported. resultCounts is
 * only filled for worklog imports.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummaryResponse {

    private int received;
    private int inserted;
    private int skipped;
    private int rejected;

    @Builder.Default
    private Map<String, Integer> resultCounts = new LinkedHashMap<>();

    @Builder.Default
    private List<RejectedRow> rejectedRows = new ArrayList<>();

    /**
     * A row that was not persisted.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RejectedRow {

        /**
         * 1-based position of the row in the batch.
         */
        private int rowNumber;

        private String field;
        private String reason;
    }
}
