package com.ruian.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of re-validating a work date range.
 *
 * Rows are grouped per order number: every non-passing result of an order
 * forms one exception group, the passing rows of an order form one normal
 * group.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReportResponse {

    private int totalProductionRecords;
    private int totalWorklogRecords;
    private List<ExceptionGroup> exceptions;
    private List<NormalGroup> normal;
    private int exceptionCount;
    private int normalCount;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExceptionGroup {
        private String orderNo;
        private String exceptionType;
        private List<WorklogResponse> worklogs;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NormalGroup {
        private String orderNo;
        private List<WorklogResponse> worklogs;
    }
}
