package com.ruian.dto.response;

import com.ruian.entity.EmployeeWorklog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Worklog row as returned by the list and validation endpoints.
 *
 * validationResult is the stored label (通过, 未匹配, 重复, ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorklogResponse {

    private Long id;
    private String orderNo;
    private String model;
    private String brandNo;
    private String employeeId;
    private String employeeName;
    private String jobType;
    private Integer quantity;
    private BigDecimal performanceFactor;
    private BigDecimal performanceAmount;
    private OffsetDateTime workDate;
    private OffsetDateTime uploadDate;
    private String validationResult;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static WorklogResponse from(EmployeeWorklog worklog) {
        return WorklogResponse.builder()
                .id(worklog.getId())
                .orderNo(worklog.getOrderNo())
                .model(worklog.getModel())
                .brandNo(worklog.getBrandNo())
                .employeeId(worklog.getEmployeeId())
                .employeeName(worklog.getEmployeeName())
                .jobType(worklog.getJobType())
                .quantity(worklog.getQuantity())
                .performanceFactor(worklog.getPerformanceFactor())
                .performanceAmount(worklog.getPerformanceAmount())
                .workDate(worklog.getWorkDate())
                .uploadDate(worklog.getUploadDate())
                .validationResult(worklog.getValidationResult() == null
                        ? null : worklog.getValidationResult().getLabel())
                .createdAt(worklog.getCreatedAt())
                .updatedAt(worklog.getUpdatedAt())
                .build();
    }
}
