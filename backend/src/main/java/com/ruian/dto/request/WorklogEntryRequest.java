package com.ruian.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One row of a piece-rate sheet ("上传计件信息") import.
 *
 * Example JSON row:
 * <pre>
 * {
 *   "orderNo": "2516572",
 *   "model": "W/mG000-AMP",
 *   "brandNo": "07912",
 *   "employeeId": "024",
 *   "employeeName": "张三",
 *   "jobType": "钝化",
 *   "quantity": 50,
 *   "performanceFactor": 1.20,
 *   "workDate": "2025-11-08T00:00:00+08:00"
 * }
 * </pre>
 *
 * workDate and uploadDate default to now when omitted; jobType defaults to 未知.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorklogEntryRequest {

    private String orderNo;
    private String model;
    private String brandNo;
    private String employeeId;
    private String employeeName;
    private String jobType;
    private Integer quantity;
    private BigDecimal performanceFactor;
    private OffsetDateTime workDate;
    private OffsetDateTime uploadDate;
}
