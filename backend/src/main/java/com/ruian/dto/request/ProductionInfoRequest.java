package com.ruian.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One row of an order sheet ("上传订单信息") import.
 *
 * Fields are checked per row by the import service so that a bad row is
 * reported in the batch summary instead of failing the whole request.
 *
 * performanceFactor defaults to 1.00 and uploadDate to the start of the
 * current day when omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductionInfoRequest {

    private String orderNo;
    private String model;
    private String brandNo;
    private Integer quantity;
    private String jobType;

    /**
     * 转出工序计划号.
     */
    private String worklogNo;

    private BigDecimal performanceFactor;
    private OffsetDateTime uploadDate;
}
