package com.ruian.dto.response;

import com.ruian.entity.ProductionInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductionInfoResponse {

    private Long id;
    private String orderNo;
    private String model;
    private String brandNo;
    private Integer quantity;
    private String jobType;
    private String worklogNo;
    private BigDecimal performanceFactor;
    private OffsetDateTime uploadDate;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static ProductionInfoResponse from(ProductionInfo info) {
        return ProductionInfoResponse.builder()
                .id(info.getId())
                .orderNo(info.getOrderNo())
                .model(info.getModel())
                .brandNo(info.getBrandNo())
                .quantity(info.getQuantity())
                .jobType(info.getJobType())
                .worklogNo(info.getWorklogNo())
                .performanceFactor(info.getPerformanceFactor())
                .uploadDate(info.getUploadDate())
                .createdAt(info.getCreatedAt())
                .updatedAt(info.getUpdatedAt())
                .build();
    }
}
