package com.ruian.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * ProductionInfo entity holding the job-type quota of a production order.
 *
 * One row exists per (order, model, brand, job type, upload date). Rows come
 * from the order-sheet import and are immutable afterwards; re-uploading the
 * same day's sheet must not create duplicates, which the unique constraint
 * uq_prodinfo enforces at the storage level.
 *
 * Database Table: production_info
 */
@Entity
@Table(name = "production_info",
        uniqueConstraints = {
            @UniqueConstraint(name = "uq_prodinfo",
                    columnNames = {"order_no", "model", "brand_no", "job_type", "upload_date"})
        },
        indexes = {
            @Index(name = "idx_prodinfo_order_date", columnList = "order_no, upload_date DESC"),
            @Index(name = "idx_prodinfo_job_type", columnList = "job_type"),
            @Index(name = "idx_prodinfo_worklog_no", columnList = "worklog_no")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductionInfo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Production order number from the ERP sheet, e.g. "2516572".
     */
    @Column(name = "order_no", nullable = false, columnDefinition = "TEXT")
    private String orderNo;

    /**
     * Product model, e.g. "W/mG000-AMP".
     */
    @Column(name = "model", nullable = false, columnDefinition = "TEXT")
    private String model;

    /**
     * Brand (grade) number, e.g. "GXZYD00652946".
     */
    @Column(name = "brand_no", nullable = false, columnDefinition = "TEXT")
    private String brandNo;

    /**
     * Quantity to produce for this job type. Always greater than zero.
     */
    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    /**
     * Manufacturing process step, e.g. "钝化" (passivation) or "烧结" (sintering).
     */
    @Column(name = "job_type", nullable = false, columnDefinition = "TEXT")
    private String jobType;

    /**
     * Outgoing process plan number linking the order to worklog sheets.
     */
    @Column(name = "worklog_no", nullable = false, columnDefinition = "TEXT")
    private String worklogNo;

    @Column(name = "performance_factor", nullable = false, precision = 6, scale = 2)
    private BigDecimal performanceFactor;

    @Column(name = "upload_date", nullable = false)
    private OffsetDateTime uploadDate;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
