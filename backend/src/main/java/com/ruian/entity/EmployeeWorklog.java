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
import java.util.Arrays;

/**
 * EmployeeWorklog entity for per-employee, per-day piece-rate output.
 *
 * Each row records the quantity an employee produced for one job type on one
 * day, the performance factor applied to it, and the derived performance
 * amount. Rows reference ProductionInfo by business key (order_no, job_type
 * and optionally model/brand_no); the schema has no foreign key between them.
 *
 * Status transitions: UNVALIDATED → PASSED / UNMATCHED / DUPLICATE
 * (or QUOTA_EXCEEDED when quota checking is on). Re-validation recomputes
 * from scratch and overwrites.
 *
 * Database Table: employee_worklog
 */
@Entity
@Table(name = "employee_worklog", indexes = {
    @Index(name = "idx_worklog_emp_date", columnList = "employee_id, work_date DESC"),
    @Index(name = "idx_worklog_order_date", columnList = "order_no, work_date DESC"),
    @Index(name = "idx_worklog_job_date", columnList = "job_type, work_date DESC")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeWorklog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "order_no", nullable = false, columnDefinition = "TEXT")
    private String orderNo;

    @Column(name = "model", columnDefinition = "TEXT")
    private String model;

    @Column(name = "brand_no", columnDefinition = "TEXT")
    private String brandNo;

    /**
     * Employee number, e.g. "024".
     */
    @Column(name = "employee_id", nullable = false, columnDefinition = "TEXT")
    private String employeeId;

    @Column(name = "employee_name", columnDefinition = "TEXT")
    private String employeeName;

    @Column(name = "job_type", nullable = false, columnDefinition = "TEXT")
    private String jobType;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "performance_factor", nullable = false, precision = 6, scale = 2)
    private BigDecimal performanceFactor;

    /**
     * quantity × performance_factor, rounded to two decimals.
     */
    @Column(name = "performance_amount", nullable = false, precision = 18, scale = 2)
    private BigDecimal performanceAmount;

    @Column(name = "work_date", nullable = false)
    private OffsetDateTime workDate;

    @Column(name = "upload_date", nullable = false)
    private OffsetDateTime uploadDate;

    @Convert(converter = ValidationResultConverter.class)
    @Column(name = "validation_result", nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private ValidationResult validationResult = ValidationResult.UNVALIDATED;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    /**
     * Outcome of matching a worklog row against the production configuration.
     * Persisted as its Chinese label.
     */
    public enum ValidationResult {
        /**
         * Initial state before validation runs.
         */
        UNVALIDATED("未校验"),

        /**
         * Exactly one matching production row, within quota.
         */
        PASSED("通过"),

        /**
         * No production row for the order number and job type.
         */
        UNMATCHED("未匹配"),

        /**
         * Another row already exists for the same order, employee, job type and day.
         */
        DUPLICATE("重复"),

        /**
         * Cumulative quantity exceeds the production quota.
         * Only produced when quota checking is enabled.
         */
        QUOTA_EXCEEDED("工作量超出系统值");

        private final String label;

        ValidationResult(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        /**
         * Resolve a stored label back to its constant.
         *
         * @param label the stored column value
         * @return the matching constant
         * @throws IllegalArgumentException if the label is unknown
         */
        public static ValidationResult fromLabel(String label) {
            return Arrays.stream(values())
                    .filter(value -> value.label.equals(label))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown validation result: " + label));
        }
    }

    /**
     * Record the outcome of a validation run.
     *
     * @param amount the recomputed performance amount
     * @param result the validation outcome
     */
    public void markValidated(BigDecimal amount, ValidationResult result) {
        this.performanceAmount = amount;
        this.validationResult = result;
    }
}
