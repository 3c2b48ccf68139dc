package com.ruian.service;

import com.ruian.dto.request.ProductionInfoRequest;
import com.ruian.dto.response.ImportSummaryResponse;
import com.ruian.dto.response.ImportSummaryResponse.RejectedRow;
import com.ruian.entity.ProductionInfo;
import com.ruian.exception.DuplicateImportException;
import com.ruian.exception.WorklogValidationException;
import com.ruian.repository.ProductionInfoRepository;
import com.ruian.validation.PerformanceCalculator;
import com.ruian.validation.WorklogValidator;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Imports order sheet rows into production_info.
 *
 * Import is insert-if-absent on (order_no, model, brand_no, job_type,
 * upload_date): re-uploading the same sheet for the same day is a no-op and
 * existing rows are never updated. Rows with a non-positive quantity or
 * factor, or a missing key field, are rejected and listed in the summary.
 *
 * The whole batch runs in one transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProductionImportService {

    static final BigDecimal DEFAULT_PERFORMANCE_FACTOR = new BigDecimal("1.00");

    private final ProductionInfoRepository productionInfoRepository;
    private final WorklogValidator worklogValidator;

    /**
     * Import one batch of order sheet rows.
     *
     * @param rows parsed rows, in file order
     * @return counts of inserted, skipped and rejected rows
     * @throws IllegalArgumentException if rows is null
     */
    @Transactional
    public ImportSummaryResponse importBatch(List<ProductionInfoRequest> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        log.info("Production import started: {} rows", rows.size());

        OffsetDateTime defaultUploadDate = ImportRows.startOfToday(worklogValidator.getZone());
        Set<ProductionKey> seenInBatch = new HashSet<>();
        ImportSummaryResponse summary = ImportSummaryResponse.builder().received(rows.size()).build();

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            try {
                ProductionInfo info = toEntity(rows.get(i), defaultUploadDate);
                insertIfAbsent(info, seenInBatch);
                summary.setInserted(summary.getInserted() + 1);
            } catch (DuplicateImportException e) {
                log.debug("Row {} skipped: {}", rowNumber, e.getMessage());
                summary.setSkipped(summary.getSkipped() + 1);
            } catch (WorklogValidationException e) {
                log.warn("Row {} rejected: {}", rowNumber, e.getMessage());
                summary.getRejectedRows().add(new RejectedRow(rowNumber, e.getField(), e.getMessage()));
                summary.setRejected(summary.getRejected() + 1);
            }
        }

        log.info("Production import finished: received={}, inserted={}, skipped={}, rejected={}",
                summary.getReceived(), summary.getInserted(), summary.getSkipped(), summary.getRejected());
        return summary;
    }

    /**
     * Insert a production row unless its natural key is already stored or
     * was inserted earlier in the same batch.
     *
     * @throws DuplicateImportException if the row already exists
     */
    void insertIfAbsent(ProductionInfo info, Set<ProductionKey> seenInBatch) {
        boolean inserted = seenInBatch.add(ProductionKey.of(info))
                && productionInfoRepository.insertIfAbsent(
                        info.getOrderNo(), info.getModel(), info.getBrandNo(), info.getQuantity(),
                        info.getJobType(), info.getWorklogNo(), info.getPerformanceFactor(),
                        info.getUploadDate()) > 0;
        if (!inserted) {
            throw DuplicateImportException.forKey(info.getOrderNo(), info.getModel(), info.getBrandNo(),
                    info.getJobType(), info.getUploadDate());
        }
    }

    private ProductionInfo toEntity(ProductionInfoRequest row, OffsetDateTime defaultUploadDate) {
        if (row == null) {
            throw new WorklogValidationException("row", null, "Row is empty");
        }
        String orderNo = ImportRows.requireText(row.getOrderNo(), "orderNo");
        String model = ImportRows.requireText(row.getModel(), "model");
        String brandNo = ImportRows.requireText(row.getBrandNo(), "brandNo");
        String jobType = ImportRows.requireText(row.getJobType(), "jobType");
        String worklogNo = ImportRows.requireText(row.getWorklogNo(), "worklogNo");

        int quantity = PerformanceCalculator.requirePositiveQuantity(row.getQuantity());
        BigDecimal factor = PerformanceCalculator.normalizeFactor(
                row.getPerformanceFactor() == null ? DEFAULT_PERFORMANCE_FACTOR : row.getPerformanceFactor());
        OffsetDateTime uploadDate = row.getUploadDate() == null
                ? defaultUploadDate
                : ImportRows.toStoredPrecision(row.getUploadDate());

        return ProductionInfo.builder()
                .orderNo(orderNo)
                .model(model)
                .brandNo(brandNo)
                .quantity(quantity)
                .jobType(jobType)
                .worklogNo(worklogNo)
                .performanceFactor(factor)
                .uploadDate(uploadDate)
                .build();
    }

    /**
     * Natural key of a production row; upload_date compared as an instant.
     */
    @Value
    static class ProductionKey {
        String orderNo;
        String model;
        String brandNo;
        String jobType;
        Instant uploadDate;

        static ProductionKey of(ProductionInfo info) {
            return new ProductionKey(info.getOrderNo(), info.getModel(), info.getBrandNo(), info.getJobType(),
                    info.getUploadDate().toInstant());
        }
    }
}
