package com.ruian.service;

import com.ruian.dto.request.WorklogEntryRequest;
import com.ruian.dto.response.ImportSummaryResponse;
import com.ruian.dto.response.ImportSummaryResponse.RejectedRow;
import com.ruian.entity.EmployeeWorklog;
import com.ruian.entity.ProductionInfo;
import com.ruian.exception.WorklogValidationException;
import com.ruian.repository.EmployeeWorklogRepository;
import com.ruian.repository.ProductionInfoRepository;
import com.ruian.validation.ValidationBatch;
import com.ruian.validation.ValidationOutcome;
import com.ruian.validation.WorklogValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Imports piece-rate sheet rows into employee_worklog.
 *
 * Every row is validated and scored against the production rows of the
 * orders it references, loaded once at the start of the batch:
 * 1. quantity and factor must be positive, otherwise the row is rejected
 * 2. a row whose (order, employee, job type, day) is already stored, or seen
 *    earlier in the batch, is stored as 重复
 * 3. a row with no production match is stored as 未匹配
 * 4. everything else is stored as 通过 (or 工作量超出系统值 when quota
 *    checking is enabled and the order is over quota)
 *
 * The whole batch runs in one transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorklogImportService {

    static final String UNKNOWN_JOB_TYPE = "未知";

    private final EmployeeWorklogRepository worklogRepository;
    private final ProductionInfoRepository productionInfoRepository;
    private final WorklogValidator worklogValidator;

    /**
     * Import one batch of worklog rows.
     *
     * @param rows parsed rows, in file order
     * @return counts per validation result and the rejected rows
     * @throws IllegalArgumentException if rows is null
     */
    @Transactional
    public ImportSummaryResponse importBatch(List<WorklogEntryRequest> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        log.info("Worklog import started: {} rows", rows.size());

        Set<String> orderNos = ImportRows.orderNumbers(rows, WorklogEntryRequest::getOrderNo);
        ValidationBatch batch = openBatch(orderNos);

        OffsetDateTime now = ImportRows.toStoredPrecision(OffsetDateTime.now(worklogValidator.getZone()));
        ImportSummaryResponse summary = ImportSummaryResponse.builder().received(rows.size()).build();
        List<EmployeeWorklog> accepted = new ArrayList<>();

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            try {
                EmployeeWorklog worklog = toEntity(rows.get(i), now);
                ValidationOutcome outcome = batch.apply(worklog);
                accepted.add(worklog);
                summary.getResultCounts().merge(outcome.getResult().getLabel(), 1, Integer::sum);
                log.debug("Row {} scored: order={}, employee={}, amount={}, result={}", rowNumber,
                        worklog.getOrderNo(), worklog.getEmployeeId(), outcome.getPerformanceAmount(),
                        outcome.getResult().getLabel());
            } catch (WorklogValidationException e) {
                log.warn("Row {} rejected: {}", rowNumber, e.getMessage());
                summary.getRejectedRows().add(new RejectedRow(rowNumber, e.getField(), e.getMessage()));
                summary.setRejected(summary.getRejected() + 1);
            }
        }

        worklogRepository.saveAll(accepted);
        summary.setInserted(accepted.size());

        log.info("Worklog import finished: received={}, inserted={}, rejected={}, results={}",
                summary.getReceived(), summary.getInserted(), summary.getRejected(), summary.getResultCounts());
        return summary;
    }

    private ValidationBatch openBatch(Set<String> orderNos) {
        if (orderNos.isEmpty()) {
            return worklogValidator.newBatch(List.of());
        }
        List<ProductionInfo> production = productionInfoRepository.findByOrderNoIn(orderNos);
        ValidationBatch batch = worklogValidator.newBatch(production);
        List<EmployeeWorklog> existing = worklogRepository.findByOrderNoInOrderByIdAsc(orderNos);
        existing.forEach(batch::recordExisting);
        log.debug("Validation batch opened: {} orders, {} production rows, {} stored worklogs",
                orderNos.size(), production.size(), existing.size());
        return batch;
    }

    private EmployeeWorklog toEntity(WorklogEntryRequest row, OffsetDateTime now) {
        if (row == null) {
            throw new WorklogValidationException("row", null, "Row is empty");
        }
        String jobType = ImportRows.trimToNull(row.getJobType());
        return EmployeeWorklog.builder()
                .orderNo(ImportRows.requireText(row.getOrderNo(), "orderNo"))
                .model(ImportRows.trimToNull(row.getModel()))
                .brandNo(ImportRows.trimToNull(row.getBrandNo()))
                .employeeId(ImportRows.requireText(row.getEmployeeId(), "employeeId"))
                .employeeName(ImportRows.trimToNull(row.getEmployeeName()))
                .jobType(jobType == null ? UNKNOWN_JOB_TYPE : jobType)
                .quantity(row.getQuantity())
                .performanceFactor(row.getPerformanceFactor())
                .workDate(row.getWorkDate() == null ? now : ImportRows.toStoredPrecision(row.getWorkDate()))
                .uploadDate(row.getUploadDate() == null ? now : ImportRows.toStoredPrecision(row.getUploadDate()))
                .build();
    }
}
