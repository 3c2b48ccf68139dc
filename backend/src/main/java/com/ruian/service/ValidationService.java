package com.ruian.service;

import com.ruian.dto.response.ValidationReportResponse;
import com.ruian.dto.response.ValidationReportResponse.ExceptionGroup;
import com.ruian.dto.response.ValidationReportResponse.NormalGroup;
import com.ruian.dto.response.WorklogResponse;
import com.ruian.entity.EmployeeWorklog;
import com.ruian.entity.EmployeeWorklog.ValidationResult;
import com.ruian.entity.ProductionInfo;
import com.ruian.exception.WorklogValidationException;
import com.ruian.repository.EmployeeWorklogRepository;
import com.ruian.repository.ProductionInfoRepository;
import com.ruian.validation.ValidationBatch;
import com.ruian.validation.WorklogValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Re-validates stored worklogs of a work date range.
 *
 * Results are recomputed from scratch and overwrite the stored amount and
 * validation_result. Rows are processed in id order across all worklogs of
 * the involved orders, so a row in the range is a duplicate when any row
 * with the same key has a smaller id, even outside the range. Rows outside
 * the range are never modified.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ValidationService {

    private final EmployeeWorklogRepository worklogRepository;
    private final ProductionInfoRepository productionInfoRepository;
    private final WorklogValidator worklogValidator;

    /**
     * Re-validate every worklog whose work_date lies in [startDate, endDate].
     *
     * @param startDate inclusive start
     * @param endDate inclusive end
     * @return the grouped report
     * @throws IllegalArgumentException if a bound is missing or startDate is after endDate
     */
    @Transactional
    public ValidationReportResponse check(OffsetDateTime startDate, OffsetDateTime endDate) {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("Start date and end date are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("Start date must not be after end date");
        }
        log.info("Re-validation started for work dates {} .. {}", startDate, endDate);

        List<EmployeeWorklog> inRange = worklogRepository.findByWorkDateBetweenOrderByIdAsc(startDate, endDate);
        Set<Long> inRangeIds = inRange.stream().map(EmployeeWorklog::getId).collect(Collectors.toSet());
        Set<String> orderNos = ImportRows.orderNumbers(inRange, EmployeeWorklog::getOrderNo);

        List<ProductionInfo> production = orderNos.isEmpty()
                ? List.of()
                : productionInfoRepository.findByOrderNoIn(orderNos);
        ValidationBatch batch = worklogValidator.newBatch(production);

        List<EmployeeWorklog> ordered = orderNos.isEmpty()
                ? List.of()
                : worklogRepository.findByOrderNoInOrderByIdAsc(orderNos);
        List<EmployeeWorklog> updated = new ArrayList<>();
        for (EmployeeWorklog worklog : ordered) {
            if (!inRangeIds.contains(worklog.getId())) {
                batch.recordExisting(worklog);
                continue;
            }
            try {
                batch.apply(worklog);
                updated.add(worklog);
            } catch (WorklogValidationException e) {
                log.warn("Stored worklog {} cannot be scored: {}", worklog.getId(), e.getMessage());
            }
        }
        worklogRepository.saveAll(updated);

        ValidationReportResponse report = buildReport(inRange, production.size());
        log.info("Re-validation finished: {} worklogs, {} production rows, {} exception groups, {} normal groups",
                report.getTotalWorklogRecords(), report.getTotalProductionRecords(),
                report.getExceptionCount(), report.getNormalCount());
        return report;
    }

    private ValidationReportResponse buildReport(List<EmployeeWorklog> inRange, int productionCount) {
        Map<String, List<WorklogResponse>> normal = new LinkedHashMap<>();
        Map<String, Map<String, List<WorklogResponse>>> exceptions = new LinkedHashMap<>();

        for (EmployeeWorklog worklog : inRange) {
            WorklogResponse view = WorklogResponse.from(worklog);
            if (worklog.getValidationResult() == ValidationResult.PASSED) {
                normal.computeIfAbsent(worklog.getOrderNo(), k -> new ArrayList<>()).add(view);
            } else {
                exceptions.computeIfAbsent(worklog.getOrderNo(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(worklog.getValidationResult().getLabel(), k -> new ArrayList<>())
                        .add(view);
            }
        }

        List<ExceptionGroup> exceptionGroups = new ArrayList<>();
        exceptions.forEach((orderNo, byType) -> byType.forEach((type, worklogs) ->
                exceptionGroups.add(new ExceptionGroup(orderNo, type, worklogs))));
        List<NormalGroup> normalGroups = new ArrayList<>();
        normal.forEach((orderNo, worklogs) -> normalGroups.add(new NormalGroup(orderNo, worklogs)));

        return ValidationReportResponse.builder()
                .totalProductionRecords(productionCount)
                .totalWorklogRecords(inRange.size())
                .exceptions(exceptionGroups)
                .normal(normalGroups)
                .exceptionCount(exceptionGroups.size())
                .normalCount(normalGroups.size())
                .build();
    }
}
