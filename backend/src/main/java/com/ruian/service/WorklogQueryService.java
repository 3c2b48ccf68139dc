package com.ruian.service;

import com.ruian.dto.response.PageResponse;
import com.ruian.dto.response.WorklogResponse;
import com.ruian.entity.EmployeeWorklog;
import com.ruian.repository.EmployeeWorklogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Read access to employee_worklog for the list and detail endpoints.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WorklogQueryService {

    private static final Sort NEWEST_WORK_DATE_FIRST = Sort.by(Sort.Order.desc("workDate"), Sort.Order.desc("id"));

    private final EmployeeWorklogRepository worklogRepository;

    /**
     * List worklog rows, latest work date first.
     *
     * @param page 1-based page number
     * @param pageSize 1 to 100
     * @param orderNo optional substring of the order number
     * @param startDate optional inclusive lower bound on work_date
     * @param endDate optional inclusive upper bound on work_date
     * @param employeeId optional exact employee number
     * @return the requested page
     */
    public PageResponse<WorklogResponse> list(int page, int pageSize, String orderNo,
                                              OffsetDateTime startDate, OffsetDateTime endDate,
                                              String employeeId) {
        PageRequests.requireOrderedRange(startDate, endDate);
        Specification<EmployeeWorklog> filter = Specification
                .where(EmployeeWorklogRepository.orderNoContains(orderNo))
                .and(EmployeeWorklogRepository.workedFrom(startDate))
                .and(EmployeeWorklogRepository.workedUntil(endDate))
                .and(EmployeeWorklogRepository.employeeIdEquals(employeeId));

        Page<EmployeeWorklog> result = worklogRepository.findAll(
                filter, PageRequests.of(page, pageSize, NEWEST_WORK_DATE_FIRST));
        log.debug("Worklog list: page={}, pageSize={}, orderNo={}, employeeId={}, total={}",
                page, pageSize, orderNo, employeeId, result.getTotalElements());
        return PageResponse.of(result, WorklogResponse::from);
    }

    public List<WorklogResponse> getByOrderNo(String orderNo) {
        if (orderNo == null || orderNo.isBlank()) {
            throw new IllegalArgumentException("Order number cannot be null or empty");
        }
        return worklogRepository.findByOrderNoOrderByWorkDateDesc(orderNo.trim()).stream()
                .map(WorklogResponse::from)
                .toList();
    }
}
