package com.ruian.controller;

import com.ruian.dto.request.ImportBatchRequest;
import com.ruian.dto.request.WorklogEntryRequest;
import com.ruian.dto.response.ImportSummaryResponse;
import com.ruian.dto.response.PageResponse;
import com.ruian.dto.response.WorklogResponse;
import com.ruian.service.WorklogImportService;
import com.ruian.service.WorklogQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * REST Controller for employee worklogs.
 *
 * Endpoints (all require a bearer token):
 * - GET /api/worklog: paged list, filter by order number, work date range and employee
 * - GET /api/worklog/{orderNo}: every worklog of one order
 * - POST /api/worklog/import: validate, score and store parsed piece-rate rows
 */
@RestController
@RequestMapping("/api/worklog")
@RequiredArgsConstructor
@Slf4j
public class WorklogController {

    private final WorklogQueryService worklogQueryService;
    private final WorklogImportService worklogImportService;

    @GetMapping
    public ResponseEntity<PageResponse<WorklogResponse>> list(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int pageSize,
            @RequestParam(required = false) String orderNo,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDate,
            @RequestParam(required = false) String employeeId
    ) {
        try {
            return ResponseEntity.ok(
                    worklogQueryService.list(page, pageSize, orderNo, startDate, endDate, employeeId));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid worklog list request: {}", e.getMessage());
            throw e;
        }
    }

    @GetMapping("/{orderNo}")
    public ResponseEntity<List<WorklogResponse>> getByOrderNo(@PathVariable String orderNo) {
        return ResponseEntity.ok(worklogQueryService.getByOrderNo(orderNo));
    }

    /**
     * Import piece-rate rows.
     *
     * Rows with a non-positive quantity or factor are not stored; they are
     * listed under rejectedRows with their 1-based position. Every other row is
     * stored with its amount and validation result.
     */
    @PostMapping("/import")
    public ResponseEntity<ImportSummaryResponse> importRows(
            @Valid @RequestBody ImportBatchRequest<WorklogEntryRequest> request,
            Authentication authentication
    ) {
        log.info("Worklog import requested by {}: {} rows",
                authentication.getName(), request.getRows().size());
        return ResponseEntity.ok(worklogImportService.importBatch(request.getRows()));
    }
}
