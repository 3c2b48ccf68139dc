package com.ruian.controller;

import com.ruian.dto.request.ValidationCheckRequest;
import com.ruian.dto.response.ValidationReportResponse;
import com.ruian.service.ValidationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for re-validating stored worklogs.
 *
 * POST /api/validation/check recomputes amount and validation result of every
 * worklog in a work date range, stores them, and returns the rows grouped by
 * order number into exception and normal groups.
 *
 * Example request:
 * <pre>
 * {
 *   "startDate": "2025-11-01T00:00:00+08:00",
 *   "endDate": "2025-11-30T23:59:59+08:00"
 * }
 * </pre>
 */
@RestController
@RequestMapping("/api/validation")
@RequiredArgsConstructor
@Slf4j
public class ValidationController {

    private final ValidationService validationService;

    @PostMapping("/check")
    public ResponseEntity<ValidationReportResponse> check(@Valid @RequestBody ValidationCheckRequest request) {
        log.info("Re-validation requested: {} .. {}", request.getStartDate(), request.getEndDate());

        try {
            return ResponseEntity.ok(validationService.check(request.getStartDate(), request.getEndDate()));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid re-validation request: {}", e.getMessage());
            throw e;
        }
    }
}
