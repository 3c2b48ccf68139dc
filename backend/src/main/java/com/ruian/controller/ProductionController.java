package com.ruian.controller;

import com.ruian.dto.request.ImportBatchRequest;
import com.ruian.dto.request.ProductionInfoRequest;
import com.ruian.dto.response.ImportSummaryResponse;
import com.ruian.dto.response.PageResponse;
import com.ruian.dto.response.ProductionInfoResponse;
import com.ruian.service.ProductionImportService;
import com.ruian.service.ProductionInfoService;
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
 * REST Controller for production order configuration (production_info).
 *
 * Endpoints (all require a bearer token):
 * - GET /api/production: paged list, filter by order number substring and upload date range
 * - GET /api/production/{orderNo}: every row of one order
 * - POST /api/production/import: import parsed order sheet rows
 *
 * Error Responses:
 * - 400 Bad Request: page &lt; 1, pageSize outside 1-100, inverted date range
 * - 401 Unauthorized: missing or invalid token
 */
@RestController
@RequestMapping("/api/production")
@RequiredArgsConstructor
@Slf4j
public class ProductionController {

    private final ProductionInfoService productionInfoService;
    private final ProductionImportService productionImportService;

    /**
     * Example: GET /api/production?page=1&amp;pageSize=10&amp;orderNo=2516
     */
    @GetMapping
    public ResponseEntity<PageResponse<ProductionInfoResponse>> list(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int pageSize,
            @RequestParam(required = false) String orderNo,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDate
    ) {
        try {
            return ResponseEntity.ok(productionInfoService.list(page, pageSize, orderNo, startDate, endDate));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid production list request: {}", e.getMessage());
            throw e;
        }
    }

    @GetMapping("/{orderNo}")
    public ResponseEntity<List<ProductionInfoResponse>> getByOrderNo(@PathVariable String orderNo) {
        return ResponseEntity.ok(productionInfoService.getByOrderNo(orderNo));
    }

    /**
     * Import order sheet rows. Rows already imported are skipped.
     *
     * Example request:
     * <pre>
     * POST /api/production/import
     *
     * {
     *   "rows": [
     *     {
     *       "orderNo": "2516572",
     *       "model": "W/mG000-AMP",
     *       "brandNo": "GXZYD00652946",
     *       "quantity": 500,
     *       "jobType": "钝化",
     *       "worklogNo": "P-001",
     *       "performanceFactor": 1.20
     *     }
     *   ]
     * }
     * </pre>
     */
    @PostMapping("/import")
    public ResponseEntity<ImportSummaryResponse> importRows(
            @Valid @RequestBody ImportBatchRequest<ProductionInfoRequest> request,
            Authentication authentication
    ) {
        log.info("Production import requested by {}: {} rows",
                authentication.getName(), request.getRows().size());
        return ResponseEntity.ok(productionImportService.importBatch(request.getRows()));
    }
}
