package com.ruian.service;

import com.ruian.dto.response.PageResponse;
import com.ruian.dto.response.ProductionInfoResponse;
import com.ruian.entity.ProductionInfo;
import com.ruian.repository.ProductionInfoRepository;
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
 * Read access to production_info for the list and detail endpoints.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProductionInfoService {

    private static final Sort NEWEST_UPLOAD_FIRST = Sort.by(Sort.Order.desc("uploadDate"), Sort.Order.desc("id"));

    private final ProductionInfoRepository productionInfoRepository;

    /**
     * List production rows, newest upload first.
     *
     * @param page 1-based page number
     * @param pageSize 1 to 100
     * @param orderNo optional substring of the order number
     * @param startDate optional inclusive lower bound on upload_date
     * @param endDate optional inclusive upper bound on upload_date
     * @return the requested page
     * @throws IllegalArgumentException on invalid paging or an inverted range
     */
    public PageResponse<ProductionInfoResponse> list(int page, int pageSize, String orderNo,
                                                     OffsetDateTime startDate, OffsetDateTime endDate) {
        PageRequests.requireOrderedRange(startDate, endDate);
        Specification<ProductionInfo> filter = Specification
                .where(ProductionInfoRepository.orderNoContains(orderNo))
                .and(ProductionInfoRepository.uploadedFrom(startDate))
                .and(ProductionInfoRepository.uploadedUntil(endDate));

        Page<ProductionInfo> result = productionInfoRepository.findAll(
                filter, PageRequests.of(page, pageSize, NEWEST_UPLOAD_FIRST));
        log.debug("Production list: page={}, pageSize={}, orderNo={}, total={}",
                page, pageSize, orderNo, result.getTotalElements());
        return PageResponse.of(result, ProductionInfoResponse::from);
    }

    /**
     * All rows of one order, newest upload first. Empty when the order is unknown.
     */
    public List<ProductionInfoResponse> getByOrderNo(String orderNo) {
        if (orderNo == null || orderNo.isBlank()) {
            throw new IllegalArgumentException("Order number cannot be null or empty");
        }
        return productionInfoRepository.findByOrderNoOrderByUploadDateDesc(orderNo.trim()).stream()
                .map(ProductionInfoResponse::from)
                .toList();
    }
}
