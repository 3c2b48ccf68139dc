package com.ruian.validation;

import com.ruian.entity.EmployeeWorklog;
import com.ruian.entity.ProductionInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Production rows of one validation batch, indexed by (order_no, job_type).
 *
 * Built from the database at the start of every batch and discarded with it,
 * so matching never reads a stale cache.
 *
 * Rows of the same order+job type that differ only by upload date are
 * re-uploads of the same sheet line; only the latest one counts for matching
 * and for the quota.
 */
public final class ProductionOrderLookup {

    private static final Comparator<ProductionInfo> LATEST_FIRST = Comparator
            .comparing(ProductionInfo::getUploadDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ProductionInfo::getId, Comparator.nullsLast(Comparator.reverseOrder()));

    private final Map<OrderJobKey, List<ProductionInfo>> rowsByKey;

    private ProductionOrderLookup(Map<OrderJobKey, List<ProductionInfo>> rowsByKey) {
        this.rowsByKey = rowsByKey;
    }

    /**
     * Index a set of production rows.
     *
     * @param rows production rows loaded for the batch
     * @return the lookup
     */
    public static ProductionOrderLookup of(Collection<ProductionInfo> rows) {
        Map<OrderJobKey, Map<String, ProductionInfo>> latest = new HashMap<>();
        for (ProductionInfo row : rows) {
            OrderJobKey key = OrderJobKey.of(row.getOrderNo(), row.getJobType());
            String variant = OrderJobKey.normalize(row.getModel()) + '\u0000' + OrderJobKey.normalize(row.getBrandNo());
            latest.computeIfAbsent(key, k -> new LinkedHashMap<>())
                    .merge(variant, row, (current, candidate) ->
                            LATEST_FIRST.compare(candidate, current) < 0 ? candidate : current);
        }

        Map<OrderJobKey, List<ProductionInfo>> index = new HashMap<>();
        latest.forEach((key, variants) -> {
            List<ProductionInfo> list = new ArrayList<>(variants.values());
            list.sort(LATEST_FIRST);
            index.put(key, Collections.unmodifiableList(list));
        });
        return new ProductionOrderLookup(index);
    }

    /**
     * Production rows sharing the order number and job type, one per distinct
     * (model, brand_no), latest upload first.
     */
    public List<ProductionInfo> candidates(String orderNo, String jobType) {
        return rowsByKey.getOrDefault(OrderJobKey.of(orderNo, jobType), List.of());
    }

    /**
     * Find the single production row a worklog refers to.
     *
     * A row matches on order_no and job_type. model and brand_no only narrow
     * the choice when the pair maps to several (model, brand_no) variants.
     *
     * @param entry the worklog row
     * @return the matched row, or empty when there is none or the match is ambiguous
     */
    public Optional<ProductionInfo> match(EmployeeWorklog entry) {
        List<ProductionInfo> candidates = candidates(entry.getOrderNo(), entry.getJobType());
        if (candidates.size() <= 1) {
            return candidates.stream().findFirst();
        }

        String model = OrderJobKey.normalize(entry.getModel());
        String brandNo = OrderJobKey.normalize(entry.getBrandNo());
        List<ProductionInfo> narrowed = candidates.stream()
                .filter(row -> model.isEmpty() || Objects.equals(model, OrderJobKey.normalize(row.getModel())))
                .filter(row -> brandNo.isEmpty() || Objects.equals(brandNo, OrderJobKey.normalize(row.getBrandNo())))
                .toList();
        return narrowed.size() == 1 ? Optional.of(narrowed.get(0)) : Optional.empty();
    }

    /**
     * Configured quota of an order+job type: the summed quantity of its
     * current (model, brand_no) variants.
     */
    public long quota(String orderNo, String jobType) {
        return candidates(orderNo, jobType).stream()
                .mapToLong(ProductionInfo::getQuantity)
                .sum();
    }
}
