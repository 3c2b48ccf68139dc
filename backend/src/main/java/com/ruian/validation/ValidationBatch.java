package com.ruian.validation;

import com.ruian.entity.EmployeeWorklog;
import com.ruian.entity.EmployeeWorklog.ValidationResult;
import com.ruian.entity.ProductionInfo;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validation state of one import or re-validation batch.
 *
 * Rows must be fed in id (or file) order: the first row for a natural key
 * wins and every later one is a duplicate. Quota consumption is counted
 * from rows that passed.
 *
 * Not thread-safe; create one per batch with {@link WorklogValidator#newBatch}.
 */
@Slf4j
public class ValidationBatch {

    private final ProductionOrderLookup lookup;
    private final ZoneId zone;
    private final boolean quotaCheckEnabled;

    private final Set<WorklogKey> seenKeys = new HashSet<>();
    private final Map<OrderJobKey, Long> consumed = new HashMap<>();

    ValidationBatch(ProductionOrderLookup lookup, ZoneId zone, boolean quotaCheckEnabled) {
        this.lookup = lookup;
        this.zone = zone;
        this.quotaCheckEnabled = quotaCheckEnabled;
    }

    /**
     * Register a stored row that is not re-validated in this batch, so later
     * rows with the same key are tagged as duplicates and its passed quantity
     * counts against the quota.
     *
     * @param existing a persisted worklog row
     */
    public void recordExisting(EmployeeWorklog existing) {
        seenKeys.add(WorklogKey.of(existing, zone));
        if (existing.getValidationResult() == ValidationResult.PASSED && existing.getQuantity() != null) {
            consumed.merge(OrderJobKey.of(existing.getOrderNo(), existing.getJobType()),
                    existing.getQuantity().longValue(), Long::sum);
        }
    }

    /**
     * Compute the performance amount of a row and decide its validation result.
     *
     * Checks run in this order: numeric fields, duplicate key, production
     * match, quota. The amount is computed for every accepted row, including
     * duplicates and unmatched ones.
     *
     * @param entry the worklog row
     * @return the outcome
     * @throws com.ruian.exception.InvalidQuantityException if quantity is not positive
     * @throws com.ruian.exception.InvalidFactorException if the factor is not positive
     */
    public ValidationOutcome validateAndScore(EmployeeWorklog entry) {
        BigDecimal amount = PerformanceCalculator.performanceAmount(
                entry.getQuantity(), entry.getPerformanceFactor());

        if (!seenKeys.add(WorklogKey.of(entry, zone))) {
            return new ValidationOutcome(amount, ValidationResult.DUPLICATE, null);
        }

        Optional<ProductionInfo> match = lookup.match(entry);
        if (match.isEmpty()) {
            log.debug("No production row for order {} / job type {}", entry.getOrderNo(), entry.getJobType());
            return new ValidationOutcome(amount, ValidationResult.UNMATCHED, null);
        }

        OrderJobKey orderJob = OrderJobKey.of(entry.getOrderNo(), entry.getJobType());
        long alreadyConsumed = consumed.getOrDefault(orderJob, 0L);
        long afterThisRow = alreadyConsumed + entry.getQuantity();

        if (quotaCheckEnabled && afterThisRow > lookup.quota(entry.getOrderNo(), entry.getJobType())) {
            log.debug("Order {} / job type {} over quota: {} > {}", entry.getOrderNo(), entry.getJobType(),
                    afterThisRow, lookup.quota(entry.getOrderNo(), entry.getJobType()));
            return new ValidationOutcome(amount, ValidationResult.QUOTA_EXCEEDED, match.get());
        }

        consumed.put(orderJob, afterThisRow);
        return new ValidationOutcome(amount, ValidationResult.PASSED, match.get());
    }

    /**
     * Validate a row and write the amount and result back onto it.
     */
    public ValidationOutcome apply(EmployeeWorklog entry) {
        ValidationOutcome outcome = validateAndScore(entry);
        entry.setPerformanceFactor(PerformanceCalculator.normalizeFactor(entry.getPerformanceFactor()));
        entry.markValidated(outcome.getPerformanceAmount(), outcome.getResult());
        return outcome;
    }
}
