package com.ruian.validation;

import com.ruian.entity.ProductionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.Collection;

/**
 * Entry point of worklog validation.
 *
 * Holds the validation settings and opens a {@link ValidationBatch} over a
 * freshly loaded set of production rows.
 *
 * Configuration:
 * - app.validation.quota-check-enabled: tag rows over the production quota
 * - app.validation.zone: business time zone used to derive the work day
 */
@Component
@Slf4j
public class WorklogValidator {

    private final boolean quotaCheckEnabled;
    private final ZoneId zone;

    public WorklogValidator(
            @Value("${app.validation.quota-check-enabled:false}") boolean quotaCheckEnabled,
            @Value("${app.validation.zone:Asia/Shanghai}") String zone) {
        this.quotaCheckEnabled = quotaCheckEnabled;
        this.zone = ZoneId.of(zone);
        log.info("Worklog validator configured: quotaCheckEnabled={}, zone={}", quotaCheckEnabled, zone);
    }

    /**
     * Open a validation batch.
     *
     * @param productionRows production rows for every order the batch touches
     * @return a new batch with empty duplicate and quota state
     */
    public ValidationBatch newBatch(Collection<ProductionInfo> productionRows) {
        return new ValidationBatch(ProductionOrderLookup.of(productionRows), zone, quotaCheckEnabled);
    }

    public boolean isQuotaCheckEnabled() {
        return quotaCheckEnabled;
    }

    public ZoneId getZone() {
        return zone;
    }
}
