package com.ruian.validation;

import com.ruian.exception.InvalidFactorException;
import com.ruian.exception.InvalidQuantityException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes the performance amount of a worklog row.
 *
 * The factor is first normalized to the stored NUMERIC(6,2) precision so that
 * the persisted amount always equals the product of the persisted quantity and
 * factor.
 */
public final class PerformanceCalculator {

    public static final int SCALE = 2;

    /**
     * Exclusive upper bound of a NUMERIC(6,2) column.
     */
    private static final BigDecimal MAX_FACTOR = new BigDecimal("10000");

    private PerformanceCalculator() {
    }

    /**
     * Round a performance factor to two decimals and check it is positive.
     *
     * @param factor the raw factor
     * @return the factor at scale 2
     * @throws InvalidFactorException if the factor is missing, not positive
     *         after rounding, or does not fit NUMERIC(6,2)
     */
    public static BigDecimal normalizeFactor(BigDecimal factor) {
        if (factor == null) {
            throw InvalidFactorException.of(null);
        }
        BigDecimal normalized = factor.setScale(SCALE, RoundingMode.HALF_UP);
        if (normalized.signum() <= 0) {
            throw InvalidFactorException.of(factor);
        }
        if (normalized.compareTo(MAX_FACTOR) >= 0) {
            throw new InvalidFactorException(factor,
                    String.format("Performance factor must be less than %s, got %s",
                            MAX_FACTOR.toPlainString(), factor.toPlainString()));
        }
        return normalized;
    }

    /**
     * Check that a quantity is present and positive.
     *
     * @param quantity the raw quantity
     * @return the same quantity
     * @throws InvalidQuantityException if the quantity is missing or not positive
     */
    public static int requirePositiveQuantity(Integer quantity) {
        if (quantity == null || quantity <= 0) {
            throw InvalidQuantityException.of(quantity);
        }
        return quantity;
    }

    /**
     * performance_amount = quantity × performance_factor, at scale 2.
     *
     * @param quantity units produced, must be greater than 0
     * @param factor performance factor, must be greater than 0
     * @return the performance amount
     * @throws InvalidQuantityException if quantity is not positive
     * @throws InvalidFactorException if factor is not positive
     */
    public static BigDecimal performanceAmount(Integer quantity, BigDecimal factor) {
        int checkedQuantity = requirePositiveQuantity(quantity);
        BigDecimal normalizedFactor = normalizeFactor(factor);
        return normalizedFactor.multiply(BigDecimal.valueOf(checkedQuantity))
                .setScale(SCALE, RoundingMode.HALF_UP);
    }
}
