package com.ruian.exception;

import java.math.BigDecimal;

/**
 * Thrown when a performance factor is missing or not greater than zero.
 */
public class InvalidFactorException extends WorklogValidationException {

    public InvalidFactorException(Object rejectedValue, String message) {
        super("performanceFactor", rejectedValue, message);
    }

    /**
     * @param factor the offending factor, possibly null
     * @return an InvalidFactorException with a formatted message
     */
    public static InvalidFactorException of(BigDecimal factor) {
        if (factor == null) {
            return new InvalidFactorException(null, "Performance factor is required");
        }
        return new InvalidFactorException(factor,
                String.format("Performance factor must be greater than 0, got %s", factor.toPlainString()));
    }
}
