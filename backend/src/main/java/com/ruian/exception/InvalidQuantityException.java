package com.ruian.exception;

/**
 * Thrown when a worklog or production row carries a quantity that is
 * missing or not greater than zero.
 */
public class InvalidQuantityException extends WorklogValidationException {

    public InvalidQuantityException(Object rejectedValue, String message) {
        super("quantity", rejectedValue, message);
    }

    /**
     * @param quantity the offending quantity, possibly null
     * @return an InvalidQuantityException with a formatted message
     */
    public static InvalidQuantityException of(Integer quantity) {
        if (quantity == null) {
            return new InvalidQuantityException(null, "Quantity is required");
        }
        return new InvalidQuantityException(quantity,
                String.format("Quantity must be greater than 0, got %d", quantity));
    }
}
