package com.ruian.exception;

/**
 * Base exception for worklog rows whose numeric fields violate the
 * employee_worklog CHECK constraints.
 *
 * These rows are rejected before an insert is attempted: a constraint
 * violation inside the batch transaction would abort the whole batch.
 * During an import the row is reported in the batch summary; when raised
 * from an API call GlobalExceptionHandler maps it to HTTP 422.
 *
 * @see InvalidQuantityException
 * @see InvalidFactorException
 */
public class WorklogValidationException extends RuntimeException {

    private final String field;
    private final Object rejectedValue;

    public WorklogValidationException(String field, Object rejectedValue, String message) {
        super(message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
