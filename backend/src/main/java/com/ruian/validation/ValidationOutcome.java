package com.ruian.validation;

import com.ruian.entity.EmployeeWorklog.ValidationResult;
import com.ruian.entity.ProductionInfo;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of validating and scoring one worklog row.
 */
@Value
public class ValidationOutcome {

    BigDecimal performanceAmount;
    ValidationResult result;

    /**
     * The production row the worklog was matched to, null when unmatched
     * or when the row is a duplicate.
     */
    ProductionInfo matchedOrder;
}
