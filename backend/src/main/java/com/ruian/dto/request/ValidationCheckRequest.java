package com.ruian.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Work date range to re-validate, both ends inclusive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationCheckRequest {

    @NotNull(message = "Start date is required")
    private OffsetDateTime startDate;

    @NotNull(message = "End date is required")
    private OffsetDateTime endDate;
}
