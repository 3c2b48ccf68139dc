package com.ruian.service;

import com.ruian.exception.WorklogValidationException;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Field helpers shared by the import services.
 */
final class ImportRows {

    private ImportRows() {
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * @throws WorklogValidationException if the value is blank
     */
    static String requireText(String value, String field) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            throw new WorklogValidationException(field, value, field + " is required");
        }
        return trimmed;
    }

    /**
     * PostgreSQL keeps microseconds; truncating up front keeps equality
     * checks against stored values exact.
     */
    static OffsetDateTime toStoredPrecision(OffsetDateTime value) {
        return value == null ? null : value.truncatedTo(ChronoUnit.MICROS);
    }

    static OffsetDateTime startOfToday(ZoneId zone) {
        return LocalDate.now(zone).atStartOfDay(zone).toOffsetDateTime();
    }

    static <T> Set<String> orderNumbers(Collection<T> rows, Function<T, String> orderNo) {
        return rows.stream()
                .filter(Objects::nonNull)
                .map(orderNo)
                .map(ImportRows::trimToNull)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }
}
