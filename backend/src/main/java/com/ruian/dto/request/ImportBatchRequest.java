package com.ruian.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch of parsed spreadsheet rows, imported in one transaction.
 *
 * @param <T> the row type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportBatchRequest<T> {

    @NotNull(message = "Rows are required")
    @Size(max = 10000, message = "A batch may contain at most 10000 rows")
    private List<T> rows;
}
