package com.ruian.exception;

import java.time.OffsetDateTime;

/**
 * Signals that a production row with the same
 * (order_no, model, brand_no, job_type, upload_date) was already imported.
 *
 * This is the expected "already imported" outcome of re-uploading an order
 * sheet. The import loop counts the row as skipped and continues; it never
 * reaches the HTTP layer.
 */
public class DuplicateImportException extends RuntimeException {

    public DuplicateImportException(String message) {
        super(message);
    }

    /**
     * @return a DuplicateImportException naming the natural key
     */
    public static DuplicateImportException forKey(
            String orderNo, String model, String brandNo, String jobType, OffsetDateTime uploadDate) {
        return new DuplicateImportException(String.format(
                "Production row already imported: order=%s, model=%s, brand=%s, jobType=%s, uploadDate=%s",
                orderNo, model, brandNo, jobType, uploadDate));
    }
}
