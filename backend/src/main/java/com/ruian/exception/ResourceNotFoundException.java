package com.ruian.exception;

/**
 * Exception thrown when a requested resource does not exist.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found with RFC 7807 format.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    /**
     * @param username the username that was not found
     * @return a ResourceNotFoundException with a formatted message
     */
    public static ResourceNotFoundException user(String username) {
        return new ResourceNotFoundException(
                String.format("User '%s' does not exist in the system.", username));
    }
}
