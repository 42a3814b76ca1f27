package com.bulkresizer.exception;

/**
 * Fatal problem found before any job is dispatched: missing source directory,
 * a destination that cannot be created, or unusable run parameters.
 */
public class BatchSetupException extends RuntimeException {

    public BatchSetupException(String message) {
        super(message);
    }

    public BatchSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
