package com.bulkresizer.exception;

import java.io.IOException;

/**
 * Resized image could not be encoded or written to its destination.
 */
public class ImageEncodeException extends IOException {

    public ImageEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
