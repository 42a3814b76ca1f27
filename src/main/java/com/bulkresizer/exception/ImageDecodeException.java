package com.bulkresizer.exception;

import java.io.IOException;

/**
 * Source file could not be read or is not an image the decoder understands.
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
