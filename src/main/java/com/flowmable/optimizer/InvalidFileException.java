package com.flowmable.optimizer;

/**
 * Thrown when an input file is missing, unreadable, or cannot be decoded as an image.
 */
public class InvalidFileException extends ConversionException {

    public InvalidFileException(String message) {
        super(message);
    }

    public InvalidFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
