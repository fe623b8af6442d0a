package com.flowmable.optimizer;

/**
 * Thrown when a decoded image cannot be encoded or written.
 */
public class ProcessingException extends ConversionException {

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
