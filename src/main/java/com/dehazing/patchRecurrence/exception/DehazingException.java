package com.dehazing.patchRecurrence.exception;

/**
 * Base class of every failure raised by the airlight pipeline stages.
 * Stages never retry; the caller decides whether to abort or fall back.
 */
public class DehazingException extends RuntimeException {

    public DehazingException(String message) {
        super(message);
    }

    public DehazingException(String message, Throwable cause) {
        super(message, cause);
    }
}
