package com.dehazing.patchRecurrence.exception;

public class DimensionMismatchException extends DehazingException {

    public DimensionMismatchException(String message) {
        super(message);
    }
}
