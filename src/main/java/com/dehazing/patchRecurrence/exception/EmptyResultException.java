package com.dehazing.patchRecurrence.exception;

/**
 * A stage produced nothing to hand over: no patches, no pairs, or no pair
 * left to weigh into an airlight estimate.
 */
public class EmptyResultException extends DehazingException {

    public EmptyResultException(String message) {
        super(message);
    }
}
