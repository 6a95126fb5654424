package com.dehazing.patchRecurrence.exception;

/**
 * Invalid scale factors, non-positive sizes or counts, or more neighbours
 * requested than there are candidate patches.
 */
public class ConfigurationException extends DehazingException {

    public ConfigurationException(String message) {
        super(message);
    }
}
