package com.williamcallahan.pftreport.service.registry;

/**
 * Signals that the backing status store could not be read or written.
 *
 * <p>Callers must never answer from stale data when this is thrown.</p>
 */
public class RegistryUnavailableException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the store failure
     */
    public RegistryUnavailableException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the store failure
     * @param cause underlying store exception
     */
    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
