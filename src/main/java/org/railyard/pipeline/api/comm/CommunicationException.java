package org.railyard.pipeline.api.comm;

/**
 * Thrown when a collective operation cannot complete, e.g. because the waiting worker was interrupted.
 */
public class CommunicationException extends RuntimeException {

    public CommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
