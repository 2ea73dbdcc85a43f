package org.janelia.seaflow.sink;

/**
 * Writing filter results failed. Store writes are not retried.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
