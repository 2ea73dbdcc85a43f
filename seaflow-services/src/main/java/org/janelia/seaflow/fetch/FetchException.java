package org.janelia.seaflow.fetch;

/**
 * Remote retrieval of an EVT file failed.
 */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
