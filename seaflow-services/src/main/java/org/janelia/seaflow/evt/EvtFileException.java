package org.janelia.seaflow.evt;

/**
 * Raised when EVT data is empty, truncated or otherwise does not follow the binary layout.
 */
public class EvtFileException extends RuntimeException {

    public EvtFileException(String message) {
        super(message);
    }

    public EvtFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
