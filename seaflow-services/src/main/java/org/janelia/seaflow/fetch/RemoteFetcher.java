package org.janelia.seaflow.fetch;

/**
 * Retrieves the content of a remote EVT file.
 */
@FunctionalInterface
public interface RemoteFetcher {
    /**
     * @param reference object reference relative to the remote store
     * @return the raw (possibly gzipped) file bytes
     * @throws FetchException if the content could not be retrieved
     */
    byte[] fetch(String reference);
}
