package org.janelia.seaflow.fetch;

import java.io.Closeable;
import java.util.List;

/**
 * Remote object store that can both list and fetch EVT objects.
 */
public interface RemoteObjectStore extends RemoteFetcher, Closeable {
    /**
     * @param prefix key prefix, e.g. "&lt;cruise&gt;/"
     * @return the keys of all objects under <code>prefix</code> in the order returned by the store
     * @throws FetchException if the listing could not be retrieved
     */
    List<String> listObjects(String prefix);
}
