package org.janelia.seaflow.sink;

import org.janelia.seaflow.filter.FilteredResult;
import org.janelia.seaflow.stats.ChannelStats;

/**
 * Destination for the filter results of one EVT file. Implementations write nothing when no particle was retained.
 */
public interface ResultSink {
    /**
     * @param fileKey file identity of the source, see {@link org.janelia.seaflow.evt.FileIdentity#fileKey(String)}
     * @param result retained particles
     * @param stats raw (untransformed) statistics of the retained particles
     * @throws PersistenceException if the write fails
     */
    void write(String fileKey, FilteredResult result, ChannelStats stats);
}
