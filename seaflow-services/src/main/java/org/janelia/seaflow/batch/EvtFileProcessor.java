package org.janelia.seaflow.batch;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.janelia.seaflow.evt.EvtCodec;
import org.janelia.seaflow.evt.EvtFileException;
import org.janelia.seaflow.evt.FileIdentity;
import org.janelia.seaflow.evt.ParticleMatrix;
import org.janelia.seaflow.fetch.FetchException;
import org.janelia.seaflow.fetch.RemoteFetcher;
import org.janelia.seaflow.filter.FilterConfigException;
import org.janelia.seaflow.filter.FilterEngine;
import org.janelia.seaflow.filter.FilterParams;
import org.janelia.seaflow.filter.FilteredResult;
import org.janelia.seaflow.sink.PersistenceException;
import org.janelia.seaflow.sink.ResultSink;
import org.janelia.seaflow.stats.ChannelStats;
import org.janelia.seaflow.stats.StatsTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline for a single EVT file: fetch (for remote inputs), decode, filter, statistics and sinks.
 * Every failure is returned as a {@link FileOutcome}; nothing is thrown.
 */
public class EvtFileProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(EvtFileProcessor.class);

    private final RemoteFetcher remoteFetcher;
    private final EvtCodec codec;
    private final FilterEngine filterEngine;
    private final FilterParams filterParams;
    private final List<ResultSink> sinks;

    /**
     * @param remoteFetcher fetcher for remote references or null if references are local file paths
     */
    public EvtFileProcessor(RemoteFetcher remoteFetcher,
                            EvtCodec codec,
                            FilterEngine filterEngine,
                            FilterParams filterParams,
                            List<ResultSink> sinks) {
        this.remoteFetcher = remoteFetcher;
        this.codec = codec;
        this.filterEngine = filterEngine;
        this.filterParams = filterParams;
        this.sinks = ImmutableList.copyOf(sinks);
    }

    public FileOutcome process(String reference) {
        try {
            ParticleMatrix evt = readEvt(reference);
            FilteredResult result = filterEngine.filter(evt, filterParams);
            ChannelStats stats = StatsTransform.compute(result);
            String fileKey = FileIdentity.fileKey(reference);
            for (ResultSink sink : sinks) {
                sink.write(fileKey, result, stats);
            }
            LOG.debug("Filtered {}: {}", reference, result);
            return FileOutcome.ok(reference, result.getTotalCount(), result.getRetainedCount());
        } catch (EvtFileException e) {
            return FileOutcome.failed(reference, OutcomeStatus.FORMAT_ERROR, e);
        } catch (FetchException e) {
            return FileOutcome.failed(reference, OutcomeStatus.FETCH_ERROR, e);
        } catch (FilterConfigException e) {
            return FileOutcome.failed(reference, OutcomeStatus.CONFIG_ERROR, e);
        } catch (PersistenceException e) {
            return FileOutcome.failed(reference, OutcomeStatus.PERSISTENCE_ERROR, e);
        } catch (Exception e) {
            return FileOutcome.failed(reference, OutcomeStatus.UNEXPECTED_ERROR, e);
        }
    }

    private ParticleMatrix readEvt(String reference) throws IOException {
        if (remoteFetcher != null) {
            return codec.decode(reference, remoteFetcher.fetch(reference));
        } else {
            return codec.read(Paths.get(reference));
        }
    }
}
