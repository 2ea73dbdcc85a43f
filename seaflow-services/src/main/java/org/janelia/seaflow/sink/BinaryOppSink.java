package org.janelia.seaflow.sink;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

import org.janelia.seaflow.evt.EvtCodec;
import org.janelia.seaflow.filter.FilteredResult;
import org.janelia.seaflow.stats.ChannelStats;
import org.janelia.seaflow.utils.ArchiveUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the retained particles as LabVIEW binary OPP files under an output directory, mirroring the julian day
 * layout of the inputs. Values are written raw, without the log transform.
 */
public class BinaryOppSink implements ResultSink {

    private static final Logger LOG = LoggerFactory.getLogger(BinaryOppSink.class);

    private final Path outputDir;
    private final boolean gzip;
    private final EvtCodec codec;

    public BinaryOppSink(Path outputDir, boolean gzip, EvtCodec codec) {
        this.outputDir = outputDir;
        this.gzip = gzip;
        this.codec = codec;
    }

    Path getOutputFile(String fileKey) {
        return outputDir.resolve(gzip ? fileKey + ArchiveUtils.EXTENSION_GZIP : fileKey);
    }

    @Override
    public void write(String fileKey, FilteredResult result, ChannelStats stats) {
        if (result.getRetainedCount() == 0) {
            return;
        }
        Path outputFile = getOutputFile(fileKey);
        try (OutputStream output = ArchiveUtils.openOutputStream(outputFile, gzip)) {
            codec.write(result.getParticles(), output);
        } catch (IOException e) {
            throw new PersistenceException("Error writing OPP binary file " + outputFile, e);
        }
        LOG.debug("Wrote {} OPP particles to {}", result.getRetainedCount(), outputFile);
    }
}
