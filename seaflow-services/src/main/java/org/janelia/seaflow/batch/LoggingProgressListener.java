package org.janelia.seaflow.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingProgressListener implements ProgressListener {

    private static final Logger LOG = LoggerFactory.getLogger("org.janelia.seaflow.batch.progress");

    @Override
    public void onBlock(BlockReport report) {
        LOG.info(String.format("File: %d/%d (%.02f%%) Particles this block: %d / %d (%.06f) elapsed: %.2fs",
                report.getCompletedFiles(),
                report.getTotalFiles(),
                report.getPercentComplete(),
                report.getOppCount(),
                report.getEvtCount(),
                report.getOppEvtRatio(),
                report.getElapsed().toMillis() / 1000.));
    }

    @Override
    public void onFinish(BatchSummary summary) {
        LOG.info("Input EVT files = {}", summary.getInputFiles());
        LOG.info("Parsed EVT files = {}", summary.getParsedFiles());
        LOG.info(String.format("EVT particles = %d (%.2f p/s)", summary.getEvtCount(), summary.getEvtRate()));
        LOG.info(String.format("OPP particles = %d (%.2f p/s)", summary.getOppCount(), summary.getOppRate()));
        LOG.info(String.format("OPP/EVT ratio = %.06f", summary.getOppEvtRatio()));
        LOG.info(String.format("Filtering completed in %.2f seconds", summary.getElapsed().toMillis() / 1000.));
    }
}
