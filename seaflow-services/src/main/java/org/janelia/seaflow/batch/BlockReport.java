package org.janelia.seaflow.batch;

import java.time.Duration;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Progress of a batch at a reporting milestone: counts for the particles processed since the previous report.
 */
public class BlockReport {

    private final int completedFiles;
    private final int totalFiles;
    private final long evtCount;
    private final long oppCount;
    private final Duration elapsed;

    public BlockReport(int completedFiles, int totalFiles, long evtCount, long oppCount, Duration elapsed) {
        this.completedFiles = completedFiles;
        this.totalFiles = totalFiles;
        this.evtCount = evtCount;
        this.oppCount = oppCount;
        this.elapsed = elapsed;
    }

    public int getCompletedFiles() {
        return completedFiles;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public double getPercentComplete() {
        return totalFiles == 0 ? 100.0 : completedFiles * 100.0 / totalFiles;
    }

    public long getEvtCount() {
        return evtCount;
    }

    public long getOppCount() {
        return oppCount;
    }

    public double getOppEvtRatio() {
        return evtCount == 0 ? 0.0 : (double) oppCount / evtCount;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("completedFiles", completedFiles)
                .append("totalFiles", totalFiles)
                .append("evtCount", evtCount)
                .append("oppCount", oppCount)
                .append("elapsed", elapsed)
                .toString();
    }
}
