package org.janelia.seaflow.batch;

import java.time.Duration;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Totals of a completed batch.
 */
public class BatchSummary {

    private final int inputFiles;
    private final int parsedFiles;
    private final long evtCount;
    private final long oppCount;
    private final Duration elapsed;
    private final List<FileOutcome> failures;

    public BatchSummary(int inputFiles, int parsedFiles, long evtCount, long oppCount, Duration elapsed, List<FileOutcome> failures) {
        this.inputFiles = inputFiles;
        this.parsedFiles = parsedFiles;
        this.evtCount = evtCount;
        this.oppCount = oppCount;
        this.elapsed = elapsed;
        this.failures = ImmutableList.copyOf(failures);
    }

    public int getInputFiles() {
        return inputFiles;
    }

    public int getParsedFiles() {
        return parsedFiles;
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

    /**
     * @return EVT particles per second
     */
    public double getEvtRate() {
        return rate(evtCount);
    }

    /**
     * @return OPP particles per second
     */
    public double getOppRate() {
        return rate(oppCount);
    }

    public List<FileOutcome> getFailures() {
        return failures;
    }

    private double rate(long count) {
        double secs = elapsed.toNanos() / 1e9;
        return secs == 0 ? 0.0 : count / secs;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("inputFiles", inputFiles)
                .append("parsedFiles", parsedFiles)
                .append("evtCount", evtCount)
                .append("oppCount", oppCount)
                .append("elapsed", elapsed)
                .append("failures", failures.size())
                .toString();
    }
}
