package org.janelia.seaflow.batch;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

/**
 * Accumulates per file outcomes in completion order. A block report is emitted each time the completed percentage
 * crosses a new multiple of the reporting resolution; crossing several multiples at once still yields a single report.
 * Not thread safe: only the orchestrator thread records outcomes.
 */
public class ProgressTracker {

    private final int totalFiles;
    private final double resolutionPercent;
    private final ProgressListener listener;
    private final Stopwatch stopwatch;

    private int completedFiles;
    private int parsedFiles;
    private long evtCount;
    private long oppCount;
    private final List<FileOutcome> failures = new ArrayList<>();

    private long lastMilestone;
    private int blockFiles;
    private long blockEvtCount;
    private long blockOppCount;

    public ProgressTracker(int totalFiles, double resolutionPercent, ProgressListener listener, Stopwatch stopwatch) {
        Preconditions.checkArgument(resolutionPercent > 0 && resolutionPercent <= 100,
                "Progress resolution must be in (0, 100] but was %s", resolutionPercent);
        this.totalFiles = totalFiles;
        this.resolutionPercent = resolutionPercent;
        this.listener = listener;
        this.stopwatch = stopwatch;
    }

    public void record(FileOutcome outcome) {
        completedFiles++;
        if (outcome.isOk()) {
            parsedFiles++;
        } else {
            failures.add(outcome);
        }
        evtCount += outcome.getEvtCount();
        oppCount += outcome.getOppCount();
        blockFiles++;
        blockEvtCount += outcome.getEvtCount();
        blockOppCount += outcome.getOppCount();

        long milestone = (long) Math.floor((completedFiles * 100.0) / (totalFiles * resolutionPercent));
        if (milestone > lastMilestone) {
            lastMilestone = milestone;
            reportBlock();
        }
    }

    /**
     * Report any trailing block and the batch totals.
     */
    public BatchSummary finish() {
        if (blockFiles > 0) {
            reportBlock();
        }
        BatchSummary summary = new BatchSummary(totalFiles, parsedFiles, evtCount, oppCount, stopwatch.elapsed(), failures);
        listener.onFinish(summary);
        return summary;
    }

    private void reportBlock() {
        listener.onBlock(new BlockReport(completedFiles, totalFiles, blockEvtCount, blockOppCount, stopwatch.elapsed()));
        blockFiles = 0;
        blockEvtCount = 0;
        blockOppCount = 0;
    }
}
