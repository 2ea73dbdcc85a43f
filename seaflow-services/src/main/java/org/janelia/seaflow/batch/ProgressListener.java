package org.janelia.seaflow.batch;

public interface ProgressListener {
    void onBlock(BlockReport report);

    void onFinish(BatchSummary summary);
}
