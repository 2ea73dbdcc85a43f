package org.janelia.seaflow.batch;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans EVT file references out to a fixed pool of workers and consumes their outcomes in completion order.
 * A persistence or configuration failure stops the batch; every other failure is logged and counted.
 */
public class BatchOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchOrchestrator.class);
    private static final long SHUTDOWN_WAIT_MINUTES = 10;

    private final EvtFileProcessor processor;
    private final int workers;
    private final double progressPercent;
    private final ProgressListener progressListener;
    private final Ticker ticker;

    public BatchOrchestrator(EvtFileProcessor processor, int workers, double progressPercent, ProgressListener progressListener) {
        this(processor, workers, progressPercent, progressListener, Ticker.systemTicker());
    }

    public BatchOrchestrator(EvtFileProcessor processor, int workers, double progressPercent, ProgressListener progressListener, Ticker ticker) {
        Preconditions.checkArgument(workers >= 1, "Number of workers must be at least 1 but was %s", workers);
        this.processor = processor;
        this.workers = workers;
        this.progressPercent = progressPercent;
        this.progressListener = progressListener;
        this.ticker = ticker;
    }

    public BatchSummary run(List<String> references) {
        ProgressTracker tracker = new ProgressTracker(references.size(), progressPercent, progressListener, Stopwatch.createStarted(ticker));
        LOG.info("Filtering {} EVT files with {} workers. Progress every {}% (approximately)", references.size(), workers, progressPercent);
        ExecutorService executorService = createExecutorService();
        boolean aborted = true;
        try {
            CompletionService<FileOutcome> completionService = new ExecutorCompletionService<>(executorService);
            Map<Future<FileOutcome>, String> pending = new HashMap<>();
            for (String reference : references) {
                pending.put(completionService.submit(() -> processor.process(reference)), reference);
            }
            for (int i = 0; i < references.size(); i++) {
                FileOutcome outcome = takeOutcome(completionService, pending);
                handleOutcome(outcome);
                tracker.record(outcome);
            }
            aborted = false;
        } finally {
            shutdownExecutor(executorService, aborted);
        }
        return tracker.finish();
    }

    private ExecutorService createExecutorService() {
        final ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("SEAFLOW-FILTER-%03d")
                .setDaemon(true)
                .build();
        return Executors.newFixedThreadPool(workers, threadFactory);
    }

    private FileOutcome takeOutcome(CompletionService<FileOutcome> completionService, Map<Future<FileOutcome>, String> pending) {
        Future<FileOutcome> future;
        try {
            future = completionService.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for filter results", e);
        }
        String reference = pending.remove(future);
        try {
            return future.get();
        } catch (ExecutionException e) {
            return FileOutcome.failed(reference, OutcomeStatus.UNEXPECTED_ERROR, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for filter results", e);
        }
    }

    private void handleOutcome(FileOutcome outcome) {
        switch (outcome.getStatus()) {
            case OK:
                return;
            case FORMAT_ERROR:
                LOG.warn("Could not parse file {}: {}", outcome.getReference(), outcome.getErrorMessage());
                return;
            case FETCH_ERROR:
                LOG.warn("Could not fetch file {}: {}", outcome.getReference(), outcome.getErrorMessage());
                return;
            case UNEXPECTED_ERROR:
                LOG.error("Unexpected error processing file {}", outcome.getReference(), outcome.getError().orElse(null));
                return;
            default:
                LOG.error("Aborting batch at file {} ({})", outcome.getReference(), outcome.getStatus(), outcome.getError().orElse(null));
                Throwable error = outcome.getError().orElse(null);
                if (error instanceof RuntimeException) {
                    throw (RuntimeException) error;
                }
                throw new IllegalStateException("Batch aborted at file " + outcome.getReference(), error);
        }
    }

    private void shutdownExecutor(ExecutorService executorService, boolean now) {
        LOG.debug("Shutting down filter executor: {}", executorService);
        if (now) {
            executorService.shutdownNow();
            return;
        }
        executorService.shutdown();
        try {
            executorService.awaitTermination(SHUTDOWN_WAIT_MINUTES, TimeUnit.MINUTES);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while shutting down filter executor", e);
        }
    }
}
