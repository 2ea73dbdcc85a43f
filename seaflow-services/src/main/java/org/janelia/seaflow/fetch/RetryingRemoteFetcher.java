package org.janelia.seaflow.fetch;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a fetch on any failure with exponential backoff: before attempt <i>k+1</i> it waits
 * 2<sup>k-1</sup> seconds plus a random jitter in [0, 1) seconds. Once all attempts fail the last failure is
 * reported as a {@link FetchException}.
 */
public class RetryingRemoteFetcher implements RemoteFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingRemoteFetcher.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final RemoteFetcher delegate;
    private final int maxAttempts;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;

    public RetryingRemoteFetcher(RemoteFetcher delegate) {
        this(delegate, DEFAULT_MAX_ATTEMPTS, Sleeper.THREAD_SLEEPER, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryingRemoteFetcher(RemoteFetcher delegate, int maxAttempts, Sleeper sleeper, DoubleSupplier jitter) {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
        this.jitter = jitter;
    }

    @Override
    public byte[] fetch(String reference) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                backoff(reference, attempt);
            }
            try {
                return delegate.fetch(reference);
            } catch (RuntimeException e) {
                lastFailure = e;
                LOG.warn("Attempt {}/{} to fetch {} failed: {}", attempt, maxAttempts, reference, e.getMessage());
            }
        }
        throw new FetchException("Failed to fetch " + reference + " after " + maxAttempts + " attempts: " + lastFailure.getMessage(), lastFailure);
    }

    long backoffMillis(int failedAttempts) {
        double delaySecs = Math.pow(2, failedAttempts - 1) + jitter.getAsDouble();
        return (long) (delaySecs * 1000);
    }

    private void backoff(String reference, int nextAttempt) {
        long delay = backoffMillis(nextAttempt - 1);
        LOG.debug("Wait {}ms before attempt {} to fetch {}", delay, nextAttempt, reference);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while waiting to fetch " + reference, e);
        }
    }
}
