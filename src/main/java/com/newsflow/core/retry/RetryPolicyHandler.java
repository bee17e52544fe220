package com.newsflow.core.retry;

import com.newsflow.core.interrupt.NodeInterrupt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.random.RandomGenerator;

/**
 * Executes a node invocation under a {@link RetryPolicy}.
 * <p>
 * Every exception counts as transient except {@link NodeInterrupt}, which is a
 * control-flow signal and passes through on the first throw. The attempt counter
 * lives on the stack of {@link #execute}, so it starts over for every invocation.
 */
public class RetryPolicyHandler {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicyHandler.class);

    private static final long MAX_JITTER_MS = 1000;

    private final Sleeper sleeper;
    private final RandomGenerator random;

    public RetryPolicyHandler() {
        this(Sleeper.SYSTEM, RandomGenerator.getDefault());
    }

    public RetryPolicyHandler(Sleeper sleeper, RandomGenerator random) {
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Listener notified before each wait.
     */
    @FunctionalInterface
    public interface RetryListener {

        RetryListener NONE = (attempt, error, delay) -> {};

        void onRetry(int failedAttempt, Exception error, Duration delay);
    }

    public <T> T execute(String nodeName, RetryPolicy policy, Callable<T> call) throws Exception {
        return execute(nodeName, policy, call, RetryListener.NONE);
    }

    /**
     * Runs {@code call} up to {@code policy.maxAttempts()} times.
     *
     * @return the first successful result
     * @throws Exception the error of the last attempt once all attempts are used up
     */
    public <T> T execute(String nodeName, RetryPolicy policy, Callable<T> call,
                         RetryListener listener) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (NodeInterrupt interrupt) {
                throw interrupt;
            } catch (Exception e) {
                if (attempt >= policy.maxAttempts()) {
                    if (policy.maxAttempts() > 1) {
                        log.warn("Node {} failed after {} attempts: {}", nodeName, attempt, e.getMessage());
                    }
                    throw e;
                }
                Duration delay = delayAfter(policy, attempt);
                log.info("Node {} failed on attempt {}/{} ({}), retrying in {} ms",
                        nodeName, attempt, policy.maxAttempts(), e.getMessage(), delay.toMillis());
                listener.onRetry(attempt, e, delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    Duration delayAfter(RetryPolicy policy, int failedAttempt) {
        Duration base = policy.backoffAfter(failedAttempt);
        if (!policy.jitter()) {
            return base;
        }
        return base.plusMillis(random.nextLong(MAX_JITTER_MS + 1));
    }
}
