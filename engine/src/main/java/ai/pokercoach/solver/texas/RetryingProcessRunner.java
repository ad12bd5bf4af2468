package ai.pokercoach.solver.texas;

import ai.pokercoach.solver.ProcessExecutionException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorator that retries a failed run once, after a fixed backoff, when the failure is
 * transient (timeout or a resource-exhaustion exit status). Deterministic failures and
 * spawn failures propagate immediately.
 */
public class RetryingProcessRunner implements ProcessRunner {
    private static final Logger log = LoggerFactory.getLogger(RetryingProcessRunner.class);

    private final ProcessRunner delegate;
    private final Duration backoff;

    public RetryingProcessRunner(ProcessRunner delegate, Duration backoff) {
        this.delegate = delegate;
        this.backoff = backoff;
    }

    @Override
    public RawOutput run(ProcessInvocation invocation, Duration timeout) {
        try {
            return delegate.run(invocation, timeout);
        } catch (ProcessExecutionException first) {
            if (!first.isRetryable()) {
                throw first;
            }
            log.warn("Transient solver failure, retrying once in {} ms: {}", backoff.toMillis(), first.getMessage());
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw first;
            }
            try {
                return delegate.run(invocation, timeout);
            } catch (ProcessExecutionException second) {
                second.addSuppressed(first);
                throw second;
            }
        }
    }
}
