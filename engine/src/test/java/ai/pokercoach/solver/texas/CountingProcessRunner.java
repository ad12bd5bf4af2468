package ai.pokercoach.solver.texas;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runner double that returns canned output, counts calls and can hold each run until released.
 */
public class CountingProcessRunner implements ProcessRunner {
    private final RawOutput output;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<ProcessInvocation> invocations = Collections.synchronizedList(new ArrayList<>());
    private final CountDownLatch started = new CountDownLatch(1);
    private volatile CountDownLatch release;

    public CountingProcessRunner(RawOutput output) {
        this.output = output;
    }

    /** Makes every run block until {@link #release()} is called. */
    public CountingProcessRunner holdUntilReleased() {
        this.release = new CountDownLatch(1);
        return this;
    }

    public void release() {
        release.countDown();
    }

    public boolean awaitStarted(long millis) throws InterruptedException {
        return started.await(millis, TimeUnit.MILLISECONDS);
    }

    public int calls() {
        return calls.get();
    }

    public List<ProcessInvocation> invocations() {
        return invocations;
    }

    @Override
    public RawOutput run(ProcessInvocation invocation, Duration timeout) {
        calls.incrementAndGet();
        invocations.add(invocation);
        started.countDown();
        CountDownLatch gate = release;
        if (gate != null) {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Runner was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        return output;
    }
}
