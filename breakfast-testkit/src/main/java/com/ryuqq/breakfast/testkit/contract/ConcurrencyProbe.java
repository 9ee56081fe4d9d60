package com.ryuqq.breakfast.testkit.contract;

import com.ryuqq.breakfast.core.spi.OutputSink;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Counts how many callers are inside a critical section at the same time.
 *
 * <p>The counter is incremented on {@link #enter()} and decremented on {@link #exit()}.
 * The highest value ever observed is kept in {@link #maxConcurrent()}.
 * For a correctly guarded section it never exceeds 1.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ConcurrencyProbe probe = new ConcurrencyProbe();
 * OutputSink probed = probe.around(sink, line -&gt; line.startsWith("Creating"), 20);
 * // ... run scheduler with probed sink ...
 * assertEquals(1, probe.maxConcurrent());
 * </pre>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public class ConcurrencyProbe {

    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger max = new AtomicInteger();
    private final AtomicInteger entries = new AtomicInteger();

    /**
     * Marks entry into the critical section.
     */
    public void enter() {
        int inside = current.incrementAndGet();
        max.accumulateAndGet(inside, Math::max);
        entries.incrementAndGet();
    }

    /**
     * Marks exit from the critical section.
     */
    public void exit() {
        current.decrementAndGet();
    }

    /**
     * Wraps a sink so that tracked writes are bracketed by enter/exit.
     *
     * @param delegate the sink receiving every write
     * @param tracked selects which lines count as critical-section writes
     * @param holdMillis time to stay inside the section per tracked write, widening the race window
     * @return the probing sink
     */
    public OutputSink around(OutputSink delegate, Predicate<String> tracked, long holdMillis) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (tracked == null) {
            throw new IllegalArgumentException("tracked cannot be null");
        }
        return line -> {
            if (!tracked.test(line)) {
                delegate.write(line);
                return;
            }
            enter();
            try {
                hold(holdMillis);
                delegate.write(line);
            } finally {
                exit();
            }
        };
    }

    /**
     * Returns the highest number of simultaneous holders observed.
     *
     * @return max concurrent holders
     */
    public int maxConcurrent() {
        return max.get();
    }

    /**
     * Returns the total number of entries.
     *
     * @return entry count
     */
    public int entries() {
        return entries.get();
    }

    private void hold(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Probe interrupted", e);
        }
    }
}
