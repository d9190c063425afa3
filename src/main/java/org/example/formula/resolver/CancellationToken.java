package org.example.formula.resolver;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal polled by the resolver at every choice point.
 */
@FunctionalInterface
public interface CancellationToken {

    boolean isCancelled();

    /**
     * A token that is never cancelled.
     */
    static CancellationToken never() {
        return () -> false;
    }

    /**
     * A token that follows the given flag.
     */
    static CancellationToken of(AtomicBoolean flag) {
        return flag::get;
    }

    /**
     * A token that becomes cancelled once the timeout has elapsed, measured from now.
     */
    static CancellationToken timeout(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        return () -> System.nanoTime() - deadline >= 0;
    }
}
