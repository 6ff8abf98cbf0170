package deckhand.engine.execution;

import deckhand.cluster.OrchestrationApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fixed-interval poll loop bounded by a deadline and a cancellation token.
 * Read errors from the cluster are logged and retried on the next tick; they
 * never end the loop on their own.
 */
public final class StatusPoller {

    private static final Logger log = LoggerFactory.getLogger(StatusPoller.class);

    public enum Outcome {
        /** The done predicate matched */
        DONE,
        /** Deadline passed first */
        TIMED_OUT,
        /** Token was cancelled first */
        CANCELLED
    }

    /**
     * @param outcome         how the loop ended
     * @param lastObservation last value read, null if every read failed
     */
    public record Result<T>(Outcome outcome, T lastObservation) {
    }

    private final Duration interval;
    private final Clock clock;
    private final CancellationToken token;

    public StatusPoller(Duration interval, Clock clock, CancellationToken token) {
        this.interval = interval;
        this.clock = clock;
        this.token = token;
    }

    /**
     * Poll until {@code done} matches, the timeout passes or the token is
     * cancelled.
     *
     * @param what     description used in log lines
     * @param timeout  time allowed from now
     * @param observe  reads the current state
     * @param done     terminal-state check
     * @param observed called with every successful read
     */
    public <T> Result<T> poll(String what, Duration timeout, Supplier<T> observe,
            Predicate<T> done, Consumer<T> observed) {
        Instant deadline = clock.instant().plus(timeout);
        T last = null;
        int failedReads = 0;

        while (true) {
            if (token.isCancelled()) {
                return new Result<>(Outcome.CANCELLED, last);
            }
            try {
                T current = observe.get();
                last = current;
                failedReads = 0;
                observed.accept(current);
                if (done.test(current)) {
                    return new Result<>(Outcome.DONE, current);
                }
            } catch (OrchestrationApiException e) {
                failedReads++;
                log.warn("Failed to read status of {} (attempt {}), retrying: {}", what, failedReads, e.getMessage());
            }
            if (!clock.instant().isBefore(deadline)) {
                log.debug("Deadline for {} passed", what);
                return new Result<>(Outcome.TIMED_OUT, last);
            }
            if (token.sleep(interval)) {
                return new Result<>(Outcome.CANCELLED, last);
            }
        }
    }
}
