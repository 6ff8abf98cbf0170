package deckhand.engine.execution;

import deckhand.cluster.OrchestrationApiException;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StatusPollerTest {

    private static final Duration INTERVAL = Duration.ofMillis(5);

    @Test
    void returnsWhenDone() {
        AtomicInteger reads = new AtomicInteger();
        List<Integer> seen = new ArrayList<>();
        StatusPoller poller = new StatusPoller(INTERVAL, Clock.systemUTC(), new CancellationToken());

        StatusPoller.Result<Integer> result = poller.poll("counter", Duration.ofSeconds(5),
                reads::incrementAndGet, v -> v >= 3, seen::add);

        assertEquals(StatusPoller.Outcome.DONE, result.outcome());
        assertEquals(3, result.lastObservation().intValue());
        assertEquals(List.of(1, 2, 3), seen);
    }

    @Test
    void readErrorsDoNotEndTheLoop() {
        AtomicInteger reads = new AtomicInteger();
        StatusPoller poller = new StatusPoller(INTERVAL, Clock.systemUTC(), new CancellationToken());

        StatusPoller.Result<String> result = poller.poll("flaky", Duration.ofSeconds(5), () -> {
            if (reads.incrementAndGet() <= 2) {
                throw new OrchestrationApiException(503, "unavailable");
            }
            return "ready";
        }, "ready"::equals, v -> { });

        assertEquals(StatusPoller.Outcome.DONE, result.outcome());
        assertEquals(3, reads.get());
    }

    @Test
    void timesOut() {
        StatusPoller poller = new StatusPoller(INTERVAL, Clock.systemUTC(), new CancellationToken());

        StatusPoller.Result<String> result = poller.poll("never", Duration.ofMillis(50),
                () -> "busy", v -> false, v -> { });

        assertEquals(StatusPoller.Outcome.TIMED_OUT, result.outcome());
        assertEquals("busy", result.lastObservation());
    }

    @Test
    void timeoutWithOnlyFailedReadsHasNoObservation() {
        StatusPoller poller = new StatusPoller(INTERVAL, Clock.systemUTC(), new CancellationToken());

        StatusPoller.Result<String> result = poller.poll("down", Duration.ofMillis(30), () -> {
            throw new OrchestrationApiException(503, "unavailable");
        }, v -> true, v -> { });

        assertEquals(StatusPoller.Outcome.TIMED_OUT, result.outcome());
        assertNull(result.lastObservation());
    }

    @Test
    void cancelWakesTheLoop() throws Exception {
        CancellationToken token = new CancellationToken();
        StatusPoller poller = new StatusPoller(Duration.ofSeconds(10), Clock.systemUTC(), token);

        CompletableFuture<StatusPoller.Result<String>> running = CompletableFuture.supplyAsync(
                () -> poller.poll("idle", Duration.ofMinutes(1), () -> "busy", v -> false, v -> { }));
        Thread.sleep(50);
        token.cancel();

        assertEquals(StatusPoller.Outcome.CANCELLED, running.get(5, TimeUnit.SECONDS).outcome());
    }
}
