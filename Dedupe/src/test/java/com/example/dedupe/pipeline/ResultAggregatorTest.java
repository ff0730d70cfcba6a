package com.example.dedupe.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.example.dedupe.digest.DigestModule.Digest;
import com.example.dedupe.pipeline.Pipeline.Cancellation;
import com.example.dedupe.pipeline.Pipeline.Event;
import com.example.dedupe.pipeline.Pipeline.HashResult;
import com.example.dedupe.pipeline.Pipeline.Outcome;
import com.example.dedupe.pipeline.Pipeline.PipelineResult;
import com.example.dedupe.pipeline.Pipeline.ResultAggregator;
import com.example.dedupe.pipeline.Pipeline.ScanCounters;
import com.example.dedupe.scan.Scanner.WalkOutcome;
import com.example.dedupe.scan.Scanner.WalkStatistics;

@Timeout(10)
class ResultAggregatorTest {

    private static final Path ROOT = Path.of("/data");
    private static final Digest D1 = Digest.ofLong(1);
    private static final Digest D2 = Digest.ofLong(2);

    private final ScanCounters counters = new ScanCounters();
    private final ResultAggregator aggregator = new ResultAggregator(counters);

    @Test
    void secondOccurrenceSeedsGroupWithFirstSeenPath() {
        aggregator.apply(HashResult.success(ROOT.resolve("a"), D1));
        aggregator.apply(HashResult.success(ROOT.resolve("b"), D2));

        assertThat(result().duplicates().isEmpty()).isTrue();

        aggregator.apply(HashResult.success(ROOT.resolve("c"), D1));
        aggregator.apply(HashResult.success(ROOT.resolve("d"), D1));

        PipelineResult result = result();
        assertThat(result.duplicates().get(D1.hex()))
                .containsExactly(ROOT.resolve("a"), ROOT.resolve("c"), ROOT.resolve("d"));
        assertThat(result.duplicates().get(D2.hex())).isEmpty();
        assertThat(result.uniqueDigests()).isEqualTo(2);
        assertThat(counters.filesHashed()).isEqualTo(4);
    }

    @Test
    void errorResultIsRecordedWithoutCountingOrGrouping() {
        aggregator.apply(HashResult.success(ROOT.resolve("a"), D1));
        aggregator.apply(HashResult.failure(ROOT.resolve("b"), new IOException("ilegível")));

        PipelineResult result = result();
        assertThat(counters.filesHashed()).isEqualTo(1);
        assertThat(result.failures()).singleElement()
                .satisfies(f -> assertThat(f.path()).isEqualTo(ROOT.resolve("b")));
        assertThat(result.digestsByPath()).containsOnlyKeys(ROOT.resolve("a"));
    }

    @Test
    void sameResultIsNeverAppliedTwice() {
        HashResult result = HashResult.success(ROOT.resolve("a"), D1);
        aggregator.apply(result);
        aggregator.apply(result);

        assertThat(counters.filesHashed()).isEqualTo(1);
        assertThat(result().duplicates().isEmpty()).isTrue();
    }

    @Test
    void drainWaitsForEverySourceToClose() throws InterruptedException {
        BlockingQueue<Event> events = new ArrayBlockingQueue<>(16);
        events.put(Event.directory(ROOT.resolve("sub")));
        events.put(Event.result(HashResult.success(ROOT.resolve("a"), D1)));
        events.put(Event.directoriesClosed());
        events.put(Event.walkFinished(WalkOutcome.completed(WalkStatistics.empty())));
        events.put(Event.workerFinished());
        events.put(Event.result(HashResult.success(ROOT.resolve("sub/b"), D1)));
        events.put(Event.workerFinished());

        Outcome outcome = aggregator.drain(events, 2, Cancellation.create());

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(events).isEmpty();
        assertThat(result().duplicates().get(D1.hex())).containsExactly(ROOT.resolve("a"), ROOT.resolve("sub/b"));
        assertThat(result().directories()).containsExactly(ROOT.resolve("sub"));
    }

    @Test
    void failedWalkStopsDrainingWithoutWaitingForWorkers() {
        BlockingQueue<Event> events = new ArrayBlockingQueue<>(16);
        IOException cause = new IOException("raiz sumiu");
        events.add(Event.walkFinished(WalkOutcome.failed(cause, WalkStatistics.empty())));

        Outcome outcome = aggregator.drain(events, 4, Cancellation.create());

        assertThat(outcome.status()).isEqualTo(Outcome.Status.FAILED);
        assertThat(outcome.failure()).contains(cause);
    }

    @Test
    void cancellationWakesBlockedDrain() throws InterruptedException {
        BlockingQueue<Event> events = new ArrayBlockingQueue<>(16);
        Cancellation cancellation = Cancellation.create();
        cancellation.onCancel(() -> events.offer(Event.wakeUp()));

        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            cancellation.cancel();
        });
        canceller.start();

        Outcome outcome = aggregator.drain(events, 1, cancellation);
        canceller.join();

        assertThat(outcome.isCancelled()).isTrue();
    }

    @Test
    void cancelNotifiesListenersOnceAndLateListenersImmediately() {
        Cancellation cancellation = Cancellation.create();
        AtomicInteger calls = new AtomicInteger();
        cancellation.onCancel(calls::incrementAndGet);

        cancellation.cancel();
        cancellation.cancel();
        assertThat(calls).hasValue(1);

        cancellation.onCancel(calls::incrementAndGet);
        assertThat(calls).hasValue(2);
    }

    @Test
    void closedRegistrationIsNotNotified() {
        Cancellation cancellation = Cancellation.create();
        AtomicInteger calls = new AtomicInteger();
        Cancellation.Registration registration = cancellation.onCancel(calls::incrementAndGet);

        registration.close();
        cancellation.cancel();

        assertThat(calls).hasValue(0);
    }

    @Test
    void cancelAfterFiresAndCanBeDisarmed() throws InterruptedException {
        Cancellation fired = Cancellation.create();
        CountDownLatch latch = new CountDownLatch(1);
        fired.onCancel(latch::countDown);
        fired.cancelAfter(Duration.ofMillis(50));
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();

        Cancellation disarmed = Cancellation.create();
        disarmed.cancelAfter(Duration.ofMillis(50)).close();
        Thread.sleep(200);
        assertThat(disarmed.isCancelled()).isFalse();
    }

    @Test
    void disarmedTimeoutsDoNotStayQueued() {
        int before = Cancellation.pendingTimeouts();

        for (int i = 0; i < 5; i++) {
            Cancellation.create().cancelAfter(Duration.ofHours(1)).close();
        }

        assertThat(Cancellation.pendingTimeouts()).isLessThanOrEqualTo(before);
    }

    @Test
    void snapshotNeverShowsMoreHashedThanFound() {
        counters.incrementFound();
        counters.incrementHashed();
        counters.incrementFound();

        assertThat(counters.snapshot().filesHashed()).isLessThanOrEqualTo(counters.snapshot().filesFound());
        assertThat(counters.snapshot().filesFound()).isEqualTo(2);
    }

    private PipelineResult result() {
        return aggregator.toResult(ROOT, Outcome.completed());
    }
}
