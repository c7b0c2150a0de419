package com.themeboard.kr.refresh;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RefreshOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-05T06:30:00Z"), ZoneId.of("Asia/Seoul"));

    /** Blocks inside runOnce until released. */
    private static final class BlockingJob implements SnapshotIngestionJob {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicInteger runs = new AtomicInteger();

        @Override
        public RefreshResult runOnce() throws Exception {
            runs.incrementAndGet();
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return new RefreshResult("240105", "/tmp/tema/240105", 1.5, 12);
        }
    }

    @Test
    void trigger_shouldRejectConcurrentRunAndKeepRefreshId() throws Exception {
        BlockingJob job = new BlockingJob();
        AtomicInteger successes = new AtomicInteger();
        RefreshOrchestrator orchestrator = new RefreshOrchestrator(job, true, "", CLOCK, successes::incrementAndGet);

        TriggerResult first = orchestrator.trigger();
        assertTrue(job.entered.await(5, TimeUnit.SECONDS));
        TriggerResult second = orchestrator.trigger();

        assertEquals(TriggerResult.Status.STARTED, first.status);
        assertEquals(1L, first.state.refreshId);
        assertEquals("2024-01-05T15:30:00", first.state.startedAt);
        assertEquals(TriggerResult.Status.ALREADY_RUNNING, second.status);
        assertEquals(1L, second.state.refreshId);
        assertTrue(orchestrator.status().inProgress);

        job.release.countDown();
        assertTrue(orchestrator.awaitIdle(5000));

        RefreshState done = orchestrator.status();
        assertFalse(done.inProgress);
        assertEquals(1L, done.refreshId);
        assertEquals("240105", done.lastResult.dateTag);
        assertEquals(12, done.lastResult.files);
        assertEquals("", done.lastError);
        assertEquals("2024-01-05T15:30:00", done.endedAt);
        assertEquals(1, job.runs.get());
        assertEquals(1, successes.get());
    }

    @Test
    void trigger_afterCompletionShouldStartNextId() throws Exception {
        RefreshOrchestrator orchestrator = new RefreshOrchestrator(
                () -> new RefreshResult("240105", "out", 0.1, 1), true, "", CLOCK, null);

        orchestrator.trigger();
        assertTrue(orchestrator.awaitIdle(5000));
        TriggerResult again = orchestrator.trigger();
        assertTrue(orchestrator.awaitIdle(5000));

        assertTrue(again.started());
        assertEquals(2L, orchestrator.status().refreshId);
    }

    @Test
    void failedJob_shouldRecordErrorAndSkipSuccessHook() throws Exception {
        AtomicInteger successes = new AtomicInteger();
        RefreshOrchestrator orchestrator = new RefreshOrchestrator(() -> {
            throw new IllegalStateException("crawler exploded");
        }, true, "", CLOCK, successes::incrementAndGet);

        orchestrator.trigger();
        assertTrue(orchestrator.awaitIdle(5000));

        RefreshState state = orchestrator.status();
        assertFalse(state.inProgress);
        assertEquals("IllegalStateException: crawler exploded", state.lastError);
        assertNull(state.lastResult);
        assertEquals(0, successes.get());
    }

    @Test
    void jobThrowingError_shouldStillClearInProgressAndAllowNextRun() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RefreshOrchestrator orchestrator = new RefreshOrchestrator(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("boom");
            }
            return new RefreshResult("240105", "out", 0.1, 1);
        }, true, "", CLOCK, null);

        orchestrator.trigger();
        assertTrue(orchestrator.awaitIdle(5000));

        RefreshState failed = orchestrator.status();
        assertFalse(failed.inProgress);
        assertEquals("AssertionError: boom", failed.lastError);
        assertEquals("2024-01-05T15:30:00", failed.endedAt);

        TriggerResult again = orchestrator.trigger();
        assertTrue(orchestrator.awaitIdle(5000));
        assertEquals(TriggerResult.Status.STARTED, again.status);
        assertEquals(2L, orchestrator.status().refreshId);
        assertEquals("", orchestrator.status().lastError);
    }

    @Test
    void trigger_shouldHonourDisabledFlagAndToken() {
        RefreshOrchestrator disabled = new RefreshOrchestrator(() -> null, false, "", CLOCK, null);
        RefreshOrchestrator guarded = new RefreshOrchestrator(() -> null, true, "s3cret", CLOCK, null);

        TriggerResult off = disabled.trigger();
        TriggerResult denied = guarded.trigger("wrong");

        assertEquals(TriggerResult.Status.DISABLED, off.status);
        assertSame(RefreshState.IDLE, off.state);
        assertFalse(disabled.isEnabled());
        assertEquals(TriggerResult.Status.FORBIDDEN, denied.status);
        assertEquals(0L, guarded.status().refreshId);
    }

    @Test
    void awaitIdle_withoutRunShouldReturnImmediately() throws Exception {
        RefreshOrchestrator orchestrator = new RefreshOrchestrator(() -> null, true, "", CLOCK, null);

        assertTrue(orchestrator.awaitIdle(10));
    }
}
