package com.themeboard.kr.refresh;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 模块说明：RefreshOrchestrator（class）。
 * 主要职责：同一时刻最多一个快照刷新任务；并发触发直接返回 ALREADY_RUNNING，不排队。
 * 处理流程：状态锁内检查并置为运行 → 守护线程执行任务 → 状态锁内写回结果/错误与结束时间。
 * 使用建议：status() 不加锁，读取的是不可变快照。
 */
public class RefreshOrchestrator {
    private static final Logger LOG = LogManager.getLogger(RefreshOrchestrator.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final SnapshotIngestionJob job;
    private final boolean enabled;
    private final String token;
    private final Clock clock;
    private final Runnable onSuccess;
    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile RefreshState state = RefreshState.IDLE;
    private volatile Thread worker;

    public RefreshOrchestrator(SnapshotIngestionJob job, boolean enabled, String token, Clock clock, Runnable onSuccess) {
        this.job = job;
        this.enabled = enabled;
        this.token = token == null ? "" : token.trim();
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.onSuccess = onSuccess;
    }

    public TriggerResult trigger() {
        return trigger("");
    }

    /**
     * Starts a run unless one is in flight. When a token is configured the caller must present it.
     */
    public TriggerResult trigger(String presentedToken) {
        if (!enabled) {
            return new TriggerResult(TriggerResult.Status.DISABLED, state);
        }
        if (!token.isEmpty() && !token.equals(presentedToken == null ? "" : presentedToken.trim())) {
            return new TriggerResult(TriggerResult.Status.FORBIDDEN, state);
        }
        RefreshState snapshot;
        long runId;
        stateLock.lock();
        try {
            if (state.inProgress) {
                return new TriggerResult(TriggerResult.Status.ALREADY_RUNNING, state);
            }
            runId = state.refreshId + 1;
            state = state.started(now(), runId);
            snapshot = state;
            Thread t = new Thread(() -> runJob(runId), "themeboard-refresh-" + runId);
            t.setDaemon(true);
            worker = t;
            t.start();
        } finally {
            stateLock.unlock();
        }
        LOG.info("refresh started id={}", runId);
        return new TriggerResult(TriggerResult.Status.STARTED, snapshot);
    }

    public RefreshState status() {
        return state;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Blocks until the current run (if any) finishes or the timeout elapses. Returns true when idle.
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        Thread t = worker;
        if (t != null) {
            t.join(Math.max(1L, timeoutMs));
        }
        return !state.inProgress;
    }

    private void runJob(long runId) {
        RefreshResult result = null;
        String error = "";
        try {
            result = job.runOnce();
        } catch (Exception e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            LOG.error("refresh id={} failed: {}", runId, error, e);
        } catch (Error e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            LOG.error("refresh id={} aborted: {}", runId, error, e);
            throw e;
        } finally {
            finish(result, error);
        }
        if (result != null) {
            LOG.info("refresh finished id={} result={}", runId, result);
            if (onSuccess != null) {
                onSuccess.run();
            }
        }
    }

    // Always leaves inProgress=false, whatever the job threw.
    private void finish(RefreshResult result, String error) {
        stateLock.lock();
        try {
            if (result != null) {
                state = state.succeeded(now(), result);
            } else {
                state = state.failed(now(), error.isEmpty() ? "ingestion job returned no result" : error);
            }
        } finally {
            stateLock.unlock();
        }
    }

    private String now() {
        return STAMP.format(LocalDateTime.now(clock));
    }
}
