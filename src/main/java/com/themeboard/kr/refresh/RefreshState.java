package com.themeboard.kr.refresh;

/**
 * 模块说明：RefreshState（class）。
 * 主要职责：刷新任务状态的不可变快照；只由 RefreshOrchestrator 在状态锁内替换。
 */
public final class RefreshState {
    public static final RefreshState IDLE = new RefreshState(false, "", "", null, "", 0L);

    public final boolean inProgress;
    public final String startedAt;
    public final String endedAt;
    public final RefreshResult lastResult;
    public final String lastError;
    public final long refreshId;

    public RefreshState(
            boolean inProgress,
            String startedAt,
            String endedAt,
            RefreshResult lastResult,
            String lastError,
            long refreshId
    ) {
        this.inProgress = inProgress;
        this.startedAt = startedAt == null ? "" : startedAt;
        this.endedAt = endedAt == null ? "" : endedAt;
        this.lastResult = lastResult;
        this.lastError = lastError == null ? "" : lastError;
        this.refreshId = refreshId;
    }

    RefreshState started(String at, long id) {
        return new RefreshState(true, at, "", lastResult, "", id);
    }

    RefreshState succeeded(String at, RefreshResult result) {
        return new RefreshState(false, startedAt, at, result, "", refreshId);
    }

    RefreshState failed(String at, String error) {
        return new RefreshState(false, startedAt, at, lastResult, error, refreshId);
    }
}
