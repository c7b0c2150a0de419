package com.themeboard.kr.refresh;

public final class TriggerResult {
    public enum Status {
        STARTED,
        ALREADY_RUNNING,
        DISABLED,
        FORBIDDEN
    }

    public final Status status;
    public final RefreshState state;

    public TriggerResult(Status status, RefreshState state) {
        this.status = status;
        this.state = state;
    }

    public boolean started() {
        return status == Status.STARTED;
    }
}
