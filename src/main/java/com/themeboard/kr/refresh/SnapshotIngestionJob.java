package com.themeboard.kr.refresh;

/**
 * Produces the day's theme CSV directory. Called on the refresh worker thread; any exception ends
 * the run and is recorded as the last error.
 */
public interface SnapshotIngestionJob {
    RefreshResult runOnce() throws Exception;
}
