package com.themeboard.kr.refresh;

/**
 * Outcome of one ingestion run: the day directory it filled and how many theme files it holds.
 */
public final class RefreshResult {
    public final String dateTag;
    public final String outDir;
    public final double seconds;
    public final int files;

    public RefreshResult(String dateTag, String outDir, double seconds, int files) {
        this.dateTag = dateTag == null ? "" : dateTag;
        this.outDir = outDir == null ? "" : outDir;
        this.seconds = seconds;
        this.files = Math.max(0, files);
    }

    @Override
    public String toString() {
        return "RefreshResult{dateTag=" + dateTag + ", outDir=" + outDir + ", seconds=" + seconds + ", files=" + files + "}";
    }
}
