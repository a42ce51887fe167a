package org.tanzu.pvemcp.batch;

import org.tanzu.pvemcp.exception.ErrorKind;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one batch target: what ran, against what, how it ended and how long it
 * took. A skipped target counts as a success.
 */
public final class BatchResult {

    private final BatchTarget target;
    private final BatchAction action;
    private final boolean success;
    private final boolean skipped;
    private final String previousStatus;
    private final String output;
    private final ErrorKind errorKind;
    private final String error;
    private final Instant startedAt;
    private final long durationMillis;

    private BatchResult(BatchTarget target, BatchAction action, boolean success, boolean skipped, String previousStatus,
                        String output, ErrorKind errorKind, String error, Instant startedAt, long durationMillis) {
        this.target = target;
        this.action = action;
        this.success = success;
        this.skipped = skipped;
        this.previousStatus = previousStatus;
        this.output = output;
        this.errorKind = errorKind;
        this.error = error;
        this.startedAt = startedAt;
        this.durationMillis = durationMillis;
    }

    static BatchResult success(BatchTarget target, BatchAction action, String previousStatus, String output,
                               Instant startedAt, long durationMillis) {
        return new BatchResult(target, action, true, false, previousStatus, output, null, null, startedAt, durationMillis);
    }

    static BatchResult skipped(BatchTarget target, BatchAction action, String previousStatus,
                               Instant startedAt, long durationMillis) {
        return new BatchResult(target, action, true, true, previousStatus,
                "Already " + previousStatus + ", nothing to do", null, null, startedAt, durationMillis);
    }

    static BatchResult failure(BatchTarget target, BatchAction action, ErrorKind errorKind, String error,
                               Instant startedAt, long durationMillis) {
        return new BatchResult(target, action, false, false, null, null, errorKind, error, startedAt, durationMillis);
    }

    public BatchTarget getTarget() { return target; }
    public BatchAction getAction() { return action; }
    public boolean isSuccess() { return success; }
    public boolean isSkipped() { return skipped; }
    public String getPreviousStatus() { return previousStatus; }
    public String getOutput() { return output; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getError() { return error; }
    public Instant getStartedAt() { return startedAt; }
    public long getDurationMillis() { return durationMillis; }

    public static long succeeded(List<BatchResult> results) {
        return results.stream().filter(BatchResult::isSuccess).count();
    }

    public static long failed(List<BatchResult> results) {
        return results.stream().filter(r -> !r.isSuccess()).count();
    }

    public static long skipped(List<BatchResult> results) {
        return results.stream().filter(BatchResult::isSkipped).count();
    }

    @Override
    public String toString() {
        return "BatchResult{target=" + target + ", action=" + action + ", success=" + success +
               (skipped ? ", skipped" : "") + (errorKind != null ? ", errorKind=" + errorKind + ", error='" + error + "'" : "") +
               ", durationMillis=" + durationMillis + "}";
    }
}
