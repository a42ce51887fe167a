package org.tanzu.pvemcp.pve;

import org.tanzu.pvemcp.batch.BatchAction;
import org.tanzu.pvemcp.batch.BatchResult;

import java.util.List;

/**
 * Results of a batch dispatch; the counts are derived from the results.
 */
public class BatchReport {
    private final BatchAction action;
    private final List<BatchResult> results;

    public BatchReport(BatchAction action, List<BatchResult> results) {
        this.action = action;
        this.results = results;
    }

    public BatchAction getAction() { return action; }
    public List<BatchResult> getResults() { return results; }
    public int getTotal() { return results.size(); }
    public long getSucceeded() { return BatchResult.succeeded(results); }
    public long getFailed() { return BatchResult.failed(results); }
    public long getSkipped() { return BatchResult.skipped(results); }

    @Override
    public String toString() {
        return "BatchReport{action=" + action + ", total=" + getTotal() + ", succeeded=" + getSucceeded() +
               ", failed=" + getFailed() + "}";
    }
}
