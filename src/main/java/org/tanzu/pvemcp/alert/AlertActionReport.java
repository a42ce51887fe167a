package org.tanzu.pvemcp.alert;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of applying one operator action to several alerts. Ids that failed map to the
 * reason.
 */
public class AlertActionReport {
    private final AlertAction action;
    private final List<String> processed;
    private final Map<String, String> failed;

    public AlertActionReport(AlertAction action, List<String> processed, Map<String, String> failed) {
        this.action = action;
        this.processed = Collections.unmodifiableList(processed);
        this.failed = Collections.unmodifiableMap(failed);
    }

    public AlertAction getAction() { return action; }
    public List<String> getProcessed() { return processed; }
    public Map<String, String> getFailed() { return failed; }
    public int getProcessedCount() { return processed.size(); }
    public int getFailedCount() { return failed.size(); }

    @Override
    public String toString() {
        return "AlertActionReport{action=" + action + ", processed=" + processed.size() + ", failed=" + failed.size() + "}";
    }
}
