package aquabase.app.setup;

import java.util.List;

/**
 * What happened to each action of one setup run, in action order.
 */
public record ExecutionReport(String setupId, String setupName, List<ExecutionReport.ActionOutcome> outcomes) {

    public enum Status {
        APPLIED,
        SKIPPED_UNCHANGED,
        ROLLED_BACK,
        DEVICE_NOT_FOUND,
        NOT_BASE_DEVICE
    }

    public record ActionOutcome(Action action, Status status, String detail) { }

    public ExecutionReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public boolean anyApplied() {
        return count(Status.APPLIED) > 0;
    }
}
