package io.github.byzatic.jobscheduler.model;

/**
 * Scheduling lifecycle of a job. Execution outcomes are tracked separately, see {@link ExecutionOutcome}.
 */
public enum JobStatus {
    SCHEDULED,
    PAUSED,
    RUNNING,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
