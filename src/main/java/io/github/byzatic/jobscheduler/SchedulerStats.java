package io.github.byzatic.jobscheduler;

import io.github.byzatic.jobscheduler.model.JobStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time counters of the scheduling core. Values are read one after another and are not a consistent
 * snapshot.
 */
public final class SchedulerStats {
    private final Map<JobStatus, Integer> jobsByStatus;
    private final int totalJobs;
    private final int queueDepth;
    private final int pendingRetries;
    private final int executionsInFlight;
    private final int runningExecutions;
    private final int busyWorkers;
    private final int workerPoolSize;

    SchedulerStats(Map<JobStatus, Integer> jobsByStatus, int queueDepth, int pendingRetries, int executionsInFlight,
                   int runningExecutions, int busyWorkers, int workerPoolSize) {
        EnumMap<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, jobsByStatus.getOrDefault(status, 0));
        }
        this.jobsByStatus = Collections.unmodifiableMap(counts);
        this.totalJobs = counts.values().stream().mapToInt(Integer::intValue).sum();
        this.queueDepth = queueDepth;
        this.pendingRetries = pendingRetries;
        this.executionsInFlight = executionsInFlight;
        this.runningExecutions = runningExecutions;
        this.busyWorkers = busyWorkers;
        this.workerPoolSize = workerPoolSize;
    }

    /**
     * Every status is present, with 0 where no job has it.
     */
    public Map<JobStatus, Integer> getJobsByStatus() {
        return jobsByStatus;
    }

    public int getJobCount(JobStatus status) {
        return jobsByStatus.get(status);
    }

    public int getTotalJobs() {
        return totalJobs;
    }

    /**
     * Attempts waiting in the dispatch queue.
     */
    public int getQueueDepth() {
        return queueDepth;
    }

    /**
     * Retries waiting for their backoff to elapse.
     */
    public int getPendingRetries() {
        return pendingRetries;
    }

    /**
     * Jobs with an execution queued, running or waiting for a retry.
     */
    public int getExecutionsInFlight() {
        return executionsInFlight;
    }

    public int getRunningExecutions() {
        return runningExecutions;
    }

    public int getBusyWorkers() {
        return busyWorkers;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    @Override
    public String toString() {
        return "SchedulerStats{jobsByStatus=" + jobsByStatus + ", queueDepth=" + queueDepth +
                ", pendingRetries=" + pendingRetries + ", executionsInFlight=" + executionsInFlight +
                ", runningExecutions=" + runningExecutions + ", busyWorkers=" + busyWorkers + '/' + workerPoolSize + '}';
    }
}
