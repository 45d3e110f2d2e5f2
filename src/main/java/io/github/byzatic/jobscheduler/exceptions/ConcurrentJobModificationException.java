package io.github.byzatic.jobscheduler.exceptions;

import java.util.UUID;

/**
 * Version-checked update lost against another writer. The caller has to re-fetch the job and retry.
 */
public class ConcurrentJobModificationException extends JobSchedulerException {
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrentJobModificationException(UUID jobId, long expectedVersion, long actualVersion) {
        super("Job " + jobId + " was modified concurrently: expected version " + expectedVersion
                + ", actual " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
