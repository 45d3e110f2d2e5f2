package io.github.byzatic.jobscheduler.exceptions;

import java.util.UUID;

public class JobNotFoundException extends JobSchedulerException {
    public JobNotFoundException(String message) {
        super(message);
    }

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
    }

    public JobNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobNotFoundException(Throwable cause, String message) {
        super(message, cause);
    }
}
