package io.github.byzatic.jobscheduler.exceptions;

/**
 * Lifecycle operation is not allowed in the current (terminal) status of the job.
 */
public class IllegalJobStateException extends JobSchedulerException {
    public IllegalJobStateException(String message) {
        super(message);
    }

    public IllegalJobStateException(Throwable cause) {
        super(cause);
    }

    public IllegalJobStateException(String message, Throwable cause) {
        super(message, cause);
    }

    public IllegalJobStateException(Throwable cause, String message) {
        super(message, cause);
    }
}
