package io.github.byzatic.jobscheduler.exceptions;

/**
 * Base class of the errors the scheduling core reports synchronously to its callers.
 */
public class JobSchedulerException extends Exception {
    public JobSchedulerException(String message) {
        super(message);
    }

    public JobSchedulerException(Throwable cause) {
        super(cause);
    }

    public JobSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobSchedulerException(Throwable cause, String message) {
        super(message, cause);
    }
}
