package io.github.byzatic.jobscheduler.exceptions;

/**
 * Describes an execution attempt that outlived its timeout. Never thrown to callers, only recorded.
 */
public class ExecutionTimeoutException extends JobSchedulerException {
    public ExecutionTimeoutException(String message) {
        super(message);
    }

    public ExecutionTimeoutException(Throwable cause) {
        super(cause);
    }

    public ExecutionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExecutionTimeoutException(Throwable cause, String message) {
        super(message, cause);
    }
}
