package io.github.byzatic.jobscheduler.exceptions;

/**
 * Schedule cannot be accepted: malformed or never-firing cron expression, a past instant for a one-off job,
 * a non-positive interval or an attempt to change the kind of schedule of an existing job.
 */
public class InvalidScheduleSpecException extends JobSchedulerException {
    public InvalidScheduleSpecException(String message) {
        super(message);
    }

    public InvalidScheduleSpecException(Throwable cause) {
        super(cause);
    }

    public InvalidScheduleSpecException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidScheduleSpecException(Throwable cause, String message) {
        super(message, cause);
    }
}
