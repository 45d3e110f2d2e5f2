package io.github.byzatic.jobscheduler.worker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token. A new one is created for every execution attempt.
 * <p>
 * The worker raises it when the attempt times out, when the job is cancelled while running and when the pool
 * closes. Handlers are expected to check it and return within the configured grace period; the worker does not
 * guarantee hard termination of handler code beyond interrupting its thread.
 */
public final class CancellationToken {
    private final AtomicBoolean stop = new AtomicBoolean(false);
    private volatile String reason = "";

    public boolean isStopRequested() {
        return stop.get();
    }

    public String reason() {
        return reason;
    }

    /**
     * @return {@code false} if a stop was already requested; the first reason is kept
     */
    boolean requestStop(String reason) {
        if (stop.compareAndSet(false, true)) {
            this.reason = reason;
            return true;
        }
        return false;
    }

    /**
     * Хелпер: бросает InterruptedException если пришёл стоп.
     */
    public void throwIfStopRequested() throws InterruptedException {
        if (isStopRequested()) throw new InterruptedException("Stop requested: " + reason);
    }
}
