package ph.extremelogic.common.logsink.dispatch;

import ph.extremelogic.common.logsink.LogEvent;

import java.util.concurrent.TimeUnit;

/**
 * Hands submitted events to a single background worker that writes them in
 * submission order.
 */
public interface LogDispatcher {
    void start();

    /**
     * @return false if the event was not accepted and will never be written
     */
    boolean submit(LogEvent event);

    /**
     * Signals the worker, waits until every accepted event is written and
     * joins the worker thread. Cooperative, with no timeout.
     */
    void shutdown();

    boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException;

    long getPendingEvents();

    WorkerState getState();

    String getName();
}
