package ph.extremelogic.common.logsink.queue;

import ph.extremelogic.common.logsink.LogEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO mailbox between producers and the single worker.
 *
 * <p>All mutation happens under one lock, so the order in which producers
 * acquire it is the order events are handed to the worker. Once shutdown has
 * been signalled and a {@link #drainWait()} sweep finds the queue empty, the
 * queue stops accepting events for good.
 */
public final class LogQueue {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition drained = lock.newCondition();

    private final ArrayDeque<LogEvent> events = new ArrayDeque<>();
    private int inFlight;
    private boolean shutdownRequested;
    private boolean accepting = true;

    /**
     * Appends an event and wakes one waiting consumer.
     *
     * @return false if the queue no longer accepts events
     */
    public boolean enqueue(LogEvent event) {
        Objects.requireNonNull(event, "event");

        lock.lock();
        try {
            if (!accepting) {
                return false;
            }
            events.addLast(event);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until events are queued or shutdown is signalled, then takes
     * every queued event in FIFO order. The caller must report the batch
     * through {@link #completed(int)} once it is written.
     *
     * @return the taken events, or an empty list once shutdown was signalled
     *         and nothing is left, after which the queue rejects new events
     */
    public List<LogEvent> drainWait() {
        lock.lock();
        try {
            while (events.isEmpty() && !shutdownRequested) {
                notEmpty.awaitUninterruptibly();
            }

            if (events.isEmpty()) {
                accepting = false;
                drained.signalAll();
                return Collections.emptyList();
            }

            List<LogEvent> batch = new ArrayList<>(events);
            events.clear();
            inFlight += batch.size();
            return batch;
        } finally {
            lock.unlock();
        }
    }

    public void completed(int count) {
        lock.lock();
        try {
            inFlight -= count;
            if (inFlight == 0 && events.isEmpty()) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until nothing is queued and no taken batch is still being written.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);

        lock.lock();
        try {
            while (!events.isEmpty() || inFlight > 0) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = drained.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void signalShutdown() {
        lock.lock();
        try {
            shutdownRequested = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects all further events and discards any still queued. Called when
     * the worker exits, so nothing is accepted that no one will write.
     *
     * @return the number of queued events discarded
     */
    public int stopAccepting() {
        lock.lock();
        try {
            accepting = false;
            int abandoned = events.size();
            events.clear();
            drained.signalAll();
            return abandoned;
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdownRequested() {
        lock.lock();
        try {
            return shutdownRequested;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAccepting() {
        lock.lock();
        try {
            return accepting;
        } finally {
            lock.unlock();
        }
    }

    /** Events waiting to be taken. */
    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    /** Events queued or taken but not yet reported as written. */
    public int pending() {
        lock.lock();
        try {
            return events.size() + inFlight;
        } finally {
            lock.unlock();
        }
    }
}
