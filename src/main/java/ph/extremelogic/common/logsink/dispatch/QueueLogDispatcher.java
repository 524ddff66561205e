package ph.extremelogic.common.logsink.dispatch;

import ph.extremelogic.common.logsink.ErrorHandler;
import ph.extremelogic.common.logsink.LogEvent;
import ph.extremelogic.common.logsink.queue.LogQueue;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default dispatcher: an unbounded {@link LogQueue} drained by one
 * {@link LogWorker} thread. Producers never wait for the worker.
 */
public final class QueueLogDispatcher implements LogDispatcher {
    private final String name;
    private final LogQueue queue = new LogQueue();
    private final LogWorker worker;
    private final Thread workerThread;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public QueueLogDispatcher(String name, EventWriter writer, ErrorHandler errorHandler) {
        this.name = name;
        this.worker = new LogWorker(queue, writer, errorHandler);
        this.workerThread = new WorkerThreadFactory(name).newThread(worker);
    }

    @Override
    public void start() {
        if (started.compareAndSet(false, true)) {
            workerThread.start();
        }
    }

    @Override
    public boolean submit(LogEvent event) {
        return queue.enqueue(event);
    }

    @Override
    public void shutdown() {
        queue.signalShutdown();

        if (started.compareAndSet(false, true)) {
            // Never started: drain on the caller's thread
            worker.run();
            return;
        }
        joinUninterruptibly();
    }

    private void joinUninterruptibly() {
        boolean interrupted = false;
        while (workerThread.isAlive()) {
            try {
                workerThread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.awaitDrained(timeout, unit);
    }

    @Override
    public long getPendingEvents() {
        return queue.pending();
    }

    @Override
    public WorkerState getState() {
        return worker.getState();
    }

    @Override
    public String getName() {
        return name;
    }

    LogQueue getQueue() {
        return queue;
    }

    LogWorker getWorker() {
        return worker;
    }
}
