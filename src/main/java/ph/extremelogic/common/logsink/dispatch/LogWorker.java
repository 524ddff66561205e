package ph.extremelogic.common.logsink.dispatch;

import ph.extremelogic.common.logsink.ErrorHandler;
import ph.extremelogic.common.logsink.LogEvent;
import ph.extremelogic.common.logsink.queue.LogQueue;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Worker loop: take everything queued, write it in order, repeat. After
 * shutdown is signalled it keeps sweeping without waiting until a sweep
 * comes back empty, then stops.
 */
public final class LogWorker implements Runnable {
    private final LogQueue queue;
    private final EventWriter writer;
    private final ErrorHandler errorHandler;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.RUNNING);
    private final AtomicLong eventsWritten = new AtomicLong(0);
    private final AtomicLong batchesProcessed = new AtomicLong(0);

    public LogWorker(LogQueue queue, EventWriter writer, ErrorHandler errorHandler) {
        this.queue = queue;
        this.writer = writer;
        this.errorHandler = errorHandler;
    }

    @Override
    public void run() {
        try {
            List<LogEvent> batch;
            while (!(batch = queue.drainWait()).isEmpty()) {
                if (queue.isShutdownRequested()) {
                    state.compareAndSet(WorkerState.RUNNING, WorkerState.DRAINING);
                }
                processBatch(batch);
            }
        } finally {
            // Also reached when an Error escapes a write
            int abandoned = queue.stopAccepting();
            if (abandoned > 0) {
                errorHandler.error("Log worker stopped with " + abandoned + " events still queued", null);
            }
            state.set(WorkerState.STOPPED);
        }
    }

    private void processBatch(List<LogEvent> batch) {
        try {
            for (LogEvent event : batch) {
                try {
                    writer.write(event);
                    eventsWritten.incrementAndGet();
                } catch (RuntimeException e) {
                    errorHandler.error("Failed to write " + event, e);
                }
            }
            batchesProcessed.incrementAndGet();
        } finally {
            queue.completed(batch.size());
        }
    }

    public WorkerState getState() { return state.get(); }
    public long getEventsWritten() { return eventsWritten.get(); }
    public long getBatchesProcessed() { return batchesProcessed.get(); }
}
