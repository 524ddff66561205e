package ph.extremelogic.common.logsink.dispatch;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.LifecycleAware;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import ph.extremelogic.common.logsink.ErrorHandler;
import ph.extremelogic.common.logsink.LogEvent;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded dispatcher on an LMAX Disruptor ring buffer. Producers claim
 * slots in sequence order, so events are written in the order their slots
 * were claimed. When the ring is full the {@link OverflowPolicy} decides
 * between waiting and dropping.
 */
public final class DisruptorLogDispatcher implements LogDispatcher {
    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;
    public static final int MIN_RING_BUFFER_SIZE = 16;

    private final String name;
    private final OverflowPolicy overflowPolicy;
    private final EventWriter writer;
    private final ErrorHandler errorHandler;

    private final Disruptor<EventSlot> disruptor;
    private final RingBuffer<EventSlot> ringBuffer;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.RUNNING);
    private final CountDownLatch stoppedLatch = new CountDownLatch(1);

    // Publishers hold the read lock; shutdown takes the write lock so no
    // publish can race past the final drain
    private final ReentrantReadWriteLock publishLock = new ReentrantReadWriteLock();
    private volatile boolean shuttingDown = false;

    private final ReentrantLock drainLock = new ReentrantLock();
    private final Condition drained = drainLock.newCondition();

    private final AtomicLong publishedEvents = new AtomicLong(0);
    private final AtomicLong processedEvents = new AtomicLong(0);
    private final AtomicLong droppedEvents = new AtomicLong(0);

    public DisruptorLogDispatcher(String name, int ringBufferSize, OverflowPolicy overflowPolicy,
                                  EventWriter writer, ErrorHandler errorHandler) {
        if (ringBufferSize < MIN_RING_BUFFER_SIZE) {
            throw new IllegalArgumentException("Ring buffer size must be at least " + MIN_RING_BUFFER_SIZE);
        }
        if ((ringBufferSize & (ringBufferSize - 1)) != 0) {
            throw new IllegalArgumentException("Ring buffer size must be a power of 2");
        }

        this.name = name;
        this.overflowPolicy = overflowPolicy;
        this.writer = writer;
        this.errorHandler = errorHandler;

        this.disruptor = new Disruptor<>(
                EventSlot::new,
                ringBufferSize,
                new WorkerThreadFactory(name),
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );
        disruptor.setDefaultExceptionHandler(new ReportingExceptionHandler());
        disruptor.handleEventsWith(new SlotHandler());
        this.ringBuffer = disruptor.getRingBuffer();
    }

    @Override
    public void start() {
        if (started.compareAndSet(false, true)) {
            disruptor.start();
        }
    }

    @Override
    public boolean submit(LogEvent event) {
        publishLock.readLock().lock();
        try {
            if (shuttingDown) {
                return false;
            }

            long sequence;
            if (overflowPolicy == OverflowPolicy.BLOCK) {
                sequence = ringBuffer.next();
            } else {
                try {
                    sequence = ringBuffer.tryNext();
                } catch (InsufficientCapacityException e) {
                    droppedEvents.incrementAndGet();
                    return false;
                }
            }

            try {
                ringBuffer.get(sequence).event = event;
            } finally {
                ringBuffer.publish(sequence);
                publishedEvents.incrementAndGet();
            }
            return true;
        } finally {
            publishLock.readLock().unlock();
        }
    }

    @Override
    public void shutdown() {
        publishLock.writeLock().lock();
        try {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
        } finally {
            publishLock.writeLock().unlock();
        }

        // A never-started ring still holds events; start it so they drain
        start();
        state.compareAndSet(WorkerState.RUNNING, WorkerState.DRAINING);

        // Waits for the backlog with no timeout, then halts the handler
        disruptor.shutdown();
        awaitStoppedUninterruptibly();
    }

    private void awaitStoppedUninterruptibly() {
        boolean interrupted = false;
        while (stoppedLatch.getCount() > 0) {
            try {
                stoppedLatch.await();
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
        long nanos = unit.toNanos(timeout);

        drainLock.lock();
        try {
            while (processedEvents.get() < publishedEvents.get()) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = drained.awaitNanos(nanos);
            }
            return true;
        } finally {
            drainLock.unlock();
        }
    }

    // Called by the handler at the end of each batch
    private void signalDrained() {
        drainLock.lock();
        try {
            drained.signalAll();
        } finally {
            drainLock.unlock();
        }
    }

    @Override
    public long getPendingEvents() {
        return publishedEvents.get() - processedEvents.get();
    }

    @Override
    public WorkerState getState() {
        return state.get();
    }

    @Override
    public String getName() {
        return name;
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    static final class EventSlot {
        LogEvent event;
    }

    private final class SlotHandler implements EventHandler<EventSlot>, LifecycleAware {
        @Override
        public void onEvent(EventSlot slot, long sequence, boolean endOfBatch) {
            LogEvent event = slot.event;
            slot.event = null;
            try {
                writer.write(event);
            } catch (RuntimeException e) {
                errorHandler.error("Failed to write " + event, e);
            } finally {
                processedEvents.incrementAndGet();
                if (endOfBatch) {
                    signalDrained();
                }
            }
        }

        @Override
        public void onStart() {
        }

        @Override
        public void onShutdown() {
            state.set(WorkerState.STOPPED);
            stoppedLatch.countDown();
            signalDrained();
        }
    }

    private final class ReportingExceptionHandler implements ExceptionHandler<EventSlot> {
        @Override
        public void handleEventException(Throwable ex, long sequence, EventSlot slot) {
            errorHandler.error("Log worker failed on sequence " + sequence, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            errorHandler.error("Log worker failed to start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            errorHandler.error("Log worker failed to shut down", ex);
        }
    }
}
