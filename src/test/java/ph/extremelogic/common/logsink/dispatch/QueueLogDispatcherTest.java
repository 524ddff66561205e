package ph.extremelogic.common.logsink.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ph.extremelogic.common.logsink.ErrorHandler;
import ph.extremelogic.common.logsink.LogEvent;
import ph.extremelogic.common.logsink.api.Level;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class QueueLogDispatcherTest {

    private final List<String> written = Collections.synchronizedList(new ArrayList<>());
    private final ErrorHandler errorHandler = mock(ErrorHandler.class);
    private QueueLogDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
    }

    private static LogEvent event(String text) {
        return new LogEvent(0L, Level.INFO, text, "QueueLogDispatcherTest.java", 1);
    }

    @Test
    @DisplayName("Should write submitted events in order")
    void testFifoDelivery() throws Exception {
        dispatcher = new QueueLogDispatcher("fifo", e -> written.add(e.getText()), errorHandler);
        dispatcher.start();

        for (int i = 0; i < 100; i++) {
            assertTrue(dispatcher.submit(event("m" + i)));
        }
        assertTrue(dispatcher.awaitDrained(5, TimeUnit.SECONDS));

        assertEquals(100, written.size());
        for (int i = 0; i < 100; i++) {
            assertEquals("m" + i, written.get(i));
        }
        assertEquals(WorkerState.RUNNING, dispatcher.getState());
    }

    @Test
    @DisplayName("Shutdown should write every accepted event before stopping")
    void testDrainOnShutdown() {
        CountDownLatch release = new CountDownLatch(1);
        dispatcher = new QueueLogDispatcher("drain", e -> {
            awaitQuietly(release);
            written.add(e.getText());
        }, errorHandler);
        dispatcher.start();

        for (int i = 0; i < 500; i++) {
            dispatcher.submit(event("m" + i));
        }
        release.countDown();
        dispatcher.shutdown();

        assertEquals(500, written.size(), "No event may be lost on a clean shutdown");
        assertEquals(WorkerState.STOPPED, dispatcher.getState());
        assertEquals(0, dispatcher.getPendingEvents());
        assertFalse(dispatcher.submit(event("late")), "Stopped dispatcher should reject events");
    }

    @Test
    @DisplayName("Worker should report DRAINING while it finishes after a shutdown signal")
    void testDrainingState() throws Exception {
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<WorkerState> observed = Collections.synchronizedList(new ArrayList<>());
        dispatcher = new QueueLogDispatcher("draining", e -> {
            if ("block".equals(e.getText())) {
                writing.countDown();
                awaitQuietly(release);
            }
            observed.add(dispatcher.getState());
            written.add(e.getText());
        }, errorHandler);
        dispatcher.start();

        dispatcher.submit(event("block"));
        assertTrue(writing.await(5, TimeUnit.SECONDS));
        dispatcher.submit(event("after"));

        Thread stopper = new Thread(dispatcher::shutdown);
        stopper.start();
        // Wait until the shutdown signal is visible to the queue
        while (!dispatcher.getQueue().isShutdownRequested()) {
            Thread.sleep(1);
        }
        release.countDown();
        stopper.join(5000);

        assertFalse(stopper.isAlive());
        assertEquals(List.of("block", "after"), written);
        assertEquals(List.of(WorkerState.RUNNING, WorkerState.DRAINING), observed);
        assertEquals(WorkerState.STOPPED, dispatcher.getState());
    }

    @Test
    @DisplayName("Shutdown without start should drain on the calling thread")
    void testShutdownWithoutStart() {
        dispatcher = new QueueLogDispatcher("unstarted", e -> written.add(e.getText()), errorHandler);
        dispatcher.submit(event("a"));
        dispatcher.submit(event("b"));

        dispatcher.shutdown();

        assertEquals(List.of("a", "b"), written);
        assertEquals(WorkerState.STOPPED, dispatcher.getState());
    }

    @Test
    @DisplayName("A failing write should be reported and not stop the worker")
    void testWriteFailure() throws Exception {
        dispatcher = new QueueLogDispatcher("failing", e -> {
            if ("bad".equals(e.getText())) {
                throw new IllegalStateException("boom");
            }
            written.add(e.getText());
        }, errorHandler);
        dispatcher.start();

        dispatcher.submit(event("good1"));
        dispatcher.submit(event("bad"));
        dispatcher.submit(event("good2"));
        assertTrue(dispatcher.awaitDrained(5, TimeUnit.SECONDS));

        assertEquals(List.of("good1", "good2"), written);
        verify(errorHandler).error(anyString(), any(IllegalStateException.class));
        assertEquals(2, dispatcher.getWorker().getEventsWritten());
    }

    @Test
    @DisplayName("Shutdown should be safe to call twice")
    void testDoubleShutdown() {
        dispatcher = new QueueLogDispatcher("twice", e -> written.add(e.getText()), errorHandler);
        dispatcher.start();
        dispatcher.submit(event("once"));

        dispatcher.shutdown();
        assertDoesNotThrow(dispatcher::shutdown);
        assertEquals(List.of("once"), written);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("Submissions after the worker died should be rejected")
    void testWorkerDeathRejectsSubmissions() throws Exception {
        dispatcher = new QueueLogDispatcher("fatal", e -> {
            throw new Error("fatal write");
        }, errorHandler);
        dispatcher.start();

        assertTrue(dispatcher.submit(event("kills the worker")));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (dispatcher.getState() != WorkerState.STOPPED && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(WorkerState.STOPPED, dispatcher.getState());
        assertFalse(dispatcher.submit(event("never written")));
        assertFalse(dispatcher.getQueue().isAccepting());
        assertTrue(dispatcher.awaitDrained(1, TimeUnit.SECONDS));
    }
}
