package ph.extremelogic.common.logsink.dispatch;

import java.util.concurrent.ThreadFactory;

final class WorkerThreadFactory implements ThreadFactory {
    private final String threadName;

    WorkerThreadFactory(String name) {
        this.threadName = "logsink-worker-" + name;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, threadName);
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((thread, ex) -> {
            System.err.println("Log worker thread " + thread.getName() + " error: " + ex.getMessage());
            ex.printStackTrace(System.err);
        });
        return t;
    }
}
