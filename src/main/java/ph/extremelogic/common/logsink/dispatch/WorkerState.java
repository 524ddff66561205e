package ph.extremelogic.common.logsink.dispatch;

public enum WorkerState {
    RUNNING,
    /** Shutdown signalled; writing what is left without waiting for more. */
    DRAINING,
    STOPPED
}
