package ph.extremelogic.common.logsink.dispatch;

import ph.extremelogic.common.logsink.LogEvent;

/**
 * Renders and writes one event; called only from the worker thread.
 */
@FunctionalInterface
public interface EventWriter {
    void write(LogEvent event);
}
