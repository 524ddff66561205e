package ph.extremelogic.common.logsink;

/**
 * Receives the sink's own failures: unopenable log files, failed writes,
 * skipped file output. Implementations must not log through the sink that
 * reports to them.
 */
@FunctionalInterface
public interface ErrorHandler {
    void error(String message, Throwable cause);
}
