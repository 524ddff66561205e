package ph.extremelogic.common.logsink;

/**
 * Default {@link ErrorHandler}, prints one line per failure to {@code System.err}.
 */
public final class StdErrErrorHandler implements ErrorHandler {
    private final String name;

    public StdErrErrorHandler(String name) {
        this.name = name;
    }

    @Override
    public void error(String message, Throwable cause) {
        if (cause != null) {
            System.err.printf("%s: %s: %s%n", name, message, cause);
        } else {
            System.err.printf("%s: %s%n", name, message);
        }
    }
}
