package ph.extremelogic.common.logsink.appender;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes each line to a {@link PrintStream}. The stream's charset does any
 * transcoding the console needs.
 */
public final class ConsoleAppender implements Appender {
    private final String name;
    private final PrintStream out;
    private volatile boolean started = false;

    public ConsoleAppender(String name) {
        this(name, System.out);
    }

    public ConsoleAppender(String name, PrintStream out) {
        this.name = name;
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void append(String line) throws IOException {
        if (!started) {
            throw new IOException("Console appender " + name + " is not started");
        }

        synchronized (out) {
            out.println(line);
            // PrintStream never throws, it only records the failure
            if (out.checkError()) {
                throw new IOException("Console stream reported a write error");
            }
        }
    }

    @Override
    public void start() { started = true; }

    @Override
    public void stop() {
        started = false;
        out.flush();
    }

    @Override
    public boolean isStarted() { return started; }

    @Override
    public String getName() { return name; }
}
