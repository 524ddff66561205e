package ph.extremelogic.common.logsink;

import ph.extremelogic.common.logsink.api.Level;
import ph.extremelogic.common.logsink.api.SourceLocation;

import java.util.Objects;

/**
 * A submitted log message. Immutable; the timestamp is taken on the
 * submitting thread, so queueing delay never changes it.
 */
public final class LogEvent {
    private final long timeMillis;
    private final Level level;
    private final String text;
    private final String sourceFile;
    private final int sourceLine;
    private final String threadName;

    public LogEvent(long timeMillis, Level level, String text, String sourceFile, int sourceLine) {
        this(timeMillis, level, text, sourceFile, sourceLine, Thread.currentThread().getName());
    }

    public LogEvent(long timeMillis, Level level, String text, String sourceFile, int sourceLine,
                    String threadName) {
        this.timeMillis = timeMillis;
        this.level = Objects.requireNonNull(level, "level");
        this.text = text;
        this.sourceFile = sourceFile;
        this.sourceLine = sourceLine;
        this.threadName = threadName;
    }

    public long getTimeMillis() { return timeMillis; }
    public Level getLevel() { return level; }
    public String getText() { return text; }
    public String getSourceFile() { return sourceFile; }
    public int getSourceLine() { return sourceLine; }
    public String getThreadName() { return threadName; }

    public SourceLocation getSourceLocation() {
        return new SourceLocation(sourceFile, sourceLine);
    }

    @Override
    public String toString() {
        return "LogEvent[" + level + " " + sourceFile + ":" + sourceLine + " " + text + "]";
    }
}
