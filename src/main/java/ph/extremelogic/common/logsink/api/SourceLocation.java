package ph.extremelogic.common.logsink.api;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * File name and line of the code that submitted a log call.
 */
public final class SourceLocation {
    private static final String UNKNOWN_FILE = "unknown";

    public static final SourceLocation UNKNOWN = new SourceLocation(UNKNOWN_FILE, 0);

    private static final StackWalker WALKER = StackWalker.getInstance();

    // Frames from these classes belong to the logging facade, not the caller
    private static final Set<String> FACADE_CLASSES = Set.of(
            SourceLocation.class.getName(),
            "ph.extremelogic.common.logsink.AsyncLogger"
    );

    private final String fileName;
    private final int lineNumber;

    public SourceLocation(String fileName, int lineNumber) {
        this.fileName = fileName != null ? fileName : UNKNOWN_FILE;
        this.lineNumber = lineNumber;
    }

    /**
     * Location of the first stack frame outside the logging facade.
     */
    public static SourceLocation capture() {
        Optional<StackWalker.StackFrame> caller = WALKER.walk(frames -> frames
                .filter(frame -> !FACADE_CLASSES.contains(frame.getClassName()))
                .findFirst());
        return caller
                .map(frame -> new SourceLocation(frame.getFileName(), frame.getLineNumber()))
                .orElse(UNKNOWN);
    }

    public String getFileName() { return fileName; }
    public int getLineNumber() { return lineNumber; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return lineNumber == that.lineNumber && fileName.equals(that.fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, lineNumber);
    }

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
