package ph.extremelogic.common.logsink.appender;

import ph.extremelogic.common.logsink.ErrorHandler;
import ph.extremelogic.common.logsink.api.OutputTarget;

import java.io.IOException;
import java.util.Objects;

/**
 * Routes a rendered line to the console and/or the current log file.
 * The file reference is swapped by the owning logger under its
 * configuration lock; writes run without that lock against a snapshot.
 */
public final class SinkWriter {
    private final Appender console;
    private final ErrorHandler errorHandler;
    private FileAppender file;

    public SinkWriter(Appender console, ErrorHandler errorHandler) {
        this.console = Objects.requireNonNull(console, "console");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    }

    public void write(String line, OutputTarget target) {
        if (!write(line, target, file)) {
            errorHandler.error("Log file is not open, file output skipped", null);
        }
    }

    /**
     * Writes {@code line} to the destinations in {@code target}, using
     * {@code file} as the log file. The caller passes the file it saw when it
     * read the rest of its configuration, so no lock needs to be held while
     * the line is written.
     *
     * @return false if {@code file} was closed before the line reached it,
     *         so the caller can retry with the file that replaced it
     */
    public boolean write(String line, OutputTarget target, FileAppender file) {
        if (target.includes(OutputTarget.CONSOLE)) {
            try {
                console.append(line);
            } catch (IOException e) {
                errorHandler.error("Failed to write to " + console.getName(), e);
            }
        }

        if (target.includes(OutputTarget.FILE)) {
            return writeFile(line, file);
        }
        return true;
    }

    /**
     * @return false if {@code file} was closed before the line reached it
     */
    public boolean writeFile(String line, FileAppender file) {
        if (file == null) {
            errorHandler.error("Log file is not open, file output skipped", null);
            return true;
        }
        try {
            file.append(line);
            return true;
        } catch (IOException e) {
            if (!file.isStarted()) {
                return false;
            }
            errorHandler.error("Failed to write to log file " + file.getPath(), e);
            return true;
        }
    }

    /**
     * Closes the current log file, if any, and makes {@code next} the file
     * destination. {@code next} may be null to leave file output closed.
     */
    public void replaceFile(FileAppender next) {
        closeFile();
        this.file = next;
    }

    public void closeFile() {
        if (file == null) return;

        try {
            file.stop();
        } catch (IOException e) {
            errorHandler.error("Failed to close log file " + file.getPath(), e);
        } finally {
            file = null;
        }
    }

    public boolean isFileOpen() {
        return file != null && file.isStarted();
    }

    public FileAppender getFile() {
        return file;
    }

    public Appender getConsole() {
        return console;
    }
}
