package ph.extremelogic.common.logsink;

import ph.extremelogic.common.logsink.api.Level;
import ph.extremelogic.common.logsink.api.OutputTarget;
import ph.extremelogic.common.logsink.api.SourceLocation;
import ph.extremelogic.common.logsink.appender.ConsoleAppender;
import ph.extremelogic.common.logsink.appender.FileAppender;
import ph.extremelogic.common.logsink.appender.SinkWriter;
import ph.extremelogic.common.logsink.dispatch.DisruptorLogDispatcher;
import ph.extremelogic.common.logsink.dispatch.LogDispatcher;
import ph.extremelogic.common.logsink.dispatch.QueueLogDispatcher;
import ph.extremelogic.common.logsink.dispatch.WorkerState;
import ph.extremelogic.common.logsink.layout.TemplateLayout;
import ph.extremelogic.common.logsink.message.MessageText;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Asynchronous log sink writing to the console, a file, or both.
 *
 * <p>Callers submit events from any thread; the level check runs on the
 * caller's thread and accepted events are queued for a single worker that
 * renders them with the current template and writes them in submission
 * order. {@link #close()} waits until every accepted event is written before
 * the log file is closed.
 *
 * <p>Until {@link #init} is called the logger writes to the console only,
 * with the default template, at {@link Level#TRACE}.
 *
 * <pre>{@code
 * try (AsyncLogger logger = AsyncLogger.builder().name("app").build()) {
 *     logger.init(Level.DEBUG, "logs/app.log");
 *     logger.setOutputTarget(OutputTarget.BOTH);
 *     logger.info("User ", user, " logged in");
 * }
 * }</pre>
 */
public final class AsyncLogger implements AutoCloseable {
    private static final DateTimeFormatter STARTUP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final String name;
    private final Clock clock;
    private final ErrorHandler errorHandler;
    private final String startupTime;
    private final LogDispatcher dispatcher;

    // Guards outputTarget, layout, logFilePath and the sink writer's file.
    // The worker reads them under the read lock, then writes without it.
    private final ReentrantReadWriteLock configLock = new ReentrantReadWriteLock();
    private final SinkWriter sinkWriter;
    private OutputTarget outputTarget;
    private TemplateLayout layout;
    private Path logFilePath;

    private volatile Level minimumLevel;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong processedEvents = new AtomicLong(0);
    private final AtomicLong droppedEvents = new AtomicLong(0);

    public AsyncLogger() {
        this(builder());
    }

    public AsyncLogger(Configuration configuration) {
        this(builder().configuration(configuration));
    }

    private AsyncLogger(Builder builder) {
        Configuration config = builder.configuration;

        this.name = builder.name;
        this.clock = builder.clock;
        this.errorHandler = builder.errorHandler != null ? builder.errorHandler : new StdErrErrorHandler(name);
        this.startupTime = LocalDateTime.now(clock).format(STARTUP_FORMATTER);

        this.minimumLevel = config.getLevel();
        this.outputTarget = config.getOutputTarget();
        this.layout = new TemplateLayout(config.getFormatTemplate(), clock.getZone());

        ConsoleAppender console = new ConsoleAppender(name + "-console",
                builder.console != null ? builder.console : System.out);
        console.start();
        this.sinkWriter = new SinkWriter(console, errorHandler);

        if (config.getDispatcherType() == Configuration.DispatcherType.DISRUPTOR) {
            this.dispatcher = new DisruptorLogDispatcher(name, config.getRingBufferSize(),
                    config.getOverflowPolicy(), this::writeEvent, errorHandler);
        } else {
            this.dispatcher = new QueueLogDispatcher(name, this::writeEvent, errorHandler);
        }
        dispatcher.start();

        if (config.isRegisterShutdownHook()) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::close, "logsink-shutdown-" + name));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public void init(Level level, String filePath) {
        init(level, filePath, true, true);
    }

    public void init(Level level, String filePath, boolean append) {
        init(level, filePath, append, true);
    }

    /**
     * Sets the minimum level and (re)opens the log file. A previously open
     * file is closed first. Failures to resolve, create or open the file are
     * reported to the {@link ErrorHandler} and leave file output closed; they
     * are never thrown. Ignored, and reported, once the logger is closed.
     *
     * @param addTimestampSuffix insert {@code _yyyy-MM-dd_HH-mm-ss} (the
     *                           logger's startup time) before the file
     *                           name's extension
     */
    public void init(Level level, String filePath, boolean append, boolean addTimestampSuffix) {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(filePath, "filePath");

        configLock.writeLock().lock();
        try {
            if (closed.get()) {
                errorHandler.error("Logger " + name + " is closed, init of " + filePath + " ignored", null);
                return;
            }
            minimumLevel = level;

            Path resolved;
            try {
                resolved = resolveLogFilePath(filePath, addTimestampSuffix);
            } catch (InvalidPathException e) {
                errorHandler.error("Invalid log file path " + filePath, e);
                logFilePath = null;
                sinkWriter.replaceFile(null);
                return;
            }
            logFilePath = resolved;

            // The old file must be closed before the new one is opened, as
            // both may name the same path
            sinkWriter.closeFile();
            FileAppender next = new FileAppender(name + "-file", resolved, append);
            try {
                next.start();
                sinkWriter.replaceFile(next);
            } catch (IOException e) {
                errorHandler.error("Failed to open log file " + resolved, e);
            }
        } finally {
            configLock.writeLock().unlock();
        }
    }

    Path resolveLogFilePath(String filePath, boolean addTimestampSuffix) {
        Path path = Paths.get(filePath);
        Path fileName = path.getFileName();
        if (!addTimestampSuffix || fileName == null) {
            return path;
        }

        String file = fileName.toString();
        int dot = file.lastIndexOf('.');
        String suffixed = dot >= 0
                ? file.substring(0, dot) + "_" + startupTime + file.substring(dot)
                : file + "_" + startupTime;
        return path.resolveSibling(suffixed);
    }

    public void setLogLevel(Level level) {
        minimumLevel = Objects.requireNonNull(level, "level");
    }

    public Level getLogLevel() {
        return minimumLevel;
    }

    public void setOutputTarget(OutputTarget target) {
        Objects.requireNonNull(target, "target");

        configLock.writeLock().lock();
        try {
            outputTarget = target;
        } finally {
            configLock.writeLock().unlock();
        }
    }

    public OutputTarget getOutputTarget() {
        configLock.readLock().lock();
        try {
            return outputTarget;
        } finally {
            configLock.readLock().unlock();
        }
    }

    /**
     * Template used for events written from now on, including events already
     * queued. See {@link TemplateLayout} for the placeholders.
     */
    public void setFormatTemplate(String formatTemplate) {
        TemplateLayout next = new TemplateLayout(formatTemplate, clock.getZone());

        configLock.writeLock().lock();
        try {
            layout = next;
        } finally {
            configLock.writeLock().unlock();
        }
    }

    public String getFormatTemplate() {
        configLock.readLock().lock();
        try {
            return layout.getTemplate();
        } finally {
            configLock.readLock().unlock();
        }
    }

    /**
     * Path of the last {@link #init} call after suffixing, or null before the
     * first one.
     */
    public Path getLogFilePath() {
        configLock.readLock().lock();
        try {
            return logFilePath;
        } finally {
            configLock.readLock().unlock();
        }
    }

    public boolean isFileOpen() {
        configLock.readLock().lock();
        try {
            return sinkWriter.isFileOpen();
        } finally {
            configLock.readLock().unlock();
        }
    }

    public boolean isEnabled(Level level) {
        return Level.isLoggingEnabled(minimumLevel, level);
    }

    public void log(Level level, String message, String sourceFile, int sourceLine) {
        if (!isEnabled(level)) {
            return;
        }
        submit(new LogEvent(clock.millis(), level, message, sourceFile, sourceLine));
    }

    /**
     * Joins {@code values} into the message text, see {@link MessageText#join}.
     */
    public void log(Level level, String sourceFile, int sourceLine, Object... values) {
        if (!isEnabled(level)) {
            return;
        }
        submit(new LogEvent(clock.millis(), level, MessageText.join(values), sourceFile, sourceLine));
    }

    public void log(Level level, SourceLocation location, Object... values) {
        if (!isEnabled(level)) {
            return;
        }
        submit(new LogEvent(clock.millis(), level, MessageText.join(values),
                location.getFileName(), location.getLineNumber()));
    }

    /**
     * SLF4J-style {@code {}} formatting, see {@link MessageText#format}.
     */
    public void logf(Level level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        log(level, SourceLocation.capture(), MessageText.format(format, args));
    }

    public void trace(Object... values) {
        if (isEnabled(Level.TRACE)) {
            log(Level.TRACE, SourceLocation.capture(), values);
        }
    }

    public void debug(Object... values) {
        if (isEnabled(Level.DEBUG)) {
            log(Level.DEBUG, SourceLocation.capture(), values);
        }
    }

    public void info(Object... values) {
        if (isEnabled(Level.INFO)) {
            log(Level.INFO, SourceLocation.capture(), values);
        }
    }

    public void warn(Object... values) {
        if (isEnabled(Level.WARNING)) {
            log(Level.WARNING, SourceLocation.capture(), values);
        }
    }

    public void error(Object... values) {
        if (isEnabled(Level.ERROR)) {
            log(Level.ERROR, SourceLocation.capture(), values);
        }
    }

    public void critical(Object... values) {
        if (isEnabled(Level.CRITICAL)) {
            log(Level.CRITICAL, SourceLocation.capture(), values);
        }
    }

    private void submit(LogEvent event) {
        if (closed.get() || !dispatcher.submit(event)) {
            droppedEvents.incrementAndGet();
        }
    }

    // Runs on the worker thread only. The lock is held to read the
    // configuration, never across the write itself.
    private void writeEvent(LogEvent event) {
        TemplateLayout currentLayout;
        OutputTarget currentTarget;
        FileAppender currentFile;
        configLock.readLock().lock();
        try {
            currentLayout = layout;
            currentTarget = outputTarget;
            currentFile = sinkWriter.getFile();
        } finally {
            configLock.readLock().unlock();
        }

        String line = currentLayout.toSerializable(event);
        if (!sinkWriter.write(line, currentTarget, currentFile)) {
            // init replaced the file while this line was being written
            FileAppender latest = currentFile();
            if (latest == currentFile || !sinkWriter.writeFile(line, latest)) {
                errorHandler.error("Log file closed during write, line dropped", null);
            }
        }
        processedEvents.incrementAndGet();
    }

    private FileAppender currentFile() {
        configLock.readLock().lock();
        try {
            return sinkWriter.getFile();
        } finally {
            configLock.readLock().unlock();
        }
    }

    /**
     * Waits until every event accepted so far has been written.
     *
     * @return false if the timeout elapsed first
     */
    public boolean flush(long timeout, TimeUnit unit) throws InterruptedException {
        return dispatcher.awaitDrained(timeout, unit);
    }

    /**
     * Stops accepting events, waits for the worker to write everything
     * already accepted, joins it, then closes the log file. There is no
     * timeout: a blocked write delays this call. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        dispatcher.shutdown();

        configLock.writeLock().lock();
        try {
            sinkWriter.closeFile();
            try {
                sinkWriter.getConsole().stop();
            } catch (IOException e) {
                errorHandler.error("Failed to stop console output", e);
            }
        } finally {
            configLock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String getName() { return name; }
    public String getStartupTime() { return startupTime; }
    public WorkerState getWorkerState() { return dispatcher.getState(); }
    public long getProcessedEvents() { return processedEvents.get(); }
    public long getDroppedEvents() { return droppedEvents.get(); }
    public long getPendingEvents() { return dispatcher.getPendingEvents(); }

    public static final class Builder {
        private String name = "logsink";
        private Configuration configuration = new Configuration();
        private PrintStream console;
        private Clock clock = Clock.systemDefaultZone();
        private ErrorHandler errorHandler;

        private Builder() {
        }

        public Builder name(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Logger name must not be blank");
            }
            this.name = name;
            return this;
        }

        public Builder configuration(Configuration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
            return this;
        }

        /** Stream for console output, {@code System.out} by default. */
        public Builder console(PrintStream console) {
            this.console = Objects.requireNonNull(console, "console");
            return this;
        }

        /** Source of event timestamps and of the zone they are rendered in. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder errorHandler(ErrorHandler errorHandler) {
            this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
            return this;
        }

        public AsyncLogger build() {
            return new AsyncLogger(this);
        }
    }
}
