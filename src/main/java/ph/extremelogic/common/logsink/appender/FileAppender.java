package ph.extremelogic.common.logsink.appender;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends UTF-8 lines to a single file and forces them to disk after every
 * write. A fresh (empty) file starts with a UTF-8 byte-order mark.
 */
public final class FileAppender implements Appender {
    static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private static final String LINE_SEPARATOR = System.lineSeparator();

    private final String name;
    private final Path path;
    private final boolean append;

    private final ReentrantLock channelLock = new ReentrantLock();
    private FileChannel fileChannel;
    private volatile boolean started = false;

    private final AtomicLong bytesWritten = new AtomicLong(0);
    private final AtomicLong writeOperations = new AtomicLong(0);

    public FileAppender(String name, Path path, boolean append) {
        this.name = name;
        this.path = Objects.requireNonNull(path, "path");
        this.append = append;
    }

    @Override
    public void start() throws IOException {
        channelLock.lock();
        try {
            if (started) return;

            createDirectoriesIfNeeded();
            openFileChannel();
            started = true;
        } finally {
            channelLock.unlock();
        }
    }

    @Override
    public void stop() throws IOException {
        channelLock.lock();
        try {
            if (!started) return;
            started = false;

            try {
                fileChannel.force(true);
            } finally {
                fileChannel.close();
                fileChannel = null;
            }
        } finally {
            channelLock.unlock();
        }
    }

    @Override
    public void append(String line) throws IOException {
        byte[] bytes = (line + LINE_SEPARATOR).getBytes(StandardCharsets.UTF_8);

        channelLock.lock();
        try {
            if (!started) {
                throw new IOException("Log file " + path + " is closed");
            }
            writeFully(ByteBuffer.wrap(bytes));
            fileChannel.force(false);
            writeOperations.incrementAndGet();
        } finally {
            channelLock.unlock();
        }
    }

    private void writeFully(ByteBuffer buffer) throws IOException {
        int written = 0;
        while (buffer.hasRemaining()) {
            written += fileChannel.write(buffer);
        }
        bytesWritten.addAndGet(written);
    }

    private void openFileChannel() throws IOException {
        FileChannel channel = FileChannel.open(
                path,
                StandardOpenOption.CREATE,
                append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
        );
        try {
            this.fileChannel = channel;
            if (channel.size() == 0) {
                writeFully(ByteBuffer.wrap(UTF8_BOM));
                channel.force(false);
            }
        } catch (IOException e) {
            this.fileChannel = null;
            channel.close();
            throw e;
        }
    }

    private void createDirectoriesIfNeeded() throws IOException {
        Path parentDir = path.toAbsolutePath().getParent();
        if (parentDir != null && !Files.exists(parentDir)) {
            Files.createDirectories(parentDir);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
    }

    public long getBytesWritten() {
        return bytesWritten.get();
    }

    public long getWriteOperations() {
        return writeOperations.get();
    }
}
