package ph.extremelogic.common.logsink.appender;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileAppenderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("A fresh file should start with the UTF-8 BOM followed by the first line")
    void testBomOnFreshFile() throws IOException {
        Path file = tempDir.resolve("fresh.log");
        FileAppender appender = new FileAppender("file", file, true);

        appender.start();
        appender.append("first line");
        appender.stop();

        byte[] bytes = Files.readAllBytes(file);
        assertArrayEquals(FileAppender.UTF8_BOM, Arrays.copyOf(bytes, 3));
        String rest = new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        assertEquals("first line" + System.lineSeparator(), rest);
    }

    @Test
    @DisplayName("Appending to a non-empty file should not write a second BOM")
    void testNoBomWhenAppending() throws IOException {
        Path file = tempDir.resolve("existing.log");
        Files.writeString(file, "old" + System.lineSeparator(), StandardCharsets.UTF_8);

        FileAppender appender = new FileAppender("file", file, true);
        appender.start();
        appender.append("new");
        appender.stop();

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(List.of("old", "new"), lines);
    }

    @Test
    @DisplayName("Truncate mode should discard old content and write a BOM")
    void testTruncate() throws IOException {
        Path file = tempDir.resolve("truncate.log");
        Files.writeString(file, "old content" + System.lineSeparator(), StandardCharsets.UTF_8);

        FileAppender appender = new FileAppender("file", file, false);
        appender.start();
        appender.append("replacement");
        appender.stop();

        byte[] bytes = Files.readAllBytes(file);
        assertArrayEquals(FileAppender.UTF8_BOM, Arrays.copyOf(bytes, 3));
        assertFalse(new String(bytes, StandardCharsets.UTF_8).contains("old content"));
    }

    @Test
    @DisplayName("Should create missing parent directories")
    void testCreatesDirectories() throws IOException {
        Path file = tempDir.resolve("logs").resolve("nested").resolve("app.log");
        FileAppender appender = new FileAppender("file", file, true);

        appender.start();
        appender.append("hello");
        appender.stop();

        assertTrue(Files.isRegularFile(file));
    }

    @Test
    @DisplayName("Should write non-ASCII text as UTF-8")
    void testUtf8() throws IOException {
        Path file = tempDir.resolve("utf8.log");
        FileAppender appender = new FileAppender("file", file, true);

        appender.start();
        appender.append("Завершение программы ✓");
        appender.stop();

        String content = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(content.contains("Завершение программы ✓"));
    }

    @Test
    @DisplayName("Should fail to start when the path is a directory")
    void testStartFailure() {
        FileAppender appender = new FileAppender("file", tempDir, true);

        assertThrows(IOException.class, appender::start);
        assertFalse(appender.isStarted());
    }

    @Test
    @DisplayName("Writing to a stopped appender should fail")
    void testAppendAfterStop() throws IOException {
        FileAppender appender = new FileAppender("file", tempDir.resolve("stopped.log"), true);
        appender.start();
        appender.stop();

        assertThrows(IOException.class, () -> appender.append("late"));
    }

    @Test
    @DisplayName("Should track bytes and write operations")
    void testCounters() throws IOException {
        FileAppender appender = new FileAppender("file", tempDir.resolve("counted.log"), true);
        appender.start();
        appender.append("one");
        appender.append("two");
        appender.stop();

        assertEquals(2, appender.getWriteOperations());
        long expected = 3 + 2L * (3 + System.lineSeparator().length());
        assertEquals(expected, appender.getBytesWritten());
    }
}
