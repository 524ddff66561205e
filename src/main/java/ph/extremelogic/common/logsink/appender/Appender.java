package ph.extremelogic.common.logsink.appender;

import java.io.IOException;

public interface Appender {
    void append(String line) throws IOException;
    void start() throws IOException;
    void stop() throws IOException;
    boolean isStarted();
    String getName();
}
