package ph.extremelogic.common.logsink.layout;

import ph.extremelogic.common.logsink.LogEvent;

public interface Layout<T> {
    T toSerializable(LogEvent event);
    String getContentType();
}
