package ph.extremelogic.common.logsink.layout;

import ph.extremelogic.common.logsink.LogEvent;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders an event by substituting placeholders in a template:
 * <ul>
 *     <li>{@code {t}} timestamp, {@code yyyy-MM-dd HH:mm:ss}</li>
 *     <li>{@code {L}} level label</li>
 *     <li>{@code {f}} source file</li>
 *     <li>{@code {l}} source line</li>
 *     <li>{@code {m}} message text</li>
 * </ul>
 * The template is scanned once from left to right. Substituted values are
 * never scanned again, and unknown placeholders are copied as they are.
 */
public final class TemplateLayout implements Layout<String> {
    public static final String DEFAULT_TEMPLATE = "{t} | {L} | {f}:{l} -> {m}";

    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int PLACEHOLDER_LENGTH = 3;

    private static final ThreadLocal<StringBuilder> BUFFER_POOL =
            ThreadLocal.withInitial(() -> new StringBuilder(256));

    private final String template;
    private final ZoneId zone;

    public TemplateLayout() {
        this(DEFAULT_TEMPLATE, ZoneId.systemDefault());
    }

    public TemplateLayout(String template, ZoneId zone) {
        this.template = Objects.requireNonNull(template, "template");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public String getTemplate() {
        return template;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public String toSerializable(LogEvent event) {
        StringBuilder sb = BUFFER_POOL.get();
        sb.setLength(0);

        final int length = template.length();
        int start = 0;
        int open;
        while ((open = template.indexOf('{', start)) != -1) {
            sb.append(template, start, open);
            if (open + PLACEHOLDER_LENGTH <= length && template.charAt(open + 2) == '}'
                    && appendPlaceholder(sb, template.charAt(open + 1), event)) {
                start = open + PLACEHOLDER_LENGTH;
            } else {
                sb.append('{');
                start = open + 1;
            }
        }
        sb.append(template, start, length);

        return sb.toString();
    }

    private boolean appendPlaceholder(StringBuilder sb, char key, LogEvent event) {
        switch (key) {
            case 't':
                sb.append(formatTimestamp(event.getTimeMillis()));
                return true;
            case 'L':
                sb.append(event.getLevel().getLabel());
                return true;
            case 'f':
                sb.append(event.getSourceFile());
                return true;
            case 'l':
                sb.append(event.getSourceLine());
                return true;
            case 'm':
                sb.append(event.getText());
                return true;
            default:
                return false;
        }
    }

    public String formatTimestamp(long millis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), zone).format(TIMESTAMP_FORMATTER);
    }

    @Override
    public String getContentType() { return "text/plain"; }
}
