package ph.extremelogic.common.logsink.message;

/**
 * Builds message text from the values handed to a log call.
 */
public final class MessageText {
    private static final int INITIAL_CAPACITY = 128;
    private static final String PLACEHOLDER = "{}";

    private MessageText() {
    }

    /**
     * Concatenates the string forms of {@code values} with no separator.
     * {@code null} values render as {@code "null"}.
     */
    public static String join(Object... values) {
        if (values == null) {
            return "null";
        }
        if (values.length == 1) {
            return String.valueOf(values[0]);
        }

        // A value's toString() may itself log, so each call gets its own builder
        StringBuilder sb = new StringBuilder(INITIAL_CAPACITY);
        for (Object value : values) {
            appendValue(sb, value);
        }
        return sb.toString();
    }

    /**
     * Replaces each {@code {}} in {@code format} with the next argument.
     * Arguments left over after the last placeholder are appended in
     * brackets.
     */
    public static String format(String format, Object... args) {
        if (format == null) {
            return null;
        }
        if (args == null || args.length == 0) {
            return format;
        }

        StringBuilder sb = new StringBuilder(format.length() + INITIAL_CAPACITY);

        int argIndex = 0;
        int lastIndex = 0;
        int index;
        while (argIndex < args.length && (index = format.indexOf(PLACEHOLDER, lastIndex)) != -1) {
            sb.append(format, lastIndex, index);
            appendValue(sb, args[argIndex++]);
            lastIndex = index + PLACEHOLDER.length();
        }
        sb.append(format, lastIndex, format.length());

        if (argIndex < args.length) {
            sb.append(" [");
            for (; argIndex < args.length; argIndex++) {
                appendValue(sb, args[argIndex]);
                if (argIndex < args.length - 1) {
                    sb.append(", ");
                }
            }
            sb.append(']');
        }
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value instanceof String) {
            sb.append((String) value);
        } else {
            sb.append(value);
        }
    }
}
