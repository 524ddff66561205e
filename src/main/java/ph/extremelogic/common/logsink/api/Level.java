package ph.extremelogic.common.logsink.api;

public enum Level {
    TRACE(0, "TRACE"),
    DEBUG(1, "DEBUG"),
    INFO(2, "INFO"),
    WARNING(3, "WARNING"),
    ERROR(4, "ERROR"),
    CRITICAL(5, "CRITICAL");

    public final int intLevel;
    private final String label;

    Level(int intLevel, String label) {
        this.intLevel = intLevel;
        this.label = label;
    }

    public int getIntLevel() {
        return intLevel;
    }

    /**
     * Name written for the {@code {L}} placeholder.
     */
    public String getLabel() {
        return label;
    }

    public boolean isMoreSpecificThan(Level other) {
        return this.intLevel >= other.intLevel;
    }

    public boolean isLessSpecificThan(Level other) {
        return this.intLevel <= other.intLevel;
    }

    public static Level getLevel(String name) {
        if (name == null) return null;
        String normalized = name.trim().toUpperCase();
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        try {
            return Level.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    // Message at messageLevel passes a logger configured at minimum
    public static boolean isLoggingEnabled(Level minimum, Level messageLevel) {
        return messageLevel.intLevel >= minimum.intLevel;
    }
}
