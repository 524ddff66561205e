package ph.extremelogic.common.logsink.api;

/**
 * Destinations a rendered line is written to. Values are bit flags so that
 * {@link #BOTH} is the union of {@link #CONSOLE} and {@link #FILE}.
 */
public enum OutputTarget {
    CONSOLE(1),
    FILE(2),
    BOTH(3);

    private final int mask;

    OutputTarget(int mask) {
        this.mask = mask;
    }

    public int getMask() {
        return mask;
    }

    public boolean includes(OutputTarget other) {
        return (mask & other.mask) == other.mask;
    }

    public static OutputTarget fromMask(int mask) {
        for (OutputTarget target : values()) {
            if (target.mask == mask) {
                return target;
            }
        }
        throw new IllegalArgumentException("No output target for mask " + mask);
    }
}
