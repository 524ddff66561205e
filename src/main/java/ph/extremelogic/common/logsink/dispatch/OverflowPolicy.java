package ph.extremelogic.common.logsink.dispatch;

/**
 * What a bounded dispatcher does with an event when no slot is free.
 */
public enum OverflowPolicy {
    /** The producer waits for the worker to free a slot. */
    BLOCK,
    /** The event is dropped and counted. */
    DROP_NEWEST
}
