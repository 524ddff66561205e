package ph.extremelogic.common.logsink;

import ph.extremelogic.common.logsink.api.Level;
import ph.extremelogic.common.logsink.api.OutputTarget;
import ph.extremelogic.common.logsink.dispatch.DisruptorLogDispatcher;
import ph.extremelogic.common.logsink.dispatch.OverflowPolicy;
import ph.extremelogic.common.logsink.layout.TemplateLayout;

import java.util.Objects;

/**
 * Starting settings for an {@link AsyncLogger}. Read once when the logger is
 * built; later changes go through the logger's setters.
 */
public final class Configuration {

    public enum DispatcherType {
        /** Unbounded queue, producers never wait. */
        QUEUE,
        /** Bounded ring buffer with an overflow policy. */
        DISRUPTOR
    }

    private Level level = Level.TRACE;
    private OutputTarget outputTarget = OutputTarget.CONSOLE;
    private String formatTemplate = TemplateLayout.DEFAULT_TEMPLATE;
    private DispatcherType dispatcherType = DispatcherType.QUEUE;
    private int ringBufferSize = DisruptorLogDispatcher.DEFAULT_RING_BUFFER_SIZE;
    private OverflowPolicy overflowPolicy = OverflowPolicy.BLOCK;
    private boolean registerShutdownHook = false;

    public Configuration() {
    }

    public Configuration(Level level) {
        this.level = Objects.requireNonNull(level, "level");
    }

    public Level getLevel() {
        return level;
    }

    public Configuration setLevel(Level level) {
        this.level = Objects.requireNonNull(level, "level");
        return this;
    }

    public OutputTarget getOutputTarget() {
        return outputTarget;
    }

    public Configuration setOutputTarget(OutputTarget outputTarget) {
        this.outputTarget = Objects.requireNonNull(outputTarget, "outputTarget");
        return this;
    }

    public String getFormatTemplate() {
        return formatTemplate;
    }

    public Configuration setFormatTemplate(String formatTemplate) {
        this.formatTemplate = Objects.requireNonNull(formatTemplate, "formatTemplate");
        return this;
    }

    public DispatcherType getDispatcherType() {
        return dispatcherType;
    }

    public Configuration setDispatcherType(DispatcherType dispatcherType) {
        this.dispatcherType = Objects.requireNonNull(dispatcherType, "dispatcherType");
        return this;
    }

    public int getRingBufferSize() {
        return ringBufferSize;
    }

    /**
     * Ring size for {@link DispatcherType#DISRUPTOR}; a power of 2, at least
     * {@value DisruptorLogDispatcher#MIN_RING_BUFFER_SIZE}. Checked when the
     * logger is built.
     */
    public Configuration setRingBufferSize(int ringBufferSize) {
        this.ringBufferSize = ringBufferSize;
        return this;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public Configuration setOverflowPolicy(OverflowPolicy overflowPolicy) {
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        return this;
    }

    public boolean isRegisterShutdownHook() {
        return registerShutdownHook;
    }

    /**
     * Close the logger from a JVM shutdown hook. The hook keeps a reference
     * to the logger until the JVM exits.
     */
    public Configuration setRegisterShutdownHook(boolean registerShutdownHook) {
        this.registerShutdownHook = registerShutdownHook;
        return this;
    }
}
