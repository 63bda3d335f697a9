package org.aimux.distribution.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade of the distribution engine.
 *
 * <p>The engine is embedded into hosts that do not necessarily ship SLF4J, which is why
 * log calls go through this class instead of calling SLF4J directly. If SLF4J is present on
 * the classpath it is used as the sink, otherwise messages are handed to {@link java.util.logging.Logger}.
 * Hosts with yet another logging framework may {@link #setDefaultLogger(LoggingAdapter) install}
 * their own adapter.
 *
 * <p>Messages use SLF4J placeholders ("{}"). Arguments without a matching placeholder are appended
 * to the end of the message and leftover placeholders are kept as-is. Placeholders are never escaped
 * and never indexed. If the last argument is a {@link Throwable}, its stacktrace is logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    static volatile LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    /**
     * Replaces the adapter used by all components of the distribution engine.
     *
     * @param instance The new adapter
     * @return The adapter which was in use before
     */
    @NotNull
    public static LoggingAdapter setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter previous = LoggingAdapter.currentInstance;
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
        return previous;
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void error(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void info(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
