package org.aimux.distribution.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    // Substitutes "{}" placeholders from left to right. Surplus arguments are appended,
    // a trailing Throwable without placeholder is rendered with its stacktrace.
    @NotNull
    static String format(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder(message.length() + 16 * args.length);
        int cursor = 0;
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder != -1) {
                builder.append(message, cursor, placeholder).append(Objects.toString(arg));
                cursor = placeholder + 2;
                continue;
            }
            if (cursor < message.length()) {
                builder.append(message, cursor, message.length());
                cursor = message.length();
            }
            if (i == args.length - 1 && arg instanceof Throwable) {
                StringWriter sw = new StringWriter();
                ((Throwable) arg).printStackTrace(new PrintWriter(sw));
                builder.append('\n').append(sw);
            } else {
                builder.append(' ').append(Objects.toString(arg));
            }
        }
        if (cursor < message.length()) {
            builder.append(message, cursor, message.length());
        }
        return builder.toString();
    }

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.format(message, args));
        }
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
