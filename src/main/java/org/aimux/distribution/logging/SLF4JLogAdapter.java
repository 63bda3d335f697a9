package org.aimux.distribution.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class SLF4JLogAdapter extends LoggingAdapter {

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        Logger logger = LoggerFactory.getLogger(clazz);
        if (logger.isDebugEnabled()) {
            logger.debug(message, args);
        }
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        LoggerFactory.getLogger(clazz).error(message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        LoggerFactory.getLogger(clazz).info(message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        LoggerFactory.getLogger(clazz).warn(message, args);
    }
}
