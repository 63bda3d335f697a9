package org.aimux.distribution.registry;

import java.time.Instant;

import org.aimux.distribution.transport.TransportException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when the source host refuses a request because the request budget is exhausted.
 * Rate limiting is always transient: the same request is expected to succeed after {@link #getResetTime()}.
 */
public class RateLimitedException extends TransportException {

    private static final long serialVersionUID = -6016542390951125170L;

    @Nullable
    private final Instant resetTime;

    public RateLimitedException(@NotNull String url, int statusCode, @Nullable Instant resetTime) {
        super(url, statusCode, resetTime == null ? "rate limited" : "rate limited until " + resetTime, true);
        this.resetTime = resetTime;
    }

    /**
     * Obtains the point in time at which the request budget is replenished.
     *
     * @return The reset time, or null if the host did not announce one
     */
    @Nullable
    @Contract(pure = true)
    public Instant getResetTime() {
        return this.resetTime;
    }
}
