package org.aimux.distribution.transport;

import java.io.IOException;
import java.nio.file.FileSystemException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a remote answered with a status code that prevents the request from being fulfilled.
 */
public class TransportException extends IOException {

    private static final long serialVersionUID = 4417231858106046221L;

    /**
     * Whether a request which failed with the given status code may succeed if repeated later on.
     * This is the case for rate limiting (429), request timeouts (408) and any server-side error (5xx).
     *
     * @param statusCode The HTTP status code
     * @return True if the status code denotes a transient failure
     */
    public static boolean isTransientStatus(int statusCode) {
        return statusCode == 408 || statusCode == 429 || (statusCode / 100) == 5;
    }

    /**
     * Whether a failed request may succeed when repeated. Transport errors are retryable if they are transient,
     * local file system errors never are, and any other I/O error (connection resets, timeouts) always is.
     *
     * @param e The failure
     * @return True if the request should be repeated
     */
    public static boolean isRetryable(@NotNull IOException e) {
        if (e instanceof TransportException) {
            return ((TransportException) e).isTransient();
        }
        return !(e instanceof FileSystemException);
    }

    @NotNull
    private final String url;
    private final int statusCode;
    private final boolean transientFailure;

    public TransportException(@NotNull String url, int statusCode, @Nullable String message) {
        this(url, statusCode, message, TransportException.isTransientStatus(statusCode));
    }

    protected TransportException(@NotNull String url, int statusCode, @Nullable String message, boolean transientFailure) {
        super("Query for " + url + " returned with a response code of " + statusCode + (message == null || message.isEmpty() ? "" : " (" + message + ")"));
        this.url = url;
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    @Contract(pure = true)
    public int getStatusCode() {
        return this.statusCode;
    }

    @NotNull
    @Contract(pure = true)
    public String getUrl() {
        return this.url;
    }

    @Contract(pure = true)
    public boolean isTransient() {
        return this.transientFailure;
    }
}
