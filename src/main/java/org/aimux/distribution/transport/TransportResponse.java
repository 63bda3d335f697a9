package org.aimux.distribution.transport;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A response to a metadata request. Header names are case-insensitive.
 */
public final class TransportResponse {
    private final int statusCode;
    @NotNull
    private final Map<String, String> headers;
    @NotNull
    private final String body;

    public TransportResponse(int statusCode, @NotNull Map<String, String> headers, @NotNull String body) {
        this.statusCode = statusCode;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body;
    }

    @NotNull
    @Contract(pure = true)
    public String getBody() {
        return this.body;
    }

    @Nullable
    public String getHeader(@NotNull String name) {
        return this.headers.get(name.toLowerCase(Locale.ROOT));
    }

    @NotNull
    @Contract(pure = true)
    public Map<String, String> getHeaders() {
        return this.headers;
    }

    @Contract(pure = true)
    public int getStatusCode() {
        return this.statusCode;
    }

    @Contract(pure = true)
    public boolean isSuccessful() {
        return (this.statusCode / 100) == 2;
    }

    @Override
    public String toString() {
        return "TransportResponse[status=" + this.statusCode + " length=" + this.body.length() + "]";
    }
}
