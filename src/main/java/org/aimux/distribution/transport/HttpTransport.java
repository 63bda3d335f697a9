package org.aimux.distribution.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.aimux.distribution.logging.LoggingAdapter;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * {@link Transport} implementation backed by the {@link HttpClient} of the JDK.
 * Resuming is implemented through HTTP range requests.
 */
public class HttpTransport implements Transport {

    private static final int BUFFER_SIZE = 16 * 1024;

    @NotNull
    private final HttpClient client;
    @NotNull
    private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
    @NotNull
    private volatile Duration timeout = Duration.ofSeconds(30);
    private volatile int maxRetries = 3;

    public HttpTransport(@NotNull String userAgent, @NotNull Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout may not be null"))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), userAgent);
    }

    public HttpTransport(@NotNull HttpClient client, @NotNull String userAgent) {
        this.client = Objects.requireNonNull(client, "client may not be null");
        this.defaultHeaders.put("User-Agent", Objects.requireNonNull(userAgent, "userAgent may not be null"));
    }

    @NotNull
    private HttpRequest.Builder newRequest(@NotNull String url, @NotNull Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url)).timeout(this.timeout).GET();
        this.defaultHeaders.forEach(builder::header);
        headers.forEach(builder::setHeader);
        return builder;
    }

    @Override
    @NotNull
    public TransportResponse fetch(@NotNull String url, @NotNull Map<String, String> headers) throws IOException {
        HttpResponse<String> response = this.send(this.newRequest(url, headers).build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        Map<String, String> responseHeaders = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> header : response.headers().map().entrySet()) {
            if (!header.getValue().isEmpty()) {
                responseHeaders.put(header.getKey(), header.getValue().get(0));
            }
        }
        return new TransportResponse(response.statusCode(), responseHeaders, response.body());
    }

    @Override
    public boolean download(@NotNull String url, @NotNull Path destination, @Nullable ProgressListener listener) throws IOException {
        HttpResponse<InputStream> response = this.send(this.newRequest(url, Map.of()).build(), HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream in = response.body()) {
            if (!HttpTransport.checkStatus(url, response.statusCode())) {
                return false;
            }
            long total = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            try (OutputStream out = Files.newOutputStream(destination, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                return HttpTransport.copy(in, out, 0L, total, listener);
            }
        }
    }

    @Override
    public boolean resume(@NotNull String url, @NotNull Path destination, long offset, @Nullable ProgressListener listener) throws IOException {
        if (offset <= 0L || Files.notExists(destination)) {
            return this.download(url, destination, listener);
        }
        HttpRequest request = this.newRequest(url, Map.of("Range", "bytes=" + offset + "-")).build();
        HttpResponse<InputStream> response = this.send(request, HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream in = response.body()) {
            int status = response.statusCode();
            if (status == 416) {
                // The server considers the range unsatisfiable, most likely because the file is already complete
                return true;
            } else if (!HttpTransport.checkStatus(url, status)) {
                return false;
            }
            long length = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            if (status == 206) {
                long total = length < 0 ? -1L : offset + length;
                try (OutputStream out = Files.newOutputStream(destination, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    return HttpTransport.copy(in, out, offset, total, listener);
                }
            }
            LoggingAdapter.getDefaultLogger().debug(HttpTransport.class, "Server ignored range request for {}, restarting the transfer.", url);
            try (OutputStream out = Files.newOutputStream(destination, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                return HttpTransport.copy(in, out, 0L, length, listener);
            }
        }
    }

    private static boolean checkStatus(@NotNull String url, int statusCode) throws TransportException {
        if ((statusCode / 100) == 2) {
            return true;
        } else if (TransportException.isTransientStatus(statusCode)) {
            throw new TransportException(url, statusCode, null);
        }
        return false;
    }

    private static boolean copy(@NotNull InputStream in, @NotNull OutputStream out, long written, long total, @Nullable ProgressListener listener) throws IOException {
        byte[] buffer = new byte[HttpTransport.BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            written += read;
            if (listener != null) {
                listener.onProgress(written, total);
            }
        }
        return total < 0 || written == total;
    }

    @NotNull
    private <T> HttpResponse<T> send(@NotNull HttpRequest request, @NotNull HttpResponse.BodyHandler<T> handler) throws IOException {
        try {
            return this.client.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Request to " + request.uri() + " was interrupted", e);
        }
    }

    @Override
    public boolean supportsResume() {
        return true;
    }

    @Override
    @NotNull
    public Duration getTimeout() {
        return this.timeout;
    }

    @Override
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public HttpTransport setTimeout(@NotNull Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("The timeout must be positive, got " + timeout);
        }
        this.timeout = timeout;
        return this;
    }

    @Override
    public int getMaxRetries() {
        return this.maxRetries;
    }

    @Override
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public HttpTransport setMaxRetries(int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("The amount of retries may not be negative, got " + retries);
        }
        this.maxRetries = retries;
        return this;
    }
}
