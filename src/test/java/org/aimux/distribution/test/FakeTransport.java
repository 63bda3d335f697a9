package org.aimux.distribution.test;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.aimux.distribution.transport.ProgressListener;
import org.aimux.distribution.transport.Transport;
import org.aimux.distribution.transport.TransportException;
import org.aimux.distribution.transport.TransportResponse;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An in-memory transport serving canned responses and files.
 */
public class FakeTransport implements Transport {

    private static final class Failure {
        private final int bytesBeforeFailure;
        @NotNull
        private final IOException exception;

        private Failure(int bytesBeforeFailure, @NotNull IOException exception) {
            this.bytesBeforeFailure = bytesBeforeFailure;
            this.exception = exception;
        }
    }

    private final Map<String, TransportResponse> responses = new ConcurrentHashMap<>();
    private final Map<String, byte[]> files = new ConcurrentHashMap<>();
    private final Map<String, Deque<Failure>> failures = new ConcurrentHashMap<>();
    private final Map<String, Deque<TransportResponse>> pendingResponses = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
    private final List<Long> resumeOffsets = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger downloads = new AtomicInteger();
    @Nullable
    private volatile Consumer<String> downloadHook;
    private volatile boolean resumable = true;
    private volatile Duration timeout = Duration.ofSeconds(30);
    private volatile int maxRetries = 3;

    @NotNull
    public FakeTransport addFile(@NotNull String url, byte @NotNull[] data) {
        this.files.put(url, data.clone());
        return this;
    }

    @NotNull
    public FakeTransport addResponse(@NotNull String url, int status, @NotNull String body) {
        return this.addResponse(url, status, body, Collections.emptyMap());
    }

    @NotNull
    public FakeTransport addResponse(@NotNull String url, int status, @NotNull String body, @NotNull Map<String, String> headers) {
        this.responses.put(url, new TransportResponse(status, headers, body));
        return this;
    }

    @Override
    public boolean download(@NotNull String url, @NotNull Path destination, @Nullable ProgressListener listener) throws IOException {
        this.downloads.incrementAndGet();
        byte[] data = this.beginTransfer(url);
        Failure failure = this.pollFailure(url);
        if (failure != null) {
            Files.write(destination, slice(data, 0, failure.bytesBeforeFailure));
            throw failure.exception;
        }
        Files.write(destination, data);
        if (listener != null) {
            listener.onProgress(data.length, data.length);
        }
        return true;
    }

    @NotNull
    private byte[] beginTransfer(@NotNull String url) throws IOException {
        Consumer<String> hook = this.downloadHook;
        if (hook != null) {
            hook.accept(url);
        }
        byte[] data = this.files.get(url);
        if (data == null) {
            throw new TransportException(url, 404, null);
        }
        return data;
    }

    /**
     * Makes the next transfer of the given URL write the first bytes of the file and then fail.
     */
    @NotNull
    public FakeTransport failNextTransfer(@NotNull String url, int bytesBeforeFailure, @NotNull IOException exception) {
        this.failures.computeIfAbsent(url, (ignored) -> new ArrayDeque<>()).add(new Failure(bytesBeforeFailure, exception));
        return this;
    }

    /**
     * Makes the next query of the given URL answer with a status code, ahead of any canned response or file.
     */
    @NotNull
    public FakeTransport failNextFetch(@NotNull String url, int status) {
        this.pendingResponses.computeIfAbsent(url, (ignored) -> new ArrayDeque<>()).add(new TransportResponse(status, Collections.emptyMap(), ""));
        return this;
    }

    @Override
    @NotNull
    public TransportResponse fetch(@NotNull String url, @NotNull Map<String, String> headers) throws IOException {
        this.fetches.computeIfAbsent(url, (ignored) -> new AtomicInteger()).incrementAndGet();
        Deque<TransportResponse> pending = this.pendingResponses.get(url);
        if (pending != null) {
            synchronized (pending) {
                TransportResponse next = pending.poll();
                if (next != null) {
                    return next;
                }
            }
        }
        TransportResponse response = this.responses.get(url);
        if (response != null) {
            return response;
        }
        byte[] file = this.files.get(url);
        if (file != null) {
            return new TransportResponse(200, Collections.emptyMap(), new String(file, StandardCharsets.UTF_8));
        }
        return new TransportResponse(404, Collections.emptyMap(), "{\"message\":\"Not Found\"}");
    }

    public int getDownloads() {
        return this.downloads.get();
    }

    public int getFetches(@NotNull String url) {
        AtomicInteger count = this.fetches.get(url);
        return count == null ? 0 : count.get();
    }

    @Override
    public int getMaxRetries() {
        return this.maxRetries;
    }

    @NotNull
    public List<Long> getResumeOffsets() {
        return new ArrayList<>(this.resumeOffsets);
    }

    @Override
    @NotNull
    public Duration getTimeout() {
        return this.timeout;
    }

    @Nullable
    private Failure pollFailure(@NotNull String url) {
        Deque<Failure> queue = this.failures.get(url);
        if (queue == null) {
            return null;
        }
        synchronized (queue) {
            return queue.poll();
        }
    }

    @Override
    public boolean resume(@NotNull String url, @NotNull Path destination, long offset, @Nullable ProgressListener listener) throws IOException {
        this.resumeOffsets.add(offset);
        byte[] data = this.beginTransfer(url);
        Failure failure = this.pollFailure(url);
        int end = failure == null ? data.length : Math.min(data.length, (int) offset + failure.bytesBeforeFailure);
        try (OutputStream out = Files.newOutputStream(destination, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            out.write(slice(data, (int) offset, end));
        }
        if (failure != null) {
            throw failure.exception;
        }
        if (listener != null) {
            listener.onProgress(data.length, data.length);
        }
        return true;
    }

    @NotNull
    public FakeTransport setDownloadHook(@Nullable Consumer<String> downloadHook) {
        this.downloadHook = downloadHook;
        return this;
    }

    @Override
    @NotNull
    public Transport setMaxRetries(int retries) {
        this.maxRetries = retries;
        return this;
    }

    @NotNull
    public FakeTransport setResumable(boolean resumable) {
        this.resumable = resumable;
        return this;
    }

    @Override
    @NotNull
    public Transport setTimeout(@NotNull Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    private static byte @NotNull[] slice(byte @NotNull[] data, int from, int to) {
        byte[] slice = new byte[Math.max(0, Math.min(to, data.length) - from)];
        System.arraycopy(data, from, slice, 0, slice.length);
        return slice;
    }

    @Override
    public boolean supportsResume() {
        return this.resumable;
    }
}
