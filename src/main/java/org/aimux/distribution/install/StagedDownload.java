package org.aimux.distribution.install;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.aimux.distribution.logging.LoggingAdapter;
import org.aimux.distribution.transport.Transport;
import org.aimux.distribution.transport.TransportException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Transfers a single artifact into a staging file, retrying transient failures with linear backoff and
 * resuming interrupted transfers from the last byte present on disk where the transport supports it.
 *
 * <p>The download can be cancelled from any thread through {@link #cancel()}. Cancellation is observed
 * whenever the transport reports progress and between attempts, and surfaces as a {@link CancellationException}.
 * The staging file is left behind in any case and must be discarded by the caller if the download did not succeed.
 */
public class StagedDownload {

    @NotNull
    private final Transport transport;
    @NotNull
    private final String url;
    @NotNull
    private final Path stagingFile;
    @NotNull
    private final DownloadProgress progress;
    @NotNull
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private int maxRetries;
    @NotNull
    private Duration backoff = Duration.ofSeconds(2);
    private boolean resuming = true;
    private int retries;

    public StagedDownload(@NotNull Transport transport, @NotNull String url, @NotNull Path stagingFile, @NotNull DownloadProgress progress) {
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
        this.url = Objects.requireNonNull(url, "url may not be null");
        this.stagingFile = Objects.requireNonNull(stagingFile, "stagingFile may not be null");
        this.progress = Objects.requireNonNull(progress, "progress may not be null");
        this.maxRetries = transport.getMaxRetries();
    }

    /**
     * Whether a failed attempt may succeed when repeated.
     *
     * @param e The failure
     * @return True if the attempt should be repeated
     * @see TransportException#isRetryable(IOException)
     */
    public static boolean isRetryable(@NotNull IOException e) {
        return TransportException.isRetryable(e);
    }

    public void cancel() {
        this.cancelled.set(true);
    }

    private void checkCancelled() {
        if (this.cancelled.get()) {
            throw new CancellationException("Download of " + this.url + " was cancelled");
        }
    }

    @NotNull
    @Contract(pure = true)
    public DownloadProgress getProgress() {
        return this.progress;
    }

    /**
     * Obtains the amount of attempts that were repeated so far.
     *
     * @return The amount of retries
     */
    @Contract(pure = true)
    public int getRetries() {
        return this.retries;
    }

    @Contract(pure = true)
    public boolean isCancelled() {
        return this.cancelled.get();
    }

    /**
     * Performs the download, blocking until it succeeded, failed permanently or was cancelled.
     *
     * @param onRetry Invoked before every repeated attempt
     * @throws IOException If the download failed permanently or the retries were exhausted
     * @throws CancellationException If the download was cancelled
     */
    public void run(@NotNull Runnable onRetry) throws IOException {
        int attempt = 0;
        while (true) {
            this.checkCancelled();
            IOException failure;
            try {
                long offset = Files.exists(this.stagingFile) ? Files.size(this.stagingFile) : 0L;
                boolean complete;
                if (attempt > 0 && offset > 0 && this.resuming && this.transport.supportsResume()) {
                    LoggingAdapter.getDefaultLogger().debug(StagedDownload.class, "Resuming download of {} at byte {}", this.url, offset);
                    complete = this.transport.resume(this.url, this.stagingFile, offset, this::onProgress);
                } else {
                    complete = this.transport.download(this.url, this.stagingFile, this::onProgress);
                }
                this.checkCancelled();
                if (complete) {
                    return;
                }
                failure = new IOException("Transfer of " + this.url + " did not complete");
            } catch (IOException e) {
                if (!StagedDownload.isRetryable(e)) {
                    throw e;
                }
                failure = e;
            }

            if (++attempt > this.maxRetries) {
                throw failure;
            }
            this.retries++;
            onRetry.run();
            long delay = this.backoff.toMillis() * attempt;
            LoggingAdapter.getDefaultLogger().warn(StagedDownload.class, "Attempt {} to download {} failed ({}), retrying in {} ms", attempt, this.url, failure.getMessage(), delay);
            this.sleep(delay);
        }
    }

    private void onProgress(long downloadedBytes, long totalBytes) {
        this.checkCancelled();
        this.progress.update(downloadedBytes, totalBytes);
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public StagedDownload setBackoff(@NotNull Duration backoff) {
        this.backoff = Objects.requireNonNull(backoff, "backoff may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public StagedDownload setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public StagedDownload setResuming(boolean resuming) {
        this.resuming = resuming;
        return this;
    }

    private void sleep(long millis) {
        long deadline = System.currentTimeMillis() + millis;
        long remaining;
        while ((remaining = deadline - System.currentTimeMillis()) > 0) {
            this.checkCancelled();
            try {
                Thread.sleep(Math.min(remaining, 50L));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                CancellationException cancellation = new CancellationException("Interrupted while waiting to retry " + this.url);
                cancellation.initCause(e);
                throw cancellation;
            }
        }
    }
}
