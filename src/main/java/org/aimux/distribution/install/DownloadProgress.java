package org.aimux.distribution.install;

import java.time.Duration;
import java.time.Instant;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The progress of a single in-flight download. Instances are updated by the download while other
 * threads may read them.
 */
public final class DownloadProgress {

    @NotNull
    private final Instant startTime;
    private volatile long totalBytes;
    private volatile long downloadedBytes;

    public DownloadProgress(long totalBytes) {
        this(totalBytes, Instant.now());
    }

    public DownloadProgress(long totalBytes, @NotNull Instant startTime) {
        this.totalBytes = totalBytes;
        this.startTime = startTime;
    }

    @Contract(pure = true)
    public long getDownloadedBytes() {
        return this.downloadedBytes;
    }

    @NotNull
    public Duration getElapsed() {
        Duration elapsed = Duration.between(this.startTime, Instant.now());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    /**
     * Estimates the time until the download completes, based on the average speed so far.
     *
     * @return The estimate, or null if the total size or the speed are unknown
     */
    @Nullable
    public Duration getEstimatedRemaining() {
        long total = this.totalBytes;
        double speed = this.getSpeed();
        if (total <= 0 || speed <= 0) {
            return null;
        }
        long remaining = Math.max(0L, total - this.downloadedBytes);
        return Duration.ofMillis((long) (remaining * 1000D / speed));
    }

    /**
     * Obtains the completed share of the download.
     *
     * @return The percentage, between 0 and 100, or 0 if the total size is unknown
     */
    public double getPercentage() {
        long total = this.totalBytes;
        if (total <= 0) {
            return 0D;
        }
        return Math.min(100D, this.downloadedBytes * 100D / total);
    }

    /**
     * Obtains the average transfer speed since the start of the download.
     *
     * @return The speed in bytes per second
     */
    public double getSpeed() {
        long millis = this.getElapsed().toMillis();
        if (millis <= 0) {
            return 0D;
        }
        return this.downloadedBytes * 1000D / millis;
    }

    @NotNull
    @Contract(pure = true)
    public Instant getStartTime() {
        return this.startTime;
    }

    @Contract(pure = true)
    public long getTotalBytes() {
        return this.totalBytes;
    }

    void update(long downloadedBytes, long totalBytes) {
        this.downloadedBytes = downloadedBytes;
        if (totalBytes > 0) {
            this.totalBytes = totalBytes;
        }
    }

    @Override
    public String toString() {
        return "DownloadProgress[" + this.downloadedBytes + "/" + this.totalBytes + "]";
    }
}
