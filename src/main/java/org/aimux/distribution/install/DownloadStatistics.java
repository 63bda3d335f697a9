package org.aimux.distribution.install;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.jetbrains.annotations.NotNull;

/**
 * Counters about the downloads and uninstallations performed by a {@link PluginInstaller}.
 * Every counter is updated atomically; a {@link #snapshot()} however is not atomic across counters.
 */
public class DownloadStatistics {

    private final AtomicLong totalDownloads = new AtomicLong();
    private final AtomicLong successfulDownloads = new AtomicLong();
    private final AtomicLong failedDownloads = new AtomicLong();
    private final AtomicLong totalBytesDownloaded = new AtomicLong();
    private final AtomicLong totalDownloadMillis = new AtomicLong();
    private final AtomicLong totalUninstalls = new AtomicLong();
    private final AtomicLong successfulUninstalls = new AtomicLong();
    private final AtomicLong checksumFailures = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong activeDownloads = new AtomicLong();

    /**
     * Resets all counters to zero.
     */
    public void clear() {
        this.totalDownloads.set(0);
        this.successfulDownloads.set(0);
        this.failedDownloads.set(0);
        this.totalBytesDownloaded.set(0);
        this.totalDownloadMillis.set(0);
        this.totalUninstalls.set(0);
        this.successfulUninstalls.set(0);
        this.checksumFailures.set(0);
        this.retries.set(0);
        this.activeDownloads.set(0);
    }

    public long getActiveDownloads() {
        return this.activeDownloads.get();
    }

    /**
     * Obtains the average speed of all successful downloads.
     *
     * @return The speed in bytes per second, or 0 if nothing was downloaded yet
     */
    public double getAverageDownloadSpeed() {
        long millis = this.totalDownloadMillis.get();
        long bytes = this.totalBytesDownloaded.get();
        if (millis <= 0) {
            return bytes > 0 ? bytes * 1000D : 0D;
        }
        return bytes * 1000D / millis;
    }

    public long getChecksumFailures() {
        return this.checksumFailures.get();
    }

    /**
     * Obtains the amount of downloads that failed, including downloads whose artifact did not match its checksum.
     *
     * @return The amount of failed downloads
     */
    public long getFailedDownloads() {
        return this.failedDownloads.get();
    }

    public long getRetries() {
        return this.retries.get();
    }

    public long getSuccessfulDownloads() {
        return this.successfulDownloads.get();
    }

    public long getSuccessfulUninstalls() {
        return this.successfulUninstalls.get();
    }

    public long getTotalBytesDownloaded() {
        return this.totalBytesDownloaded.get();
    }

    public long getTotalDownloads() {
        return this.totalDownloads.get();
    }

    public long getTotalUninstalls() {
        return this.totalUninstalls.get();
    }

    void recordChecksumFailure() {
        this.checksumFailures.incrementAndGet();
    }

    void recordDownloadFailure() {
        this.failedDownloads.incrementAndGet();
        this.activeDownloads.decrementAndGet();
    }

    void recordDownloadStart() {
        this.totalDownloads.incrementAndGet();
        this.activeDownloads.incrementAndGet();
    }

    void recordDownloadSuccess(long bytes, long millis) {
        this.successfulDownloads.incrementAndGet();
        this.totalBytesDownloaded.addAndGet(bytes);
        this.totalDownloadMillis.addAndGet(millis);
        this.activeDownloads.decrementAndGet();
    }

    void recordRetry() {
        this.retries.incrementAndGet();
    }

    void recordUninstall(boolean removed) {
        this.totalUninstalls.incrementAndGet();
        if (removed) {
            this.successfulUninstalls.incrementAndGet();
        }
    }

    /**
     * Obtains all counters, keyed by <code>total_downloads</code>, <code>successful_downloads</code>,
     * <code>failed_downloads</code>, <code>total_bytes_downloaded</code>, <code>average_download_speed</code>,
     * <code>total_uninstalls</code>, <code>successful_uninstalls</code>, <code>checksum_failures</code>,
     * <code>retries</code> and <code>active_downloads</code>.
     *
     * @return The counters
     */
    @NotNull
    public Map<String, Number> snapshot() {
        Map<String, Number> snapshot = new LinkedHashMap<>();
        snapshot.put("total_downloads", this.totalDownloads.get());
        snapshot.put("successful_downloads", this.successfulDownloads.get());
        snapshot.put("failed_downloads", this.failedDownloads.get());
        snapshot.put("total_bytes_downloaded", this.totalBytesDownloaded.get());
        snapshot.put("average_download_speed", this.getAverageDownloadSpeed());
        snapshot.put("total_uninstalls", this.totalUninstalls.get());
        snapshot.put("successful_uninstalls", this.successfulUninstalls.get());
        snapshot.put("checksum_failures", this.checksumFailures.get());
        snapshot.put("retries", this.retries.get());
        snapshot.put("active_downloads", this.activeDownloads.get());
        return snapshot;
    }
}
