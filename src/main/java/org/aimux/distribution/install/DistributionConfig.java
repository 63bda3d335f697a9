package org.aimux.distribution.install;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

import org.aimux.distribution.ResolutionStrategy;
import org.aimux.distribution.registry.GitHubPluginRegistry;
import org.aimux.distribution.transport.HttpTransport;
import org.aimux.distribution.transport.Transport;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The configuration consumed by a {@link PluginInstaller} at construction.
 * Changing the configuration after the installer was created has no effect on the installer.
 *
 * <p>Directories default to <code>~/.config/aimux/downloads</code>, <code>~/.config/aimux/plugins</code>
 * and <code>~/.config/aimux/backups</code>.
 */
public class DistributionConfig {

    @NotNull
    private static final Path DEFAULT_ROOT = Paths.get(System.getProperty("user.home", "."), ".config", "aimux");

    @NotNull
    private Path downloadDirectory = DistributionConfig.DEFAULT_ROOT.resolve("downloads");
    @NotNull
    private Path installationDirectory = DistributionConfig.DEFAULT_ROOT.resolve("plugins");
    @NotNull
    private Path backupDirectory = DistributionConfig.DEFAULT_ROOT.resolve("backups");
    @Nullable
    private Path lockfile;
    private boolean verifyChecksums = true;
    private boolean offlineMode = false;
    private boolean parallelDownloads = true;
    private int maxParallelDownloads = 3;
    @NotNull
    private Duration downloadTimeout = Duration.ofSeconds(300);
    @NotNull
    private Duration connectionTimeout = Duration.ofSeconds(30);
    private int maxRetries = 3;
    @NotNull
    private Duration retryBackoff = Duration.ofSeconds(2);
    private boolean resuming = true;
    @NotNull
    private Duration cacheTtl = Duration.ofHours(24);
    private int maxBackups = 5;
    private boolean allowPrereleases = false;
    @NotNull
    private ResolutionStrategy resolutionStrategy = ResolutionStrategy.LATEST;
    private int maxResolutionRounds = 50;

    /**
     * Reads a configuration from a properties file. See {@link #fromProperties(Properties)} for the recognised keys.
     *
     * @param file The properties file
     * @return The configuration
     * @throws IOException If the file could not be read
     */
    @NotNull
    public static DistributionConfig load(@NotNull Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return DistributionConfig.fromProperties(properties);
    }

    /**
     * Creates a configuration from snake_case keys such as <code>download_directory</code> or
     * <code>max_parallel_downloads</code>. Absent keys keep their default value and unknown keys are ignored.
     * Paths starting with <code>~</code> are resolved against the home directory of the user.
     *
     * @param properties The properties to read
     * @return The configuration
     * @throws IllegalArgumentException If a value is malformed
     */
    @NotNull
    public static DistributionConfig fromProperties(@NotNull Properties properties) {
        DistributionConfig config = new DistributionConfig();
        String value;
        if ((value = properties.getProperty("download_directory")) != null) {
            config.setDownloadDirectory(DistributionConfig.parsePath(value));
        }
        if ((value = properties.getProperty("installation_directory")) != null) {
            config.setInstallationDirectory(DistributionConfig.parsePath(value));
        }
        if ((value = properties.getProperty("backup_directory")) != null) {
            config.setBackupDirectory(DistributionConfig.parsePath(value));
        }
        if ((value = properties.getProperty("lockfile")) != null) {
            config.setLockfile(DistributionConfig.parsePath(value));
        }
        if ((value = properties.getProperty("verify_checksums")) != null) {
            config.setVerifyChecksums(DistributionConfig.parseBoolean("verify_checksums", value));
        }
        if ((value = properties.getProperty("enable_offline_mode")) != null) {
            config.setOfflineMode(DistributionConfig.parseBoolean("enable_offline_mode", value));
        }
        if ((value = properties.getProperty("parallel_downloads")) != null) {
            config.setParallelDownloads(DistributionConfig.parseBoolean("parallel_downloads", value));
        }
        if ((value = properties.getProperty("max_parallel_downloads")) != null) {
            config.setMaxParallelDownloads(DistributionConfig.parseInt("max_parallel_downloads", value));
        }
        if ((value = properties.getProperty("download_timeout")) != null) {
            config.setDownloadTimeout(Duration.ofSeconds(DistributionConfig.parseInt("download_timeout", value)));
        }
        if ((value = properties.getProperty("connection_timeout")) != null) {
            config.setConnectionTimeout(Duration.ofSeconds(DistributionConfig.parseInt("connection_timeout", value)));
        }
        if ((value = properties.getProperty("max_retries")) != null) {
            config.setMaxRetries(DistributionConfig.parseInt("max_retries", value));
        }
        if ((value = properties.getProperty("retry_backoff_millis")) != null) {
            config.setRetryBackoff(Duration.ofMillis(DistributionConfig.parseInt("retry_backoff_millis", value)));
        }
        if ((value = properties.getProperty("enable_resuming")) != null) {
            config.setResuming(DistributionConfig.parseBoolean("enable_resuming", value));
        }
        if ((value = properties.getProperty("cache_ttl_hours")) != null) {
            config.setCacheTtl(Duration.ofHours(DistributionConfig.parseInt("cache_ttl_hours", value)));
        }
        if ((value = properties.getProperty("max_backups")) != null) {
            config.setMaxBackups(DistributionConfig.parseInt("max_backups", value));
        }
        if ((value = properties.getProperty("allow_prerelease")) != null) {
            config.setAllowPrereleases(DistributionConfig.parseBoolean("allow_prerelease", value));
        }
        if ((value = properties.getProperty("resolution_strategy")) != null) {
            config.setResolutionStrategy(ResolutionStrategy.parse(value));
        }
        if ((value = properties.getProperty("max_resolution_rounds")) != null) {
            config.setMaxResolutionRounds(DistributionConfig.parseInt("max_resolution_rounds", value));
        }
        return config;
    }

    private static boolean parseBoolean(@NotNull String key, @NotNull String value) {
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (trimmed.equals("true")) {
            return true;
        } else if (trimmed.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException("Value of " + key + " must be either true or false, got \"" + value + "\"");
    }

    private static int parseInt(@NotNull String key, @NotNull String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value of " + key + " must be an integer, got \"" + value + "\"", e);
        }
    }

    @NotNull
    private static Path parsePath(@NotNull String value) {
        String trimmed = value.trim();
        if (trimmed.equals("~")) {
            return Paths.get(System.getProperty("user.home", "."));
        } else if (trimmed.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home", "."), trimmed.substring(2));
        }
        return Paths.get(trimmed);
    }

    /**
     * Creates the network transport described by the timeouts and retry bound of this configuration.
     *
     * @param userAgent The user agent to send
     * @return A new transport
     */
    @NotNull
    public HttpTransport createTransport(@NotNull String userAgent) {
        HttpTransport transport = new HttpTransport(userAgent, this.connectionTimeout);
        transport.setTimeout(this.downloadTimeout).setMaxRetries(this.maxRetries);
        return transport;
    }

    /**
     * Creates a registry querying GitHub through the given transport, using the cache TTL of this configuration.
     *
     * @param transport The transport to query the API with
     * @return A new registry
     */
    @NotNull
    public GitHubPluginRegistry createRegistry(@NotNull Transport transport) {
        return new GitHubPluginRegistry(transport).setCacheTtl(this.cacheTtl).setRetryBackoff(this.retryBackoff);
    }

    @NotNull
    @Contract(pure = true)
    public Path getBackupDirectory() {
        return this.backupDirectory;
    }

    /**
     * Obtains the directory in which verified artifacts are cached for use in offline mode.
     *
     * @return The cache directory
     */
    @NotNull
    public Path getCacheDirectory() {
        return this.downloadDirectory.resolve("cache");
    }

    @NotNull
    @Contract(pure = true)
    public Duration getCacheTtl() {
        return this.cacheTtl;
    }

    @NotNull
    @Contract(pure = true)
    public Duration getConnectionTimeout() {
        return this.connectionTimeout;
    }

    @NotNull
    @Contract(pure = true)
    public Path getDownloadDirectory() {
        return this.downloadDirectory;
    }

    @NotNull
    @Contract(pure = true)
    public Duration getDownloadTimeout() {
        return this.downloadTimeout;
    }

    @NotNull
    @Contract(pure = true)
    public Path getInstallationDirectory() {
        return this.installationDirectory;
    }

    /**
     * Obtains the location of the lockfile, which defaults to <code>plugins.lock.json</code>
     * within the installation directory.
     *
     * @return The lockfile path
     */
    @NotNull
    public Path getLockfile() {
        Path lockfile = this.lockfile;
        return lockfile == null ? this.installationDirectory.resolve("plugins.lock.json") : lockfile;
    }

    @Contract(pure = true)
    public int getMaxBackups() {
        return this.maxBackups;
    }

    @Contract(pure = true)
    public int getMaxParallelDownloads() {
        return this.maxParallelDownloads;
    }

    @Contract(pure = true)
    public int getMaxResolutionRounds() {
        return this.maxResolutionRounds;
    }

    @Contract(pure = true)
    public int getMaxRetries() {
        return this.maxRetries;
    }

    @NotNull
    @Contract(pure = true)
    public ResolutionStrategy getResolutionStrategy() {
        return this.resolutionStrategy;
    }

    @NotNull
    @Contract(pure = true)
    public Duration getRetryBackoff() {
        return this.retryBackoff;
    }

    @Contract(pure = true)
    public boolean isAllowPrereleases() {
        return this.allowPrereleases;
    }

    @Contract(pure = true)
    public boolean isOfflineMode() {
        return this.offlineMode;
    }

    @Contract(pure = true)
    public boolean isParallelDownloads() {
        return this.parallelDownloads;
    }

    @Contract(pure = true)
    public boolean isResuming() {
        return this.resuming;
    }

    @Contract(pure = true)
    public boolean isVerifyChecksums() {
        return this.verifyChecksums;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setAllowPrereleases(boolean allowPrereleases) {
        this.allowPrereleases = allowPrereleases;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DistributionConfig setBackupDirectory(@NotNull Path backupDirectory) {
        this.backupDirectory = Objects.requireNonNull(backupDirectory, "backupDirectory may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DistributionConfig setCacheTtl(@NotNull Duration cacheTtl) {
        if (cacheTtl.isNegative()) {
            throw new IllegalArgumentException("The cache TTL may not be negative");
        }
        this.cacheTtl = cacheTtl;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DistributionConfig setConnectionTimeout(@NotNull Duration connectionTimeout) {
        if (connectionTimeout.isNegative() || connectionTimeout.isZero()) {
            throw new IllegalArgumentException("The connection timeout must be positive");
        }
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DistributionConfig setDownloadDirectory(@NotNull Path downloadDirectory) {
        this.downloadDirectory = Objects.requireNonNull(downloadDirectory, "downloadDirectory may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DistributionConfig setDownloadTimeout(@NotNull Duration downloadTimeout) {
        if (downloadTimeout.isNegative() || downloadTimeout.isZero()) {
            throw new IllegalArgumentException("The download timeout must be positive");
        }
        this.downloadTimeout = downloadTimeout;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DistributionConfig setInstallationDirectory(@NotNull Path installationDirectory) {
        this.installationDirectory = Objects.requireNonNull(installationDirectory, "installationDirectory may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setLockfile(@Nullable Path lockfile) {
        this.lockfile = lockfile;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setMaxBackups(int maxBackups) {
        if (maxBackups < 0) {
            throw new IllegalArgumentException("max_backups may not be negative, got " + maxBackups);
        }
        this.maxBackups = maxBackups;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setMaxParallelDownloads(int maxParallelDownloads) {
        if (maxParallelDownloads < 1) {
            throw new IllegalArgumentException("max_parallel_downloads must be positive, got " + maxParallelDownloads);
        }
        this.maxParallelDownloads = maxParallelDownloads;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setMaxResolutionRounds(int maxResolutionRounds) {
        if (maxResolutionRounds < 1) {
            throw new IllegalArgumentException("max_resolution_rounds must be positive, got " + maxResolutionRounds);
        }
        this.maxResolutionRounds = maxResolutionRounds;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("max_retries may not be negative, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setOfflineMode(boolean offlineMode) {
        this.offlineMode = offlineMode;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setParallelDownloads(boolean parallelDownloads) {
        this.parallelDownloads = parallelDownloads;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DistributionConfig setResolutionStrategy(@NotNull ResolutionStrategy resolutionStrategy) {
        this.resolutionStrategy = Objects.requireNonNull(resolutionStrategy, "resolutionStrategy may not be null");
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setResuming(boolean resuming) {
        this.resuming = resuming;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public DistributionConfig setRetryBackoff(@NotNull Duration retryBackoff) {
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("The retry backoff may not be negative");
        }
        this.retryBackoff = retryBackoff;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public DistributionConfig setVerifyChecksums(boolean verifyChecksums) {
        this.verifyChecksums = verifyChecksums;
        return this;
    }

    @Override
    public String toString() {
        return "DistributionConfig[downloads=" + this.downloadDirectory + " installation=" + this.installationDirectory
                + " backups=" + this.backupDirectory + " offline=" + this.offlineMode + " parallel=" + this.parallelDownloads
                + "(" + this.maxParallelDownloads + ")]";
    }
}
