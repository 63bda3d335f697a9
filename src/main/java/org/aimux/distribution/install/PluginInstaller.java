package org.aimux.distribution.install;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.aimux.distribution.PluginId;
import org.aimux.distribution.PluginPackage;
import org.aimux.distribution.PluginRequest;
import org.aimux.distribution.ResolutionConflict;
import org.aimux.distribution.ResolutionResult;
import org.aimux.distribution.ResolutionStrategy;
import org.aimux.distribution.VersionResolver;
import org.aimux.distribution.install.InstallationResult.ErrorKind;
import org.aimux.distribution.internal.AtomicFiles;
import org.aimux.distribution.internal.Checksums;
import org.aimux.distribution.internal.ConcurrencyUtil;
import org.aimux.distribution.internal.FileTrees;
import org.aimux.distribution.internal.StronglyMultiCompletableFuture;
import org.aimux.distribution.lockfile.Lockfile;
import org.aimux.distribution.lockfile.LockfileEntry;
import org.aimux.distribution.logging.LoggingAdapter;
import org.aimux.distribution.registry.PluginRegistry;
import org.aimux.distribution.transport.Transport;
import org.aimux.distribution.transport.TransportException;
import org.aimux.distribution.version.SemanticVersion;
import org.aimux.distribution.version.VersionConstraint;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Turns plugin requests into installed plugins.
 *
 * <p>An installation looks the plugin up, resolves it together with its dependencies against the plugins that
 * are already installed, downloads every artifact that is not installed yet into a staging directory,
 * verifies it and finally swaps it into the installation directory. Each installed plugin occupies
 * the directory <code>&lt;installation_directory&gt;/owner_name</code>, which holds the artifact and a
 * <code>plugin.json</code> file with the package metadata. The presence of that directory is what makes a plugin installed.
 *
 * <p>All operations are asynchronous and run on a bounded worker pool. Operations on different plugins proceed
 * in parallel, operations on the same plugin are performed one after another in the order they were requested.
 * Failures are reported as {@link InstallationResult} values; only malformed input is rejected by throwing.
 */
public class PluginInstaller implements AutoCloseable {

    /**
     * The downloads performed on behalf of one installation request, which includes the downloads of its dependencies.
     */
    private static final class Installation {
        @NotNull
        private final AtomicBoolean cancelled = new AtomicBoolean();
        @NotNull
        private final Set<StagedDownload> downloads = ConcurrentHashMap.newKeySet();

        private void cancel() {
            this.cancelled.set(true);
            for (StagedDownload download : this.downloads) {
                download.cancel();
            }
        }

        private void checkCancelled() {
            if (this.cancelled.get()) {
                throw new CancellationException("The installation was cancelled");
            }
        }

        private void register(@NotNull StagedDownload download) {
            this.downloads.add(download);
            // A cancellation racing the registration must still reach the download
            if (this.cancelled.get()) {
                download.cancel();
            }
        }
    }

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    @NotNull
    private final ArtifactCache artifactCache;
    @NotNull
    private final Map<PluginId, StagedDownload> activeDownloads = new ConcurrentHashMap<>();
    @NotNull
    private final Set<Path> activeStagingDirectories = ConcurrentHashMap.newKeySet();
    @NotNull
    private final BackupStore backups;
    @NotNull
    private final DistributionConfig config;
    @NotNull
    private final Map<PluginId, Object> directoryLocks = new ConcurrentHashMap<>();
    @NotNull
    private final Executor executor;
    @NotNull
    private final Path installationDirectory;
    /**
     * Held exclusively while installation directories are renamed, so that readers never observe a plugin
     * which is being replaced as missing.
     */
    @NotNull
    private final ReadWriteLock layoutLock = new ReentrantReadWriteLock();
    @NotNull
    private final Lockfile lockfile;
    @NotNull
    private final Map<PluginId, CompletableFuture<?>> operations = new HashMap<>();
    @Nullable
    private final ExecutorService ownedExecutor;
    @NotNull
    private final PluginRegistry registry;
    @NotNull
    private final VersionResolver resolver;
    @NotNull
    private final Path stagingDirectory;
    @NotNull
    private final DownloadStatistics statistics = new DownloadStatistics();
    @NotNull
    private final Transport transport;

    public PluginInstaller(@NotNull DistributionConfig config, @NotNull PluginRegistry registry, @NotNull Transport transport) throws IOException {
        this(config, registry, transport, null);
    }

    /**
     * Creates an installer, creating all configured directories that do not exist yet and reading the lockfile.
     *
     * @param config The configuration
     * @param registry The registry to look plugins up in while online
     * @param transport The transport to download artifacts with
     * @param executor The executor to run all work on, or null to use a pool sized by the configured download parallelism
     * @throws IOException If the directories could not be created or the lockfile could not be read
     */
    public PluginInstaller(@NotNull DistributionConfig config, @NotNull PluginRegistry registry, @NotNull Transport transport, @Nullable Executor executor) throws IOException {
        this.config = Objects.requireNonNull(config, "config may not be null");
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
        Objects.requireNonNull(registry, "registry may not be null");

        Files.createDirectories(config.getDownloadDirectory());
        Files.createDirectories(config.getInstallationDirectory());
        Files.createDirectories(config.getBackupDirectory());
        this.installationDirectory = config.getInstallationDirectory();
        this.stagingDirectory = config.getDownloadDirectory().resolve(".staging");
        this.artifactCache = new ArtifactCache(config.getCacheDirectory());
        this.backups = new BackupStore(config.getBackupDirectory(), config.getMaxBackups());

        this.lockfile = Lockfile.read(config.getLockfile());
        for (String discrepancy : this.lockfile.verifyConsistency(this.getInstalledPlugins())) {
            LoggingAdapter.getDefaultLogger().warn(PluginInstaller.class, "Lockfile {} is out of date: {}", config.getLockfile(), discrepancy);
        }

        transport.setTimeout(config.getDownloadTimeout()).setMaxRetries(config.getMaxRetries());

        if (executor == null) {
            int threads = config.isParallelDownloads() ? config.getMaxParallelDownloads() : 1;
            int pool = PluginInstaller.POOL_COUNTER.incrementAndGet();
            AtomicInteger threadCounter = new AtomicInteger();
            this.ownedExecutor = Executors.newFixedThreadPool(threads, (task) -> {
                Thread thread = new Thread(task, "aimux-installer-" + pool + "-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            this.executor = this.ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.executor = executor;
        }

        // Offline installs are served exclusively from previously verified artifacts
        this.registry = config.isOfflineMode() ? this.artifactCache : registry;
        this.resolver = new VersionResolver(this.registry)
                .setAllowPrereleases(config.isAllowPrereleases())
                .setMaxRounds(config.getMaxResolutionRounds());
    }

    /**
     * Requests every active download to stop and shuts down the worker pool if it is owned by this installer.
     * Operations that are still queued on an owned pool are abandoned.
     */
    @Override
    public void close() {
        for (StagedDownload download : this.activeDownloads.values()) {
            download.cancel();
        }
        if (this.ownedExecutor != null) {
            this.ownedExecutor.shutdownNow();
        }
    }

    /**
     * Requests the active download of a plugin to stop. The installation it belongs to completes
     * with {@link ErrorKind#CANCELLED}, leaving the installation directory untouched.
     *
     * @param pluginId The plugin
     * @return True if a download was active
     */
    public boolean cancelDownload(@NotNull PluginId pluginId) {
        StagedDownload download = this.activeDownloads.get(pluginId);
        if (download == null) {
            return false;
        }
        LoggingAdapter.getDefaultLogger().info(PluginInstaller.class, "Cancelling download of {}", pluginId);
        download.cancel();
        return true;
    }

    /**
     * Deletes leftovers of interrupted downloads as well as all cached artifacts.
     * Staging directories of downloads that are in progress are kept.
     *
     * @throws IOException If a file could not be deleted
     */
    public void cleanupDownloads() throws IOException {
        if (Files.isDirectory(this.stagingDirectory)) {
            try (Stream<Path> leftovers = Files.list(this.stagingDirectory)) {
                for (Path leftover : (Iterable<Path>) leftovers::iterator) {
                    if (!this.activeStagingDirectories.contains(leftover)) {
                        FileTrees.delete(leftover);
                    }
                }
            }
        }
        this.artifactCache.clear();
        LoggingAdapter.getDefaultLogger().info(PluginInstaller.class, "Cleaned up download directory {}", this.config.getDownloadDirectory());
    }

    @NotNull
    private static String describe(@NotNull List<@NotNull ResolutionConflict> conflicts) {
        return conflicts.stream().map(ResolutionConflict::toString).collect(Collectors.joining("; "));
    }

    private void discard(@NotNull Path path) {
        try {
            FileTrees.delete(path);
        } catch (IOException e) {
            LoggingAdapter.getDefaultLogger().warn(PluginInstaller.class, "Unable to delete {}", path, e);
        }
    }

    /**
     * Downloads and verifies an artifact. A download only counts as successful once its checksum was verified.
     *
     * @return The SHA-256 checksum of the artifact
     */
    @NotNull
    private String fetchArtifact(@NotNull Installation installation, @NotNull PluginId pluginId, @NotNull PluginPackage pluginPackage, @NotNull Path destination) throws IOException {
        if (this.config.isOfflineMode()) {
            Files.copy(Path.of(URI.create(pluginPackage.getDownloadUrl())), destination, StandardCopyOption.REPLACE_EXISTING);
            return this.verify(pluginId, pluginPackage, destination);
        }

        DownloadProgress progress = new DownloadProgress(pluginPackage.getFileSize());
        StagedDownload download = new StagedDownload(this.transport, pluginPackage.getDownloadUrl(), destination, progress)
                .setBackoff(this.config.getRetryBackoff())
                .setMaxRetries(this.config.getMaxRetries())
                .setResuming(this.config.isResuming());
        this.activeDownloads.put(pluginId, download);
        installation.register(download);
        this.statistics.recordDownloadStart();
        long start = System.nanoTime();
        String checksum;
        try {
            download.run(this.statistics::recordRetry);
            checksum = this.verify(pluginId, pluginPackage, destination);
        } catch (InstallationException e) {
            this.statistics.recordDownloadFailure();
            throw e;
        } catch (IOException e) {
            this.statistics.recordDownloadFailure();
            ErrorKind kind;
            if (e instanceof TransportException && !((TransportException) e).isTransient()) {
                kind = ErrorKind.UNAVAILABLE;
            } else {
                kind = StagedDownload.isRetryable(e) ? ErrorKind.TRANSIENT : ErrorKind.IO;
            }
            throw new InstallationException(kind, "Download of " + pluginPackage.getDownloadUrl() + " failed after " + download.getRetries() + " retries: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            this.statistics.recordDownloadFailure();
            throw e;
        } finally {
            this.activeDownloads.remove(pluginId, download);
            installation.downloads.remove(download);
        }
        this.statistics.recordDownloadSuccess(Files.size(destination), (System.nanoTime() - start) / 1_000_000L);
        return checksum;
    }

    /**
     * Obtains the progress of all downloads which are currently in progress.
     *
     * @return A snapshot of the active downloads
     */
    @NotNull
    public Map<@NotNull PluginId, @NotNull DownloadProgress> getActiveDownloads() {
        Map<PluginId, DownloadProgress> downloads = new TreeMap<>();
        for (Map.Entry<PluginId, StagedDownload> entry : this.activeDownloads.entrySet()) {
            downloads.put(entry.getKey(), entry.getValue().getProgress());
        }
        return downloads;
    }

    @NotNull
    @Contract(pure = true)
    public BackupStore getBackups() {
        return this.backups;
    }

    @Nullable
    public DownloadProgress getDownloadProgress(@NotNull PluginId pluginId) {
        StagedDownload download = this.activeDownloads.get(pluginId);
        return download == null ? null : download.getProgress();
    }

    @NotNull
    @Contract(pure = true)
    public DownloadStatistics getDownloadStatistics() {
        return this.statistics;
    }

    @NotNull
    private Path getInstallation(@NotNull PluginId pluginId) {
        return this.installationDirectory.resolve(pluginId.toDirectoryName());
    }

    @NotNull
    public Optional<PluginPackage> getInstalledPluginInfo(@NotNull PluginId pluginId) throws IOException {
        Path metadata = this.getInstallation(pluginId).resolve(ArtifactCache.METADATA_FILE);
        Lock lock = this.layoutLock.readLock();
        lock.lock();
        try {
            if (!Files.isRegularFile(metadata)) {
                return Optional.empty();
            }
            return Optional.of(ArtifactCache.MAPPER.readValue(metadata.toFile(), PluginPackage.class));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enumerates the installation directory. Directories without readable package metadata are skipped with a warning.
     *
     * @return The installed plugins mapped to their package metadata
     * @throws IOException If the installation directory could not be listed
     */
    @NotNull
    public Map<@NotNull PluginId, @NotNull PluginPackage> getInstalledPlugins() throws IOException {
        Map<PluginId, PluginPackage> installed = new TreeMap<>();
        Lock lock = this.layoutLock.readLock();
        lock.lock();
        try (Stream<Path> directories = Files.list(this.installationDirectory)) {
            for (Path directory : (Iterable<Path>) directories::iterator) {
                String name = directory.getFileName().toString();
                if (name.startsWith(".") || !Files.isDirectory(directory)) {
                    continue;
                }
                Path metadata = directory.resolve(ArtifactCache.METADATA_FILE);
                if (!Files.isRegularFile(metadata)) {
                    LoggingAdapter.getDefaultLogger().warn(PluginInstaller.class, "Installation {} has no package metadata", directory);
                    continue;
                }
                try {
                    PluginPackage pluginPackage = ArtifactCache.MAPPER.readValue(metadata.toFile(), PluginPackage.class);
                    installed.put(PluginId.parse(pluginPackage.getId()), pluginPackage);
                } catch (IOException | IllegalArgumentException e) {
                    LoggingAdapter.getDefaultLogger().warn(PluginInstaller.class, "Installation {} has malformed package metadata", directory, e);
                }
            }
        } finally {
            lock.unlock();
        }
        return installed;
    }

    @NotNull
    @Contract(pure = true)
    public Lockfile getLockfile() {
        return this.lockfile;
    }

    @NotNull
    @Contract(pure = true)
    public VersionResolver getResolver() {
        return this.resolver;
    }

    @NotNull
    private CompletableFuture<InstallationResult> install(@NotNull PluginRequest request, @NotNull ResolutionStrategy strategy) {
        PluginId pluginId = request.pluginId();
        Installation installation = new Installation();
        CompletableFuture<InstallationResult> result = this.serialized(pluginId, () -> this.resolveAndInstall(installation, request, strategy))
                .exceptionally((t) -> this.toFailure(pluginId, t));
        result.whenComplete((ignored, t) -> {
            if (t instanceof CancellationException) {
                // The caller abandoned the installation, which stops the downloads of its dependencies as well
                LoggingAdapter.getDefaultLogger().info(PluginInstaller.class, "Cancelling the installation of {}", pluginId);
                installation.cancel();
            }
        });
        return result;
    }

    private void installPackage(@NotNull Installation installation, @NotNull PluginId pluginId, @NotNull PluginPackage pluginPackage, @NotNull ResolutionStrategy strategy) throws IOException {
        installation.checkCancelled();
        if (!pluginPackage.isValid()) {
            throw new InstallationException(ErrorKind.INTEGRITY, "The release of " + pluginId + " does not describe a complete artifact: " + pluginPackage);
        }

        String artifactName = ArtifactCache.getArtifactName(pluginPackage.getDownloadUrl());
        Path staging = this.stagingDirectory.resolve(UUID.randomUUID().toString());
        this.activeStagingDirectories.add(staging);
        try {
            Files.createDirectories(staging);
            Path artifact = staging.resolve(artifactName);
            String checksum = this.fetchArtifact(installation, pluginId, pluginPackage, artifact);

            PluginPackage installed = new PluginPackage(pluginPackage.getId(), pluginPackage.getVersion(), pluginPackage.getName(), pluginPackage.getDescription(),
                    pluginPackage.getDownloadUrl(), checksum, Files.size(artifact), pluginPackage.getContentType(),
                    pluginPackage.getDependencies(), pluginPackage.getConflictsWith());

            Path replacement = this.installationDirectory.resolve("." + pluginId.toDirectoryName() + ".new-" + UUID.randomUUID());
            try {
                Files.createDirectories(replacement);
                Files.move(artifact, replacement.resolve(artifactName));
                AtomicFiles.write(ArtifactCache.MAPPER.writeValueAsBytes(installed), replacement.resolve(ArtifactCache.METADATA_FILE));
                installation.checkCancelled();
                this.promote(pluginId, replacement);
            } finally {
                if (Files.exists(replacement)) {
                    this.discard(replacement);
                }
            }

            if (!this.config.isOfflineMode()) {
                try {
                    this.artifactCache.store(installed, this.getInstallation(pluginId).resolve(artifactName));
                } catch (IOException e) {
                    LoggingAdapter.getDefaultLogger().warn(PluginInstaller.class, "Unable to cache the artifact of {} {}", pluginId, installed.getVersion(), e);
                }
            }
            this.lock(pluginId, installed, strategy);
            LoggingAdapter.getDefaultLogger().info(PluginInstaller.class, "Installed {} {}", pluginId, installed.getVersion());
        } finally {
            this.discard(staging);
            this.activeStagingDirectories.remove(staging);
        }
    }

    /**
     * Installs a plugin and the dependencies it needs, using the configured resolution strategy.
     * An installed version of the plugin itself may be replaced, the versions of installed dependencies are kept.
     *
     * @param pluginId The plugin, in the form <code>owner/name</code>
     * @param constraint The version constraint, such as <code>^1.2.0</code> or <code>latest</code>
     * @return A future completing with the outcome, never exceptionally unless cancelled by the caller
     * @throws IllegalArgumentException If the plugin id or the constraint is malformed
     */
    @NotNull
    public CompletableFuture<InstallationResult> installPlugin(@NotNull String pluginId, @NotNull String constraint) {
        return this.installPlugin(PluginRequest.parse(pluginId, constraint));
    }

    @NotNull
    public CompletableFuture<InstallationResult> installPlugin(@NotNull PluginRequest request) {
        return this.install(request, this.config.getResolutionStrategy());
    }

    /**
     * Installs several plugins concurrently.
     *
     * @param requests The plugins to install
     * @return A future completing once every installation completed, with the results of all installations
     * that were not cancelled, in the order of the requests
     */
    @NotNull
    public CompletableFuture<List<@NotNull InstallationResult>> installPlugins(@NotNull Collection<@NotNull PluginRequest> requests) {
        List<CompletableFuture<InstallationResult>> installations = new ArrayList<>();
        for (PluginRequest request : requests) {
            installations.add(this.installPlugin(request));
        }
        return new StronglyMultiCompletableFuture<>(installations);
    }

    @NotNull
    private CompletableFuture<InstallationResult> installResolved(@NotNull Installation installation, @NotNull PluginId pluginId, @NotNull ResolutionResult resolution,
            @NotNull Map<PluginId, PluginPackage> installed, @NotNull ResolutionStrategy strategy) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PluginId target : resolution.getInstallOrder()) {
            PluginPackage pluginPackage = Objects.requireNonNull(resolution.getPackage(target));
            PluginPackage current = installed.get(target);
            if (current != null && current.getVersion().equals(pluginPackage.getVersion())
                    && (pluginPackage.getChecksum().isEmpty() || Checksums.matches(pluginPackage.getChecksum(), current.getChecksum()))) {
                LoggingAdapter.getDefaultLogger().debug(PluginInstaller.class, "{} {} is already installed", target, current.getVersion());
                continue;
            }
            chain = chain.thenCompose((ignored) -> ConcurrencyUtil.<Void>schedule(() -> {
                this.installPackage(installation, target, pluginPackage, strategy);
                return null;
            }, this.executor));
        }
        String version = Objects.requireNonNull(resolution.getPackage(pluginId)).getVersion();
        return chain.thenApply((ignored) -> InstallationResult.success(pluginId, version));
    }

    @NotNull
    private String verify(@NotNull PluginId pluginId, @NotNull PluginPackage pluginPackage, @NotNull Path artifact) throws IOException {
        String checksum = Checksums.sha256(artifact);
        if (this.config.isVerifyChecksums() && !Checksums.matches(pluginPackage.getChecksum(), checksum)) {
            this.statistics.recordChecksumFailure();
            LoggingAdapter.getDefaultLogger().error(PluginInstaller.class, "Checksum mismatch for {} {}: expected {}, got {}", pluginId, pluginPackage.getVersion(), pluginPackage.getChecksum(), checksum);
            throw new InstallationException(ErrorKind.INTEGRITY, "Checksum mismatch for " + pluginId + " " + pluginPackage.getVersion()
                    + ": expected " + pluginPackage.getChecksum() + " but got " + checksum);
        }
        return checksum;
    }

    /**
     * Checks whether the installation directory of a plugin exists.
     *
     * @param pluginId The plugin
     * @return True if the plugin is installed
     */
    public boolean isPluginInstalled(@NotNull PluginId pluginId) {
        Lock lock = this.layoutLock.readLock();
        lock.lock();
        try {
            return Files.isDirectory(this.getInstallation(pluginId));
        } finally {
            lock.unlock();
        }
    }

    private void lock(@NotNull PluginId pluginId, @NotNull PluginPackage pluginPackage, @NotNull ResolutionStrategy strategy) throws IOException {
        synchronized (this.lockfile) {
            this.lockfile.put(new LockfileEntry(pluginId, pluginPackage.getVersion(), pluginPackage.getChecksum(), strategy, Instant.now()));
            this.lockfile.write(this.config.getLockfile());
        }
    }

    /**
     * Moves a complete installation to the installation directory of its plugin.
     *
     * @param replacement The complete installation
     * @param target The installation directory, which does not exist when this method is called
     * @throws IOException If the installation could not be moved
     */
    protected void moveIntoPlace(@NotNull Path replacement, @NotNull Path target) throws IOException {
        AtomicFiles.move(replacement, target);
    }

    /**
     * Moves a complete installation into place. The previous installation, if any, is backed up and
     * only removed once the replacement is in place; if moving the replacement fails it is restored.
     */
    private void promote(@NotNull PluginId pluginId, @NotNull Path replacement) throws IOException {
        Path target = this.getInstallation(pluginId);
        Path previous = this.installationDirectory.resolve("." + pluginId.toDirectoryName() + ".old-" + UUID.randomUUID());
        synchronized (this.directoryLocks.computeIfAbsent(pluginId, (ignored) -> new Object())) {
            boolean replacing = Files.isDirectory(target);
            if (replacing) {
                this.backups.backup(pluginId, target);
            }
            Lock lock = this.layoutLock.writeLock();
            lock.lock();
            try {
                if (replacing) {
                    AtomicFiles.move(target, previous);
                }
                try {
                    this.moveIntoPlace(replacement, target);
                } catch (IOException e) {
                    if (replacing) {
                        try {
                            AtomicFiles.move(previous, target);
                            LoggingAdapter.getDefaultLogger().error(PluginInstaller.class, "Unable to replace {}, restored the previous installation", pluginId, e);
                        } catch (IOException restoreFailure) {
                            e.addSuppressed(restoreFailure);
                        }
                    }
                    throw e;
                }
            } finally {
                lock.unlock();
            }
            if (replacing) {
                this.discard(previous);
            }
        }
    }

    @NotNull
    private CompletableFuture<InstallationResult> resolveAndInstall(@NotNull Installation installation, @NotNull PluginRequest request, @NotNull ResolutionStrategy strategy) {
        PluginId pluginId = request.pluginId();
        return this.registry.getPluginInfo(pluginId, this.executor).thenCompose((repository) -> {
            if (repository.isEmpty()) {
                if (this.config.isOfflineMode()) {
                    return CompletableFuture.completedFuture(InstallationResult.failure(pluginId, ErrorKind.UNAVAILABLE, "No artifact of " + pluginId + " is cached for offline use"));
                }
                return CompletableFuture.completedFuture(InstallationResult.failure(pluginId, ErrorKind.POLICY, pluginId + " is not a trusted plugin"));
            }

            Map<PluginId, PluginPackage> installed;
            try {
                installed = this.getInstalledPlugins();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            Map<PluginId, SemanticVersion> pins = new TreeMap<>(this.lockfile.toInstalledConstraints());
            pins.keySet().retainAll(installed.keySet());
            for (Map.Entry<PluginId, PluginPackage> entry : installed.entrySet()) {
                SemanticVersion version = SemanticVersion.tryParse(entry.getValue().getVersion());
                if (version != null) {
                    pins.putIfAbsent(entry.getKey(), version);
                }
            }

            return this.resolver.resolve(Collections.singletonList(request), pins, installed, Collections.singleton(pluginId), strategy, this.executor).thenCompose((resolution) -> {
                if (!resolution.isSuccess()) {
                    return CompletableFuture.completedFuture(InstallationResult.failure(pluginId, ErrorKind.RESOLUTION, PluginInstaller.describe(resolution.getConflicts())));
                }
                return this.installResolved(installation, pluginId, resolution, installed, strategy);
            });
        });
    }

    /**
     * Restores the newest backup of a plugin. The installation that is replaced is backed up in turn.
     *
     * @param pluginId The plugin
     * @return A future completing with the outcome, failing with {@link ErrorKind#UNAVAILABLE} if there is no backup
     */
    @NotNull
    public CompletableFuture<InstallationResult> rollbackPlugin(@NotNull PluginId pluginId) {
        return this.serialized(pluginId, () -> ConcurrencyUtil.schedule(() -> {
            Path backup = this.backups.getLatestBackup(pluginId);
            if (backup == null) {
                return InstallationResult.failure(pluginId, ErrorKind.UNAVAILABLE, "There is no backup of " + pluginId);
            }
            PluginPackage restored = ArtifactCache.MAPPER.readValue(backup.resolve(ArtifactCache.METADATA_FILE).toFile(), PluginPackage.class);
            Path replacement = this.installationDirectory.resolve("." + pluginId.toDirectoryName() + ".new-" + UUID.randomUUID());
            try {
                FileTrees.copy(backup, replacement);
                this.promote(pluginId, replacement);
            } finally {
                if (Files.exists(replacement)) {
                    this.discard(replacement);
                }
            }
            LockfileEntry previous = this.lockfile.get(pluginId);
            ResolutionStrategy strategy = previous == null ? this.config.getResolutionStrategy() : ResolutionStrategy.parse(previous.strategy());
            this.lock(pluginId, restored, strategy);
            LoggingAdapter.getDefaultLogger().info(PluginInstaller.class, "Rolled {} back to {} from {}", pluginId, restored.getVersion(), backup);
            return InstallationResult.success(pluginId, restored.getVersion());
        }, this.executor)).exceptionally((t) -> this.toFailure(pluginId, t));
    }

    /**
     * Chains an operation on a plugin behind all operations on the same plugin that were requested earlier.
     */
    @NotNull
    private <T> CompletableFuture<T> serialized(@NotNull PluginId pluginId, @NotNull Supplier<CompletableFuture<T>> operation) {
        synchronized (this.operations) {
            CompletableFuture<?> predecessor = this.operations.get(pluginId);
            if (predecessor == null) {
                predecessor = CompletableFuture.completedFuture(null);
            }
            CompletableFuture<T> next = predecessor.handle((ignored, t) -> (Void) null).thenCompose((ignored) -> operation.get());
            this.operations.put(pluginId, next);
            next.whenComplete((ignored, t) -> {
                synchronized (this.operations) {
                    this.operations.remove(pluginId, next);
                }
            });
            return next;
        }
    }

    @NotNull
    private InstallationResult toFailure(@NotNull PluginId pluginId, @NotNull Throwable t) {
        Throwable cause = ConcurrencyUtil.unwrap(t);
        if (cause instanceof UncheckedIOException) {
            cause = cause.getCause();
        }
        ErrorKind kind;
        if (cause instanceof InstallationException) {
            kind = ((InstallationException) cause).getErrorKind();
        } else if (cause instanceof CancellationException) {
            kind = ErrorKind.CANCELLED;
        } else if (cause instanceof TransportException) {
            kind = ((TransportException) cause).isTransient() ? ErrorKind.TRANSIENT : ErrorKind.UNAVAILABLE;
        } else if (cause instanceof IllegalArgumentException) {
            kind = ErrorKind.INPUT;
        } else {
            kind = ErrorKind.IO;
        }
        if (kind == ErrorKind.IO) {
            LoggingAdapter.getDefaultLogger().error(PluginInstaller.class, "Operation on {} failed", pluginId, cause);
        } else {
            LoggingAdapter.getDefaultLogger().warn(PluginInstaller.class, "Operation on {} failed: {}", pluginId, cause.getMessage());
        }
        return InstallationResult.failure(pluginId, kind, String.valueOf(cause.getMessage()));
    }

    @NotNull
    public CompletableFuture<Boolean> uninstallPlugin(@NotNull String pluginId) {
        return this.uninstallPlugin(PluginId.parse(pluginId));
    }

    /**
     * Removes the installation directory of a plugin. Uninstalling a plugin that is not installed is not an error.
     *
     * @param pluginId The plugin
     * @return A future completing with true if the plugin was installed and has been removed
     */
    @NotNull
    public CompletableFuture<Boolean> uninstallPlugin(@NotNull PluginId pluginId) {
        return this.serialized(pluginId, () -> ConcurrencyUtil.schedule(() -> {
            Path target = this.getInstallation(pluginId);
            boolean removed = false;
            synchronized (this.directoryLocks.computeIfAbsent(pluginId, (ignored) -> new Object())) {
                if (Files.isDirectory(target)) {
                    Path trash = this.installationDirectory.resolve("." + pluginId.toDirectoryName() + ".trash-" + UUID.randomUUID());
                    Lock lock = this.layoutLock.writeLock();
                    lock.lock();
                    try {
                        AtomicFiles.move(target, trash);
                    } finally {
                        lock.unlock();
                    }
                    removed = true;
                    this.discard(trash);
                }
            }
            this.statistics.recordUninstall(removed);
            synchronized (this.lockfile) {
                if (this.lockfile.remove(pluginId)) {
                    this.lockfile.write(this.config.getLockfile());
                }
            }
            if (removed) {
                LoggingAdapter.getDefaultLogger().info(PluginInstaller.class, "Uninstalled {}", pluginId);
            } else {
                LoggingAdapter.getDefaultLogger().debug(PluginInstaller.class, "{} is not installed", pluginId);
            }
            return removed;
        }, this.executor));
    }

    /**
     * Updates an installed plugin to the newest version its dependents and dependencies permit.
     *
     * @param pluginId The plugin
     * @return A future completing with the outcome, failing with {@link ErrorKind#INPUT} if the plugin is not installed
     */
    @NotNull
    public CompletableFuture<InstallationResult> updatePlugin(@NotNull PluginId pluginId) {
        if (!this.isPluginInstalled(pluginId)) {
            return CompletableFuture.completedFuture(InstallationResult.failure(pluginId, ErrorKind.INPUT, pluginId + " is not installed"));
        }
        return this.install(new PluginRequest(pluginId, VersionConstraint.LATEST), ResolutionStrategy.LATEST);
    }

    /**
     * Compares the lockfile with the installation directory.
     *
     * @return A description of every discrepancy
     * @throws IOException If the installation directory could not be read
     */
    @NotNull
    public List<@NotNull String> verifyLockfile() throws IOException {
        return this.lockfile.verifyConsistency(this.getInstalledPlugins());
    }
}
