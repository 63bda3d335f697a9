package org.aimux.distribution.install;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

import org.aimux.distribution.PluginId;
import org.aimux.distribution.PluginPackage;
import org.aimux.distribution.internal.AtomicFiles;
import org.aimux.distribution.internal.ConcurrencyUtil;
import org.aimux.distribution.internal.FileTrees;
import org.aimux.distribution.logging.LoggingAdapter;
import org.aimux.distribution.registry.PluginRegistry;
import org.aimux.distribution.registry.Release;
import org.aimux.distribution.registry.ReleaseAsset;
import org.aimux.distribution.registry.RepositoryInfo;
import org.aimux.distribution.version.SemanticVersion;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The local store of verified artifacts, laid out as <code>&lt;owner_name&gt;/&lt;version&gt;/</code> with the
 * artifact and its package metadata side by side.
 *
 * <p>The cache doubles as the registry used in offline mode: every cached version is presented as a release whose
 * single asset is the cached artifact, addressed through a <code>file:</code> URI. Nothing is ever fetched over the network.
 */
public class ArtifactCache implements PluginRegistry {

    public static final String METADATA_FILE = "plugin.json";

    static final ObjectMapper MAPPER = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @NotNull
    private final Path cacheDirectory;

    public ArtifactCache(@NotNull Path cacheDirectory) {
        this.cacheDirectory = cacheDirectory;
    }

    /**
     * Derives the file name of an artifact from the last path segment of its download URL.
     *
     * @param downloadUrl The download URL
     * @return The file name, never empty
     */
    @NotNull
    public static String getArtifactName(@NotNull String downloadUrl) {
        String path = downloadUrl;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isEmpty() || name.equals(".") || name.equals("..") || name.equals(ArtifactCache.METADATA_FILE)) {
            return "artifact";
        }
        return name;
    }

    /**
     * Removes every cached artifact.
     *
     * @throws IOException If the cache could not be deleted
     */
    public void clear() throws IOException {
        FileTrees.delete(this.cacheDirectory);
    }

    @Override
    public void clearCache() {
        // Everything is read from disk on demand
    }

    @Nullable
    public Path getArtifact(@NotNull PluginPackage pluginPackage) {
        Path artifact = this.getVersionDirectory(PluginId.parse(pluginPackage.getId()), pluginPackage.getVersion())
                .resolve(ArtifactCache.getArtifactName(pluginPackage.getDownloadUrl()));
        return Files.isRegularFile(artifact) ? artifact : null;
    }

    /**
     * Lists the packages of which an artifact is cached, ordered by ascending version.
     *
     * @param pluginId The plugin
     * @return The cached packages
     * @throws IOException If the cache could not be read
     */
    @NotNull
    public List<@NotNull PluginPackage> getCachedPackages(@NotNull PluginId pluginId) throws IOException {
        Path pluginDirectory = this.cacheDirectory.resolve(pluginId.toDirectoryName());
        if (!Files.isDirectory(pluginDirectory)) {
            return Collections.emptyList();
        }
        List<PluginPackage> packages = new ArrayList<>();
        try (Stream<Path> versions = Files.list(pluginDirectory)) {
            for (Path versionDirectory : (Iterable<Path>) versions::iterator) {
                Path metadata = versionDirectory.resolve(ArtifactCache.METADATA_FILE);
                if (!Files.isRegularFile(metadata)) {
                    continue;
                }
                PluginPackage cached = ArtifactCache.MAPPER.readValue(metadata.toFile(), PluginPackage.class);
                if (SemanticVersion.tryParse(cached.getVersion()) == null || this.getArtifact(cached) == null) {
                    LoggingAdapter.getDefaultLogger().warn(ArtifactCache.class, "Ignoring incomplete cache entry {}", versionDirectory);
                    continue;
                }
                packages.add(cached);
            }
        }
        packages.sort((a, b) -> SemanticVersion.PRECEDENCE_THEN_ORIGIN.compare(SemanticVersion.parse(a.getVersion()), SemanticVersion.parse(b.getVersion())));
        return packages;
    }

    @NotNull
    public Path getCacheDirectory() {
        return this.cacheDirectory;
    }

    @Override
    @NotNull
    public CompletableFuture<Optional<RepositoryInfo>> getPluginInfo(@NotNull PluginId pluginId, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> {
            List<PluginPackage> packages = this.getCachedPackages(pluginId);
            if (packages.isEmpty()) {
                return Optional.empty();
            }
            PluginPackage newest = packages.get(packages.size() - 1);
            return Optional.of(new RepositoryInfo(pluginId.owner(), pluginId.name(), newest.getDescription(), null, false, 0));
        }, executor);
    }

    @Override
    @NotNull
    public CompletableFuture<PluginPackage> getPluginPackage(@NotNull PluginId pluginId, @NotNull Release release, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> {
            SemanticVersion version = release.getVersion();
            for (PluginPackage cached : this.getCachedPackages(pluginId)) {
                if (version != null && cached.getVersion().equals(version.toString())) {
                    Path artifact = this.getArtifact(cached);
                    if (artifact == null) {
                        break;
                    }
                    return new PluginPackage(cached.getId(), cached.getVersion(), cached.getName(), cached.getDescription(),
                            artifact.toUri().toString(), cached.getChecksum(), cached.getFileSize(), cached.getContentType(),
                            cached.getDependencies(), cached.getConflictsWith());
                }
            }
            throw new IOException("No cached artifact of " + pluginId + " at " + release.getTag());
        }, executor);
    }

    @Override
    @NotNull
    public CompletableFuture<List<@NotNull Release>> getPluginReleases(@NotNull PluginId pluginId, boolean includePrereleases, @NotNull Executor executor) {
        return ConcurrencyUtil.schedule(() -> {
            List<Release> releases = new ArrayList<>();
            for (PluginPackage cached : this.getCachedPackages(pluginId)) {
                SemanticVersion version = SemanticVersion.parse(cached.getVersion());
                if (version.isPrerelease() && !includePrereleases) {
                    continue;
                }
                Path artifact = this.getArtifact(cached);
                if (artifact == null) {
                    continue;
                }
                ReleaseAsset asset = new ReleaseAsset(artifact.getFileName().toString(), artifact.toUri().toString(),
                        cached.getFileSize(), cached.getContentType(), "sha256:" + cached.getChecksum());
                releases.add(new Release("v" + cached.getVersion(), cached.getName(), "", false, version.isPrerelease(), null, Collections.singletonList(asset)));
            }
            releases.sort(Release.NEWEST_FIRST);
            return releases;
        }, executor);
    }

    @NotNull
    private Path getVersionDirectory(@NotNull PluginId pluginId, @NotNull String version) {
        return this.cacheDirectory.resolve(pluginId.toDirectoryName()).resolve(version);
    }

    /**
     * Copies a verified artifact into the cache, replacing a previously cached copy of the same version.
     *
     * @param pluginPackage The package the artifact belongs to
     * @param artifact The verified artifact
     * @throws IOException If the artifact could not be cached
     */
    public void store(@NotNull PluginPackage pluginPackage, @NotNull Path artifact) throws IOException {
        Path versionDirectory = this.getVersionDirectory(PluginId.parse(pluginPackage.getId()), pluginPackage.getVersion());
        Files.createDirectories(versionDirectory);
        String artifactName = ArtifactCache.getArtifactName(pluginPackage.getDownloadUrl());
        Path part = versionDirectory.resolve(artifactName + ".part");
        Files.copy(artifact, part, StandardCopyOption.REPLACE_EXISTING);
        AtomicFiles.move(part, versionDirectory.resolve(artifactName));
        AtomicFiles.write(ArtifactCache.MAPPER.writeValueAsBytes(pluginPackage), versionDirectory.resolve(ArtifactCache.METADATA_FILE));
    }
}
