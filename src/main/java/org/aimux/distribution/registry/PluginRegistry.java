package org.aimux.distribution.registry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.aimux.distribution.PluginId;
import org.aimux.distribution.PluginPackage;
import org.jetbrains.annotations.NotNull;

/**
 * The source of plugin metadata consumed by the {@link org.aimux.distribution.VersionResolver resolver}
 * and the {@link org.aimux.distribution.install.PluginInstaller installer}.
 *
 * <p>Implementations are responsible for deciding which plugins may be installed at all. A plugin that
 * is not permitted (because it is published by an untrusted publisher, because its identity is malformed or
 * because it was blocked) is indistinguishable from a plugin that does not exist: it has no
 * {@link #getPluginInfo(PluginId, Executor) info} and no {@link #getPluginReleases(PluginId, boolean, Executor) releases}.
 *
 * <p>Lookups that could not be performed because of a transient condition (connection failures, rate limiting)
 * complete exceptionally, preferably with a {@link org.aimux.distribution.transport.TransportException}.
 * They never complete with a "not found" value in that case, as otherwise a flaky connection would be mistaken
 * for a missing plugin.
 *
 * <p>Implementations MUST be safe for use by multiple threads at once.
 */
public interface PluginRegistry {

    /**
     * Drops all cached metadata, so that subsequent lookups query the source again.
     */
    void clearCache();

    /**
     * Obtains the repository a plugin is published from.
     *
     * @param pluginId The identity of the plugin
     * @param executor The executor to perform blocking work on
     * @return A future completing with the repository, or with an empty optional if the plugin is not known or not permitted
     */
    @NotNull
    CompletableFuture<Optional<RepositoryInfo>> getPluginInfo(@NotNull PluginId pluginId, @NotNull Executor executor);

    /**
     * Builds the downloadable package of a release obtained through {@link #getPluginReleases(PluginId, boolean, Executor)}.
     * The returned package may be {@link PluginPackage#isValid() invalid} if the release lacks a usable artifact or
     * checksum, in which case it must not be installed.
     *
     * @param pluginId The identity of the plugin
     * @param release The release
     * @param executor The executor to perform blocking work on
     * @return A future completing with the package
     */
    @NotNull
    CompletableFuture<PluginPackage> getPluginPackage(@NotNull PluginId pluginId, @NotNull Release release, @NotNull Executor executor);

    /**
     * Obtains the releases of a plugin, newest first (as defined by {@link Release#NEWEST_FIRST}).
     * Drafts are never returned.
     *
     * @param pluginId The identity of the plugin
     * @param includePrereleases Whether prereleases should be returned
     * @param executor The executor to perform blocking work on
     * @return A future completing with the releases, which is an empty list if the plugin is not known or not permitted
     */
    @NotNull
    CompletableFuture<List<@NotNull Release>> getPluginReleases(@NotNull PluginId pluginId, boolean includePrereleases, @NotNull Executor executor);
}
