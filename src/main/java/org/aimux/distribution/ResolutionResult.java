package org.aimux.distribution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.aimux.distribution.version.SemanticVersion;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of a {@link VersionResolver#resolve(java.util.Collection, Map, ResolutionStrategy, java.util.concurrent.Executor) resolution}:
 * either exactly one version per plugin in the resolved graph, or a non-empty list of conflicts. Never both.
 */
public final class ResolutionResult {

    @NotNull
    public static ResolutionResult failure(@NotNull List<@NotNull ResolutionConflict> conflicts) {
        if (conflicts.isEmpty()) {
            throw new IllegalArgumentException("A failed resolution must name at least one conflict.");
        }
        return new ResolutionResult(Collections.emptyMap(), Collections.emptyList(), conflicts);
    }

    @NotNull
    public static ResolutionResult success(@NotNull Map<@NotNull PluginId, @NotNull PluginPackage> packages, @NotNull List<@NotNull PluginId> installOrder) {
        return new ResolutionResult(packages, installOrder, Collections.emptyList());
    }

    @NotNull
    private final Map<@NotNull PluginId, @NotNull PluginPackage> packages;
    @NotNull
    private final Map<@NotNull PluginId, @NotNull SemanticVersion> versions;
    @NotNull
    private final List<@NotNull PluginId> installOrder;
    @NotNull
    private final List<@NotNull ResolutionConflict> conflicts;

    private ResolutionResult(@NotNull Map<@NotNull PluginId, @NotNull PluginPackage> packages, @NotNull List<@NotNull PluginId> installOrder,
            @NotNull List<@NotNull ResolutionConflict> conflicts) {
        this.packages = Collections.unmodifiableMap(new TreeMap<>(packages));
        Map<PluginId, SemanticVersion> versions = new TreeMap<>();
        for (Map.Entry<PluginId, PluginPackage> entry : packages.entrySet()) {
            versions.put(entry.getKey(), SemanticVersion.parse(entry.getValue().getVersion()));
        }
        this.versions = Collections.unmodifiableMap(versions);
        this.installOrder = Collections.unmodifiableList(new ArrayList<>(installOrder));
        this.conflicts = Collections.unmodifiableList(new ArrayList<>(conflicts));
    }

    /**
     * Obtains the conflicts which prevented resolution, sorted deterministically.
     *
     * @return The conflicts, empty if the resolution was successful
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull ResolutionConflict> getConflicts() {
        return this.conflicts;
    }

    /**
     * Obtains the order in which the resolved plugins should be installed: every plugin comes after all of its dependencies.
     *
     * @return The installation order
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull PluginId> getInstallOrder() {
        return this.installOrder;
    }

    @Nullable
    public PluginPackage getPackage(@NotNull PluginId pluginId) {
        return this.packages.get(pluginId);
    }

    @NotNull
    @Contract(pure = true)
    public Map<@NotNull PluginId, @NotNull PluginPackage> getPackages() {
        return this.packages;
    }

    @Nullable
    public SemanticVersion getVersion(@NotNull PluginId pluginId) {
        return this.versions.get(pluginId);
    }

    /**
     * Obtains the chosen version of each resolved plugin, keyed by plugin identity in ascending order.
     *
     * @return The version assignment, empty if resolution failed
     */
    @NotNull
    @Contract(pure = true)
    public Map<@NotNull PluginId, @NotNull SemanticVersion> getVersions() {
        return this.versions;
    }

    @Contract(pure = true)
    public boolean isSuccess() {
        return this.conflicts.isEmpty();
    }

    @Override
    public String toString() {
        if (this.isSuccess()) {
            Map<String, String> assignment = new LinkedHashMap<>();
            this.versions.forEach((id, version) -> assignment.put(id.toString(), version.toString()));
            return "ResolutionResult[success " + assignment + "]";
        }
        return "ResolutionResult[failure " + this.conflicts + "]";
    }
}
