package org.aimux.distribution;

import org.aimux.distribution.version.VersionConstraint;
import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A dependency declared by a plugin release. The constraint is kept in textual form so that
 * serialising a {@link PluginPackage} reproduces exactly what the publisher declared.
 * Optional dependencies that cannot be found are skipped during resolution instead of failing it.
 */
public final record PluginDependency(@JsonProperty("plugin_id") @NotNull String pluginId,
        @JsonProperty("version_constraint") @NotNull String versionConstraint,
        @JsonProperty("optional") boolean optional) {

    public PluginDependency {
        if (pluginId == null || pluginId.isEmpty()) {
            throw new IllegalArgumentException("pluginId may not be empty");
        }
        if (versionConstraint == null || versionConstraint.isBlank()) {
            versionConstraint = "latest";
        }
    }

    public PluginDependency(@NotNull String pluginId, @NotNull String versionConstraint) {
        this(pluginId, versionConstraint, false);
    }

    @NotNull
    public VersionConstraint constraint() {
        return VersionConstraint.parse(this.versionConstraint);
    }

    @NotNull
    public PluginId target() {
        return PluginId.parse(this.pluginId);
    }
}
