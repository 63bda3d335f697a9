package org.aimux.distribution;

import java.util.Objects;

import org.aimux.distribution.version.VersionConstraint;
import org.jetbrains.annotations.NotNull;

/**
 * A request issued by the caller to have a plugin at a certain version constraint.
 */
public final record PluginRequest(@NotNull PluginId pluginId, @NotNull VersionConstraint constraint) {

    public PluginRequest {
        Objects.requireNonNull(pluginId, "pluginId may not be null");
        Objects.requireNonNull(constraint, "constraint may not be null");
    }

    /**
     * Parses both the plugin identity and the constraint. Malformed input is rejected
     * synchronously through an {@link IllegalArgumentException}.
     *
     * @param pluginId The plugin identity, in the form <code>owner/name</code>
     * @param constraint The version constraint
     * @return The parsed request
     */
    @NotNull
    public static PluginRequest parse(@NotNull String pluginId, @NotNull String constraint) {
        return new PluginRequest(PluginId.parse(pluginId), VersionConstraint.parse(constraint));
    }
}
