package org.aimux.distribution.lockfile;

import java.time.Instant;
import java.util.Objects;

import org.aimux.distribution.PluginId;
import org.aimux.distribution.ResolutionStrategy;
import org.aimux.distribution.version.SemanticVersion;
import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The durable record of the last successful resolution and installation of a plugin.
 * The timestamp is kept in its ISO-8601 form.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final record LockfileEntry(@JsonProperty("plugin_id") @NotNull String pluginId,
        @JsonProperty("resolved_version") @NotNull String resolvedVersion,
        @JsonProperty("checksum") @NotNull String checksum,
        @JsonProperty("strategy") @NotNull String strategy,
        @JsonProperty("resolved_at") @NotNull String resolvedAt) {

    public LockfileEntry {
        Objects.requireNonNull(pluginId, "pluginId may not be null");
        Objects.requireNonNull(resolvedVersion, "resolvedVersion may not be null");
        checksum = checksum == null ? "" : checksum;
        strategy = strategy == null ? ResolutionStrategy.LATEST.getName() : strategy;
        resolvedAt = resolvedAt == null ? Instant.EPOCH.toString() : resolvedAt;
    }

    public LockfileEntry(@NotNull PluginId pluginId, @NotNull String resolvedVersion, @NotNull String checksum, @NotNull ResolutionStrategy strategy, @NotNull Instant resolvedAt) {
        this(pluginId.toString(), resolvedVersion, checksum, strategy.getName(), resolvedAt.toString());
    }

    @NotNull
    public PluginId target() {
        return PluginId.parse(this.pluginId);
    }

    @NotNull
    public SemanticVersion version() {
        return SemanticVersion.parse(this.resolvedVersion);
    }
}
