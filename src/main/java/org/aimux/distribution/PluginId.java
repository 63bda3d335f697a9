package org.aimux.distribution;

import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The identity of a plugin, that is the owner (organization or user) and the repository name under
 * which the plugin is published on the source host. The textual form is <code>owner/name</code>.
 *
 * <p>This class only validates the shape of the identity (exactly one owner and one name part, both non-empty).
 * Whether the identity obeys the naming grammar of the source host or whether the owner is trusted
 * is decided by the {@link org.aimux.distribution.registry.PluginRegistry registry}.
 *
 * <p>Identities are case-sensitive for the purpose of {@link #equals(Object)}.
 */
public final record PluginId(@NotNull String owner, @NotNull String name) implements Comparable<PluginId> {

    public PluginId {
        Objects.requireNonNull(owner, "owner may not be null");
        Objects.requireNonNull(name, "name may not be null");
        if (owner.isEmpty() || name.isEmpty()) {
            throw new IllegalArgumentException("Neither the owner nor the name of a plugin may be empty (got \"" + owner + "/" + name + "\").");
        }
        if (owner.indexOf('/') != -1 || name.indexOf('/') != -1) {
            throw new IllegalArgumentException("The owner and the name of a plugin may not contain slashes (got \"" + owner + "/" + name + "\").");
        }
    }

    /**
     * Parses a plugin identity of the form <code>owner/name</code>, splitting at the first slash.
     *
     * @param pluginId The plugin identity string
     * @return The parsed identity
     * @throws IllegalArgumentException If the string is not of the form <code>owner/name</code>
     */
    @NotNull
    public static PluginId parse(@NotNull String pluginId) {
        int slash = pluginId.indexOf('/');
        if (slash == -1) {
            throw new IllegalArgumentException("Plugin identity \"" + pluginId + "\" is not of the form \"owner/name\".");
        }
        return new PluginId(pluginId.substring(0, slash), pluginId.substring(slash + 1));
    }

    @Override
    public int compareTo(@NotNull PluginId o) {
        int cmp = this.owner.compareTo(o.owner);
        if (cmp != 0) {
            return cmp;
        }
        return this.name.compareTo(o.name);
    }

    /**
     * Obtains the name of the directory in which the plugin is installed or backed up.
     * As owners may not contain underscores, splitting the directory name at the first underscore
     * yields the original identity.
     *
     * @return The directory name
     */
    @NotNull
    @Contract(pure = true)
    public String toDirectoryName() {
        return this.owner + '_' + this.name;
    }

    @Override
    public String toString() {
        return this.owner + '/' + this.name;
    }
}
