package org.aimux.distribution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A structured description of why a resolution could not produce a consistent version assignment.
 * Conflicts are ordinary values, they are never thrown.
 */
public final class ResolutionConflict {

    public enum Type {
        /**
         * Two or more requesters impose constraints on the same plugin that no version can satisfy at once.
         */
        VERSION_CONFLICT,
        /**
         * A plugin depends on itself, directly or transitively.
         */
        CIRCULAR_DEPENDENCY,
        /**
         * A required plugin is unknown to the registry, not trusted or does not have any eligible release.
         */
        MISSING_DEPENDENCY,
        /**
         * A selected plugin declares that it cannot coexist with another selected plugin.
         */
        MUTUALLY_EXCLUSIVE,
        /**
         * The constraints on a plugin are satisfiable in theory, but no published release satisfies them.
         */
        INSUFFICIENT_VERSION,
        /**
         * The selection did not settle within the configured amount of resolution rounds.
         */
        UNRESOLVABLE;
    }

    /**
     * A constraint imposed on a plugin together with whoever imposed it. The requester is either
     * a plugin in the form <code>owner/name@version</code>, {@link #REQUESTER_CALLER} or {@link #REQUESTER_INSTALLED}.
     * Installed plugins outside of the resolution are named <code>&lt;installed&gt;/owner/name@version</code>.
     */
    public static final record Requirement(@NotNull String requester, @NotNull String constraint) {
        public static final String REQUESTER_CALLER = "<request>";
        public static final String REQUESTER_INSTALLED = "<installed>";

        @Override
        public String toString() {
            return this.requester + " requires " + this.constraint;
        }
    }

    @NotNull
    public static ResolutionConflict circularDependency(@NotNull List<@NotNull PluginId> cyclePath) {
        StringBuilder builder = new StringBuilder("Circular dependency: ");
        for (PluginId id : cyclePath) {
            builder.append(id).append(" -> ");
        }
        builder.setLength(builder.length() - 4);
        return new ResolutionConflict(Type.CIRCULAR_DEPENDENCY, cyclePath.get(0), Collections.emptyList(), cyclePath, builder.toString());
    }

    @NotNull
    public static ResolutionConflict insufficientVersion(@NotNull PluginId pluginId, @NotNull List<@NotNull Requirement> requirements) {
        return new ResolutionConflict(Type.INSUFFICIENT_VERSION, pluginId, requirements, Collections.emptyList(),
                "No published release of " + pluginId + " satisfies " + requirements);
    }

    @NotNull
    public static ResolutionConflict missingDependency(@NotNull PluginId pluginId, @NotNull List<@NotNull Requirement> requirements) {
        return new ResolutionConflict(Type.MISSING_DEPENDENCY, pluginId, requirements, Collections.emptyList(),
                "Plugin " + pluginId + " could not be found or is not trusted (required by " + requirements + ")");
    }

    @NotNull
    public static ResolutionConflict mutuallyExclusive(@NotNull PluginId declarer, @NotNull String declarerVersion, @NotNull PluginId excluded) {
        return new ResolutionConflict(Type.MUTUALLY_EXCLUSIVE, excluded,
                Collections.singletonList(new Requirement(declarer + "@" + declarerVersion, "conflicts with " + excluded)),
                Collections.emptyList(), declarer + "@" + declarerVersion + " cannot be installed alongside " + excluded);
    }

    @NotNull
    public static ResolutionConflict unresolvable(@NotNull String description) {
        return new ResolutionConflict(Type.UNRESOLVABLE, null, Collections.emptyList(), Collections.emptyList(), description);
    }

    @NotNull
    public static ResolutionConflict versionConflict(@NotNull PluginId pluginId, @NotNull List<@NotNull Requirement> requirements) {
        return new ResolutionConflict(Type.VERSION_CONFLICT, pluginId, requirements, Collections.emptyList(),
                "Version conflict for " + pluginId + ": " + requirements);
    }

    @NotNull
    private final Type type;
    @Nullable
    private final PluginId pluginId;
    @NotNull
    private final List<@NotNull Requirement> requirements;
    @NotNull
    private final List<@NotNull PluginId> cyclePath;
    @NotNull
    private final String description;

    private ResolutionConflict(@NotNull Type type, @Nullable PluginId pluginId, @NotNull List<@NotNull Requirement> requirements,
            @NotNull List<@NotNull PluginId> cyclePath, @NotNull String description) {
        this.type = Objects.requireNonNull(type);
        this.pluginId = pluginId;
        this.requirements = Collections.unmodifiableList(new ArrayList<>(requirements));
        this.cyclePath = Collections.unmodifiableList(new ArrayList<>(cyclePath));
        this.description = description;
    }

    /**
     * Obtains the path of the dependency cycle if this is a {@link Type#CIRCULAR_DEPENDENCY} conflict.
     * The first and the last element of the path are the same plugin.
     *
     * @return The cycle path, or an empty list for other conflict types
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull PluginId> getCyclePath() {
        return this.cyclePath;
    }

    @NotNull
    @Contract(pure = true)
    public String getDescription() {
        return this.description;
    }

    @Nullable
    @Contract(pure = true)
    public PluginId getPluginId() {
        return this.pluginId;
    }

    /**
     * Obtains the requirements which contributed to the conflict. For a {@link Type#VERSION_CONFLICT}
     * these are all requirements imposed on {@link #getPluginId() the plugin}, which includes at least two
     * disjoint ones.
     *
     * @return The contributing requirements
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull Requirement> getRequirements() {
        return this.requirements;
    }

    @NotNull
    @Contract(pure = true)
    public Type getType() {
        return this.type;
    }

    @Override
    public String toString() {
        return this.type + ": " + this.description;
    }
}
