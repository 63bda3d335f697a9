package org.aimux.distribution;

import java.util.Locale;

import org.jetbrains.annotations.NotNull;

/**
 * The policy used to pick one version out of all published versions satisfying the
 * constraints imposed on a plugin.
 */
public enum ResolutionStrategy {

    /**
     * Pick the highest satisfying version.
     */
    LATEST,

    /**
     * Pick the lowest satisfying version.
     */
    MINIMUM,

    /**
     * Pick the highest satisfying version that is not a prerelease, falling back to the highest
     * satisfying prerelease if no stable version satisfies the constraints.
     */
    STABLE;

    @NotNull
    public static ResolutionStrategy parse(@NotNull String name) {
        for (ResolutionStrategy strategy : ResolutionStrategy.values()) {
            if (strategy.getName().equals(name.trim().toLowerCase(Locale.ROOT))) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown resolution strategy: \"" + name + "\". Expected one of latest, minimum or stable.");
    }

    /**
     * Obtains the lowercase name of the strategy as it is written to lockfiles and configuration files.
     *
     * @return The name of the strategy
     */
    @NotNull
    public String getName() {
        return this.name().toLowerCase(Locale.ROOT);
    }
}
