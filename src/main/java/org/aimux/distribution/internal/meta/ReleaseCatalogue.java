package org.aimux.distribution.internal.meta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.aimux.distribution.PluginId;
import org.aimux.distribution.ResolutionStrategy;
import org.aimux.distribution.registry.Release;
import org.aimux.distribution.version.SemanticVersion;
import org.aimux.distribution.version.VersionConstraint;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The releases of a single plugin that are eligible for resolution, keyed by their semantic version.
 * Releases whose tag is not a semantic version are not part of the catalogue.
 */
public class ReleaseCatalogue {

    public static final class Entry {
        @NotNull
        private final SemanticVersion version;
        @NotNull
        private final Release release;

        private Entry(@NotNull SemanticVersion version, @NotNull Release release) {
            this.version = version;
            this.release = release;
        }

        @NotNull
        @Contract(pure = true)
        public Release getRelease() {
            return this.release;
        }

        @NotNull
        @Contract(pure = true)
        public SemanticVersion getVersion() {
            return this.version;
        }

        @Override
        public String toString() {
            return this.version.getOriginText();
        }
    }

    private static final Comparator<Entry> ENTRY_ORDER = Comparator.comparing(Entry::getVersion, SemanticVersion.PRECEDENCE_THEN_ORIGIN);

    @NotNull
    private final PluginId pluginId;
    @NotNull
    private final List<@NotNull Entry> entries;

    public ReleaseCatalogue(@NotNull PluginId pluginId, @NotNull List<@NotNull Release> releases) {
        this.pluginId = pluginId;
        List<Entry> entries = new ArrayList<>();
        for (Release release : releases) {
            SemanticVersion version = release.getVersion();
            if (version != null && !release.isDraft()) {
                entries.add(new Entry(version, release));
            }
        }
        entries.sort(ReleaseCatalogue.ENTRY_ORDER);
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * Obtains all entries whose version satisfies the constraint, lowest version first.
     *
     * @param constraint The constraint
     * @return The matching entries
     */
    @NotNull
    public List<@NotNull Entry> getMatching(@NotNull VersionConstraint constraint) {
        List<Entry> matching = new ArrayList<>();
        for (Entry entry : this.entries) {
            if (constraint.containsVersion(entry.version)) {
                matching.add(entry);
            }
        }
        return matching;
    }

    @NotNull
    @Contract(pure = true)
    public PluginId getPluginId() {
        return this.pluginId;
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    /**
     * Picks the entry which should be installed for a given constraint.
     *
     * <p>The {@link VersionConstraint#MINIMUM} sentinel always selects the lowest matching version and the
     * {@link VersionConstraint#LATEST} sentinel turns the {@link ResolutionStrategy#MINIMUM minimum} strategy into
     * the {@link ResolutionStrategy#LATEST latest} strategy. Otherwise the strategy decides:
     * the highest version, the lowest version, or the highest version that is not a prerelease
     * (falling back to the highest prerelease if there is no such version).
     *
     * <p>Ties between versions of equal precedence are broken through {@link SemanticVersion#PRECEDENCE_THEN_ORIGIN}.
     *
     * @param constraint The effective constraint
     * @param strategy The strategy
     * @return The selected entry, or null if no version satisfies the constraint
     */
    @Nullable
    public Entry select(@NotNull VersionConstraint constraint, @NotNull ResolutionStrategy strategy) {
        List<Entry> matching = this.getMatching(constraint);
        if (matching.isEmpty()) {
            return null;
        }
        if (constraint == VersionConstraint.MINIMUM) {
            strategy = ResolutionStrategy.MINIMUM;
        } else if (constraint == VersionConstraint.LATEST && strategy == ResolutionStrategy.MINIMUM) {
            strategy = ResolutionStrategy.LATEST;
        }

        switch (strategy) {
        case MINIMUM:
            return matching.get(0);
        case STABLE:
            for (int i = matching.size() - 1; i >= 0; i--) {
                if (!matching.get(i).release.isPrerelease()) {
                    return matching.get(i);
                }
            }
            return matching.get(matching.size() - 1);
        case LATEST:
        default:
            return matching.get(matching.size() - 1);
        }
    }

    @Override
    public String toString() {
        return "ReleaseCatalogue[" + this.pluginId + " " + this.entries + "]";
    }
}
