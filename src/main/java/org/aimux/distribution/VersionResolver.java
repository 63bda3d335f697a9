package org.aimux.distribution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

import org.aimux.distribution.ResolutionConflict.Requirement;
import org.aimux.distribution.internal.ConcurrencyUtil;
import org.aimux.distribution.internal.meta.ReleaseCatalogue;
import org.aimux.distribution.logging.LoggingAdapter;
import org.aimux.distribution.registry.PluginRegistry;
import org.aimux.distribution.registry.Release;
import org.aimux.distribution.version.SemanticVersion;
import org.aimux.distribution.version.VersionConstraint;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Computes one consistent version assignment for a set of plugin requests and the plugins which are already installed.
 *
 * <p>Resolution proceeds in rounds. Each round walks the dependency graph spanned by the versions selected in the
 * previous round, collects all constraints imposed on every reached plugin, intersects them and selects a version
 * for every plugin through the {@link ResolutionStrategy}. Resolution succeeds once a round selects exactly the same
 * versions as the round before it, as at that point every selected version satisfies every constraint imposed by the
 * other selected versions. Installed plugins are pinned to their installed version unless they are explicitly
 * scheduled for an upgrade.
 *
 * <p>Release catalogues and packages are fetched at most once per resolution call, no matter how many rounds or
 * dependency paths reach them. Nothing is cached across calls, so that the registry stays in charge of freshness.
 *
 * <p>Conflicts and cycles are reported through {@link ResolutionResult#getConflicts()}. The returned future only
 * completes exceptionally if the registry could not be queried (e.g. because the network is down).
 */
public class VersionResolver {

    private static final class ResolutionContext {
        @NotNull
        private final ConcurrentMap<PluginId, CompletableFuture<ReleaseCatalogue>> catalogues = new ConcurrentHashMap<>();
        @NotNull
        private final ConcurrentMap<String, CompletableFuture<PluginPackage>> packages = new ConcurrentHashMap<>();
        @NotNull
        private final List<@NotNull PluginRequest> requests;
        @NotNull
        private final Map<@NotNull PluginId, @NotNull SemanticVersion> installed;
        @NotNull
        private final Map<@NotNull PluginId, @NotNull PluginPackage> installedPackages;
        @NotNull
        private final Set<@NotNull PluginId> upgrade;
        @NotNull
        private final ResolutionStrategy strategy;
        @NotNull
        private final Executor executor;

        private ResolutionContext(@NotNull List<@NotNull PluginRequest> requests, @NotNull Map<@NotNull PluginId, @NotNull SemanticVersion> installed,
                @NotNull Map<@NotNull PluginId, @NotNull PluginPackage> installedPackages, @NotNull Set<@NotNull PluginId> upgrade,
                @NotNull ResolutionStrategy strategy, @NotNull Executor executor) {
            this.requests = requests;
            this.installed = installed;
            this.installedPackages = installedPackages;
            this.upgrade = upgrade;
            this.strategy = strategy;
            this.executor = executor;
        }
    }

    private static final class Selection {
        @NotNull
        private final ReleaseCatalogue.Entry entry;
        @NotNull
        private final PluginPackage pluginPackage;

        private Selection(@NotNull ReleaseCatalogue.Entry entry, @NotNull PluginPackage pluginPackage) {
            this.entry = entry;
            this.pluginPackage = pluginPackage;
        }
    }

    private static final class NodeRequirements {
        @NotNull
        private final List<@NotNull Requirement> requirements = new ArrayList<>();
        @Nullable
        private VersionConstraint constraint;
        private boolean optionalOnly = true;

        private void add(@NotNull String requester, @NotNull VersionConstraint constraint, boolean optional) {
            this.requirements.add(new Requirement(requester, constraint.toString()));
            this.constraint = this.constraint == null ? constraint : this.constraint.intersect(constraint);
            this.optionalOnly &= optional;
        }
    }

    public static final int DEFAULT_MAX_ROUNDS = 50;

    @NotNull
    private final PluginRegistry registry;
    private boolean allowPrereleases;
    private int maxRounds = VersionResolver.DEFAULT_MAX_ROUNDS;
    @NotNull
    private final AtomicLong totalResolutions = new AtomicLong();
    @NotNull
    private final AtomicLong successfulResolutions = new AtomicLong();
    @NotNull
    private final AtomicLong failedResolutions = new AtomicLong();
    @NotNull
    private final AtomicLong cacheHits = new AtomicLong();

    public VersionResolver(@NotNull PluginRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry may not be null");
    }

    @NotNull
    private CompletableFuture<ReleaseCatalogue> fetchCatalogue(@NotNull ResolutionContext ctx, @NotNull PluginId pluginId) {
        CompletableFuture<ReleaseCatalogue> cached = ctx.catalogues.get(pluginId);
        if (cached != null) {
            this.cacheHits.incrementAndGet();
            return cached;
        }
        boolean includePrereleases = this.allowPrereleases || ctx.strategy == ResolutionStrategy.STABLE;
        return ctx.catalogues.computeIfAbsent(pluginId, (id) -> {
            return this.registry.getPluginReleases(id, includePrereleases, ctx.executor).thenApply((releases) -> {
                List<Release> eligible = releases;
                if (!this.allowPrereleases && ctx.strategy != ResolutionStrategy.STABLE) {
                    eligible = new ArrayList<>();
                    for (Release release : releases) {
                        if (!release.isPrerelease()) {
                            eligible.add(release);
                        }
                    }
                }
                return new ReleaseCatalogue(id, eligible);
            });
        });
    }

    @NotNull
    private CompletableFuture<PluginPackage> fetchPackage(@NotNull ResolutionContext ctx, @NotNull PluginId pluginId, @NotNull Release release) {
        String key = pluginId + "@" + release.getTag();
        CompletableFuture<PluginPackage> cached = ctx.packages.get(key);
        if (cached != null) {
            this.cacheHits.incrementAndGet();
            return cached;
        }
        return ctx.packages.computeIfAbsent(key, (ignored) -> this.registry.getPluginPackage(pluginId, release, ctx.executor));
    }

    /**
     * Lists all versions of a plugin that satisfy a constraint and that are eligible under the prerelease policy of this resolver.
     *
     * @param pluginId The plugin
     * @param constraint The constraint
     * @param executor The executor to perform blocking work on
     * @return A future completing with the versions, lowest first
     */
    @NotNull
    public CompletableFuture<List<@NotNull SemanticVersion>> findCompatibleVersions(@NotNull PluginId pluginId, @NotNull VersionConstraint constraint, @NotNull Executor executor) {
        return this.registry.getPluginReleases(pluginId, this.allowPrereleases, executor).thenApply((releases) -> {
            List<SemanticVersion> versions = new ArrayList<>();
            for (ReleaseCatalogue.Entry entry : new ReleaseCatalogue(pluginId, releases).getMatching(constraint)) {
                versions.add(entry.getVersion());
            }
            return versions;
        });
    }

    @NotNull
    private ResolutionResult finish(@NotNull ResolutionResult result) {
        if (result.isSuccess()) {
            this.successfulResolutions.incrementAndGet();
        } else {
            this.failedResolutions.incrementAndGet();
            LoggingAdapter.getDefaultLogger().info(VersionResolver.class, "Resolution failed: {}", result.getConflicts());
        }
        return result;
    }

    @Contract(pure = true)
    public int getMaxRounds() {
        return this.maxRounds;
    }

    /**
     * Obtains statistics about the resolutions performed by this resolver.
     *
     * @return A map with the keys <code>total_resolutions</code>, <code>successful_resolutions</code>,
     * <code>failed_resolutions</code> and <code>cache_hits</code>
     */
    @NotNull
    public Map<String, Long> getResolutionStatistics() {
        Map<String, Long> statistics = new LinkedHashMap<>();
        statistics.put("total_resolutions", this.totalResolutions.get());
        statistics.put("successful_resolutions", this.successfulResolutions.get());
        statistics.put("failed_resolutions", this.failedResolutions.get());
        statistics.put("cache_hits", this.cacheHits.get());
        return statistics;
    }

    @Contract(pure = true)
    public boolean isAllowPrereleases() {
        return this.allowPrereleases;
    }

    @NotNull
    public CompletableFuture<ResolutionResult> resolve(@NotNull Collection<@NotNull PluginRequest> requests, @NotNull Map<@NotNull PluginId, @NotNull SemanticVersion> installed,
            @NotNull ResolutionStrategy strategy, @NotNull Executor executor) {
        return this.resolve(requests, installed, Collections.emptySet(), strategy, executor);
    }

    @NotNull
    public CompletableFuture<ResolutionResult> resolve(@NotNull Collection<@NotNull PluginRequest> requests, @NotNull Map<@NotNull PluginId, @NotNull SemanticVersion> installed,
            @NotNull Set<@NotNull PluginId> upgrade, @NotNull ResolutionStrategy strategy, @NotNull Executor executor) {
        return this.resolve(requests, installed, Collections.emptyMap(), upgrade, strategy, executor);
    }

    /**
     * Resolves a set of requests against the installed plugins.
     *
     * <p>The dependencies declared by installed plugins that are not part of the resolution themselves keep
     * constraining the plugins they depend on, so that replacing a plugin cannot break the plugins that need it.
     *
     * @param requests The plugins requested by the caller
     * @param installed The plugins which are currently installed, mapped to their installed version
     * @param installedPackages The package metadata of the installed plugins, used for the dependencies they declare
     * @param upgrade The installed plugins which may change their version
     * @param strategy The strategy to select versions with
     * @param executor The executor to perform blocking work on
     * @return A future completing with the result of the resolution
     */
    @NotNull
    public CompletableFuture<ResolutionResult> resolve(@NotNull Collection<@NotNull PluginRequest> requests, @NotNull Map<@NotNull PluginId, @NotNull SemanticVersion> installed,
            @NotNull Map<@NotNull PluginId, @NotNull PluginPackage> installedPackages, @NotNull Set<@NotNull PluginId> upgrade,
            @NotNull ResolutionStrategy strategy, @NotNull Executor executor) {
        List<PluginRequest> sortedRequests = new ArrayList<>(requests);
        sortedRequests.sort((a, b) -> a.pluginId().compareTo(b.pluginId()));
        ResolutionContext ctx = new ResolutionContext(sortedRequests, new TreeMap<>(installed), new TreeMap<>(installedPackages), new HashSet<>(upgrade), strategy, executor);
        this.totalResolutions.incrementAndGet();
        return this.resolveRound(ctx, Collections.emptyMap(), 1).thenApply(this::finish);
    }

    @NotNull
    private CompletableFuture<ResolutionResult> resolveRound(@NotNull ResolutionContext ctx, @NotNull Map<PluginId, Selection> previous, int round) {
        if (round > this.maxRounds) {
            return CompletableFuture.completedFuture(ResolutionResult.failure(Collections.singletonList(ResolutionConflict.unresolvable(
                    "The selected versions did not settle within " + this.maxRounds + " rounds"))));
        }

        DependencyGraph graph = new DependencyGraph();
        Map<PluginId, NodeRequirements> nodes = new TreeMap<>();
        Deque<PluginId> queue = new ArrayDeque<>();
        for (PluginRequest request : ctx.requests) {
            graph.addNode(request.pluginId());
            nodes.computeIfAbsent(request.pluginId(), (id) -> new NodeRequirements()).add(Requirement.REQUESTER_CALLER, request.constraint(), false);
            if (!queue.contains(request.pluginId())) {
                queue.add(request.pluginId());
            }
        }

        Set<PluginId> visited = new HashSet<>(queue);
        while (!queue.isEmpty()) {
            PluginId declarer = queue.poll();
            Selection selection = previous.get(declarer);
            if (selection == null) {
                continue;
            }
            String requester = declarer + "@" + selection.entry.getVersion();
            for (PluginDependency dependency : selection.pluginPackage.getDependencies()) {
                PluginId target;
                VersionConstraint constraint;
                try {
                    target = dependency.target();
                    constraint = dependency.constraint();
                } catch (IllegalArgumentException e) {
                    return CompletableFuture.completedFuture(ResolutionResult.failure(Collections.singletonList(ResolutionConflict.unresolvable(
                            requester + " declares a malformed dependency on \"" + dependency.pluginId() + "\" (" + e.getMessage() + ")"))));
                }
                graph.addEdge(declarer, target, constraint, dependency.optional());
                nodes.computeIfAbsent(target, (id) -> new NodeRequirements()).add(requester, constraint, dependency.optional());
                if (visited.add(target)) {
                    queue.add(target);
                }
            }
        }

        List<PluginId> cycle = graph.findCycle();
        if (cycle != null) {
            return CompletableFuture.completedFuture(ResolutionResult.failure(Collections.singletonList(ResolutionConflict.circularDependency(cycle))));
        }

        for (Map.Entry<PluginId, NodeRequirements> node : nodes.entrySet()) {
            SemanticVersion pinned = ctx.installed.get(node.getKey());
            if (pinned != null && !ctx.upgrade.contains(node.getKey())) {
                // A pin alone does not make an optional dependency mandatory
                node.getValue().add(Requirement.REQUESTER_INSTALLED, VersionConstraint.exactly(pinned), true);
            }
        }

        for (Map.Entry<PluginId, PluginPackage> dependent : ctx.installedPackages.entrySet()) {
            if (nodes.containsKey(dependent.getKey()) || ctx.upgrade.contains(dependent.getKey())) {
                continue;
            }
            String requester = Requirement.REQUESTER_INSTALLED + "/" + dependent.getKey() + "@" + dependent.getValue().getVersion();
            for (PluginDependency dependency : dependent.getValue().getDependencies()) {
                PluginId target;
                VersionConstraint constraint;
                try {
                    target = dependency.target();
                    constraint = dependency.constraint();
                } catch (IllegalArgumentException e) {
                    LoggingAdapter.getDefaultLogger().warn(VersionResolver.class, "Installed plugin {} declares a malformed dependency on \"{}\"", dependent.getKey(), dependency.pluginId());
                    continue;
                }
                NodeRequirements requirements = nodes.get(target);
                if (requirements != null) {
                    // Installed dependents constrain a plugin but never pull it into the resolution
                    requirements.add(requester, constraint, true);
                }
            }
        }

        List<ResolutionConflict> conflicts = new ArrayList<>();
        Map<PluginId, VersionConstraint> effective = new TreeMap<>();
        for (Map.Entry<PluginId, NodeRequirements> node : nodes.entrySet()) {
            VersionConstraint constraint = Objects.requireNonNull(node.getValue().constraint);
            if (!constraint.isEmpty()) {
                effective.put(node.getKey(), constraint);
            } else if (node.getValue().optionalOnly) {
                LoggingAdapter.getDefaultLogger().debug(VersionResolver.class, "Skipping optional dependency {} as its constraints are disjoint", node.getKey());
            } else {
                conflicts.add(ResolutionConflict.versionConflict(node.getKey(), node.getValue().requirements));
            }
        }
        if (!conflicts.isEmpty()) {
            return CompletableFuture.completedFuture(ResolutionResult.failure(conflicts));
        }

        List<CompletableFuture<ReleaseCatalogue>> catalogueFutures = new ArrayList<>();
        for (PluginId pluginId : effective.keySet()) {
            catalogueFutures.add(this.fetchCatalogue(ctx, pluginId));
        }

        return ConcurrencyUtil.allOf(catalogueFutures).thenCompose((catalogues) -> {
            Map<PluginId, ReleaseCatalogue.Entry> chosen = new TreeMap<>();
            List<ResolutionConflict> selectionConflicts = new ArrayList<>();
            for (ReleaseCatalogue catalogue : catalogues) {
                PluginId pluginId = catalogue.getPluginId();
                NodeRequirements requirements = nodes.get(pluginId);
                if (catalogue.isEmpty()) {
                    if (requirements.optionalOnly) {
                        LoggingAdapter.getDefaultLogger().debug(VersionResolver.class, "Skipping missing optional dependency {}", pluginId);
                    } else {
                        selectionConflicts.add(ResolutionConflict.missingDependency(pluginId, requirements.requirements));
                    }
                    continue;
                }
                ReleaseCatalogue.Entry entry = catalogue.select(effective.get(pluginId), ctx.strategy);
                if (entry == null) {
                    if (requirements.optionalOnly) {
                        LoggingAdapter.getDefaultLogger().debug(VersionResolver.class, "Skipping optional dependency {} as no release satisfies {}", pluginId, effective.get(pluginId));
                    } else {
                        selectionConflicts.add(ResolutionConflict.insufficientVersion(pluginId, requirements.requirements));
                    }
                    continue;
                }
                chosen.put(pluginId, entry);
            }
            if (!selectionConflicts.isEmpty()) {
                return CompletableFuture.completedFuture(ResolutionResult.failure(selectionConflicts));
            }

            List<CompletableFuture<PluginPackage>> packageFutures = new ArrayList<>();
            for (Map.Entry<PluginId, ReleaseCatalogue.Entry> entry : chosen.entrySet()) {
                packageFutures.add(this.fetchPackage(ctx, entry.getKey(), entry.getValue().getRelease()));
            }
            return ConcurrencyUtil.allOf(packageFutures).thenCompose((packages) -> {
                Map<PluginId, Selection> selected = new TreeMap<>();
                int i = 0;
                for (Map.Entry<PluginId, ReleaseCatalogue.Entry> entry : chosen.entrySet()) {
                    selected.put(entry.getKey(), new Selection(entry.getValue(), packages.get(i++)));
                }

                if (!VersionResolver.isSameSelection(previous, selected)) {
                    LoggingAdapter.getDefaultLogger().debug(VersionResolver.class, "Round {} selected {} plugins, resolving again", round, selected.size());
                    return this.resolveRound(ctx, selected, round + 1);
                }

                List<ResolutionConflict> exclusions = VersionResolver.findExclusions(selected, ctx.installed);
                if (!exclusions.isEmpty()) {
                    return CompletableFuture.completedFuture(ResolutionResult.failure(exclusions));
                }

                Map<PluginId, PluginPackage> result = new TreeMap<>();
                for (Map.Entry<PluginId, Selection> entry : selected.entrySet()) {
                    graph.select(entry.getKey(), entry.getValue().entry.getVersion());
                    result.put(entry.getKey(), entry.getValue().pluginPackage);
                }
                List<PluginId> installOrder = new ArrayList<>();
                for (PluginId pluginId : graph.topologicalOrder()) {
                    if (selected.containsKey(pluginId)) {
                        installOrder.add(pluginId);
                    }
                }
                return CompletableFuture.completedFuture(ResolutionResult.success(result, installOrder));
            });
        });
    }

    @NotNull
    private static List<@NotNull ResolutionConflict> findExclusions(@NotNull Map<PluginId, Selection> selected, @NotNull Map<PluginId, SemanticVersion> installed) {
        List<ResolutionConflict> conflicts = new ArrayList<>();
        for (Map.Entry<PluginId, Selection> entry : selected.entrySet()) {
            for (String excludedId : entry.getValue().pluginPackage.getConflictsWith()) {
                PluginId excluded;
                try {
                    excluded = PluginId.parse(excludedId);
                } catch (IllegalArgumentException e) {
                    LoggingAdapter.getDefaultLogger().warn(VersionResolver.class, "{} declares a conflict with the malformed plugin identity \"{}\"", entry.getKey(), excludedId);
                    continue;
                }
                if (!excluded.equals(entry.getKey()) && (selected.containsKey(excluded) || installed.containsKey(excluded))) {
                    conflicts.add(ResolutionConflict.mutuallyExclusive(entry.getKey(), entry.getValue().entry.getVersion().toString(), excluded));
                }
            }
        }
        return conflicts;
    }

    private static boolean isSameSelection(@NotNull Map<PluginId, Selection> previous, @NotNull Map<PluginId, Selection> current) {
        if (!previous.keySet().equals(current.keySet())) {
            return false;
        }
        for (Map.Entry<PluginId, Selection> entry : current.entrySet()) {
            if (previous.get(entry.getKey()).entry.getRelease() != entry.getValue().entry.getRelease()) {
                return false;
            }
        }
        return true;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public VersionResolver setAllowPrereleases(boolean allowPrereleases) {
        this.allowPrereleases = allowPrereleases;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public VersionResolver setMaxRounds(int maxRounds) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be positive, got " + maxRounds);
        }
        this.maxRounds = maxRounds;
        return this;
    }
}
