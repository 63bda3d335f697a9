package org.aimux.distribution.registry;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

import org.aimux.distribution.PluginDependency;
import org.aimux.distribution.PluginId;
import org.aimux.distribution.PluginPackage;
import org.aimux.distribution.internal.ConcurrencyUtil;
import org.aimux.distribution.internal.FreshnessCache;
import org.aimux.distribution.logging.LoggingAdapter;
import org.aimux.distribution.transport.Transport;
import org.aimux.distribution.transport.TransportException;
import org.aimux.distribution.transport.TransportResponse;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A {@link PluginRegistry} backed by the GitHub REST API. Plugins are repositories, and the releases of
 * such a repository are the releases of the plugin.
 *
 * <p>Only repositories owned by a trusted organization are considered. Organizations are compared
 * case-insensitively, but otherwise exactly, so that lookalike organizations are not accepted.
 * Plugin identities must further obey the naming grammar of GitHub.
 *
 * <p>Requests that fail transiently are repeated up to {@link Transport#getMaxRetries()} times, waiting
 * a linearly growing {@link #setRetryBackoff(Duration) backoff} in between. Rate limiting is never repeated.
 */
public class GitHubPluginRegistry implements PluginRegistry {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final record Manifest(@JsonProperty("name") @Nullable String name,
            @JsonProperty("description") @Nullable String description,
            @JsonProperty("dependencies") @Nullable List<@NotNull PluginDependency> dependencies,
            @JsonProperty("conflicts_with") @Nullable List<@NotNull String> conflictsWith) {
    }

    @NotNull
    public static final String DEFAULT_API_BASE_URL = "https://api.github.com";
    @NotNull
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);
    @NotNull
    public static final String DEFAULT_USER_AGENT = "aimux/2.0.0";
    @NotNull
    public static final List<@NotNull String> DEFAULT_TRUSTED_ORGANIZATIONS = Collections.unmodifiableList(List.of("aimux-org", "aimux", "aimux-plugins", "awesome-aimux"));
    @NotNull
    public static final String MANIFEST_ASSET_NAME = "aimux-plugin.json";

    private static final Pattern OWNER_PATTERN = Pattern.compile("^[a-zA-Z0-9]([a-zA-Z0-9-]{0,38}[a-zA-Z0-9])?$");
    private static final Pattern REPOSITORY_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+$");
    private static final Pattern SHA256_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final String[] ARTIFACT_EXTENSIONS = {".zip", ".tar.gz", ".tgz", ".jar"};

    @NotNull
    private final Transport transport;
    @NotNull
    private final ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    @NotNull
    private final FreshnessCache<PluginId, Optional<RepositoryInfo>> repositoryCache = new FreshnessCache<>(Duration.ofHours(24), 1000);
    @NotNull
    private final FreshnessCache<PluginId, List<Release>> releaseCache = new FreshnessCache<>(Duration.ofHours(24), 1000);
    @NotNull
    private final FreshnessCache<String, PluginPackage> packageCache = new FreshnessCache<>(Duration.ofHours(24), 1000);
    @NotNull
    private final Set<String> trustedOrganizations = ConcurrentHashMap.newKeySet();
    @NotNull
    private final Set<PluginId> blockedPlugins = ConcurrentHashMap.newKeySet();
    @NotNull
    private final AtomicLong apiRequests = new AtomicLong();
    @NotNull
    private String apiBaseUrl = GitHubPluginRegistry.DEFAULT_API_BASE_URL;
    @NotNull
    private String userAgent = GitHubPluginRegistry.DEFAULT_USER_AGENT;
    @Nullable
    private String apiToken;
    @NotNull
    private volatile Duration retryBackoff = GitHubPluginRegistry.DEFAULT_RETRY_BACKOFF;
    private volatile int remainingRequests = -1;
    @Nullable
    private volatile Instant rateLimitReset;

    public GitHubPluginRegistry(@NotNull Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
        this.setTrustedOrganizations(GitHubPluginRegistry.DEFAULT_TRUSTED_ORGANIZATIONS);
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GitHubPluginRegistry addTrustedOrganization(@NotNull String organization) {
        this.trustedOrganizations.add(organization.toLowerCase(Locale.ROOT));
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GitHubPluginRegistry blockPlugin(@NotNull PluginId pluginId) {
        this.blockedPlugins.add(pluginId);
        this.refresh(pluginId);
        return this;
    }

    @Nullable
    private static ReleaseAsset chooseArtifact(@NotNull Release release) {
        for (String extension : GitHubPluginRegistry.ARTIFACT_EXTENSIONS) {
            for (ReleaseAsset asset : release.getAssets()) {
                if (asset.getName().toLowerCase(Locale.ROOT).endsWith(extension) && !asset.getDownloadUrl().isEmpty()) {
                    return asset;
                }
            }
        }
        return null;
    }

    @Override
    public void clearCache() {
        this.repositoryCache.clear();
        this.releaseCache.clear();
        this.packageCache.clear();
    }

    @NotNull
    private Map<String, String> createApiHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/vnd.github+json");
        headers.put("X-GitHub-Api-Version", "2022-11-28");
        headers.put("User-Agent", this.userAgent);
        String token = this.apiToken;
        if (token != null) {
            headers.put("Authorization", "Bearer " + token);
        }
        return headers;
    }

    /**
     * Discovers all plugins published by the trusted organizations.
     *
     * @param executor The executor to perform blocking work on
     * @return A future completing with the repositories of all discovered plugins
     */
    @NotNull
    public CompletableFuture<List<@NotNull RepositoryInfo>> discoverPlugins(@NotNull Executor executor) {
        return this.searchPlugins("", executor);
    }

    @NotNull
    private TransportResponse fetchApi(@NotNull String url) throws IOException {
        TransportResponse response = this.fetchWithRetries(url, this.createApiHeaders(), true);
        int status = response.getStatusCode();
        if (status == 429 || (status == 403 && this.remainingRequests == 0)) {
            LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Rate limit of the GitHub API exhausted while querying {}", url);
            throw new RateLimitedException(url, status, this.rateLimitReset);
        }
        return response;
    }

    /**
     * Performs a GET request, repeating it while it fails transiently. The response of the last attempt is
     * returned even if it is not successful, so that callers can interpret the status code.
     *
     * @param url The URL to query
     * @param headers The request headers
     * @param api Whether the request counts against the API rate limit
     * @return The response of the last attempt
     * @throws IOException If the last attempt failed, or if the API is rate limited
     */
    @NotNull
    private TransportResponse fetchWithRetries(@NotNull String url, @NotNull Map<String, String> headers, boolean api) throws IOException {
        int maxRetries = this.transport.getMaxRetries();
        int attempt = 0;
        while (true) {
            if (api && this.isRateLimited()) {
                throw new RateLimitedException(url, 429, this.rateLimitReset);
            }
            String failure;
            try {
                if (api) {
                    this.apiRequests.incrementAndGet();
                }
                TransportResponse response = this.transport.fetch(url, headers);
                if (api) {
                    this.trackRateLimit(response);
                }
                int status = response.getStatusCode();
                if (status == 429 || !TransportException.isTransientStatus(status) || attempt >= maxRetries) {
                    return response;
                }
                failure = "status " + status;
            } catch (IOException e) {
                if (!TransportException.isRetryable(e) || attempt >= maxRetries) {
                    throw e;
                }
                failure = String.valueOf(e.getMessage());
            }

            attempt++;
            long delay = this.retryBackoff.toMillis() * attempt;
            LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Attempt {} to query {} failed ({}), retrying in {} ms", attempt, url, failure, delay);
            if (delay > 0) {
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    InterruptedIOException interrupted = new InterruptedIOException("Interrupted while waiting to query " + url + " again");
                    interrupted.initCause(e);
                    throw interrupted;
                }
            }
        }
    }

    @NotNull
    private String fetchChecksumSibling(@NotNull Release release, @NotNull ReleaseAsset artifact) throws IOException {
        ReleaseAsset sibling = release.findAsset(artifact.getName() + ".sha256");
        if (sibling == null) {
            return "";
        }
        Map<String, String> headers = Collections.singletonMap("User-Agent", this.userAgent);
        TransportResponse response = this.fetchWithRetries(sibling.getDownloadUrl(), headers, false);
        if (!response.isSuccessful()) {
            if (TransportException.isTransientStatus(response.getStatusCode())) {
                throw new TransportException(sibling.getDownloadUrl(), response.getStatusCode(), null);
            }
            LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Unable to fetch checksum file {} (status {})", sibling.getName(), response.getStatusCode());
            return "";
        }
        // Format of sha256sum: "<hex>  <file name>"
        String body = response.getBody().trim();
        String hex = body.split("\\s+", 2)[0];
        if (!GitHubPluginRegistry.SHA256_PATTERN.matcher(hex).matches()) {
            LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Checksum file {} does not contain a SHA-256 digest", sibling.getName());
            return "";
        }
        return hex.toLowerCase(Locale.ROOT);
    }

    @NotNull
    private Manifest fetchManifest(@NotNull Release release) throws IOException {
        ReleaseAsset manifestAsset = release.findAsset(GitHubPluginRegistry.MANIFEST_ASSET_NAME);
        if (manifestAsset == null) {
            return new Manifest(null, null, null, null);
        }
        Map<String, String> headers = Collections.singletonMap("User-Agent", this.userAgent);
        TransportResponse response = this.fetchWithRetries(manifestAsset.getDownloadUrl(), headers, false);
        if (!response.isSuccessful()) {
            throw new TransportException(manifestAsset.getDownloadUrl(), response.getStatusCode(), "unable to fetch plugin manifest");
        }
        try {
            return this.mapper.readValue(response.getBody(), Manifest.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed plugin manifest in release " + release.getTag(), e);
        }
    }

    @NotNull
    @Contract(pure = true)
    public String getApiBaseUrl() {
        return this.apiBaseUrl;
    }

    @Override
    @NotNull
    public CompletableFuture<Optional<RepositoryInfo>> getPluginInfo(@NotNull PluginId pluginId, @NotNull Executor executor) {
        if (!this.isPermitted(pluginId)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        Optional<RepositoryInfo> cached = this.repositoryCache.get(pluginId);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return ConcurrencyUtil.schedule(() -> {
            String url = this.apiBaseUrl + "/repos/" + pluginId.owner() + "/" + pluginId.name();
            TransportResponse response = this.fetchApi(url);
            Optional<RepositoryInfo> info;
            if (response.getStatusCode() == 404) {
                info = Optional.empty();
            } else if (!response.isSuccessful()) {
                throw new TransportException(url, response.getStatusCode(), null);
            } else {
                RepositoryInfo repository = this.mapper.readValue(response.getBody(), RepositoryInfo.class);
                if (!repository.getOwner().equalsIgnoreCase(pluginId.owner()) || !repository.getName().equalsIgnoreCase(pluginId.name())) {
                    // Renamed or transferred repositories redirect to their new location, which needs to be trusted on its own
                    LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Repository {} resolved to {}/{}, rejecting it", pluginId, repository.getOwner(), repository.getName());
                    info = Optional.empty();
                } else {
                    info = Optional.of(repository);
                }
            }
            this.repositoryCache.put(pluginId, info);
            return info;
        }, executor);
    }

    @Override
    @NotNull
    public CompletableFuture<PluginPackage> getPluginPackage(@NotNull PluginId pluginId, @NotNull Release release, @NotNull Executor executor) {
        String key = pluginId + "@" + release.getTag();
        PluginPackage cached = this.packageCache.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return ConcurrencyUtil.schedule(() -> {
            ReleaseAsset artifact = GitHubPluginRegistry.chooseArtifact(release);
            Manifest manifest = this.fetchManifest(release);
            String checksum = "";
            if (artifact != null) {
                checksum = artifact.getChecksum();
                if (checksum.isEmpty()) {
                    checksum = this.fetchChecksumSibling(release, artifact);
                }
            } else {
                LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Release {} of {} does not carry an installable artifact", release.getTag(), pluginId);
            }
            String version = release.getVersion() == null ? release.getTag() : release.getVersion().toString();
            String name = manifest.name() == null || manifest.name().isEmpty() ? pluginId.name() : manifest.name();
            String description = manifest.description() == null || manifest.description().isEmpty() ? release.getName() : manifest.description();
            PluginPackage pluginPackage = new PluginPackage(pluginId.toString(), version, name, description,
                    artifact == null ? null : artifact.getDownloadUrl(), checksum,
                    artifact == null ? 0L : artifact.getSize(), artifact == null ? null : artifact.getContentType(),
                    manifest.dependencies(), manifest.conflictsWith());
            this.packageCache.put(key, pluginPackage);
            return pluginPackage;
        }, executor);
    }

    @Override
    @NotNull
    public CompletableFuture<List<@NotNull Release>> getPluginReleases(@NotNull PluginId pluginId, boolean includePrereleases, @NotNull Executor executor) {
        if (!this.isPermitted(pluginId)) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        List<Release> cached = this.releaseCache.get(pluginId);
        if (cached != null) {
            return CompletableFuture.completedFuture(GitHubPluginRegistry.filterReleases(cached, includePrereleases));
        }
        return ConcurrencyUtil.schedule(() -> {
            String url = this.apiBaseUrl + "/repos/" + pluginId.owner() + "/" + pluginId.name() + "/releases?per_page=100";
            TransportResponse response = this.fetchApi(url);
            List<Release> releases;
            if (response.getStatusCode() == 404) {
                releases = Collections.emptyList();
            } else if (!response.isSuccessful()) {
                throw new TransportException(url, response.getStatusCode(), null);
            } else {
                List<Release> fetched = this.mapper.readValue(response.getBody(), new TypeReference<List<Release>>() { });
                releases = new ArrayList<>();
                for (Release release : fetched) {
                    if (!release.isDraft()) {
                        releases.add(release);
                    }
                }
                releases.sort(Release.NEWEST_FIRST);
                releases = Collections.unmodifiableList(releases);
            }
            this.releaseCache.put(pluginId, releases);
            LoggingAdapter.getDefaultLogger().debug(GitHubPluginRegistry.class, "Fetched {} releases of {}", releases.size(), pluginId);
            return GitHubPluginRegistry.filterReleases(releases, includePrereleases);
        }, executor);
    }

    @NotNull
    private static List<@NotNull Release> filterReleases(@NotNull List<@NotNull Release> releases, boolean includePrereleases) {
        if (includePrereleases) {
            return releases;
        }
        List<Release> stable = new ArrayList<>();
        for (Release release : releases) {
            if (!release.isPrerelease()) {
                stable.add(release);
            }
        }
        return Collections.unmodifiableList(stable);
    }

    /**
     * Obtains statistics about the usage of this registry.
     *
     * @return A map with the keys <code>cached_repositories</code>, <code>cached_releases</code>, <code>cached_packages</code>,
     * <code>trusted_organizations</code>, <code>blocked_plugins</code>, <code>cache_hits</code> and <code>api_requests</code>
     */
    @NotNull
    public Map<String, Long> getRegistryStatistics() {
        Map<String, Long> statistics = new LinkedHashMap<>();
        statistics.put("cached_repositories", (long) this.repositoryCache.size());
        statistics.put("cached_releases", (long) this.releaseCache.size());
        statistics.put("cached_packages", (long) this.packageCache.size());
        statistics.put("trusted_organizations", (long) this.trustedOrganizations.size());
        statistics.put("blocked_plugins", (long) this.blockedPlugins.size());
        statistics.put("cache_hits", this.repositoryCache.getHits() + this.releaseCache.getHits() + this.packageCache.getHits());
        statistics.put("api_requests", this.apiRequests.get());
        return statistics;
    }

    /**
     * Obtains the amount of API requests that may still be issued before the rate limit kicks in.
     *
     * @return The amount of remaining requests, or -1 if the API did not report it yet
     */
    @Contract(pure = true)
    public int getRemainingRequests() {
        return this.remainingRequests;
    }

    @NotNull
    public Set<@NotNull String> getTrustedOrganizations() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(this.trustedOrganizations));
    }

    /**
     * Checks whether a plugin may be looked up at all. This is the case if the owner and the name obey
     * GitHub's naming rules, the owner is a trusted organization and the plugin was not blocked.
     *
     * @param pluginId The plugin to check
     * @return True if the plugin is permitted
     */
    public boolean isPermitted(@NotNull PluginId pluginId) {
        if (!GitHubPluginRegistry.isValidIdentity(pluginId)) {
            LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Rejecting malformed plugin identity {}", pluginId);
            return false;
        } else if (!this.isTrustedOrganization(pluginId.owner())) {
            LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Rejecting plugin {} as {} is not a trusted organization", pluginId, pluginId.owner());
            return false;
        } else if (this.blockedPlugins.contains(pluginId)) {
            LoggingAdapter.getDefaultLogger().warn(GitHubPluginRegistry.class, "Rejecting blocked plugin {}", pluginId);
            return false;
        }
        return true;
    }

    public boolean isRateLimited() {
        if (this.remainingRequests != 0) {
            return false;
        }
        Instant reset = this.rateLimitReset;
        return reset != null && reset.isAfter(Instant.now());
    }

    public boolean isTrustedOrganization(@NotNull String organization) {
        return this.trustedOrganizations.contains(organization.toLowerCase(Locale.ROOT));
    }

    /**
     * Checks whether the identity of a plugin obeys the naming rules of GitHub owners and repositories.
     *
     * @param pluginId The identity
     * @return True if the identity is well-formed
     */
    public static boolean isValidIdentity(@NotNull PluginId pluginId) {
        String name = pluginId.name();
        return GitHubPluginRegistry.OWNER_PATTERN.matcher(pluginId.owner()).matches()
                && GitHubPluginRegistry.REPOSITORY_PATTERN.matcher(name).matches()
                && !name.equals(".") && !name.equals("..");
    }

    /**
     * Invalidates all cached metadata of a single plugin.
     *
     * @param pluginId The plugin
     */
    public void refresh(@NotNull PluginId pluginId) {
        this.repositoryCache.invalidate(pluginId);
        this.releaseCache.invalidate(pluginId);
        String prefix = pluginId + "@";
        this.packageCache.invalidateIf((key) -> key.startsWith(prefix));
    }

    /**
     * Searches the repositories of all trusted organizations for plugins whose name or description contains
     * the query, ignoring case. Blocked plugins and archived repositories are excluded.
     *
     * @param query The text to search for, where the empty string matches all plugins
     * @param executor The executor to perform blocking work on
     * @return A future completing with the matching repositories, ordered by plugin identity
     */
    @NotNull
    public CompletableFuture<List<@NotNull RepositoryInfo>> searchPlugins(@NotNull String query, @NotNull Executor executor) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<String> organizations = new ArrayList<>(this.trustedOrganizations);
        Collections.sort(organizations);
        return ConcurrencyUtil.schedule(() -> {
            List<RepositoryInfo> matches = new ArrayList<>();
            for (String organization : organizations) {
                String url = this.apiBaseUrl + "/orgs/" + organization + "/repos?per_page=100";
                TransportResponse response = this.fetchApi(url);
                if (response.getStatusCode() == 404) {
                    continue;
                } else if (!response.isSuccessful()) {
                    throw new TransportException(url, response.getStatusCode(), null);
                }
                for (RepositoryInfo repository : this.mapper.readValue(response.getBody(), new TypeReference<List<RepositoryInfo>>() { })) {
                    if (repository.isArchived() || repository.getOwner().isEmpty() || repository.getName().isEmpty()) {
                        continue;
                    }
                    PluginId pluginId = repository.getPluginId();
                    if (!this.isTrustedOrganization(pluginId.owner()) || this.blockedPlugins.contains(pluginId)) {
                        continue;
                    }
                    if (repository.getName().toLowerCase(Locale.ROOT).contains(needle)
                            || repository.getDescription().toLowerCase(Locale.ROOT).contains(needle)) {
                        matches.add(repository);
                    }
                }
            }
            matches.sort((a, b) -> a.getPluginId().compareTo(b.getPluginId()));
            return matches;
        }, executor);
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public GitHubPluginRegistry setApiBaseUrl(@NotNull String apiBaseUrl) {
        String url = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl may not be null");
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        this.apiBaseUrl = url;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GitHubPluginRegistry setApiToken(@Nullable String apiToken) {
        this.apiToken = apiToken == null || apiToken.isEmpty() ? null : apiToken;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GitHubPluginRegistry setBlockedPlugins(@NotNull Collection<@NotNull PluginId> blockedPlugins) {
        this.blockedPlugins.clear();
        for (PluginId pluginId : blockedPlugins) {
            this.blockPlugin(pluginId);
        }
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public GitHubPluginRegistry setCacheTtl(@NotNull Duration ttl) {
        this.repositoryCache.setUpdateInterval(ttl);
        this.releaseCache.setUpdateInterval(ttl);
        this.packageCache.setUpdateInterval(ttl);
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GitHubPluginRegistry setMaxCacheEntries(int maxEntries) {
        this.repositoryCache.setMaxEntries(maxEntries);
        this.releaseCache.setMaxEntries(maxEntries);
        this.packageCache.setMaxEntries(maxEntries);
        return this;
    }

    /**
     * Sets the delay before the first repetition of a request that failed transiently.
     * Every further repetition waits the delay once more than the previous one.
     *
     * @param retryBackoff The delay
     * @return This instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public GitHubPluginRegistry setRetryBackoff(@NotNull Duration retryBackoff) {
        Objects.requireNonNull(retryBackoff, "retryBackoff may not be null");
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("The retry backoff may not be negative");
        }
        this.retryBackoff = retryBackoff;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public GitHubPluginRegistry setTrustedOrganizations(@NotNull Collection<@NotNull String> organizations) {
        this.trustedOrganizations.clear();
        for (String organization : organizations) {
            this.addTrustedOrganization(organization);
        }
        this.clearCache();
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    public GitHubPluginRegistry setUserAgent(@NotNull String userAgent) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent may not be null");
        return this;
    }

    private void trackRateLimit(@NotNull TransportResponse response) {
        String remaining = response.getHeader("X-RateLimit-Remaining");
        if (remaining != null) {
            try {
                this.remainingRequests = Integer.parseInt(remaining.trim());
            } catch (NumberFormatException e) {
                LoggingAdapter.getDefaultLogger().debug(GitHubPluginRegistry.class, "Ignoring malformed X-RateLimit-Remaining header \"{}\"", remaining);
            }
        }
        String reset = response.getHeader("X-RateLimit-Reset");
        if (reset != null) {
            try {
                this.rateLimitReset = Instant.ofEpochSecond(Long.parseLong(reset.trim()));
            } catch (NumberFormatException e) {
                LoggingAdapter.getDefaultLogger().debug(GitHubPluginRegistry.class, "Ignoring malformed X-RateLimit-Reset header \"{}\"", reset);
            }
        }
    }
}
