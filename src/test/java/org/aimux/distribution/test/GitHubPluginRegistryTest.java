package org.aimux.distribution.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import org.aimux.distribution.PluginDependency;
import org.aimux.distribution.PluginId;
import org.aimux.distribution.PluginPackage;
import org.aimux.distribution.registry.GitHubPluginRegistry;
import org.aimux.distribution.registry.RateLimitedException;
import org.aimux.distribution.registry.Release;
import org.aimux.distribution.registry.ReleaseAsset;
import org.aimux.distribution.registry.RepositoryInfo;
import org.aimux.distribution.transport.TransportException;
import org.junit.jupiter.api.Test;

public class GitHubPluginRegistryTest {

    private static final Executor DIRECT = Runnable::run;
    private static final String API = "https://api.test";
    private static final String SHA = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08";

    private static String releasesUrl(String owner, String name) {
        return GitHubPluginRegistryTest.API + "/repos/" + owner + "/" + name + "/releases?per_page=100";
    }

    private static String releaseJson(String tag, boolean draft, boolean prerelease, String publishedAt) {
        return "{\"tag_name\":\"" + tag + "\",\"name\":\"Release " + tag + "\",\"draft\":" + draft + ",\"prerelease\":" + prerelease
                + ",\"published_at\":\"" + publishedAt + "\",\"assets\":[]}";
    }

    private static GitHubPluginRegistry registry(FakeTransport transport) {
        return new GitHubPluginRegistry(transport).setApiBaseUrl(GitHubPluginRegistryTest.API + "/").setRetryBackoff(Duration.ZERO);
    }

    @Test
    public void testTrustedOrganizations() {
        FakeTransport transport = new FakeTransport();
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);

        assertTrue(registry.isPermitted(PluginId.parse("aimux-org/web-search")));
        assertTrue(registry.isPermitted(PluginId.parse("AIMUX/web-search")));
        assertFalse(registry.isPermitted(PluginId.parse("aimux-0rg/web-search")));
        assertFalse(registry.isPermitted(PluginId.parse("aimux-org-evil/web-search")));
        assertFalse(registry.isPermitted(PluginId.parse("random-user/web-search")));

        Optional<RepositoryInfo> info = registry.getPluginInfo(PluginId.parse("random-user/web-search"), GitHubPluginRegistryTest.DIRECT).join();
        assertFalse(info.isPresent());
        assertTrue(registry.getPluginReleases(PluginId.parse("aimux-0rg/web-search"), true, GitHubPluginRegistryTest.DIRECT).join().isEmpty());
        assertEquals(0L, registry.getRegistryStatistics().get("api_requests"));

        registry.blockPlugin(PluginId.parse("aimux/web-search"));
        assertFalse(registry.isPermitted(PluginId.parse("aimux/web-search")));
        assertEquals(1L, registry.getRegistryStatistics().get("blocked_plugins"));
    }

    @Test
    public void testRepositoryInfo() {
        FakeTransport transport = new FakeTransport();
        transport.addResponse(GitHubPluginRegistryTest.API + "/repos/aimux/web-search", 200,
                "{\"name\":\"web-search\",\"owner\":{\"login\":\"aimux\"},\"description\":\"Searches the web\",\"default_branch\":\"main\",\"archived\":false,\"stargazers_count\":12}");
        transport.addResponse(GitHubPluginRegistryTest.API + "/repos/aimux/moved", 200,
                "{\"name\":\"moved\",\"owner\":{\"login\":\"someone-else\"}}");
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);

        RepositoryInfo info = registry.getPluginInfo(PluginId.parse("aimux/web-search"), GitHubPluginRegistryTest.DIRECT).join().orElseThrow();
        assertEquals("Searches the web", info.getDescription());
        assertEquals("main", info.getDefaultBranch());
        assertEquals(12, info.getStars());
        assertEquals(PluginId.parse("aimux/web-search"), info.getPluginId());

        assertFalse(registry.getPluginInfo(PluginId.parse("aimux/moved"), GitHubPluginRegistryTest.DIRECT).join().isPresent());
        assertFalse(registry.getPluginInfo(PluginId.parse("aimux/missing"), GitHubPluginRegistryTest.DIRECT).join().isPresent());
    }

    @Test
    public void testReleasesAreFilteredAndSorted() {
        FakeTransport transport = new FakeTransport();
        transport.addResponse(GitHubPluginRegistryTest.releasesUrl("aimux", "web-search"), 200, "["
                + GitHubPluginRegistryTest.releaseJson("v1.0.0", false, false, "2024-01-01T00:00:00Z") + ","
                + GitHubPluginRegistryTest.releaseJson("v1.2.0", false, false, "2024-03-01T00:00:00Z") + ","
                + GitHubPluginRegistryTest.releaseJson("v1.3.0", true, false, "2024-04-01T00:00:00Z") + ","
                + GitHubPluginRegistryTest.releaseJson("v2.0.0-beta.1", false, true, "2024-05-01T00:00:00Z") + ","
                + GitHubPluginRegistryTest.releaseJson("v1.1.0", false, false, "2024-02-01T00:00:00Z") + "]");
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);
        PluginId pluginId = PluginId.parse("aimux/web-search");

        List<String> stable = registry.getPluginReleases(pluginId, false, GitHubPluginRegistryTest.DIRECT).join()
                .stream().map(Release::getTag).collect(Collectors.toList());
        assertEquals(List.of("v1.2.0", "v1.1.0", "v1.0.0"), stable);

        List<String> all = registry.getPluginReleases(pluginId, true, GitHubPluginRegistryTest.DIRECT).join()
                .stream().map(Release::getTag).collect(Collectors.toList());
        assertEquals(List.of("v2.0.0-beta.1", "v1.2.0", "v1.1.0", "v1.0.0"), all);

        // The second lookup is served from the cache
        assertEquals(1, transport.getFetches(GitHubPluginRegistryTest.releasesUrl("aimux", "web-search")));
        Map<String, Long> statistics = registry.getRegistryStatistics();
        assertEquals(1L, statistics.get("api_requests"));
        assertEquals(1L, statistics.get("cache_hits"));
        assertEquals(1L, statistics.get("cached_releases"));

        registry.refresh(pluginId);
        registry.getPluginReleases(pluginId, false, GitHubPluginRegistryTest.DIRECT).join();
        assertEquals(2, transport.getFetches(GitHubPluginRegistryTest.releasesUrl("aimux", "web-search")));
    }

    @Test
    public void testUnknownRepositoryHasNoReleases() {
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(new FakeTransport());
        assertTrue(registry.getPluginReleases(PluginId.parse("aimux/missing"), true, GitHubPluginRegistryTest.DIRECT).join().isEmpty());
    }

    @Test
    public void testServerErrorsPropagate() {
        FakeTransport transport = new FakeTransport();
        transport.addResponse(GitHubPluginRegistryTest.releasesUrl("aimux", "flaky"), 502, "Bad Gateway");
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);
        CompletionException e = assertThrows(CompletionException.class,
                () -> registry.getPluginReleases(PluginId.parse("aimux/flaky"), false, GitHubPluginRegistryTest.DIRECT).join());
        assertInstanceOf(TransportException.class, e.getCause());
        assertTrue(((TransportException) e.getCause()).isTransient());
        // Every retry was spent before giving up
        assertEquals(transport.getMaxRetries() + 1, transport.getFetches(GitHubPluginRegistryTest.releasesUrl("aimux", "flaky")));
    }

    @Test
    public void testTransientFailuresAreRetried() {
        FakeTransport transport = new FakeTransport();
        String url = GitHubPluginRegistryTest.releasesUrl("aimux", "web-search");
        transport.addResponse(url, 200, "[" + GitHubPluginRegistryTest.releaseJson("v1.0.0", false, false, "2024-01-01T00:00:00Z") + "]");
        transport.failNextFetch(url, 503);
        transport.failNextFetch(url, 502);
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);

        List<Release> releases = registry.getPluginReleases(PluginId.parse("aimux/web-search"), false, GitHubPluginRegistryTest.DIRECT).join();
        assertEquals(List.of("v1.0.0"), releases.stream().map(Release::getTag).collect(Collectors.toList()));
        assertEquals(3, transport.getFetches(url));
        assertEquals(3L, registry.getRegistryStatistics().get("api_requests"));

        // Client errors are final
        transport.failNextFetch(GitHubPluginRegistryTest.API + "/repos/aimux/calendar", 400);
        assertThrows(CompletionException.class, () -> registry.getPluginInfo(PluginId.parse("aimux/calendar"), GitHubPluginRegistryTest.DIRECT).join());
        assertEquals(1, transport.getFetches(GitHubPluginRegistryTest.API + "/repos/aimux/calendar"));
    }

    @Test
    public void testManifestFetchIsRetried() {
        FakeTransport transport = new FakeTransport();
        String base = "https://github.test/aimux/web-search/releases/download/v1.0.0/";
        String manifestUrl = base + GitHubPluginRegistry.MANIFEST_ASSET_NAME;
        transport.addFile(manifestUrl, "{\"name\":\"Web Search\"}".getBytes());
        transport.failNextFetch(manifestUrl, 500);
        Release release = new Release("v1.0.0", "", "", false, false, null, List.of(
                new ReleaseAsset("web-search.zip", base + "web-search.zip", 512, "application/zip", "sha256:" + GitHubPluginRegistryTest.SHA),
                new ReleaseAsset(GitHubPluginRegistry.MANIFEST_ASSET_NAME, manifestUrl, 20, "application/json", null)));
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);

        PluginPackage pluginPackage = registry.getPluginPackage(PluginId.parse("aimux/web-search"), release, GitHubPluginRegistryTest.DIRECT).join();
        assertEquals("Web Search", pluginPackage.getName());
        assertEquals(2, transport.getFetches(manifestUrl));
        // Manifests are not API requests
        assertEquals(0L, registry.getRegistryStatistics().get("api_requests"));
    }

    @Test
    public void testPackageCacheIsBounded() {
        FakeTransport transport = new FakeTransport();
        String base = "https://github.test/aimux/web-search/releases/download/";
        Release[] releases = new Release[2];
        for (int i = 0; i < releases.length; i++) {
            String tag = "v1." + i + ".0";
            String manifestUrl = base + tag + "/" + GitHubPluginRegistry.MANIFEST_ASSET_NAME;
            transport.addFile(manifestUrl, "{}".getBytes());
            releases[i] = new Release(tag, "", "", false, false, null, List.of(
                    new ReleaseAsset("web-search.zip", base + tag + "/web-search.zip", 512, "application/zip", "sha256:" + GitHubPluginRegistryTest.SHA),
                    new ReleaseAsset(GitHubPluginRegistry.MANIFEST_ASSET_NAME, manifestUrl, 2, "application/json", null)));
        }
        PluginId pluginId = PluginId.parse("aimux/web-search");
        String firstManifest = base + "v1.0.0/" + GitHubPluginRegistry.MANIFEST_ASSET_NAME;
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport).setMaxCacheEntries(1);

        registry.getPluginPackage(pluginId, releases[0], GitHubPluginRegistryTest.DIRECT).join();
        registry.getPluginPackage(pluginId, releases[0], GitHubPluginRegistryTest.DIRECT).join();
        assertEquals(1, transport.getFetches(firstManifest));

        // Caching the second package evicts the first one
        registry.getPluginPackage(pluginId, releases[1], GitHubPluginRegistryTest.DIRECT).join();
        assertEquals(1L, registry.getRegistryStatistics().get("cached_packages"));
        registry.getPluginPackage(pluginId, releases[0], GitHubPluginRegistryTest.DIRECT).join();
        assertEquals(2, transport.getFetches(firstManifest));

        registry.refresh(pluginId);
        assertEquals(0L, registry.getRegistryStatistics().get("cached_packages"));

        registry.setCacheTtl(Duration.ZERO);
        registry.getPluginPackage(pluginId, releases[0], GitHubPluginRegistryTest.DIRECT).join();
        registry.getPluginPackage(pluginId, releases[0], GitHubPluginRegistryTest.DIRECT).join();
        assertEquals(4, transport.getFetches(firstManifest));
    }

    @Test
    public void testRateLimit() {
        FakeTransport transport = new FakeTransport();
        long reset = Instant.now().plusSeconds(3600).getEpochSecond();
        transport.addResponse(GitHubPluginRegistryTest.releasesUrl("aimux", "web-search"), 403, "{\"message\":\"API rate limit exceeded\"}",
                Map.of("X-RateLimit-Remaining", "0", "X-RateLimit-Reset", Long.toString(reset)));
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);

        CompletionException e = assertThrows(CompletionException.class,
                () -> registry.getPluginReleases(PluginId.parse("aimux/web-search"), false, GitHubPluginRegistryTest.DIRECT).join());
        RateLimitedException rateLimited = assertInstanceOf(RateLimitedException.class, e.getCause());
        assertEquals(Instant.ofEpochSecond(reset), rateLimited.getResetTime());
        assertTrue(rateLimited.isTransient());
        assertTrue(registry.isRateLimited());
        assertEquals(0, registry.getRemainingRequests());

        // Further requests are refused without reaching the API
        e = assertThrows(CompletionException.class,
                () -> registry.getPluginInfo(PluginId.parse("aimux/other"), GitHubPluginRegistryTest.DIRECT).join());
        assertInstanceOf(RateLimitedException.class, e.getCause());
        assertEquals(0, transport.getFetches(GitHubPluginRegistryTest.API + "/repos/aimux/other"));
    }

    @Test
    public void testTooManyRequests() {
        FakeTransport transport = new FakeTransport();
        transport.addResponse(GitHubPluginRegistryTest.API + "/repos/aimux/web-search", 429, "");
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);
        CompletionException e = assertThrows(CompletionException.class,
                () -> registry.getPluginInfo(PluginId.parse("aimux/web-search"), GitHubPluginRegistryTest.DIRECT).join());
        assertInstanceOf(RateLimitedException.class, e.getCause());
        assertFalse(registry.isRateLimited());
    }

    @Test
    public void testPackageFromDigestAndManifest() {
        FakeTransport transport = new FakeTransport();
        String base = "https://github.test/aimux/web-search/releases/download/v1.2.0/";
        transport.addFile(base + GitHubPluginRegistry.MANIFEST_ASSET_NAME, ("{\"name\":\"Web Search\",\"description\":\"Searches the web\","
                + "\"dependencies\":[{\"plugin_id\":\"aimux/http\",\"version_constraint\":\"^1.0.0\"}],\"conflicts_with\":[\"aimux/old-search\"],\"unknown\":1}").getBytes());
        Release release = new Release("v1.2.0", "Release v1.2.0", "", false, false, null, List.of(
                new ReleaseAsset("notes.txt", base + "notes.txt", 10, "text/plain", null),
                new ReleaseAsset("web-search-1.2.0.zip", base + "web-search-1.2.0.zip", 2048, "application/zip", "sha256:" + GitHubPluginRegistryTest.SHA.toUpperCase()),
                new ReleaseAsset(GitHubPluginRegistry.MANIFEST_ASSET_NAME, base + GitHubPluginRegistry.MANIFEST_ASSET_NAME, 100, "application/json", null)));
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);

        PluginPackage pluginPackage = registry.getPluginPackage(PluginId.parse("aimux/web-search"), release, GitHubPluginRegistryTest.DIRECT).join();
        assertEquals("aimux/web-search", pluginPackage.getId());
        assertEquals("1.2.0", pluginPackage.getVersion());
        assertEquals("Web Search", pluginPackage.getName());
        assertEquals(base + "web-search-1.2.0.zip", pluginPackage.getDownloadUrl());
        assertEquals(GitHubPluginRegistryTest.SHA, pluginPackage.getChecksum());
        assertEquals(2048L, pluginPackage.getFileSize());
        assertEquals(List.of(new PluginDependency("aimux/http", "^1.0.0")), pluginPackage.getDependencies());
        assertEquals(List.of("aimux/old-search"), pluginPackage.getConflictsWith());
        assertTrue(pluginPackage.isValid());
    }

    @Test
    public void testChecksumSibling() {
        FakeTransport transport = new FakeTransport();
        String base = "https://github.test/aimux/web-search/releases/download/v1.0.0/";
        transport.addFile(base + "web-search.zip.sha256", (GitHubPluginRegistryTest.SHA + "  web-search.zip\n").getBytes());
        Release release = new Release("v1.0.0", "", "", false, false, null, List.of(
                new ReleaseAsset("web-search.zip", base + "web-search.zip", 512, "application/zip", null),
                new ReleaseAsset("web-search.zip.sha256", base + "web-search.zip.sha256", 80, "text/plain", null)));
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);

        PluginPackage pluginPackage = registry.getPluginPackage(PluginId.parse("aimux/web-search"), release, GitHubPluginRegistryTest.DIRECT).join();
        assertEquals(GitHubPluginRegistryTest.SHA, pluginPackage.getChecksum());
        assertEquals("web-search", pluginPackage.getName());
        assertTrue(pluginPackage.getDependencies().isEmpty());
    }

    @Test
    public void testReleaseWithoutArtifactIsInvalid() {
        Release release = new Release("v1.0.0", "Docs only", "", false, false, null, List.of());
        PluginPackage pluginPackage = GitHubPluginRegistryTest.registry(new FakeTransport())
                .getPluginPackage(PluginId.parse("aimux/docs"), release, GitHubPluginRegistryTest.DIRECT).join();
        assertFalse(pluginPackage.isValid());
    }

    @Test
    public void testSearch() {
        FakeTransport transport = new FakeTransport();
        transport.addResponse(GitHubPluginRegistryTest.API + "/orgs/aimux/repos?per_page=100", 200, "["
                + "{\"name\":\"web-search\",\"owner\":{\"login\":\"aimux\"},\"description\":\"Searches the web\"},"
                + "{\"name\":\"calendar\",\"owner\":{\"login\":\"aimux\"},\"description\":\"Calendar SEARCH integration\"},"
                + "{\"name\":\"legacy-search\",\"owner\":{\"login\":\"aimux\"},\"description\":\"\",\"archived\":true},"
                + "{\"name\":\"notes\",\"owner\":{\"login\":\"aimux\"},\"description\":\"Notes\"}]");
        transport.addResponse(GitHubPluginRegistryTest.API + "/orgs/aimux-plugins/repos?per_page=100", 200, "["
                + "{\"name\":\"code-search\",\"owner\":{\"login\":\"aimux-plugins\"},\"description\":null}]");
        GitHubPluginRegistry registry = GitHubPluginRegistryTest.registry(transport);

        List<PluginId> matches = registry.searchPlugins("Search", GitHubPluginRegistryTest.DIRECT).join()
                .stream().map(RepositoryInfo::getPluginId).collect(Collectors.toList());
        assertEquals(List.of(PluginId.parse("aimux/calendar"), PluginId.parse("aimux/web-search"), PluginId.parse("aimux-plugins/code-search")), matches);

        registry.blockPlugin(PluginId.parse("aimux/calendar"));
        assertEquals(3, registry.discoverPlugins(GitHubPluginRegistryTest.DIRECT).join().size());
    }
}
