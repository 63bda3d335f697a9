package org.aimux.distribution.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import org.aimux.distribution.ResolutionStrategy;
import org.aimux.distribution.install.DistributionConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DistributionConfigTest {

    @TempDir
    Path root;

    @Test
    public void testDefaults() {
        DistributionConfig config = new DistributionConfig();
        assertTrue(config.isVerifyChecksums());
        assertFalse(config.isOfflineMode());
        assertFalse(config.isAllowPrereleases());
        assertTrue(config.isParallelDownloads());
        assertEquals(3, config.getMaxParallelDownloads());
        assertEquals(3, config.getMaxRetries());
        assertEquals(5, config.getMaxBackups());
        assertEquals(Duration.ofSeconds(300), config.getDownloadTimeout());
        assertEquals(Duration.ofHours(24), config.getCacheTtl());
        assertEquals(ResolutionStrategy.LATEST, config.getResolutionStrategy());
        assertEquals(config.getInstallationDirectory().resolve("plugins.lock.json"), config.getLockfile());
        assertEquals(config.getDownloadDirectory().resolve("cache"), config.getCacheDirectory());

        // The lockfile follows the installation directory unless set explicitly
        config.setInstallationDirectory(this.root.resolve("plugins"));
        assertEquals(this.root.resolve("plugins").resolve("plugins.lock.json"), config.getLockfile());
        config.setLockfile(this.root.resolve("custom.lock.json"));
        assertEquals(this.root.resolve("custom.lock.json"), config.getLockfile());
    }

    @Test
    public void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("download_directory", this.root.resolve("downloads").toString());
        properties.setProperty("installation_directory", this.root.resolve("plugins").toString());
        properties.setProperty("max_parallel_downloads", " 8 ");
        properties.setProperty("download_timeout", "60");
        properties.setProperty("retry_backoff_millis", "250");
        properties.setProperty("resolution_strategy", "Minimum");
        properties.setProperty("enable_offline_mode", "TRUE");
        properties.setProperty("allow_prerelease", "true");
        properties.setProperty("verify_checksums", "false");
        properties.setProperty("max_backups", "0");
        properties.setProperty("cache_ttl_hours", "1");
        properties.setProperty("some_unknown_key", "ignored");

        DistributionConfig config = DistributionConfig.fromProperties(properties);
        assertEquals(this.root.resolve("downloads"), config.getDownloadDirectory());
        assertEquals(this.root.resolve("downloads").resolve("cache"), config.getCacheDirectory());
        assertEquals(this.root.resolve("plugins").resolve("plugins.lock.json"), config.getLockfile());
        assertEquals(8, config.getMaxParallelDownloads());
        assertEquals(Duration.ofSeconds(60), config.getDownloadTimeout());
        assertEquals(Duration.ofMillis(250), config.getRetryBackoff());
        assertEquals(ResolutionStrategy.MINIMUM, config.getResolutionStrategy());
        assertTrue(config.isOfflineMode());
        assertTrue(config.isAllowPrereleases());
        assertFalse(config.isVerifyChecksums());
        assertEquals(0, config.getMaxBackups());
        assertEquals(Duration.ofHours(1), config.getCacheTtl());
    }

    @Test
    public void testHomeDirectoryExpansion() {
        Properties properties = new Properties();
        properties.setProperty("backup_directory", "~/aimux/backups");
        properties.setProperty("lockfile", "~");
        DistributionConfig config = DistributionConfig.fromProperties(properties);
        Path home = Paths.get(System.getProperty("user.home", "."));
        assertEquals(home.resolve("aimux").resolve("backups"), config.getBackupDirectory());
        assertEquals(home, config.getLockfile());
    }

    @Test
    public void testMalformedValues() {
        assertThrows(IllegalArgumentException.class, () -> DistributionConfig.fromProperties(DistributionConfigTest.single("enable_offline_mode", "yes")));
        assertThrows(IllegalArgumentException.class, () -> DistributionConfig.fromProperties(DistributionConfigTest.single("max_parallel_downloads", "many")));
        assertThrows(IllegalArgumentException.class, () -> DistributionConfig.fromProperties(DistributionConfigTest.single("max_parallel_downloads", "0")));
        assertThrows(IllegalArgumentException.class, () -> DistributionConfig.fromProperties(DistributionConfigTest.single("download_timeout", "0")));
        assertThrows(IllegalArgumentException.class, () -> DistributionConfig.fromProperties(DistributionConfigTest.single("max_retries", "-1")));
        assertThrows(IllegalArgumentException.class, () -> DistributionConfig.fromProperties(DistributionConfigTest.single("resolution_strategy", "newest")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> DistributionConfig.fromProperties(DistributionConfigTest.single("max_backups", "1.5")));
        assertTrue(e.getMessage().contains("max_backups"), e.getMessage());
    }

    @Test
    public void testLoad() throws IOException {
        Path file = this.root.resolve("distribution.properties");
        Files.write(file, ("# aimux plugin distribution\n"
                + "max_retries=7\n"
                + "resolution_strategy=stable\n"
                + "parallel_downloads=false\n").getBytes(StandardCharsets.UTF_8));

        DistributionConfig config = DistributionConfig.load(file);
        assertEquals(7, config.getMaxRetries());
        assertEquals(ResolutionStrategy.STABLE, config.getResolutionStrategy());
        assertFalse(config.isParallelDownloads());

        assertThrows(IOException.class, () -> DistributionConfig.load(this.root.resolve("missing.properties")));
    }

    @Test
    public void testTransportAndRegistry() {
        DistributionConfig config = new DistributionConfig().setMaxRetries(1);
        assertEquals(1, config.createTransport("aimux-test").getMaxRetries());
        assertFalse(config.createRegistry(config.createTransport("aimux-test")).isRateLimited());
    }

    private static Properties single(String key, String value) {
        Properties properties = new Properties();
        properties.setProperty(key, value);
        return properties;
    }
}
