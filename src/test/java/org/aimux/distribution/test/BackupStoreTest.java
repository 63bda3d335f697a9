package org.aimux.distribution.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.aimux.distribution.PluginId;
import org.aimux.distribution.install.BackupStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class BackupStoreTest {

    private static final PluginId WEB_SEARCH = PluginId.parse("aimux/web-search");

    @TempDir
    Path directory;

    private Path installation(String content) throws IOException {
        Path installation = this.directory.resolve("plugins").resolve("aimux_web-search");
        Files.createDirectories(installation.resolve("assets"));
        Files.write(installation.resolve("plugin.json"), content.getBytes(StandardCharsets.UTF_8));
        Files.write(installation.resolve("assets").resolve("icon.txt"), "icon".getBytes(StandardCharsets.UTF_8));
        return installation;
    }

    @Test
    public void testBackupsAreRetainedNewestFirst() throws IOException {
        BackupStore store = new BackupStore(this.directory.resolve("backups"), 2);
        assertNull(store.getLatestBackup(BackupStoreTest.WEB_SEARCH));

        for (int i = 1; i <= 4; i++) {
            Path backup = store.backup(BackupStoreTest.WEB_SEARCH, this.installation("version " + i));
            assertTrue(backup.getFileName().toString().startsWith("aimux_web-search_"), backup.toString());
        }

        List<Path> backups = store.listBackups(BackupStoreTest.WEB_SEARCH);
        assertEquals(2, backups.size());
        Path latest = store.getLatestBackup(BackupStoreTest.WEB_SEARCH);
        assertEquals(backups.get(0), latest);
        assertEquals("version 4", new String(Files.readAllBytes(latest.resolve("plugin.json")), StandardCharsets.UTF_8));
        assertEquals("version 3", new String(Files.readAllBytes(backups.get(1).resolve("plugin.json")), StandardCharsets.UTF_8));
        assertTrue(Files.isRegularFile(latest.resolve("assets").resolve("icon.txt")));
    }

    @Test
    public void testNothingToBackUp() throws IOException {
        BackupStore store = new BackupStore(this.directory.resolve("backups"), 5);
        assertNull(store.backup(BackupStoreTest.WEB_SEARCH, this.directory.resolve("plugins").resolve("missing")));
        assertTrue(store.listBackups(BackupStoreTest.WEB_SEARCH).isEmpty());
    }

    @Test
    public void testBackupsDisabled() throws IOException {
        BackupStore store = new BackupStore(this.directory.resolve("backups"), 0);
        assertNull(store.backup(BackupStoreTest.WEB_SEARCH, this.installation("version 1")));
        assertFalse(Files.exists(this.directory.resolve("backups")));
    }

    @Test
    public void testForeignFilesAreIgnored() throws IOException {
        BackupStore store = new BackupStore(this.directory.resolve("backups"), 5);
        store.backup(BackupStoreTest.WEB_SEARCH, this.installation("version 1"));
        Path pluginBackups = this.directory.resolve("backups").resolve("aimux_web-search");
        Files.createDirectories(pluginBackups.resolve("notes"));
        Files.createDirectories(pluginBackups.resolve(".aimux_web-search_1.part"));
        assertEquals(1, store.listBackups(BackupStoreTest.WEB_SEARCH).size());
    }
}
