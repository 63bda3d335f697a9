package org.aimux.distribution.install;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.aimux.distribution.PluginId;
import org.aimux.distribution.internal.FileTrees;
import org.aimux.distribution.logging.LoggingAdapter;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps copies of previously installed plugin versions so that failed or unwanted updates can be rolled back.
 *
 * <p>The backups of a plugin live in <code>&lt;backup directory&gt;/&lt;owner_name&gt;/</code>, each backup being
 * named <code>&lt;owner_name&gt;_&lt;epoch seconds&gt;</code>, followed by <code>_&lt;n&gt;</code> if more than one backup
 * was taken within the same second. Only the newest backups are retained.
 */
public class BackupStore {

    private static final class BackupName {
        private final long epochSecond;
        private final int counter;
        @NotNull
        private final Path path;

        private BackupName(long epochSecond, int counter, @NotNull Path path) {
            this.epochSecond = epochSecond;
            this.counter = counter;
            this.path = path;
        }
    }

    private static final Comparator<BackupName> NEWEST_FIRST = Comparator.<BackupName>comparingLong((name) -> name.epochSecond)
            .thenComparingInt((name) -> name.counter)
            .reversed();

    @NotNull
    private final Path backupDirectory;
    private final int maxBackups;

    public BackupStore(@NotNull Path backupDirectory, int maxBackups) {
        this.backupDirectory = backupDirectory;
        this.maxBackups = maxBackups;
    }

    /**
     * Copies the installation directory of a plugin into the backup store and prunes backups beyond the retention limit.
     *
     * @param pluginId The plugin
     * @param installation The installation directory of the plugin
     * @return The path of the backup, or null if there was nothing to back up or backups are disabled
     * @throws IOException If the backup could not be taken
     */
    @Nullable
    public Path backup(@NotNull PluginId pluginId, @NotNull Path installation) throws IOException {
        if (this.maxBackups <= 0 || !Files.isDirectory(installation)) {
            return null;
        }
        String directoryName = pluginId.toDirectoryName();
        Path pluginBackups = this.backupDirectory.resolve(directoryName);
        Files.createDirectories(pluginBackups);

        // Names must sort after every existing backup, even if several backups are taken within one second
        long epochSecond = Instant.now().getEpochSecond();
        int counter = 0;
        List<BackupName> existing = this.listBackupNames(pluginId);
        if (!existing.isEmpty() && existing.get(0).epochSecond >= epochSecond) {
            epochSecond = existing.get(0).epochSecond;
            counter = existing.get(0).counter + 1;
        }
        String baseName = directoryName + "_" + epochSecond;
        Path target = pluginBackups.resolve(counter == 0 ? baseName : baseName + "_" + counter);
        while (Files.exists(target)) {
            target = pluginBackups.resolve(baseName + "_" + ++counter);
        }

        Path partial = pluginBackups.resolve("." + target.getFileName() + ".part");
        FileTrees.delete(partial);
        FileTrees.copy(installation, partial);
        Files.move(partial, target);
        LoggingAdapter.getDefaultLogger().info(BackupStore.class, "Backed up {} to {}", pluginId, target);
        this.prune(pluginId);
        return target;
    }

    @NotNull
    public Path getBackupDirectory() {
        return this.backupDirectory;
    }

    /**
     * Obtains the newest backup of a plugin.
     *
     * @param pluginId The plugin
     * @return The newest backup, or null if the plugin has no backups
     * @throws IOException If the backup directory could not be listed
     */
    @Nullable
    public Path getLatestBackup(@NotNull PluginId pluginId) throws IOException {
        List<Path> backups = this.listBackups(pluginId);
        return backups.isEmpty() ? null : backups.get(0);
    }

    @Contract(pure = true)
    public int getMaxBackups() {
        return this.maxBackups;
    }

    /**
     * Lists the backups of a plugin, newest first.
     *
     * @param pluginId The plugin
     * @return The backups
     * @throws IOException If the backup directory could not be listed
     */
    @NotNull
    public List<@NotNull Path> listBackups(@NotNull PluginId pluginId) throws IOException {
        List<BackupName> names = this.listBackupNames(pluginId);
        List<Path> backups = new ArrayList<>(names.size());
        for (BackupName name : names) {
            backups.add(name.path);
        }
        return backups;
    }

    @NotNull
    private List<BackupName> listBackupNames(@NotNull PluginId pluginId) throws IOException {
        String directoryName = pluginId.toDirectoryName();
        Path pluginBackups = this.backupDirectory.resolve(directoryName);
        if (!Files.isDirectory(pluginBackups)) {
            return Collections.emptyList();
        }
        Pattern pattern = Pattern.compile("^" + Pattern.quote(directoryName) + "_(\\d+)(?:_(\\d+))?$");
        List<BackupName> names = new ArrayList<>();
        try (Stream<Path> stream = Files.list(pluginBackups)) {
            stream.forEach((path) -> {
                Matcher matcher = pattern.matcher(path.getFileName().toString());
                if (matcher.matches() && Files.isDirectory(path)) {
                    int counter = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
                    names.add(new BackupName(Long.parseLong(matcher.group(1)), counter, path));
                }
            });
        }
        names.sort(BackupStore.NEWEST_FIRST);
        return names;
    }

    /**
     * Deletes all backups of a plugin except the newest ones.
     *
     * @param pluginId The plugin
     * @throws IOException If a backup could not be deleted
     */
    public void prune(@NotNull PluginId pluginId) throws IOException {
        List<Path> backups = this.listBackups(pluginId);
        for (int i = this.maxBackups; i < backups.size(); i++) {
            LoggingAdapter.getDefaultLogger().debug(BackupStore.class, "Pruning old backup {}", backups.get(i));
            FileTrees.delete(backups.get(i));
        }
    }
}
