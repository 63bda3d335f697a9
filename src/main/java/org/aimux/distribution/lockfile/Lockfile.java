package org.aimux.distribution.lockfile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.aimux.distribution.PluginId;
import org.aimux.distribution.PluginPackage;
import org.aimux.distribution.internal.AtomicFiles;
import org.aimux.distribution.internal.Checksums;
import org.aimux.distribution.logging.LoggingAdapter;
import org.aimux.distribution.version.SemanticVersion;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The lockfile records which version of which plugin was installed, so that future resolutions can treat
 * them as already installed and so that installations can be reproduced.
 *
 * <p>The file is a JSON document of the form <code>{"version":1,"entries":[...]}</code> and is only ever replaced
 * atomically. Instances are safe for use by multiple threads.
 */
public class Lockfile {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final record Document(@JsonProperty("version") int version,
            @JsonProperty("entries") List<@NotNull LockfileEntry> entries) {
    }

    public static final int FORMAT_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @NotNull
    private final Map<PluginId, LockfileEntry> entries = new TreeMap<>();

    /**
     * Reads a lockfile. A file that does not exist is read as an empty lockfile.
     *
     * @param file The lockfile
     * @return The lockfile
     * @throws IOException If the file could not be read, is malformed or is of an unsupported format version
     */
    @NotNull
    public static Lockfile read(@NotNull Path file) throws IOException {
        Lockfile lockfile = new Lockfile();
        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return lockfile;
        }
        Document document = Lockfile.MAPPER.readValue(data, Document.class);
        if (document.version() != Lockfile.FORMAT_VERSION) {
            throw new IOException("Unsupported lockfile version " + document.version() + " in " + file);
        }
        if (document.entries() != null) {
            for (LockfileEntry entry : document.entries()) {
                try {
                    lockfile.entries.put(entry.target(), entry);
                } catch (IllegalArgumentException e) {
                    throw new IOException("Malformed lockfile entry " + entry + " in " + file, e);
                }
            }
        }
        return lockfile;
    }

    @Nullable
    public synchronized LockfileEntry get(@NotNull PluginId pluginId) {
        return this.entries.get(pluginId);
    }

    /**
     * Obtains all entries, ordered by plugin identity.
     *
     * @return The entries
     */
    @NotNull
    public synchronized List<@NotNull LockfileEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(this.entries.values()));
    }

    public synchronized void put(@NotNull LockfileEntry entry) {
        this.entries.put(entry.target(), entry);
    }

    public synchronized boolean remove(@NotNull PluginId pluginId) {
        return this.entries.remove(pluginId) != null;
    }

    /**
     * Obtains the locked version of every plugin, for use as the installed set of a resolution.
     *
     * @return The locked versions
     */
    @NotNull
    public synchronized Map<@NotNull PluginId, @NotNull SemanticVersion> toInstalledConstraints() {
        Map<PluginId, SemanticVersion> installed = new TreeMap<>();
        for (Map.Entry<PluginId, LockfileEntry> entry : this.entries.entrySet()) {
            SemanticVersion version = SemanticVersion.tryParse(entry.getValue().resolvedVersion());
            if (version == null) {
                LoggingAdapter.getDefaultLogger().warn(Lockfile.class, "Ignoring lockfile entry of {} with malformed version {}", entry.getKey(), entry.getValue().resolvedVersion());
                continue;
            }
            installed.put(entry.getKey(), version);
        }
        return installed;
    }

    /**
     * Compares the lockfile with the plugins that are actually installed.
     *
     * @param installed The installed plugins
     * @return A description of every discrepancy, empty if the lockfile matches the installation
     */
    @NotNull
    public synchronized List<@NotNull String> verifyConsistency(@NotNull Map<@NotNull PluginId, @NotNull PluginPackage> installed) {
        List<String> discrepancies = new ArrayList<>();
        for (Map.Entry<PluginId, LockfileEntry> entry : this.entries.entrySet()) {
            PluginPackage installedPackage = installed.get(entry.getKey());
            LockfileEntry locked = entry.getValue();
            if (installedPackage == null) {
                discrepancies.add(entry.getKey() + " is locked at " + locked.resolvedVersion() + " but not installed");
            } else if (!installedPackage.getVersion().equals(locked.resolvedVersion())) {
                discrepancies.add(entry.getKey() + " is locked at " + locked.resolvedVersion() + " but installed at " + installedPackage.getVersion());
            } else if (!locked.checksum().isEmpty() && !Checksums.matches(locked.checksum(), installedPackage.getChecksum())) {
                discrepancies.add(entry.getKey() + " is installed with checksum " + installedPackage.getChecksum() + " but locked with checksum " + locked.checksum());
            }
        }
        for (Map.Entry<PluginId, PluginPackage> entry : installed.entrySet()) {
            if (!this.entries.containsKey(entry.getKey())) {
                discrepancies.add(entry.getKey() + " is installed at " + entry.getValue().getVersion() + " but not locked");
            }
        }
        return discrepancies;
    }

    /**
     * Atomically replaces the given file with the contents of this lockfile.
     *
     * @param file The lockfile
     * @throws IOException If the file could not be written
     */
    public void write(@NotNull Path file) throws IOException {
        byte[] data;
        synchronized (this) {
            data = Lockfile.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(new Document(Lockfile.FORMAT_VERSION, new ArrayList<>(this.entries.values())));
        }
        AtomicFiles.write(data, file);
        LoggingAdapter.getDefaultLogger().debug(Lockfile.class, "Wrote lockfile {}", file);
    }
}
