package org.aimux.distribution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A concrete, downloadable release of a plugin as produced by the
 * {@link org.aimux.distribution.registry.PluginRegistry registry}.
 *
 * <p>Instances are immutable. Missing string values are normalised to the empty string
 * and missing lists to empty lists, so that a partially populated package can still be
 * represented - it just will not be {@link #isValid() valid}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PluginPackage {

    @NotNull
    private final String id;
    @NotNull
    private final String version;
    @NotNull
    private final String name;
    @NotNull
    private final String description;
    @NotNull
    private final String downloadUrl;
    @NotNull
    private final String checksum;
    private final long fileSize;
    @NotNull
    private final String contentType;
    @NotNull
    private final List<@NotNull PluginDependency> dependencies;
    @NotNull
    private final List<@NotNull String> conflictsWith;

    @JsonCreator
    public PluginPackage(@JsonProperty("id") @Nullable String id,
            @JsonProperty("version") @Nullable String version,
            @JsonProperty("name") @Nullable String name,
            @JsonProperty("description") @Nullable String description,
            @JsonProperty("download_url") @Nullable String downloadUrl,
            @JsonProperty("checksum") @Nullable String checksum,
            @JsonProperty("file_size") long fileSize,
            @JsonProperty("content_type") @Nullable String contentType,
            @JsonProperty("dependencies") @Nullable List<@NotNull PluginDependency> dependencies,
            @JsonProperty("conflicts_with") @Nullable List<@NotNull String> conflictsWith) {
        this.id = id == null ? "" : id;
        this.version = version == null ? "" : version;
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
        this.downloadUrl = downloadUrl == null ? "" : downloadUrl;
        this.checksum = checksum == null ? "" : checksum;
        this.fileSize = fileSize;
        this.contentType = contentType == null ? "" : contentType;
        this.dependencies = dependencies == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(dependencies));
        this.conflictsWith = conflictsWith == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(conflictsWith));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PluginPackage) {
            PluginPackage other = (PluginPackage) obj;
            return this.id.equals(other.id)
                    && this.version.equals(other.version)
                    && this.name.equals(other.name)
                    && this.description.equals(other.description)
                    && this.downloadUrl.equals(other.downloadUrl)
                    && this.checksum.equals(other.checksum)
                    && this.fileSize == other.fileSize
                    && this.contentType.equals(other.contentType)
                    && this.dependencies.equals(other.dependencies)
                    && this.conflictsWith.equals(other.conflictsWith);
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("checksum")
    public String getChecksum() {
        return this.checksum;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("conflicts_with")
    public List<@NotNull String> getConflictsWith() {
        return this.conflictsWith;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("content_type")
    public String getContentType() {
        return this.contentType;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("dependencies")
    public List<@NotNull PluginDependency> getDependencies() {
        return this.dependencies;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("description")
    public String getDescription() {
        return this.description;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("download_url")
    public String getDownloadUrl() {
        return this.downloadUrl;
    }

    @Contract(pure = true)
    @JsonProperty("file_size")
    public long getFileSize() {
        return this.fileSize;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("id")
    public String getId() {
        return this.id;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("name")
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    @JsonProperty("version")
    public String getVersion() {
        return this.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.version, this.downloadUrl, this.checksum, this.fileSize);
    }

    /**
     * Checks whether the package carries everything that is needed to download and verify it.
     * A package is valid only if its identity (id and version), its download URL and its checksum
     * are non-empty and if its file size is larger than zero.
     *
     * @return True if the package is complete
     */
    @JsonIgnore
    @Contract(pure = true)
    public boolean isValid() {
        return !this.id.isEmpty()
                && !this.version.isEmpty()
                && !this.downloadUrl.isEmpty()
                && !this.checksum.isEmpty()
                && this.fileSize > 0;
    }

    @Override
    public String toString() {
        return "PluginPackage[id=" + this.id + " version=" + this.version + " url=" + this.downloadUrl + " size=" + this.fileSize + "]";
    }
}
