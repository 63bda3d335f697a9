package org.aimux.distribution.registry;

import java.util.Locale;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file attached to a {@link Release}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReleaseAsset {

    private static final String SHA256_DIGEST_PREFIX = "sha256:";

    @NotNull
    private final String name;
    @NotNull
    private final String downloadUrl;
    private final long size;
    @NotNull
    private final String contentType;
    @NotNull
    private final String checksum;

    @JsonCreator
    public ReleaseAsset(@JsonProperty("name") @Nullable String name,
            @JsonProperty("browser_download_url") @Nullable String downloadUrl,
            @JsonProperty("size") long size,
            @JsonProperty("content_type") @Nullable String contentType,
            @JsonProperty("digest") @Nullable String digest) {
        this.name = name == null ? "" : name;
        this.downloadUrl = downloadUrl == null ? "" : downloadUrl;
        this.size = size;
        this.contentType = contentType == null ? "" : contentType;
        if (digest != null && digest.toLowerCase(Locale.ROOT).startsWith(ReleaseAsset.SHA256_DIGEST_PREFIX)) {
            this.checksum = digest.substring(ReleaseAsset.SHA256_DIGEST_PREFIX.length()).toLowerCase(Locale.ROOT);
        } else {
            // Other digest algorithms cannot be verified and are thus treated as absent
            this.checksum = "";
        }
    }

    /**
     * Obtains the hex-encoded SHA-256 digest of the asset as published by the source host.
     *
     * @return The checksum, or an empty string if the host does not publish one for this asset
     */
    @NotNull
    @Contract(pure = true)
    public String getChecksum() {
        return this.checksum;
    }

    @NotNull
    @Contract(pure = true)
    public String getContentType() {
        return this.contentType;
    }

    @NotNull
    @Contract(pure = true)
    public String getDownloadUrl() {
        return this.downloadUrl;
    }

    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @Contract(pure = true)
    public long getSize() {
        return this.size;
    }

    @Override
    public String toString() {
        return "ReleaseAsset[" + this.name + "]";
    }
}
