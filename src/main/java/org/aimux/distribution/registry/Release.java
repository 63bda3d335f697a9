package org.aimux.distribution.registry;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.aimux.distribution.version.SemanticVersion;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A published release of a plugin. The tag of the release is its version string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Release {

    /**
     * Orders releases newest first: by publication date, then by version precedence, then by tag.
     * Releases without a publication date sort after those with one.
     */
    @NotNull
    public static final Comparator<Release> NEWEST_FIRST = Comparator
            .comparing(Release::getPublishedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(Release::getVersion, Comparator.nullsFirst(SemanticVersion.PRECEDENCE_THEN_ORIGIN))
            .thenComparing(Release::getTag)
            .reversed();

    @NotNull
    private final String tag;
    @NotNull
    private final String name;
    @NotNull
    private final String body;
    private final boolean draft;
    private final boolean prerelease;
    @Nullable
    private final Instant publishedAt;
    @NotNull
    private final List<@NotNull ReleaseAsset> assets;
    @Nullable
    private final SemanticVersion version;

    @JsonCreator
    public Release(@JsonProperty("tag_name") @Nullable String tag,
            @JsonProperty("name") @Nullable String name,
            @JsonProperty("body") @Nullable String body,
            @JsonProperty("draft") boolean draft,
            @JsonProperty("prerelease") boolean prerelease,
            @JsonProperty("published_at") @Nullable String publishedAt,
            @JsonProperty("assets") @Nullable List<@NotNull ReleaseAsset> assets) {
        this.tag = tag == null ? "" : tag;
        this.name = name == null ? "" : name;
        this.body = body == null ? "" : body;
        this.draft = draft;
        this.prerelease = prerelease;
        this.publishedAt = Release.parseInstant(publishedAt);
        this.assets = assets == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(assets));
        this.version = SemanticVersion.tryParse(this.tag);
    }

    @Nullable
    private static Instant parseInstant(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Nullable
    public ReleaseAsset findAsset(@NotNull String name) {
        for (ReleaseAsset asset : this.assets) {
            if (asset.getName().equals(name)) {
                return asset;
            }
        }
        return null;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull ReleaseAsset> getAssets() {
        return this.assets;
    }

    @NotNull
    @Contract(pure = true)
    public String getBody() {
        return this.body;
    }

    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @Nullable
    @Contract(pure = true)
    public Instant getPublishedAt() {
        return this.publishedAt;
    }

    @NotNull
    @Contract(pure = true)
    public String getTag() {
        return this.tag;
    }

    /**
     * Obtains the semantic version the tag of this release corresponds to.
     *
     * @return The version, or null if the tag is not a valid semantic version
     */
    @Nullable
    @Contract(pure = true)
    public SemanticVersion getVersion() {
        return this.version;
    }

    @Contract(pure = true)
    public boolean isDraft() {
        return this.draft;
    }

    /**
     * Whether the release is a prerelease. A release counts as prerelease if it is flagged as such
     * by the source host or if its version carries a prerelease qualifier.
     *
     * @return True if this is a prerelease
     */
    @Contract(pure = true)
    public boolean isPrerelease() {
        return this.prerelease || (this.version != null && this.version.isPrerelease());
    }

    @Override
    public String toString() {
        return "Release[" + this.tag + (this.draft ? " draft" : "") + (this.prerelease ? " prerelease" : "") + "]";
    }
}
