package org.aimux.distribution.registry;

import java.util.Objects;

import org.aimux.distribution.PluginId;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The source repository of a plugin, as reported by the source host.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RepositoryInfo {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final record Owner(@JsonProperty("login") @Nullable String login) {
    }

    @NotNull
    private final String owner;
    @NotNull
    private final String name;
    @NotNull
    private final String description;
    @NotNull
    private final String defaultBranch;
    private final boolean archived;
    private final int stars;

    @JsonCreator
    RepositoryInfo(@JsonProperty("owner") @Nullable Owner owner,
            @JsonProperty("name") @Nullable String name,
            @JsonProperty("description") @Nullable String description,
            @JsonProperty("default_branch") @Nullable String defaultBranch,
            @JsonProperty("archived") boolean archived,
            @JsonProperty("stargazers_count") int stars) {
        this(owner == null || owner.login() == null ? "" : owner.login(), name, description, defaultBranch, archived, stars);
    }

    public RepositoryInfo(@NotNull String owner, @Nullable String name, @Nullable String description, @Nullable String defaultBranch, boolean archived, int stars) {
        this.owner = Objects.requireNonNull(owner, "owner may not be null");
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
        this.defaultBranch = defaultBranch == null ? "main" : defaultBranch;
        this.archived = archived;
        this.stars = stars;
    }

    @NotNull
    @Contract(pure = true)
    public String getDefaultBranch() {
        return this.defaultBranch;
    }

    @NotNull
    @Contract(pure = true)
    public String getDescription() {
        return this.description;
    }

    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public String getOwner() {
        return this.owner;
    }

    @NotNull
    @JsonIgnore
    public PluginId getPluginId() {
        return new PluginId(this.owner, this.name);
    }

    @Contract(pure = true)
    public int getStars() {
        return this.stars;
    }

    @Contract(pure = true)
    public boolean isArchived() {
        return this.archived;
    }

    @Override
    public String toString() {
        return "RepositoryInfo[" + this.owner + "/" + this.name + "]";
    }
}
