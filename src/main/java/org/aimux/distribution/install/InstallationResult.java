package org.aimux.distribution.install;

import java.util.Objects;

import org.aimux.distribution.PluginId;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of an installation, update or rollback: either the version that is now installed,
 * or the reason why the operation failed. Never both.
 */
public final class InstallationResult {

    /**
     * The category of a failure, which callers can use to decide whether retrying later is sensible.
     */
    public enum ErrorKind {
        /**
         * Network failures, timeouts and rate limiting which persisted after all retries were exhausted.
         */
        TRANSIENT,

        /**
         * The artifact did not match its published checksum, or the release did not carry a verifiable artifact.
         */
        INTEGRITY,

        /**
         * The plugin is not trusted, blocked or does not exist.
         */
        POLICY,

        /**
         * No consistent set of versions could be found.
         */
        RESOLUTION,

        /**
         * The request itself was malformed.
         */
        INPUT,

        /**
         * The local file system refused an operation.
         */
        IO,

        CANCELLED,

        /**
         * The operation needs resources that are unavailable in the current mode, e.g. a network transfer in offline mode.
         */
        UNAVAILABLE;
    }

    @NotNull
    public static InstallationResult failure(@NotNull PluginId pluginId, @NotNull ErrorKind kind, @NotNull String errorMessage) {
        return new InstallationResult(pluginId, null, Objects.requireNonNull(kind, "kind may not be null"), Objects.requireNonNull(errorMessage, "errorMessage may not be null"));
    }

    @NotNull
    public static InstallationResult success(@NotNull PluginId pluginId, @NotNull String version) {
        return new InstallationResult(pluginId, Objects.requireNonNull(version, "version may not be null"), null, null);
    }

    @NotNull
    private final PluginId pluginId;
    @Nullable
    private final String version;
    @Nullable
    private final ErrorKind errorKind;
    @Nullable
    private final String errorMessage;

    private InstallationResult(@NotNull PluginId pluginId, @Nullable String version, @Nullable ErrorKind errorKind, @Nullable String errorMessage) {
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId may not be null");
        this.version = version;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    @Nullable
    @Contract(pure = true)
    public ErrorKind getErrorKind() {
        return this.errorKind;
    }

    @Nullable
    @Contract(pure = true)
    public String getErrorMessage() {
        return this.errorMessage;
    }

    @NotNull
    @Contract(pure = true)
    public PluginId getPluginId() {
        return this.pluginId;
    }

    /**
     * Obtains the version which was installed.
     *
     * @return The version, or null if the operation failed
     */
    @Nullable
    @Contract(pure = true)
    public String getVersion() {
        return this.version;
    }

    @Contract(pure = true)
    public boolean isSuccess() {
        return this.errorKind == null;
    }

    @Override
    public String toString() {
        if (this.isSuccess()) {
            return "InstallationResult[" + this.pluginId + "@" + this.version + "]";
        }
        return "InstallationResult[" + this.pluginId + " failed (" + this.errorKind + "): " + this.errorMessage + "]";
    }
}
