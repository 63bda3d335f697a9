package org.aimux.distribution.install;

import java.io.IOException;
import java.util.Objects;

import org.aimux.distribution.install.InstallationResult.ErrorKind;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Aborts an installation step with a failure of a known kind. Thrown on worker threads and converted into an
 * {@link InstallationResult} before reaching the caller.
 */
public class InstallationException extends IOException {

    private static final long serialVersionUID = -3075211950348816742L;

    @NotNull
    private final ErrorKind errorKind;

    public InstallationException(@NotNull ErrorKind errorKind, @NotNull String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind may not be null");
    }

    public InstallationException(@NotNull ErrorKind errorKind, @NotNull String message, @NotNull Throwable cause) {
        super(message, cause);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public ErrorKind getErrorKind() {
        return this.errorKind;
    }
}
