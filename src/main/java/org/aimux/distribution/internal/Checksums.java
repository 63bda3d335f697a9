package org.aimux.distribution.internal;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import org.jetbrains.annotations.NotNull;

public class Checksums {

    @NotNull
    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not supported by this JVM", e);
        }
    }

    /**
     * Compares a computed digest with an expected one, ignoring case and surrounding whitespace.
     *
     * @param expected The expected hex digest
     * @param actual The computed hex digest
     * @return True if both denote the same digest
     */
    public static boolean matches(@NotNull String expected, @NotNull String actual) {
        String a = expected.trim().toLowerCase(Locale.ROOT);
        return !a.isEmpty() && a.equals(actual.trim().toLowerCase(Locale.ROOT));
    }

    @NotNull
    public static String sha256(byte @NotNull[] data) {
        return HexFormat.of().formatHex(Checksums.newDigest().digest(data));
    }

    @NotNull
    public static String sha256(@NotNull Path file) throws IOException {
        MessageDigest digest = Checksums.newDigest();
        byte[] buffer = new byte[8192];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
