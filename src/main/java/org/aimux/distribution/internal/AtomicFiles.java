package org.aimux.distribution.internal;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

import org.aimux.distribution.logging.LoggingAdapter;
import org.jetbrains.annotations.NotNull;

public class AtomicFiles {

    /**
     * Moves a file or directory, atomically if the file system supports it.
     * An existing target file is replaced.
     *
     * @param from The source path
     * @param to The target path
     * @throws IOException If the move failed
     */
    public static void move(@NotNull Path from, @NotNull Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LoggingAdapter.getDefaultLogger().debug(AtomicFiles.class, "Atomic move from {} to {} not supported, falling back to a regular move", from, to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static FileLock tryLock(@NotNull FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // Held by another thread of this JVM
            return null;
        }
    }

    /**
     * Writes data to a file so that concurrent readers either observe the old or the new contents.
     * The data is first written to a <code>.part</code> sibling guarded by a file lock and then moved over the target.
     *
     * @param data The data to write
     * @param to The file to write to
     * @throws IOException If writing failed or the lock could not be acquired in time
     */
    public static void write(byte @NotNull[] data, @NotNull Path to) throws IOException {
        Path parts = to.resolveSibling(to.getFileName().toString() + ".part");
        Path lock = to.resolveSibling(to.getFileName().toString() + ".part.lock");
        if (to.getParent() != null) {
            Files.createDirectories(to.getParent());
        }

        try (FileChannel lockChannel = FileChannel.open(lock, StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.DELETE_ON_CLOSE)) {
            FileLock fileLock;
            long idleTime = 0L;
            while ((fileLock = AtomicFiles.tryLock(lockChannel)) == null) {
                try {
                    Thread.sleep(10L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while waiting for the lock on " + parts.toAbsolutePath(), e);
                }
                if ((idleTime += 10L) > 10_000L) {
                    throw new IOException("Waited more than 10 seconds to acquire lock on " + parts.toAbsolutePath());
                }
            }

            try {
                Files.write(parts, data, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                AtomicFiles.move(parts, to);
            } finally {
                fileLock.release();
            }
        }
    }
}
