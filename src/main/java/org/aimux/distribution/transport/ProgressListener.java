package org.aimux.distribution.transport;

/**
 * Receives progress updates of a running transfer.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * Called whenever a chunk of data was written to the destination.
     *
     * @param downloadedBytes The total amount of bytes present at the destination, including resumed bytes
     * @param totalBytes The expected total size of the file, or -1 if unknown
     */
    void onProgress(long downloadedBytes, long totalBytes);
}
