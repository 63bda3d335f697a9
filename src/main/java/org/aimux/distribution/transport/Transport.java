package org.aimux.distribution.transport;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The capability surface through which metadata is fetched and artifacts are downloaded.
 * Implementations may talk to a real network, or serve canned responses for testing purposes.
 *
 * <p>All methods are blocking; callers are expected to schedule them on an executor of their choosing.
 * Implementations MUST be safe for use by multiple threads at once.
 *
 * <p><ul>
 * <li>Connection failures, timeouts and transient server responses (rate limits and 5xx status codes)
 * SHOULD be reported as an {@link IOException}, preferably a {@link TransportException} that is
 * {@link TransportException#isTransient() transient}. These failures are eligible for retries.</li>
 * <li>{@link #download(String, Path, ProgressListener)} and {@link #resume(String, Path, long, ProgressListener)}
 * MAY return false instead of throwing in case the transfer was not successful. Callers treat this the same
 * way as a transient failure.</li>
 * <li>If the progress listener throws an unchecked exception (as it does when a download is cancelled),
 * the transfer MUST be aborted and the exception propagated as-is.</li>
 * <li>Implementations SHOULD NOT retry on their own. The retry bound set through {@link #setMaxRetries(int)}
 * is advisory and is read back by the callers that implement the retry policy.</li>
 * </ul>
 */
public interface Transport {

    /**
     * Issues a metadata request. Unlike the download methods, a non-successful status code is not an error
     * and is returned as part of the response for the caller to interpret.
     *
     * @param url The URL to fetch
     * @param headers Additional request headers
     * @return The response
     * @throws IOException If no response could be obtained
     */
    @NotNull
    TransportResponse fetch(@NotNull String url, @NotNull Map<String, String> headers) throws IOException;

    /**
     * Downloads a file, replacing the destination if it already exists.
     *
     * @param url The URL of the file
     * @param destination The path to write the file to
     * @param listener The listener to notify about the progress of the transfer, or null
     * @return True if the file was transferred completely, false otherwise
     * @throws IOException If the transfer failed
     */
    boolean download(@NotNull String url, @NotNull Path destination, @Nullable ProgressListener listener) throws IOException;

    /**
     * Resumes a previously interrupted download, appending to the bytes already present at the destination.
     * Callers should only invoke this method if {@link #supportsResume()} returns true.
     *
     * @param url The URL of the file
     * @param destination The path of the partially downloaded file
     * @param offset The amount of bytes which were confirmed to have been written to the destination
     * @param listener The listener to notify about the progress of the transfer, or null
     * @return True if the file was transferred completely, false otherwise
     * @throws IOException If the transfer failed
     */
    boolean resume(@NotNull String url, @NotNull Path destination, long offset, @Nullable ProgressListener listener) throws IOException;

    @Contract(pure = true)
    boolean supportsResume();

    @NotNull
    @Contract(pure = true)
    Duration getTimeout();

    @NotNull
    @Contract(mutates = "this", pure = false, value = "null -> fail; !null -> this")
    Transport setTimeout(@NotNull Duration timeout);

    @Contract(pure = true)
    int getMaxRetries();

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    Transport setMaxRetries(int retries);
}
