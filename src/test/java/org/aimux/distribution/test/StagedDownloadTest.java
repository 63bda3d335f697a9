package org.aimux.distribution.test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import org.aimux.distribution.install.DownloadProgress;
import org.aimux.distribution.install.StagedDownload;
import org.aimux.distribution.transport.TransportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class StagedDownloadTest {

    private static final String URL = "https://example.invalid/aimux/web-search/releases/download/v1.0.0/web-search.zip";
    private static final byte[] DATA = "0123456789abcdefghijklmnopqrstuvwxyz".getBytes();

    @TempDir
    Path directory;

    private StagedDownload download(FakeTransport transport) {
        return new StagedDownload(transport, StagedDownloadTest.URL, this.directory.resolve("web-search.zip"), new DownloadProgress(StagedDownloadTest.DATA.length))
                .setBackoff(Duration.ofMillis(1))
                .setMaxRetries(3);
    }

    @Test
    public void testPlainDownload() throws IOException {
        FakeTransport transport = new FakeTransport().addFile(StagedDownloadTest.URL, StagedDownloadTest.DATA);
        StagedDownload download = this.download(transport);
        download.run(() -> { });
        assertArrayEquals(StagedDownloadTest.DATA, Files.readAllBytes(this.directory.resolve("web-search.zip")));
        assertEquals(0, download.getRetries());
        assertEquals(StagedDownloadTest.DATA.length, download.getProgress().getDownloadedBytes());
        assertEquals(100D, download.getProgress().getPercentage());
    }

    @Test
    public void testResumeAfterInterruption() throws IOException {
        FakeTransport transport = new FakeTransport().addFile(StagedDownloadTest.URL, StagedDownloadTest.DATA)
                .failNextTransfer(StagedDownloadTest.URL, 8, new IOException("Connection reset"))
                .failNextTransfer(StagedDownloadTest.URL, 10, new IOException("Connection reset"));
        AtomicInteger retries = new AtomicInteger();
        StagedDownload download = this.download(transport);
        download.run(retries::incrementAndGet);

        assertArrayEquals(StagedDownloadTest.DATA, Files.readAllBytes(this.directory.resolve("web-search.zip")));
        assertEquals(List.of(8L, 18L), transport.getResumeOffsets());
        assertEquals(2, download.getRetries());
        assertEquals(2, retries.get());
        assertEquals(1, transport.getDownloads());
    }

    @Test
    public void testRestartWithoutResumeSupport() throws IOException {
        FakeTransport transport = new FakeTransport().addFile(StagedDownloadTest.URL, StagedDownloadTest.DATA)
                .failNextTransfer(StagedDownloadTest.URL, 8, new IOException("Connection reset"))
                .setResumable(false);
        StagedDownload download = this.download(transport);
        download.run(() -> { });
        assertArrayEquals(StagedDownloadTest.DATA, Files.readAllBytes(this.directory.resolve("web-search.zip")));
        assertTrue(transport.getResumeOffsets().isEmpty());
        assertEquals(2, transport.getDownloads());
    }

    @Test
    public void testRetriesAreBounded() {
        FakeTransport transport = new FakeTransport().addFile(StagedDownloadTest.URL, StagedDownloadTest.DATA);
        TransportException failure = new TransportException(StagedDownloadTest.URL, 503, null);
        for (int i = 0; i < 4; i++) {
            transport.failNextTransfer(StagedDownloadTest.URL, 0, failure);
        }
        StagedDownload download = this.download(transport);
        IOException thrown = assertThrows(IOException.class, () -> download.run(() -> { }));
        assertSame(failure, thrown);
        assertEquals(3, download.getRetries());
        assertEquals(4, transport.getDownloads());
    }

    @Test
    public void testPermanentFailuresAreNotRetried() {
        FakeTransport transport = new FakeTransport();
        StagedDownload download = this.download(transport);
        TransportException thrown = assertThrows(TransportException.class, () -> download.run(() -> { }));
        assertEquals(404, thrown.getStatusCode());
        assertFalse(thrown.isTransient());
        assertEquals(0, download.getRetries());
        assertEquals(1, transport.getDownloads());
    }

    @Test
    public void testRetryability() {
        assertTrue(StagedDownload.isRetryable(new IOException("Connection reset")));
        assertTrue(StagedDownload.isRetryable(new TransportException(StagedDownloadTest.URL, 429, null)));
        assertTrue(StagedDownload.isRetryable(new TransportException(StagedDownloadTest.URL, 500, null)));
        assertFalse(StagedDownload.isRetryable(new TransportException(StagedDownloadTest.URL, 403, null)));
        assertFalse(StagedDownload.isRetryable(new AccessDeniedException("/plugins")));
    }

    @Test
    public void testCancellation() {
        FakeTransport transport = new FakeTransport().addFile(StagedDownloadTest.URL, StagedDownloadTest.DATA);
        StagedDownload download = this.download(transport);
        transport.setDownloadHook((url) -> download.cancel());
        assertThrows(CancellationException.class, () -> download.run(() -> { }));
        assertTrue(download.isCancelled());
        assertEquals(0, download.getRetries());
    }
}
