package com.wis2.downloader.worker;

import com.wis2.downloader.core.integrity.IntegrityVerifier;
import com.wis2.downloader.core.model.DownloadJob;
import com.wis2.downloader.core.model.Integrity;
import com.wis2.downloader.core.model.JobLink;
import com.wis2.downloader.core.model.LinkOutcome;
import com.wis2.downloader.core.path.OutputPathResolver;
import com.wis2.downloader.core.store.ArtifactStore;
import com.wis2.downloader.download.DownloadException;
import com.wis2.downloader.download.Downloader;
import com.wis2.downloader.metrics.DownloadMetrics;
import com.wis2.downloader.queue.JobQueue;
import com.wis2.downloader.subscription.SubscriptionTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobProcessorTest {

    private static final Clock MARCH_5 = Clock.fixed(Instant.parse("2024-03-05T12:00:00Z"), ZoneOffset.UTC);
    private static final byte[] CONTENT = "BUFR-payload".getBytes(StandardCharsets.US_ASCII);

    @TempDir
    Path dataDir;

    private final Downloader downloader = mock(Downloader.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final SubscriptionTable table = new SubscriptionTable();

    private JobProcessor processor;

    @BeforeEach
    void setUp() {
        table.add("a", dataDir);
        processor = new JobProcessor(
                new OutputPathResolver(table, dataDir.resolve("default"), MARCH_5),
                new ArtifactStore(),
                downloader,
                new IntegrityVerifier(),
                new DownloadMetrics(registry, new JobQueue()));
    }

    @Test
    void matchingDownloadShouldBeWrittenToTheDatePartition() throws Exception {
        when(downloader.fetch("http://h/f.bin")).thenReturn(CONTENT);

        List<LinkOutcome> outcomes = processor.process(job("http://h/f.bin", sha256(CONTENT)));

        Path expected = dataDir.resolve("2024/03/05/urnx1");
        assertEquals(List.of(LinkOutcome.DOWNLOADED), outcomes);
        assertArrayEquals(CONTENT, Files.readAllBytes(expected));
        assertEquals(1.0, registry.get("wis2.integrity").tag("result", "match").counter().count());
    }

    @Test
    void mismatchShouldStillBePersisted() throws Exception {
        when(downloader.fetch("http://h/f.bin")).thenReturn(CONTENT);

        List<LinkOutcome> outcomes = processor.process(job("http://h/f.bin", sha256("other".getBytes())));

        assertEquals(List.of(LinkOutcome.DOWNLOADED), outcomes);
        assertTrue(Files.exists(dataDir.resolve("2024/03/05/urnx1")));
        assertEquals(1.0, registry.get("wis2.integrity").tag("result", "mismatch").counter().count());
    }

    @Test
    void jobWithoutCanonicalLinkShouldNotFetch() throws Exception {
        DownloadJob job = new DownloadJob("a", "urn:x:1", List.of(new JobLink("via", "http://h/about")), null);

        assertTrue(processor.process(job).isEmpty());

        verify(downloader, never()).fetch(anyString());
        assertFalse(Files.exists(dataDir.resolve("2024")));
    }

    @Test
    void existingFileShouldBeSkippedWithoutFetching() throws Exception {
        Path existing = dataDir.resolve("2024/03/05/urnx1");
        Files.createDirectories(existing.getParent());
        Files.write(existing, new byte[] {0});

        List<LinkOutcome> outcomes = processor.process(job("http://h/f.bin", null));

        assertEquals(List.of(LinkOutcome.SKIPPED_EXISTING), outcomes);
        verify(downloader, never()).fetch(anyString());
        assertArrayEquals(new byte[] {0}, Files.readAllBytes(existing));
    }

    @Test
    void failedDownloadShouldWriteNothingAndMoveOnToTheNextLink() throws Exception {
        when(downloader.fetch("http://unreachable/f.bin"))
                .thenThrow(new DownloadException("http://unreachable/f.bin", "Connection refused"));
        when(downloader.fetch("http://mirror/f.bin")).thenReturn(CONTENT);
        DownloadJob job = new DownloadJob("a", "urn:x:1", List.of(
                new JobLink("canonical", "http://unreachable/f.bin"),
                new JobLink("canonical", "http://mirror/f.bin")), null);

        List<LinkOutcome> outcomes = processor.process(job);

        assertEquals(List.of(LinkOutcome.DOWNLOAD_FAILED, LinkOutcome.DOWNLOADED), outcomes);
        assertTrue(Files.exists(dataDir.resolve("2024/03/05/urnx1")));
    }

    @Test
    void laterCanonicalLinksShouldBeSkippedOnceTheFileExists() throws Exception {
        when(downloader.fetch(anyString())).thenReturn(CONTENT);
        DownloadJob job = new DownloadJob("a", "urn:x:1", List.of(
                new JobLink("canonical", "http://one/f.bin"),
                new JobLink("canonical", "http://two/f.bin")), null);

        List<LinkOutcome> outcomes = processor.process(job);

        assertEquals(List.of(LinkOutcome.DOWNLOADED, LinkOutcome.SKIPPED_EXISTING), outcomes);
        verify(downloader, times(1)).fetch(anyString());
    }

    @Test
    void persistFailureShouldBeReported() throws Exception {
        // A regular file where the year directory should be makes directory creation fail.
        Files.write(dataDir.resolve("2024"), new byte[0]);
        when(downloader.fetch("http://h/f.bin")).thenReturn(CONTENT);

        List<LinkOutcome> outcomes = processor.process(job("http://h/f.bin", null));

        assertEquals(List.of(LinkOutcome.PERSIST_FAILED), outcomes);
        assertEquals(1.0, registry.get("wis2.downloads").tag("outcome", "persist_failed").counter().count());
    }

    @Test
    void unplaceableDataIdShouldBeDroppedWithoutFetching() throws Exception {
        DownloadJob job = new DownloadJob("a", "../../escape",
                List.of(new JobLink("canonical", "http://h/f.bin")), null);

        assertTrue(processor.process(job).isEmpty());
        verify(downloader, never()).fetch(anyString());
    }

    @Test
    void fileNameShouldBeTheLastUrlSegment() {
        assertEquals("f.bin", JobProcessor.fileName("http://h/a/b/f.bin?x=1"));
        assertEquals("http://h", JobProcessor.fileName("http://h"));
    }

    private static DownloadJob job(String href, String sha256) {
        Integrity integrity = sha256 == null ? null : new Integrity("sha256", sha256);
        return new DownloadJob("a", "urn:x:1", List.of(new JobLink("canonical", href)), integrity);
    }

    private static String sha256(byte[] data) throws Exception {
        return Base64.getEncoder().encodeToString(MessageDigest.getInstance("SHA-256").digest(data));
    }
}
