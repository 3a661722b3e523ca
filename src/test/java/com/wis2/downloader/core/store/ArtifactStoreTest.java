package com.wis2.downloader.core.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactStoreTest {

    @TempDir
    Path tempDir;

    private final ArtifactStore store = new ArtifactStore();

    @Test
    void writeShouldCreateParentsAndLeaveNoTemporaryFiles() throws Exception {
        Path target = tempDir.resolve("2024/03/05/urnx1");

        store.write(target, "payload".getBytes(StandardCharsets.UTF_8));

        assertTrue(store.exists(target));
        assertEquals("payload", Files.readString(target, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void existsShouldBeFalseForMissingFilesAndDirectories() throws Exception {
        assertFalse(store.exists(tempDir.resolve("nope")));

        Path dir = Files.createDirectories(tempDir.resolve("dir"));
        assertFalse(store.exists(dir));
    }

    @Test
    void concurrentWritersShouldShareTheDatePartition() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                Path target = tempDir.resolve("2024/03/05/file-" + i);
                futures.add(pool.submit(() -> {
                    go.await();
                    store.write(target, new byte[] {1, 2, 3});
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        try (Stream<Path> files = Files.list(tempDir.resolve("2024/03/05"))) {
            assertEquals(writers, files.count());
        }
    }
}
