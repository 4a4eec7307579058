package com.alterante.relay.transfer;

import com.alterante.relay.http.HttpProtocolException;
import com.alterante.relay.http.TransferCancelledException;
import com.alterante.relay.queue.CommandQueue;
import com.alterante.relay.queue.EventLoop;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.storage.LocalMediaStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.LongConsumer;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class UploadCoordinatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path dir;

    private EventLoop loop;
    private ExecutorService io;
    private CommandQueue queue;
    private LocalMediaStore store;
    private FakeTarget target;
    private UploadCoordinator upload;

    private final List<UserError> reported = new CopyOnWriteArrayList<>();
    private final List<String> completed = new CopyOnWriteArrayList<>();
    private final AtomicInteger ended = new AtomicInteger();

    /** Server stand-in: reads the file in 100 byte chunks and records what arrived. */
    private static final class FakeTarget implements UploadTarget {

        static final int CHUNK = 100;

        final List<String> attempts = new CopyOnWriteArrayList<>();
        final Map<String, byte[]> received = new ConcurrentHashMap<>();
        final Set<String> rejected = ConcurrentHashMap.newKeySet();
        volatile ChunkHook hook = (name, sent) -> { };

        @FunctionalInterface
        interface ChunkHook {
            void afterChunk(String name, long sent) throws IOException;
        }

        @Override
        public String upload(String name, Path file, LongConsumer onBytesSent, BooleanSupplier cancelled)
                throws IOException {
            attempts.add(name);
            if (rejected.contains(name)) {
                throw new HttpProtocolException("Project is read-only (code 7)");
            }
            byte[] data = Files.readAllBytes(file);
            long sent = 0;
            while (sent < data.length) {
                if (cancelled.getAsBoolean()) {
                    throw new TransferCancelledException(sent);
                }
                int n = (int) Math.min(CHUNK, data.length - sent);
                sent += n;
                onBytesSent.accept(n);
                hook.afterChunk(name, sent);
            }
            if (cancelled.getAsBoolean()) {
                throw new TransferCancelledException(sent);
            }
            received.put(name, data);
            return "task-" + name;
        }

        int attempts(String name) {
            int n = 0;
            for (String a : attempts) {
                if (a.equals(name)) n++;
            }
            return n;
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        loop = new EventLoop("test-loop");
        io = Executors.newSingleThreadExecutor();
        queue = new CommandQueue("server", loop, reported::add, 2, 20);
        queue.setEnabled(true);
        store = new LocalMediaStore(dir.resolve("album"));
        target = new FakeTarget();
        upload = new UploadCoordinator(loop, queue, target, store, io, reported::add);
        upload.addListener(new TransferListener() {
            @Override
            public void onFileCompleted(String leg, String name) {
                completed.add(name);
            }

            @Override
            public void onTransferEnded(String leg) {
                ended.incrementAndGet();
            }
        });
    }

    @AfterEach
    void tearDown() {
        io.shutdownNow();
        loop.close();
    }

    private UploadItem file(String name, int size, long seed) throws IOException {
        byte[] content = new byte[size];
        new Random(seed).nextBytes(content);
        Path path = dir.resolve(name);
        Files.write(path, content);
        return new UploadItem(name, path, size, false);
    }

    private void awaitEnded(int count) {
        await().atMost(TIMEOUT).until(() -> ended.get() >= count);
    }

    @Test
    void uploadsLocalFilesInOrder() throws Exception {
        UploadItem a = file("A.MP4", 250, 1);
        UploadItem b = file("B.JPG", 100, 2);

        upload.requestUpload(List.of(a, b), List.of());
        awaitEnded(1);

        assertEquals(List.of("A.MP4", "B.JPG"), completed);
        assertArrayEquals(Files.readAllBytes(a.source()), target.received.get("A.MP4"));
        assertArrayEquals(Files.readAllBytes(b.source()), target.received.get("B.JPG"));
        assertEquals(Set.of("A.MP4", "B.JPG"), upload.remoteFiles());
        assertFalse(upload.snapshot().active());
        assertTrue(reported.isEmpty());
    }

    @Test
    void pauseRollsBackAndResumeRestartsFromZero() throws Exception {
        UploadItem a = file("A", 500, 1);
        AtomicBoolean paused = new AtomicBoolean();
        target.hook = (name, sent) -> {
            if (sent == 200 && paused.compareAndSet(false, true)) {
                upload.pause();
                loop.run(() -> { });
            }
        };

        upload.requestUpload(List.of(a), List.of());
        await().atMost(TIMEOUT).until(() -> upload.snapshot().pausedReason() == PauseReason.USER);

        TransferSnapshot s = loop.call(upload::snapshot);
        assertEquals(0, s.transferredBytes());
        assertEquals(0, s.currentOffset());
        assertEquals(500, s.totalBytes());
        assertFalse(target.received.containsKey("A"));

        upload.resume();
        awaitEnded(1);

        assertEquals(2, target.attempts("A"));
        assertArrayEquals(Files.readAllBytes(a.source()), target.received.get("A"));
    }

    @Test
    void connectionLossSuspendsUntilServerIsBack() throws Exception {
        UploadItem a = file("A", 400, 1);
        AtomicBoolean dropped = new AtomicBoolean();
        target.hook = (name, sent) -> {
            if (sent == 100 && dropped.compareAndSet(false, true)) {
                upload.connectionChanged(false);
                loop.run(() -> { });
            }
        };

        upload.requestUpload(List.of(a), List.of());
        await().atMost(TIMEOUT).until(() -> upload.snapshot().pausedReason() == PauseReason.SUSPENDED);
        assertEquals(0, upload.snapshot().transferredBytes());

        // Only the connection can lift a suspension
        upload.resume();
        assertEquals(PauseReason.SUSPENDED, loop.call(upload::snapshot).pausedReason());

        upload.connectionChanged(true);
        awaitEnded(1);
        assertEquals(2, target.attempts("A"));
        assertTrue(target.received.containsKey("A"));
    }

    @Test
    void vanishedSourceIsDroppedAndTheRestContinues() throws Exception {
        UploadItem a = file("A", 300, 1);
        UploadItem b = file("B", 200, 2);
        target.hook = (name, sent) -> {
            if (name.equals("A") && sent == 100) {
                Files.deleteIfExists(b.source());
            }
        };

        upload.requestUpload(List.of(a, b), List.of());
        awaitEnded(1);

        assertEquals(List.of("A"), completed);
        assertEquals(1, reported.size());
        assertEquals("File missing", reported.get(0).title());
    }

    @Test
    void rejectedFileIsDroppedAndTheRestContinues() throws Exception {
        UploadItem a = file("A", 100, 1);
        UploadItem b = file("B", 100, 2);
        target.rejected.add("A");

        upload.requestUpload(List.of(a, b), List.of());
        awaitEnded(1);

        assertEquals(1, target.attempts("A"));
        assertEquals(1, reported.size());
        assertEquals("Upload rejected", reported.get(0).title());
        assertEquals(List.of("B"), completed);
        assertFalse(target.received.containsKey("A"));
        assertArrayEquals(Files.readAllBytes(b.source()), target.received.get("B"));
    }

    @Test
    void rejectedFileBeforeWaitingEntriesLeavesTheLegWaiting() throws Exception {
        UploadItem a = file("A", 100, 1);
        target.rejected.add("A");

        upload.requestUpload(List.of(a), List.of(new WaitingFile("W", 40)));
        await().atMost(TIMEOUT).until(() -> upload.snapshot().pausedReason() == PauseReason.DEPENDENCY
                && reported.size() == 1);
        assertEquals(1, upload.snapshot().waitingFiles());

        Path temp = store.tempPath("W");
        Files.write(temp, new byte[40]);
        upload.downloadCompleted("W", temp, true);
        awaitEnded(1);

        assertEquals(List.of("W"), completed);
    }

    @Test
    void unexpectedTargetErrorFailsTheFileInsteadOfHanging() throws Exception {
        UploadItem a = file("A", 300, 1);
        UploadItem b = file("B", 100, 2);
        target.hook = (name, sent) -> {
            if (name.equals("A")) throw new IllegalStateException("encoder bug");
        };

        upload.requestUpload(List.of(a, b), List.of());
        awaitEnded(1);

        assertEquals(1, target.attempts("A"));
        assertEquals(1, reported.size());
        assertEquals("Upload failed", reported.get(0).title());
        assertEquals(List.of("B"), completed);
        await().atMost(TIMEOUT).until(() -> !queue.isExecuting());
    }

    @Test
    void waitingEntriesHoldTheLegUntilDownloaded() throws Exception {
        upload.requestUpload(List.of(), List.of(new WaitingFile("W1", 120), new WaitingFile("W2", 80)));
        await().atMost(TIMEOUT).until(() -> upload.snapshot().pausedReason() == PauseReason.DEPENDENCY);

        TransferSnapshot s = upload.snapshot();
        assertEquals(200, s.totalBytes());
        assertEquals(2, s.waitingFiles());

        Path temp = store.tempPath("W1");
        Files.write(temp, new byte[120]);
        upload.downloadCompleted("W1", temp, true);

        await().atMost(TIMEOUT).until(() -> completed.contains("W1"));
        await().atMost(TIMEOUT).until(() -> !Files.exists(temp));
        await().atMost(TIMEOUT).until(() -> upload.snapshot().pausedReason() == PauseReason.DEPENDENCY);
        assertEquals(200, upload.snapshot().totalBytes());
        assertEquals(120, upload.snapshot().transferredBytes());

        upload.downloadCancelled(List.of("W2"));
        awaitEnded(1);
        assertFalse(upload.snapshot().active());
    }

    @Test
    void cancelledDownloadLowersTotals() {
        upload.requestUpload(List.of(), List.of(new WaitingFile("W1", 120), new WaitingFile("W2", 80)));
        await().atMost(TIMEOUT).until(() -> upload.snapshot().waitingFiles() == 2);

        upload.downloadCancelled(List.of("W1", "NOT-TRACKED"));

        await().atMost(TIMEOUT).until(() -> upload.snapshot().waitingFiles() == 1);
        assertEquals(80, upload.snapshot().totalBytes());
        assertEquals(1, upload.snapshot().totalFiles());
    }

    @Test
    void completedDownloadNobodyWaitsForIsDeleted() throws Exception {
        Path temp = store.tempPath("X");
        Files.write(temp, new byte[10]);

        upload.downloadCompleted("X", temp, true);

        await().atMost(TIMEOUT).until(() -> !Files.exists(temp));
        assertFalse(upload.snapshot().active());
    }

    @Test
    void filesAlreadyOnServerAreSkipped() throws Exception {
        upload.setRemoteFiles(List.of("A", "W"));
        UploadItem a = file("A", 100, 1);
        UploadItem b = file("B", 100, 2);

        upload.requestUpload(List.of(a, b), List.of(new WaitingFile("W", 10)));
        awaitEnded(1);

        assertEquals(List.of("B"), target.attempts);
        assertEquals(1, reported.size());
        assertEquals("Files skipped", reported.get(0).title());
    }

    @Test
    void temporarySourceIsDeletedAfterUpload() throws Exception {
        Path temp = store.tempPath("T.MP4");
        Files.write(temp, new byte[150]);

        upload.requestUpload(List.of(UploadItem.of(temp, 150)), List.of());
        awaitEnded(1);

        assertEquals(List.of("T.MP4"), completed);
        await().atMost(TIMEOUT).until(() -> !Files.exists(temp));
    }

    @Test
    void newFilesResumeAWaitingLeg() throws Exception {
        upload.requestUpload(List.of(), List.of(new WaitingFile("W", 50)));
        await().atMost(TIMEOUT).until(() -> upload.snapshot().pausedReason() == PauseReason.DEPENDENCY);

        UploadItem a = file("A", 100, 1);
        upload.requestUpload(List.of(a), List.of());

        await().atMost(TIMEOUT).until(() -> completed.contains("A"));
        await().atMost(TIMEOUT).until(() -> upload.snapshot().pausedReason() == PauseReason.DEPENDENCY);
        assertEquals(1, upload.snapshot().waitingFiles());
    }
}
