package com.alterante.relay.transfer;

import com.alterante.relay.device.MediaFile;
import com.alterante.relay.device.MemoryMediaSource;
import com.alterante.relay.queue.CommandQueue;
import com.alterante.relay.queue.EventLoop;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.storage.LocalMediaStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class DownloadCoordinatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path dir;

    private EventLoop loop;
    private ExecutorService io;
    private CommandQueue queue;
    private MemoryMediaSource source;
    private LocalMediaStore store;
    private DownloadCoordinator download;

    private final List<UserError> reported = new CopyOnWriteArrayList<>();
    private final List<TransferSnapshot> snapshots = new CopyOnWriteArrayList<>();
    private final List<String> completed = new CopyOnWriteArrayList<>();
    private final AtomicInteger ended = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        loop = new EventLoop("test-loop");
        io = Executors.newSingleThreadExecutor();
        queue = new CommandQueue("device", loop, reported::add, 3, 20);
        source = new MemoryMediaSource(50);
        store = new LocalMediaStore(dir.resolve("album"));
        download = new DownloadCoordinator(loop, queue, source, store, io, reported::add);
        download.addListener(new TransferListener() {
            @Override
            public void onSnapshot(TransferSnapshot snapshot) {
                snapshots.add(snapshot);
            }

            @Override
            public void onFileCompleted(String leg, String name) {
                completed.add(name);
            }

            @Override
            public void onTransferEnded(String leg) {
                ended.incrementAndGet();
            }
        });
        download.deviceConnected();
    }

    @AfterEach
    void tearDown() {
        io.shutdownNow();
        loop.close();
    }

    private TransferSnapshot lastActive() {
        for (int i = snapshots.size() - 1; i >= 0; i--) {
            if (snapshots.get(i).active()) return snapshots.get(i);
        }
        fail("no active snapshot published");
        return null;
    }

    private void awaitEnded(int count) {
        await().atMost(TIMEOUT).until(() -> ended.get() >= count);
    }

    private static void block(CountDownLatch latch) throws InterruptedIOException {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException();
        }
    }

    @Test
    void threeFilesWithOneTransientFailure() throws Exception {
        MediaFile a = source.add("A", 100, 1);
        MediaFile b = source.add("B", 200, 2);
        MediaFile c = source.add("C", 50, 3);
        source.failOnce("B", 2);

        download.requestDownload(List.of(a, b, c), false);
        awaitEnded(1);

        TransferSnapshot last = lastActive();
        assertEquals(3, last.transferredFiles());
        assertEquals(350, last.transferredBytes());
        assertEquals(350, last.totalBytes());
        assertEquals(1, queue.totalRetries());
        assertEquals(List.of("A", "B", "C"), completed);
        assertTrue(reported.isEmpty());

        // The retry picked up after the chunk that made it
        assertEquals(List.of(0L, 50L), source.openOffsets("B"));
        for (String name : List.of("A", "B", "C")) {
            assertArrayEquals(source.content(name), Files.readAllBytes(store.finalPath(name)));
            assertFalse(store.hasTemporary(name));
            assertNull(store.loadPartialState(name));
        }
        assertFalse(download.snapshot().active());
    }

    @Test
    void pauseAndResumeProduceIdenticalFile() throws Exception {
        source = new MemoryMediaSource(1000);
        download = new DownloadCoordinator(loop, queue, source, store, io, reported::add);
        download.addListener(new TransferListener() {
            @Override
            public void onSnapshot(TransferSnapshot snapshot) {
                snapshots.add(snapshot);
            }

            @Override
            public void onTransferEnded(String leg) {
                ended.incrementAndGet();
            }
        });
        MediaFile f = source.add("clip.mp4", 20_000, 9);

        AtomicBoolean paused = new AtomicBoolean();
        source.setReadHook((name, position) -> {
            if (position >= 8000 && paused.compareAndSet(false, true)) {
                download.pause();
                loop.run(() -> { });
            }
        });

        download.requestDownload(List.of(f), false);
        await().atMost(TIMEOUT).until(() -> download.snapshot().paused() && !queue.isExecuting());

        TransferSnapshot pausedSnap = download.snapshot();
        assertEquals(PauseReason.USER, pausedSnap.pausedReason());
        assertEquals(8000, pausedSnap.currentOffset());
        assertEquals(8000, pausedSnap.transferredBytes());
        assertEquals(20_000, pausedSnap.totalBytes());

        // A second pause changes nothing
        download.pause();
        assertEquals(pausedSnap, loop.call(download::snapshot));

        download.resume();
        awaitEnded(1);

        assertEquals(List.of(0L, 8000L), source.openOffsets("clip.mp4"));
        assertArrayEquals(source.content("clip.mp4"), Files.readAllBytes(store.finalPath("clip.mp4")));
        assertEquals(20_000, lastActive().transferredBytes());
    }

    @Test
    void restartResumesFromSidecar() throws Exception {
        MediaFile f = source.add("V.MP4", 5000, 4);
        byte[] content = source.content("V.MP4");
        // The temp file may hold more than the sidecar committed
        Files.write(store.tempPath("V.MP4"), Arrays.copyOf(content, 3000));
        store.savePartialState("V.MP4", 5000, 2000);

        download.requestDownload(List.of(f), false);
        awaitEnded(1);

        assertEquals(List.of(2000L), source.openOffsets("V.MP4"));
        assertArrayEquals(content, Files.readAllBytes(store.finalPath("V.MP4")));
        assertEquals(5000, lastActive().transferredBytes());
        assertNull(store.loadPartialState("V.MP4"));
    }

    @Test
    void staleTemporaryWithoutSidecarStartsOver() throws Exception {
        MediaFile f = source.add("V.MP4", 5000, 4);
        Files.write(store.tempPath("V.MP4"), new byte[3000]);

        download.requestDownload(List.of(f), false);
        awaitEnded(1);

        assertEquals(List.of(0L), source.openOffsets("V.MP4"));
        assertArrayEquals(source.content("V.MP4"), Files.readAllBytes(store.finalPath("V.MP4")));
    }

    @Test
    void sidecarForDifferentSizeIsIgnored() throws Exception {
        MediaFile f = source.add("V.MP4", 5000, 4);
        Files.write(store.tempPath("V.MP4"), new byte[3000]);
        store.savePartialState("V.MP4", 9999, 2000);

        download.requestDownload(List.of(f), false);
        awaitEnded(1);

        assertEquals(List.of(0L), source.openOffsets("V.MP4"));
        assertArrayEquals(source.content("V.MP4"), Files.readAllBytes(store.finalPath("V.MP4")));
    }

    @Test
    void temporaryCopyKeepsTemporaryName() throws Exception {
        MediaFile f = source.add("T.JPG", 120, 5);

        download.requestDownload(List.of(f), true);
        awaitEnded(1);

        assertEquals(List.of("T.JPG"), completed);
        assertFalse(store.isSaved("T.JPG"));
        assertTrue(store.hasTemporary("T.JPG"));
        assertNull(store.loadPartialState("T.JPG"));
        assertArrayEquals(source.content("T.JPG"), Files.readAllBytes(store.tempPath("T.JPG")));
    }

    @Test
    void invalidAndSavedFilesAreSkippedWithOneNotice() throws Exception {
        MediaFile saved = source.add("S.JPG", 10, 6);
        Files.write(store.finalPath("S.JPG"), source.content("S.JPG"));
        MediaFile empty = new MediaFile("E.JPG", 0);

        download.requestDownload(List.of(saved, empty), false);

        await().atMost(TIMEOUT).until(() -> reported.size() == 1);
        assertEquals("Files skipped", reported.get(0).title());
        assertFalse(download.snapshot().active());
        assertTrue(source.openOffsets("S.JPG").isEmpty());
    }

    @Test
    void abandonedFileIsDroppedAndTheNextOneFetched() throws Exception {
        queue = new CommandQueue("device", loop, reported::add, 1, 10);
        download = new DownloadCoordinator(loop, queue, source, store, io, reported::add);
        download.addListener(new TransferListener() {
            @Override
            public void onTransferEnded(String leg) {
                ended.incrementAndGet();
            }
        });
        download.deviceConnected();

        MediaFile a = source.add("A", 100, 1);
        MediaFile b = source.add("B", 100, 2);
        source.failAlways("A");

        download.requestDownload(List.of(a, b), false);
        awaitEnded(1);

        assertEquals(2, source.openOffsets("A").size());
        assertEquals(1, reported.size());
        assertEquals("Download failed", reported.get(0).title());
        assertTrue(store.isSaved("B"));
        assertFalse(store.isSaved("A"));
        assertFalse(download.snapshot().active());
    }

    @Test
    void albumWriteFailurePausesUntilResumed() throws Exception {
        MediaFile a = source.add("A", 100, 1);
        MediaFile b = source.add("B", 100, 2);
        // A directory where the album file should go makes the final rename fail
        Files.createDirectories(store.finalPath("A").resolve("blocker"));

        download.requestDownload(List.of(a, b), false);
        await().atMost(TIMEOUT).until(() -> download.snapshot().pausedReason() == PauseReason.FAILURE
                && reported.size() == 1);

        assertEquals("Cannot save A", reported.get(0).title());
        assertEquals(1, download.snapshot().totalFiles());
        assertFalse(loop.call(() -> download.isPending("A")));
        assertTrue(source.openOffsets("B").isEmpty());

        download.resume();
        awaitEnded(1);
        assertTrue(store.isSaved("B"));
    }

    @Test
    void unexpectedDeviceErrorFailsTheFileInsteadOfHanging() throws Exception {
        MediaFile a = source.add("A", 100, 1);
        MediaFile b = source.add("B", 100, 2);
        source.setReadHook((name, position) -> {
            if (name.equals("A")) throw new IllegalStateException("driver bug");
        });

        download.requestDownload(List.of(a, b), false);
        awaitEnded(1);

        assertEquals(1, source.openOffsets("A").size());
        assertEquals(1, reported.size());
        assertEquals("Download failed", reported.get(0).title());
        assertTrue(store.isSaved("B"));
        await().atMost(TIMEOUT).until(() -> !queue.isExecuting());
    }

    @Test
    void cancellingCurrentFileDiscardsPartial() throws Exception {
        MediaFile a = source.add("A", 500, 1);
        MediaFile b = source.add("B", 100, 2);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        source.setReadHook((name, position) -> {
            if (name.equals("A") && position == 100) {
                started.countDown();
                block(release);
            }
        });

        download.requestDownload(List.of(a, b), false);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        download.cancel(List.of(a));
        TransferSnapshot afterCancel = loop.call(download::snapshot);
        assertEquals(1, afterCancel.totalFiles());
        assertEquals(100, afterCancel.totalBytes());
        assertEquals(0, afterCancel.transferredBytes());
        release.countDown();

        awaitEnded(1);
        assertTrue(store.isSaved("B"));
        assertFalse(store.isSaved("A"));
        await().atMost(TIMEOUT).until(() -> !store.hasTemporary("A"));
        assertNull(store.loadPartialState("A"));
    }

    @Test
    void deviceDisconnectKeepsPartialForLaterResume() throws Exception {
        MediaFile a = source.add("A", 500, 1);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        source.setReadHook((name, position) -> {
            if (position == 100 && started.getCount() > 0) {
                started.countDown();
                block(release);
            }
        });

        download.requestDownload(List.of(a), false);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        download.deviceDisconnected();
        loop.run(() -> { });
        release.countDown();
        // The fetch stops at its next chunk and records what it committed
        io.submit(() -> { }).get(10, TimeUnit.SECONDS);
        loop.run(() -> { });
        assertFalse(download.snapshot().active());
        assertNotNull(store.loadPartialState("A"));
        assertFalse(queue.isEnabled());
        assertTrue(store.hasTemporary("A"));
        long committed = store.loadPartialState("A").bytesWritten();
        assertTrue(committed >= 100);

        download.deviceConnected();
        download.requestDownload(List.of(a), false);
        awaitEnded(2);

        assertEquals(List.of(0L, committed), source.openOffsets("A"));
        assertArrayEquals(source.content("A"), Files.readAllBytes(store.finalPath("A")));
    }
}
