package com.alterante.relay.transfer;

import com.alterante.relay.device.MediaFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransferStateTest {

    private static void assertBalanced(TransferState<?> s) {
        assertEquals(s.totalBytes(), s.transferredBytes() + s.remainingBytes(),
                "transferred + remaining must equal total");
        assertEquals(s.totalFiles(), s.transferredFiles() + s.pendingCount() + s.waitingCount());
    }

    @Test
    void totalsFollowSetMembership() {
        TransferState<MediaFile> s = new TransferState<>();
        assertTrue(s.addPending(new MediaFile("a", 100)));
        assertTrue(s.addPending(new MediaFile("b", 50)));
        assertFalse(s.addPending(new MediaFile("a", 999)));
        assertTrue(s.addWaiting(new WaitingFile("c", 25)));

        assertEquals(175, s.totalBytes());
        assertEquals(3, s.totalFiles());
        assertEquals(List.of("a", "b"), List.copyOf(s.pendingNames()));
        assertBalanced(s);
    }

    @Test
    void invariantHoldsThroughCursorLifecycle() {
        TransferState<MediaFile> s = new TransferState<>();
        s.addPending(new MediaFile("a", 100));
        s.addPending(new MediaFile("b", 200));
        s.addWaiting(new WaitingFile("c", 50));

        assertEquals("a", s.selectCurrent().name());
        s.addProgress(40);
        assertEquals(40, s.currentOffset());
        assertEquals(350, s.totalBytes());
        assertBalanced(s);

        s.rollbackCurrent();
        assertEquals(0, s.transferredBytes());
        assertBalanced(s);

        s.addProgress(70);
        s.completeCurrent();
        assertEquals(100, s.transferredBytes());
        assertEquals(1, s.transferredFiles());
        assertNull(s.current());
        assertEquals(350, s.totalBytes());
        assertBalanced(s);

        assertEquals("b", s.selectCurrent().name());
        s.addProgress(10);
        s.removePending("b");
        assertEquals(100, s.transferredBytes());
        assertEquals(150, s.totalBytes());
        assertBalanced(s);

        s.removeWaiting("c");
        assertEquals(100, s.totalBytes());
        assertEquals(1, s.totalFiles());
        assertTrue(s.isEmpty());
        assertBalanced(s);
    }

    @Test
    void completeWithoutChunksCountsWholeFile() {
        TransferState<MediaFile> s = new TransferState<>();
        s.addPending(new MediaFile("a", 64));
        s.selectCurrent();
        s.completeCurrent();

        assertEquals(64, s.transferredBytes());
        assertEquals(64, s.totalBytes());
        assertBalanced(s);
    }

    @Test
    void selectCurrentKeepsExistingCursor() {
        TransferState<MediaFile> s = new TransferState<>();
        s.addPending(new MediaFile("a", 10));
        s.addPending(new MediaFile("b", 10));
        s.selectCurrent();
        s.addProgress(5);

        assertEquals("a", s.selectCurrent().name());
        assertEquals(5, s.currentOffset());
    }

    @Test
    void progressWithoutCursorIsRejected() {
        TransferState<MediaFile> s = new TransferState<>();
        assertThrows(IllegalStateException.class, () -> s.addProgress(1));
        assertThrows(IllegalStateException.class, s::completeCurrent);
        assertNull(s.selectCurrent());
    }

    @Test
    void pauseIsIdempotent() {
        TransferState<MediaFile> s = new TransferState<>();
        assertTrue(s.pause(PauseReason.USER, false));
        assertFalse(s.pause(PauseReason.USER, false));
        assertTrue(s.isPaused());
        assertEquals(PauseReason.USER, s.pauseReason());

        assertTrue(s.resume());
        assertFalse(s.resume());
        assertFalse(s.isPaused());
        assertNull(s.pauseReason());
    }

    @Test
    void forcedPauseOverridesUserPauseOnly() {
        TransferState<MediaFile> s = new TransferState<>();
        s.pause(PauseReason.USER, false);
        assertFalse(s.pause(PauseReason.FAILURE, true));
        assertEquals(PauseReason.FAILURE, s.pauseReason());
        assertTrue(s.isForcePaused());

        assertFalse(s.pause(PauseReason.USER, false));
        assertEquals(PauseReason.FAILURE, s.pauseReason());
    }

    @Test
    void snapshotReflectsState() {
        TransferState<MediaFile> s = new TransferState<>();
        s.addPending(new MediaFile("a", 100));
        s.addWaiting(new WaitingFile("w", 100));
        s.selectCurrent();
        s.addProgress(50);
        s.pause(PauseReason.USER, false);

        TransferSnapshot snap = s.snapshot("download");
        assertTrue(snap.active());
        assertEquals(200, snap.totalBytes());
        assertEquals(50, snap.transferredBytes());
        assertEquals(1, snap.waitingFiles());
        assertEquals("a", snap.currentFile());
        assertEquals(PauseReason.USER, snap.pausedReason());
        assertEquals(25.0, snap.percentComplete(), 0.001);
        assertTrue(snap.progressBar(10).contains("paused (user)"));
    }

    @Test
    void speedIsBytesPerSecondOverPeriod() {
        TransferState<MediaFile> s = new TransferState<>();
        s.addPending(new MediaFile("a", 10_000));
        s.selectCurrent();
        s.addProgress(1000);
        s.sampleSpeed(500);
        assertEquals(2000.0, s.speed(), 0.001);

        s.sampleSpeed(500);
        assertEquals(0.0, s.speed(), 0.001);
    }
}
