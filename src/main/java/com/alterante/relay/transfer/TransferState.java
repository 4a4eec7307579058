package com.alterante.relay.transfer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Set membership, cursor and byte accounting of one leg.
 *
 * Not thread-safe: owned by the event loop. Every mutation ends in {@link #recalculate()},
 * which re-derives the totals from the sets so that
 * {@code transferredBytes + remainingBytes() == totalBytes} holds after every call.
 *
 * @param <T> the pending item type of the leg
 */
public class TransferState<T extends TransferItem> {

    private final Map<String, T> pending = new LinkedHashMap<>();
    private final Map<String, WaitingFile> waiting = new LinkedHashMap<>();

    private T current;
    private long currentOffset;

    private boolean paused;
    private boolean forcePaused;
    private PauseReason pauseReason;

    private long totalBytes;
    private int totalFiles;
    private long transferredBytes;
    private int transferredFiles;

    private double speed;
    private long speedLastBytes;

    // --- set membership ---

    /** Add an item unless one with the same name is pending. Returns true if added. */
    public boolean addPending(T item) {
        if (pending.containsKey(item.name())) return false;
        pending.put(item.name(), item);
        recalculate();
        return true;
    }

    /**
     * Remove a pending item. If it is the cursor's file, the cursor is cleared and its
     * offset no longer counts as transferred.
     */
    public T removePending(String name) {
        T removed = pending.remove(name);
        if (removed != null && current != null && current.name().equals(name)) {
            transferredBytes -= currentOffset;
            current = null;
            currentOffset = 0;
        }
        recalculate();
        return removed;
    }

    public boolean addWaiting(WaitingFile file) {
        if (waiting.containsKey(file.name())) return false;
        waiting.put(file.name(), file);
        recalculate();
        return true;
    }

    public WaitingFile removeWaiting(String name) {
        WaitingFile removed = waiting.remove(name);
        recalculate();
        return removed;
    }

    public boolean isPending(String name) {
        return pending.containsKey(name);
    }

    public boolean isWaiting(String name) {
        return waiting.containsKey(name);
    }

    public T pendingItem(String name) {
        return pending.get(name);
    }

    public List<T> pendingItems() {
        return new ArrayList<>(pending.values());
    }

    public List<WaitingFile> waitingItems() {
        return new ArrayList<>(waiting.values());
    }

    public int pendingCount() {
        return pending.size();
    }

    public int waitingCount() {
        return waiting.size();
    }

    /** Both sets are empty: the state should be dropped. */
    public boolean isEmpty() {
        return pending.isEmpty() && waiting.isEmpty();
    }

    // --- cursor ---

    /**
     * Point the cursor at the first pending item, unless it already points somewhere.
     * Returns the cursor's file, or null when nothing is pending.
     */
    public T selectCurrent() {
        if (current == null && !pending.isEmpty()) {
            current = pending.values().iterator().next();
            currentOffset = 0;
        }
        return current;
    }

    /** Account bytes moved for the cursor's file. */
    public void addProgress(long bytes) {
        if (current == null) {
            throw new IllegalStateException("No current file");
        }
        currentOffset += bytes;
        transferredBytes += bytes;
        recalculate();
    }

    /** Forget the cursor's offset: the file restarts from byte 0. */
    public void rollbackCurrent() {
        transferredBytes -= currentOffset;
        currentOffset = 0;
        recalculate();
    }

    /**
     * The cursor's file is done. Bytes not yet accounted through {@link #addProgress}
     * are added so the whole file counts.
     */
    public void completeCurrent() {
        if (current == null) {
            throw new IllegalStateException("No current file");
        }
        transferredBytes += current.size() - currentOffset;
        pending.remove(current.name());
        transferredFiles++;
        current = null;
        currentOffset = 0;
        recalculate();
    }

    public T current() { return current; }
    public long currentOffset() { return currentOffset; }

    public boolean isCurrent(String name) {
        return current != null && current.name().equals(name);
    }

    // --- pause ---

    /** Returns false if already paused. */
    public boolean pause(PauseReason reason, boolean force) {
        if (paused) {
            // A forced pause overrides a user pause, never the other way round
            if (force && !forcePaused) {
                forcePaused = true;
                pauseReason = reason;
            }
            return false;
        }
        paused = true;
        forcePaused = force;
        pauseReason = reason;
        return true;
    }

    /** Clear any pause. Returns false if not paused. */
    public boolean resume() {
        if (!paused) return false;
        paused = false;
        forcePaused = false;
        pauseReason = null;
        return true;
    }

    public boolean isPaused() { return paused; }
    public boolean isForcePaused() { return forcePaused; }
    public PauseReason pauseReason() { return pauseReason; }

    // --- accounting ---

    /** Re-derive totals from the sets. */
    public void recalculate() {
        long sum = 0;
        for (T item : pending.values()) sum += item.size();
        for (WaitingFile w : waiting.values()) sum += w.size();
        totalBytes = (transferredBytes - currentOffset) + sum;
        totalFiles = transferredFiles + pending.size() + waiting.size();
    }

    /** Bytes still to move: everything pending or waiting, minus what the cursor holds. */
    public long remainingBytes() {
        long sum = -currentOffset;
        for (T item : pending.values()) sum += item.size();
        for (WaitingFile w : waiting.values()) sum += w.size();
        return sum;
    }

    public void sampleSpeed(long periodMs) {
        long delta = transferredBytes - speedLastBytes;
        speedLastBytes = transferredBytes;
        speed = delta <= 0 || periodMs <= 0 ? 0 : delta * 1000.0 / periodMs;
    }

    public long totalBytes() { return totalBytes; }
    public int totalFiles() { return totalFiles; }
    public long transferredBytes() { return transferredBytes; }
    public int transferredFiles() { return transferredFiles; }
    public double speed() { return speed; }

    public TransferSnapshot snapshot(String leg) {
        return new TransferSnapshot(leg, true, totalBytes, transferredBytes, totalFiles, transferredFiles,
                waiting.size(), current == null ? null : current.name(), currentOffset,
                paused ? pauseReason : null, speed);
    }

    /** Names of pending items, in transfer order. */
    public Collection<String> pendingNames() {
        return new ArrayList<>(pending.keySet());
    }
}
