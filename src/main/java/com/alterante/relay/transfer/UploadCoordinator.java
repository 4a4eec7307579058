package com.alterante.relay.transfer;

import com.alterante.relay.queue.CommandQueue;
import com.alterante.relay.queue.CommandResult;
import com.alterante.relay.queue.ErrorReporter;
import com.alterante.relay.queue.EventLoop;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.storage.LocalMediaStore;
import com.alterante.relay.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * The local to server leg.
 *
 * Pending files are sent one at a time by {@link UploadStep} commands on the server queue.
 * The server cannot resume an upload, so an interrupted file restarts from byte 0.
 * Entries in the waiting set are files the download leg has not delivered yet; they count
 * towards the totals and move to the pending set on {@link #downloadCompleted}.
 *
 * All state is confined to the event loop. Public methods may be called from any thread.
 */
public class UploadCoordinator implements TransferLeg {

    private static final Logger log = LoggerFactory.getLogger(UploadCoordinator.class);

    public static final String LEG = "upload";

    private final EventLoop loop;
    private final CommandQueue queue;
    private final UploadTarget target;
    private final LocalMediaStore store;
    private final Executor io;
    private final ErrorReporter reporter;
    private final List<TransferListener> listeners = new CopyOnWriteArrayList<>();

    private DownloadCoordinator downloadLeg;
    private TransferState<UploadItem> state;
    private final Set<String> remote = new LinkedHashSet<>();
    private Cancellation activeSend;
    private volatile TransferSnapshot snapshot = TransferSnapshot.idle(LEG);

    public UploadCoordinator(EventLoop loop, CommandQueue queue, UploadTarget target, LocalMediaStore store,
                             Executor io, ErrorReporter reporter) {
        this.loop = loop;
        this.queue = queue;
        this.target = target;
        this.store = store;
        this.io = io;
        this.reporter = reporter;
    }

    /** Waiting entries are fulfilled by, and cancellations reported to, this download leg. */
    public void linkDownloadLeg(DownloadCoordinator downloadLeg) {
        loop.dispatch(() -> this.downloadLeg = downloadLeg);
    }

    @Override
    public String name() { return LEG; }

    public void requestUpload(Collection<UploadItem> localFiles, Collection<WaitingFile> waitingOnDownload) {
        requestUpload(localFiles, waitingOnDownload, true);
    }

    /**
     * Add files to the upload set.
     *
     * @param localFiles        files on disk; an entry already in the set wins over a new one
     * @param waitingOnDownload files the download leg will deliver
     * @param startIfUserPaused whether new files resume a leg the user paused
     */
    public void requestUpload(Collection<UploadItem> localFiles, Collection<WaitingFile> waitingOnDownload,
                              boolean startIfUserPaused) {
        List<UploadItem> local = List.copyOf(localFiles);
        List<WaitingFile> waiting = List.copyOf(waitingOnDownload);
        loop.dispatch(() -> applyRequest(local, waiting, startIfUserPaused));
    }

    private void applyRequest(List<UploadItem> localFiles, List<WaitingFile> waitingFiles, boolean startIfUserPaused) {
        TransferState<UploadItem> target = state != null ? state : new TransferState<>();
        List<String> noLongerNeeded = new ArrayList<>();
        int skipped = 0;
        int added = 0;

        // Step 1: entries the server received in the meantime
        for (UploadItem item : target.pendingItems()) {
            if (remote.contains(item.name())) {
                dropPending(target, item.name());
                deleteIfTemporary(item);
            }
        }
        for (WaitingFile w : target.waitingItems()) {
            if (remote.contains(w.name())) {
                target.removeWaiting(w.name());
                noLongerNeeded.add(w.name());
            }
        }

        // Step 2: local files
        for (UploadItem item : localFiles) {
            String name = item.name();
            if (remote.contains(name)) {
                skipped++;
                deleteIfTemporary(item);
            } else if (target.isPending(name)) {
                log.debug("{} already queued for upload", name);
            } else if (!Files.isRegularFile(item.source())) {
                skipped++;
            } else {
                target.addPending(item);
                target.removeWaiting(name);
                added++;
            }
        }

        // Step 3: files still on the device
        for (WaitingFile w : waitingFiles) {
            String name = w.name();
            if (remote.contains(name)) {
                skipped++;
                noLongerNeeded.add(name);
            } else if (!target.isPending(name) && target.addWaiting(w)) {
                added++;
            }
        }

        // Step 4: lifecycle
        if (state == null && !target.isEmpty()) {
            state = target;
            log.info("Upload started: {} files, {}", state.totalFiles(), TransferSnapshot.formatSize(state.totalBytes()));
        }
        if (state != null) {
            if (state.isEmpty()) {
                finish();
            } else {
                if (added > 0 && state.isPaused()) {
                    PauseReason reason = state.pauseReason();
                    if (reason == PauseReason.DEPENDENCY
                            || (reason == PauseReason.USER && startIfUserPaused)) {
                        state.resume();
                    }
                }
                if (!state.isPaused()) {
                    if (state.pendingCount() == 0) {
                        waitForDownloads();
                    } else {
                        queue.pushOnce(new UploadStep(this));
                    }
                }
                publish();
            }
        }

        // Step 5: other leg and notices
        if (downloadLeg != null && !noLongerNeeded.isEmpty()) {
            downloadLeg.uploadCancelled(noLongerNeeded);
        }
        if (skipped > 0) {
            reporter.report(Notices.skipped(skipped, "missing or already on the server"));
        }
    }

    /**
     * A download finished. If an upload waits for it, the file joins the pending set.
     * A temporary copy nobody waits for is deleted.
     */
    public void downloadCompleted(String name, Path path, boolean temporary) {
        loop.dispatch(() -> {
            if (state == null || !state.isWaiting(name)) {
                if (temporary) {
                    deleteSource(path);
                }
                return;
            }
            WaitingFile w = state.removeWaiting(name);
            state.addPending(new UploadItem(name, path, w.size(), temporary));
            log.debug("{} is local now, queued for upload", name);
            if (state.isPaused() && state.pauseReason() == PauseReason.DEPENDENCY) {
                state.resume();
            }
            if (!state.isPaused()) {
                queue.pushOnce(new UploadStep(this));
            }
            publish();
        });
    }

    /** Downloads will not happen: drop the waiting entries for them. */
    public void downloadCancelled(Collection<String> names) {
        List<String> copy = List.copyOf(names);
        loop.dispatch(() -> {
            if (state == null) return;
            int removed = 0;
            for (String name : copy) {
                if (state.removeWaiting(name) != null) removed++;
            }
            if (removed == 0) return;
            log.info("{} uploads cancelled with their downloads", removed);
            if (state.isEmpty()) {
                finish();
            } else {
                publish();
            }
        });
    }

    /** Replace the list of files already on the server, and drop entries it now contains. */
    public void setRemoteFiles(Collection<String> names) {
        List<String> copy = List.copyOf(names);
        loop.dispatch(() -> {
            remote.clear();
            remote.addAll(copy);
            log.debug("Server holds {} files", remote.size());
            if (state != null) {
                applyRequest(List.of(), List.of(), false);
            }
        });
    }

    public Set<String> remoteFiles() {
        return loop.call(() -> Set.copyOf(remote));
    }

    /**
     * Connection to the server lost or restored. While it is down the leg is suspended;
     * the file in flight restarts once it is back.
     */
    public void connectionChanged(boolean connected) {
        loop.dispatch(() -> {
            if (state == null) return;
            if (!connected) {
                if (state.isPaused()) return;
                state.pause(PauseReason.SUSPENDED, true);
                state.rollbackCurrent();
                cancelSend();
                log.info("Upload suspended until the server is back");
                publish();
            } else if (state.isPaused() && state.pauseReason() == PauseReason.SUSPENDED) {
                state.resume();
                log.info("Upload continues");
                if (state.pendingCount() == 0) {
                    waitForDownloads();
                } else {
                    queue.pushOnce(new UploadStep(this));
                }
                publish();
            }
        });
    }

    /** The server session closed cleanly: the upload set is discarded. */
    public void sessionClosed() {
        loop.dispatch(() -> {
            if (state == null) return;
            log.info("Server session closed, discarding upload");
            discard();
        });
    }

    @Override
    public void pause() {
        loop.dispatch(() -> {
            if (state == null || !state.pause(PauseReason.USER, false)) return;
            state.rollbackCurrent();
            cancelSend();
            log.info("Upload paused");
            publish();
        });
    }

    @Override
    public void resume() {
        loop.dispatch(() -> {
            if (state == null || !state.isPaused()) return;
            if (state.isForcePaused()) {
                log.info("Upload cannot be resumed: {}", state.pauseReason());
                return;
            }
            state.resume();
            log.info("Upload resumed");
            if (state.pendingCount() == 0) {
                waitForDownloads();
            } else {
                queue.pushOnce(new UploadStep(this));
            }
            publish();
        });
    }

    @Override
    public void stop() {
        loop.dispatch(() -> {
            if (state == null) return;
            log.info("Upload stopped");
            discard();
        });
    }

    @Override
    public TransferSnapshot snapshot() {
        return snapshot;
    }

    @Override
    public void sampleSpeed(long periodMs) {
        if (state == null) return;
        state.sampleSpeed(periodMs);
        publish();
    }

    @Override
    public void addListener(TransferListener listener) {
        listeners.add(listener);
    }

    /** True if the file is pending or waiting. Loop only. */
    public boolean isTracked(String name) {
        return state != null && (state.isPending(name) || state.isWaiting(name));
    }

    /** True if the server already holds the file. Loop only. */
    public boolean isRemote(String name) {
        return remote.contains(name);
    }

    // --- step callbacks, all on the loop ---

    TransferState<UploadItem> state() { return state; }
    UploadTarget target() { return target; }
    Executor io() { return io; }
    EventLoop loop() { return loop; }

    Cancellation beginSend() {
        activeSend = new Cancellation();
        return activeSend;
    }

    void onBytesSent(UploadItem item, Cancellation token, long bytes) {
        if (token != activeSend || token.isCancelled()) return;
        if (state == null || !state.isCurrent(item.name())) return;
        if (state.isPaused()) {
            token.cancel();
            state.rollbackCurrent();
            publish();
            return;
        }
        state.addProgress(bytes);
        publish();
    }

    void onUploaded(UploadItem item, Cancellation token, String taskId, Consumer<CommandResult> onDone) {
        if (token == activeSend) activeSend = null;
        remote.add(item.name());
        deleteIfTemporary(item);
        log.info("Uploaded {} (task {})", item.name(), taskId);

        // The server has the file even if the leg was paused or stopped meanwhile
        if (state != null && state.isCurrent(item.name())) {
            state.completeCurrent();
            publish();
        } else if (state != null && state.isPending(item.name())) {
            state.removePending(item.name());
            publish();
        }
        for (TransferListener l : listeners) l.onFileCompleted(LEG, item.name());
        queue.pushOnce(new UploadStep(this));
        onDone.accept(CommandResult.ok());
    }

    void onSendEnded(UploadItem item, Cancellation token, CommandResult result, Consumer<CommandResult> onDone) {
        if (token == activeSend) activeSend = null;
        if (state != null && state.isCurrent(item.name())) {
            state.rollbackCurrent();
            publish();
        }
        onDone.accept(token.isCancelled() ? CommandResult.ok() : result);
    }

    /** The source vanished: drop that entry and carry on with the rest. */
    void onSourceMissing(UploadItem item, Cancellation token, Consumer<CommandResult> onDone) {
        if (token == activeSend) activeSend = null;
        if (state != null && state.isPending(item.name())) {
            state.removePending(item.name());
            queue.pushOnce(new UploadStep(this));
            publish();
        }
        onDone.accept(CommandResult.fail(new UserError("File missing",
                item.name() + " is no longer at " + item.source())));
    }

    /** The queue gave up on the file in flight: drop it and move on to the next one. */
    void stepAbandoned(UserError error) {
        if (state == null || state.current() == null) return;
        UploadItem failed = state.current();
        dropPending(state, failed.name());
        deleteIfTemporary(failed);
        log.warn("Upload of {} abandoned: {}", failed.name(), error);
        if (state.isEmpty()) {
            finish();
            return;
        }
        if (state.isPaused()) {
            publish();
        } else if (state.pendingCount() > 0) {
            queue.pushOnce(new UploadStep(this));
            publish();
        } else {
            waitForDownloads();
        }
    }

    /** Pending set empty: wait for downloads, or finish if nothing waits either. */
    void waitForDownloads() {
        if (state == null) return;
        if (state.waitingCount() == 0) {
            finish();
            return;
        }
        if (state.pause(PauseReason.DEPENDENCY, true)) {
            log.info("Upload waiting for {} downloads", state.waitingCount());
        }
        publish();
    }

    void finish() {
        if (state == null) return;
        log.info("Upload finished: {} files, {}", state.transferredFiles(),
                TransferSnapshot.formatSize(state.transferredBytes()));
        tearDown();
    }

    // --- internals ---

    private void discard() {
        cancelSend();
        List<String> waitingNames = new ArrayList<>();
        for (WaitingFile w : state.waitingItems()) waitingNames.add(w.name());
        for (UploadItem item : state.pendingItems()) {
            deleteIfTemporary(item);
        }
        tearDown();
        if (downloadLeg != null && !waitingNames.isEmpty()) {
            downloadLeg.uploadCancelled(waitingNames);
        }
    }

    private void dropPending(TransferState<UploadItem> target, String name) {
        if (target.isCurrent(name)) {
            cancelSend();
        }
        target.removePending(name);
    }

    private void deleteIfTemporary(UploadItem item) {
        if (item.temporary()) {
            deleteSource(item.source());
        }
    }

    /** Runs on the I/O executor, after any send still reading the file. */
    private void deleteSource(Path path) {
        io.execute(() -> {
            try {
                store.delete(path);
                log.debug("Deleted temporary source {}", path.getFileName());
            } catch (StorageException e) {
                log.warn("Could not delete temporary source {}: {}", path.getFileName(), e.getMessage());
            }
        });
    }

    private void cancelSend() {
        if (activeSend != null) {
            activeSend.cancel();
            activeSend = null;
        }
    }

    private void tearDown() {
        state = null;
        activeSend = null;
        publish();
        for (TransferListener l : listeners) l.onTransferEnded(LEG);
    }

    private void publish() {
        TransferSnapshot s = state == null ? TransferSnapshot.idle(LEG) : state.snapshot(LEG);
        snapshot = s;
        for (TransferListener l : listeners) l.onSnapshot(s);
    }
}
