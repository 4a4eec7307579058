package com.alterante.relay.transfer;

import com.alterante.relay.device.MediaFile;
import com.alterante.relay.device.MediaSource;
import com.alterante.relay.queue.CommandQueue;
import com.alterante.relay.queue.CommandResult;
import com.alterante.relay.queue.ErrorReporter;
import com.alterante.relay.queue.EventLoop;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.storage.LocalMediaStore;
import com.alterante.relay.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * The device to local leg.
 *
 * Files are fetched one at a time, in request order, by {@link DownloadStep} commands on
 * the device queue. A file is written under its temporary name and renamed when complete;
 * temporary downloads (upload sources) keep the temporary name.
 *
 * All state is confined to the event loop. Public methods may be called from any thread.
 */
public class DownloadCoordinator implements TransferLeg {

    private static final Logger log = LoggerFactory.getLogger(DownloadCoordinator.class);

    public static final String LEG = "download";

    private final EventLoop loop;
    private final CommandQueue queue;
    private final MediaSource source;
    private final LocalMediaStore store;
    private final Executor io;
    private final ErrorReporter reporter;
    private final List<TransferListener> listeners = new CopyOnWriteArrayList<>();

    private UploadCoordinator uploadLeg;
    private TransferState<MediaFile> state;
    private final Set<String> temporary = new HashSet<>();
    private Cancellation activeFetch;
    private boolean saveFailed;
    private volatile TransferSnapshot snapshot = TransferSnapshot.idle(LEG);

    public DownloadCoordinator(EventLoop loop, CommandQueue queue, MediaSource source, LocalMediaStore store,
                               Executor io, ErrorReporter reporter) {
        this.loop = loop;
        this.queue = queue;
        this.source = source;
        this.store = store;
        this.io = io;
        this.reporter = reporter;
    }

    /** Completions and cancellations are reported to this upload leg. */
    public void linkUploadLeg(UploadCoordinator uploadLeg) {
        loop.dispatch(() -> this.uploadLeg = uploadLeg);
    }

    @Override
    public String name() { return LEG; }

    /**
     * Add files to the download set.
     *
     * @param temporaryCopy keep the files under their temporary name as upload sources
     *                      instead of saving them to the album
     */
    public void requestDownload(Collection<MediaFile> files, boolean temporaryCopy) {
        List<MediaFile> request = List.copyOf(files);
        loop.dispatch(() -> applyRequest(request, temporaryCopy));
    }

    private void applyRequest(List<MediaFile> request, boolean temporaryCopy) {
        TransferState<MediaFile> target = state != null ? state : new TransferState<>();
        List<String> unavailable = new ArrayList<>();
        List<MediaFile> alreadySaved = new ArrayList<>();
        List<MediaFile> promote = new ArrayList<>();
        List<MediaFile> readyTemporary = new ArrayList<>();
        int skipped = 0;
        int added = 0;

        // Step 1: pending files that reached the album some other way
        for (MediaFile f : target.pendingItems()) {
            if (!temporary.contains(f.name()) && store.isSaved(f.name())) {
                dropPending(target, f.name());
                alreadySaved.add(f);
            }
        }

        // Step 2: merge the request
        for (MediaFile f : request) {
            String name = f.name();
            if (!f.valid()) {
                skipped++;
                unavailable.add(name);
            } else if (target.isPending(name)) {
                if (!temporaryCopy && temporary.remove(name)) {
                    log.debug("{} will be saved to the album after all", name);
                }
            } else if (store.isSaved(name)) {
                if (temporaryCopy) {
                    alreadySaved.add(f);
                } else {
                    skipped++;
                }
            } else if (hasCompleteTemporary(f)) {
                if (temporaryCopy) {
                    readyTemporary.add(f);
                } else {
                    promote.add(f);
                }
            } else {
                target.addPending(f);
                if (temporaryCopy) temporary.add(name);
                added++;
            }
        }

        // Step 3: lifecycle
        if (state == null) {
            if (!target.isEmpty()) {
                state = target;
                log.info("Download started: {} files, {}", state.totalFiles(),
                        TransferSnapshot.formatSize(state.totalBytes()));
                queue.pushOnce(new DownloadStep(this));
            }
        } else if (added > 0) {
            if (state.isPaused()) {
                state.resume();
                log.info("Download resumed by new request");
            }
            if (!state.isPaused()) {
                queue.pushOnce(new DownloadStep(this));
            }
        }
        if (state != null && state.isEmpty()) {
            finish();
        } else {
            publish();
        }

        // Step 4: other leg and notices
        for (MediaFile f : promote) {
            promoteTemporary(f);
        }
        if (uploadLeg != null) {
            for (MediaFile f : alreadySaved) {
                uploadLeg.downloadCompleted(f.name(), store.finalPath(f.name()), false);
            }
            for (MediaFile f : readyTemporary) {
                uploadLeg.downloadCompleted(f.name(), store.tempPath(f.name()), true);
            }
            if (!unavailable.isEmpty()) {
                uploadLeg.downloadCancelled(unavailable);
            }
        }
        if (skipped > 0) {
            reporter.report(Notices.skipped(skipped, "invalid or already saved"));
        }
    }

    private boolean hasCompleteTemporary(MediaFile f) {
        return store.hasTemporary(f.name())
                && store.tempLength(f.name()) == f.size()
                && store.loadPartialState(f.name()) == null;
    }

    private void promoteTemporary(MediaFile f) {
        io.execute(() -> {
            try {
                store.promoteTemporary(f.name());
                loop.execute(() -> {
                    log.info("Saved {} from its upload copy", f.name());
                    for (TransferListener l : listeners) l.onFileCompleted(LEG, f.name());
                });
            } catch (StorageException e) {
                loop.execute(() -> reporter.report(new UserError("Cannot save " + f.name(), e.getMessage())));
            }
        });
    }

    /** Remove files from the download set. Waiting uploads for them are cancelled. */
    public void cancel(Collection<MediaFile> files) {
        List<String> names = new ArrayList<>();
        for (MediaFile f : files) names.add(f.name());
        loop.dispatch(() -> {
            if (state == null) return;
            List<String> removed = new ArrayList<>();
            for (String name : names) {
                if (dropPending(state, name)) {
                    discardPartial(name);
                    removed.add(name);
                }
            }
            if (removed.isEmpty()) return;
            log.info("Removed {} files from download", removed.size());
            if (uploadLeg != null) {
                uploadLeg.downloadCancelled(removed);
            }
            continueOrFinish();
        });
    }

    /** The upload leg no longer needs these files: drop downloads made only for it. */
    public void uploadCancelled(Collection<String> names) {
        List<String> copy = List.copyOf(names);
        loop.dispatch(() -> {
            if (state == null) return;
            int dropped = 0;
            for (String name : copy) {
                if (temporary.contains(name) && dropPending(state, name)) {
                    discardPartial(name);
                    dropped++;
                }
            }
            if (dropped == 0) return;
            log.info("Dropped {} downloads no upload needs any more", dropped);
            continueOrFinish();
        });
    }

    @Override
    public void pause() {
        loop.dispatch(() -> {
            if (state == null || !state.pause(PauseReason.USER, false)) return;
            cancelFetch();
            log.info("Download paused");
            publish();
        });
    }

    @Override
    public void resume() {
        loop.dispatch(() -> {
            if (state == null || !state.isPaused()) return;
            if (state.isForcePaused()) {
                log.info("Download cannot be resumed: {}", state.pauseReason());
                return;
            }
            state.resume();
            log.info("Download resumed");
            queue.pushOnce(new DownloadStep(this));
            publish();
        });
    }

    @Override
    public void stop() {
        loop.dispatch(() -> {
            if (state == null) return;
            cancelFetch();
            List<String> names = new ArrayList<>(state.pendingNames());
            for (String name : names) {
                discardPartial(name);
            }
            log.info("Download stopped, {} files cancelled", names.size());
            tearDown();
            if (uploadLeg != null && !names.isEmpty()) {
                uploadLeg.downloadCancelled(names);
            }
        });
    }

    /** The device is reachable: enable its queue and continue any transfer. */
    public void deviceConnected() {
        loop.dispatch(() -> {
            log.info("Device connected");
            queue.setEnabled(true);
            if (state != null && !state.isPaused()) {
                queue.pushOnce(new DownloadStep(this));
            }
        });
    }

    /**
     * The device went away: nothing queued for it can run. The transfer is dropped and
     * waiting uploads are cancelled. Partial files stay on disk for a later resume.
     */
    public void deviceDisconnected() {
        loop.dispatch(() -> {
            log.info("Device disconnected");
            queue.clear();
            cancelFetch();
            if (state != null) {
                List<String> names = new ArrayList<>(state.pendingNames());
                tearDown();
                if (uploadLeg != null && !names.isEmpty()) {
                    uploadLeg.downloadCancelled(names);
                }
            }
            queue.setEnabled(false);
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

    /** True if the file is in the download set. Loop only. */
    public boolean isPending(String name) {
        return state != null && state.isPending(name);
    }

    // --- step callbacks, all on the loop ---

    TransferState<MediaFile> state() { return state; }
    LocalMediaStore store() { return store; }
    MediaSource source() { return source; }
    Executor io() { return io; }
    EventLoop loop() { return loop; }

    Cancellation beginFetch() {
        saveFailed = false;
        activeFetch = new Cancellation();
        return activeFetch;
    }

    void onChunk(MediaFile file, Cancellation token, long bytes) {
        if (token != activeFetch || token.isCancelled()) return;
        if (state == null || state.isPaused() || !state.isCurrent(file.name())) return;
        state.addProgress(bytes);
        publish();
    }

    void onFetchComplete(MediaFile file, Cancellation token, Consumer<CommandResult> onDone) {
        if (token == activeFetch) activeFetch = null;
        if (token.isCancelled() || state == null || !state.isCurrent(file.name())) {
            onDone.accept(CommandResult.ok());
            return;
        }

        boolean temp = temporary.contains(file.name());
        Path path;
        try {
            path = temp ? keepTemporary(file.name()) : store.commit(file.name());
        } catch (StorageException e) {
            saveFailed = true;
            onDone.accept(CommandResult.fail(new UserError("Cannot save " + file.name(), e.getMessage())));
            return;
        }
        temporary.remove(file.name());
        state.completeCurrent();
        log.info("Downloaded {} ({}/{})", file.name(), state.transferredFiles(), state.totalFiles());
        publish();
        for (TransferListener l : listeners) l.onFileCompleted(LEG, file.name());
        if (uploadLeg != null) {
            uploadLeg.downloadCompleted(file.name(), path, temp);
        }
        queue.pushOnce(new DownloadStep(this));
        onDone.accept(CommandResult.ok());
    }

    void onFetchFailed(MediaFile file, Cancellation token, CommandResult result, Consumer<CommandResult> onDone) {
        if (token == activeFetch) activeFetch = null;
        if (token.isCancelled()) {
            onDone.accept(CommandResult.ok());
            return;
        }
        log.debug("Fetch of {} failed: {}", file.name(), result.error());
        onDone.accept(result);
    }

    /** The local copy could not be written. */
    void onSaveFailed(MediaFile file, Cancellation token, UserError error, Consumer<CommandResult> onDone) {
        if (token == activeFetch && !token.isCancelled()) saveFailed = true;
        onFetchFailed(file, token, CommandResult.fail(error), onDone);
    }

    /**
     * The queue gave up on the current file. It leaves the set and waiting uploads for it
     * are cancelled. The next file is fetched, unless the album could not be written:
     * then the leg pauses until resumed or a new request arrives.
     */
    void stepAbandoned(UserError error) {
        if (state == null) return;
        MediaFile failed = state.current();
        if (failed != null) {
            dropPending(state, failed.name());
            if (uploadLeg != null) {
                uploadLeg.downloadCancelled(List.of(failed.name()));
            }
            log.warn("Download of {} abandoned: {}", failed.name(), error);
        }
        boolean localFailure = saveFailed;
        saveFailed = false;
        if (localFailure && !state.isEmpty()) {
            state.pause(PauseReason.FAILURE, false);
            log.warn("Download paused, local storage failed");
            publish();
            return;
        }
        continueOrFinish();
    }

    /** Nothing pending: drop the state. */
    void finish() {
        if (state == null) return;
        log.info("Download finished: {} files, {}", state.transferredFiles(),
                TransferSnapshot.formatSize(state.transferredBytes()));
        tearDown();
    }

    // --- internals ---

    private Path keepTemporary(String name) {
        store.clearPartialState(name);
        return store.tempPath(name);
    }

    /** After files left the set: the fetch of a dropped cursor is cancelled, so queue the next one. */
    private void continueOrFinish() {
        if (state.isEmpty()) {
            finish();
            return;
        }
        if (!state.isPaused()) {
            queue.pushOnce(new DownloadStep(this));
        }
        publish();
    }

    private boolean dropPending(TransferState<MediaFile> target, String name) {
        if (!target.isPending(name)) return false;
        if (target.isCurrent(name)) {
            cancelFetch();
        }
        target.removePending(name);
        temporary.remove(name);
        return true;
    }

    /** Runs on the I/O executor, so it is ordered after any fetch still writing the file. */
    private void discardPartial(String name) {
        io.execute(() -> {
            try {
                store.discardPartial(name);
            } catch (StorageException e) {
                log.warn("Could not remove partial download of {}: {}", name, e.getMessage());
            }
        });
    }

    private void cancelFetch() {
        if (activeFetch != null) {
            activeFetch.cancel();
            activeFetch = null;
        }
    }

    private void tearDown() {
        state = null;
        temporary.clear();
        activeFetch = null;
        publish();
        for (TransferListener l : listeners) l.onTransferEnded(LEG);
    }

    private void publish() {
        TransferSnapshot s = state == null ? TransferSnapshot.idle(LEG) : state.snapshot(LEG);
        snapshot = s;
        for (TransferListener l : listeners) l.onSnapshot(s);
    }
}
