package com.alterante.relay.transfer;

import com.alterante.relay.device.MediaFile;
import com.alterante.relay.device.MediaStream;
import com.alterante.relay.queue.Command;
import com.alterante.relay.queue.CommandResult;
import com.alterante.relay.queue.EventLoop;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.storage.LocalMediaStore;
import com.alterante.relay.storage.PartialDownloadState;
import com.alterante.relay.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.function.Consumer;

/**
 * Downloads the cursor's file, then reports. One step per file: the step completes when
 * the whole file is local, so a retry resumes from the last accounted chunk.
 *
 * Chunks are copied on the download I/O thread. Each written chunk is accounted on the
 * event loop; the committed offset is also saved to the sidecar every
 * {@link #SIDECAR_INTERVAL_MS} and whenever the copy stops short.
 */
final class DownloadStep implements Command {

    private static final Logger log = LoggerFactory.getLogger(DownloadStep.class);

    static final int CHUNK_SIZE = 64 * 1024;
    static final long SIDECAR_INTERVAL_MS = 2000;

    private final DownloadCoordinator coordinator;

    DownloadStep(DownloadCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void execute(Consumer<CommandResult> onDone) {
        TransferState<MediaFile> state = coordinator.state();
        if (state == null || state.isPaused()) {
            onDone.accept(CommandResult.ok());
            return;
        }
        if (state.pendingCount() == 0) {
            coordinator.finish();
            onDone.accept(CommandResult.ok());
            return;
        }

        MediaFile file = state.selectCurrent();
        long offset = state.currentOffset();
        Cancellation token = coordinator.beginFetch();
        coordinator.io().execute(() -> fetch(file, offset, token, onDone));
    }

    @Override
    public void onAbandoned(UserError error) {
        coordinator.stepAbandoned(error);
    }

    /** I/O thread. */
    private void fetch(MediaFile file, long offset, Cancellation token, Consumer<CommandResult> onDone) {
        EventLoop loop = coordinator.loop();
        LocalMediaStore store = coordinator.store();
        String name = file.name();

        // A fresh cursor may pick up where a previous process left off
        long start = offset;
        if (start == 0) {
            PartialDownloadState saved = store.loadPartialState(name);
            if (saved != null && saved.matches(file) && store.tempLength(name) >= saved.bytesWritten()) {
                start = saved.bytesWritten();
                if (start > 0) {
                    log.info("Resuming {} at byte {}", name, start);
                    long restored = start;
                    loop.execute(() -> coordinator.onChunk(file, token, restored));
                }
            }
        }

        long written = start;
        try {
            try (OutputStream out = store.openPartial(name, start);
                 MediaStream in = coordinator.source().open(file, start)) {
                byte[] buf = new byte[CHUNK_SIZE];
                long lastSave = System.currentTimeMillis();
                while (true) {
                    if (token.isCancelled()) {
                        log.debug("Fetch of {} cancelled at byte {}", name, written);
                        loop.execute(() -> coordinator.onFetchFailed(file, token, CommandResult.ok(), onDone));
                        return;
                    }
                    int n = in.read(buf);
                    if (n < 0) break;
                    write(out, buf, n, name);
                    written += n;
                    int chunk = n;
                    loop.execute(() -> coordinator.onChunk(file, token, chunk));

                    long now = System.currentTimeMillis();
                    if (now - lastSave >= SIDECAR_INTERVAL_MS) {
                        saveProgress(store, file, written);
                        lastSave = now;
                    }
                }
            }
            if (written != file.size()) {
                throw new IOException("Device returned " + written + " of " + file.size() + " bytes");
            }
        } catch (StorageException e) {
            UserError error = new UserError("Cannot save " + name, e.getMessage());
            loop.execute(() -> coordinator.onSaveFailed(file, token, error, onDone));
            return;
        } catch (IOException e) {
            log.warn("Download of {} interrupted at byte {}: {}", name, written, e.getMessage());
            CommandResult failed = CommandResult.retry(new UserError("Download failed", name + ": " + e.getMessage()));
            loop.execute(() -> coordinator.onFetchFailed(file, token, failed, onDone));
            return;
        } catch (RuntimeException e) {
            log.error("Download of {} failed unexpectedly at byte {}", name, written, e);
            CommandResult failed = CommandResult.fail(new UserError("Download failed", name + ": " + e));
            loop.execute(() -> coordinator.onFetchFailed(file, token, failed, onDone));
            return;
        } finally {
            if (written < file.size()) {
                saveProgress(store, file, written);
            }
        }
        loop.execute(() -> coordinator.onFetchComplete(file, token, onDone));
    }

    private static void write(OutputStream out, byte[] buf, int n, String name) throws StorageException {
        try {
            out.write(buf, 0, n);
        } catch (IOException e) {
            throw new StorageException("Cannot write " + name + ": " + e.getMessage(), e);
        }
    }

    private static void saveProgress(LocalMediaStore store, MediaFile file, long written) {
        try {
            store.savePartialState(file.name(), file.size(), written);
        } catch (StorageException e) {
            log.warn("Could not record progress of {}: {}", file.name(), e.getMessage());
        }
    }
}
