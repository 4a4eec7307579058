package com.alterante.relay.transfer;

import com.alterante.relay.http.HttpProtocolException;
import com.alterante.relay.http.TransferCancelledException;
import com.alterante.relay.queue.Command;
import com.alterante.relay.queue.CommandResult;
import com.alterante.relay.queue.EventLoop;
import com.alterante.relay.queue.UserError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.function.Consumer;

/**
 * Uploads the first pending file from byte 0, then reports.
 */
final class UploadStep implements Command {

    private static final Logger log = LoggerFactory.getLogger(UploadStep.class);

    private final UploadCoordinator coordinator;

    UploadStep(UploadCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void execute(Consumer<CommandResult> onDone) {
        TransferState<UploadItem> state = coordinator.state();
        if (state == null || state.isPaused()) {
            onDone.accept(CommandResult.ok());
            return;
        }
        if (state.pendingCount() == 0) {
            coordinator.waitForDownloads();
            onDone.accept(CommandResult.ok());
            return;
        }

        UploadItem item = state.selectCurrent();
        if (state.currentOffset() > 0) {
            state.rollbackCurrent();
        }
        Cancellation token = coordinator.beginSend();
        coordinator.io().execute(() -> send(item, token, onDone));
    }

    @Override
    public void onAbandoned(UserError error) {
        coordinator.stepAbandoned(error);
    }

    /** I/O thread. */
    private void send(UploadItem item, Cancellation token, Consumer<CommandResult> onDone) {
        EventLoop loop = coordinator.loop();
        try {
            String taskId = coordinator.target().upload(item.name(), item.source(),
                    n -> loop.execute(() -> coordinator.onBytesSent(item, token, n)), token);
            loop.execute(() -> coordinator.onUploaded(item, token, taskId, onDone));
        } catch (TransferCancelledException e) {
            loop.execute(() -> coordinator.onSendEnded(item, token, CommandResult.ok(), onDone));
        } catch (NoSuchFileException e) {
            log.warn("Upload source {} disappeared", item.source());
            loop.execute(() -> coordinator.onSourceMissing(item, token, onDone));
        } catch (HttpProtocolException e) {
            log.warn("Server rejected {}: {}", item.name(), e.getMessage());
            CommandResult failed = CommandResult.fail(new UserError("Upload rejected", item.name() + ": " + e.getMessage()));
            loop.execute(() -> coordinator.onSendEnded(item, token, failed, onDone));
        } catch (IOException e) {
            log.warn("Upload of {} interrupted: {}", item.name(), e.getMessage());
            CommandResult failed = CommandResult.retry(new UserError("Upload failed", item.name() + ": " + e.getMessage()));
            loop.execute(() -> coordinator.onSendEnded(item, token, failed, onDone));
        } catch (RuntimeException e) {
            log.error("Upload of {} failed unexpectedly", item.name(), e);
            CommandResult failed = CommandResult.fail(new UserError("Upload failed", item.name() + ": " + e));
            loop.execute(() -> coordinator.onSendEnded(item, token, failed, onDone));
        }
    }
}
