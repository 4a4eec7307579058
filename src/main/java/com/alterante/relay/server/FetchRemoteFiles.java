package com.alterante.relay.server;

import com.alterante.relay.http.HttpProtocolException;
import com.alterante.relay.queue.Command;
import com.alterante.relay.queue.CommandResult;
import com.alterante.relay.queue.EventLoop;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.transfer.UploadCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Refresh the list of files the server already holds, so the upload leg skips them.
 */
public class FetchRemoteFiles implements Command {

    private static final Logger log = LoggerFactory.getLogger(FetchRemoteFiles.class);

    private final ServerSession session;
    private final UploadCoordinator upload;
    private final EventLoop loop;
    private final Executor io;

    public FetchRemoteFiles(ServerSession session, UploadCoordinator upload, EventLoop loop, Executor io) {
        this.session = session;
        this.upload = upload;
        this.loop = loop;
        this.io = io;
    }

    @Override
    public void execute(Consumer<CommandResult> onDone) {
        io.execute(() -> {
            try {
                List<String> names = session.listRemoteFiles();
                log.debug("Server reports {} files", names.size());
                loop.execute(() -> {
                    upload.setRemoteFiles(names);
                    onDone.accept(CommandResult.ok());
                });
            } catch (HttpProtocolException e) {
                onDone.accept(CommandResult.fail(new UserError("Cannot list server files", e.getMessage())));
            } catch (IOException e) {
                onDone.accept(CommandResult.retry(new UserError("Cannot reach server", e.getMessage())));
            }
        });
    }
}
