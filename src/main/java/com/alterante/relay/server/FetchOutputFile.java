package com.alterante.relay.server;

import com.alterante.relay.http.HttpProtocolException;
import com.alterante.relay.http.TransferCancelledException;
import com.alterante.relay.queue.Command;
import com.alterante.relay.queue.CommandResult;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.transfer.Cancellation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * Download one processing output from the server into a local file.
 */
public class FetchOutputFile implements Command {

    private static final Logger log = LoggerFactory.getLogger(FetchOutputFile.class);

    private final ServerSession session;
    private final String name;
    private final Path destination;
    private final Executor io;
    private final LongConsumer onBytesReceived;
    private final Consumer<Path> onSaved;
    private final Consumer<UserError> onFailed;
    private final Cancellation cancellation = new Cancellation();

    public FetchOutputFile(ServerSession session, String name, Path destination, Executor io,
                           LongConsumer onBytesReceived, Consumer<Path> onSaved, Consumer<UserError> onFailed) {
        this.session = session;
        this.name = name;
        this.destination = destination;
        this.io = io;
        this.onBytesReceived = onBytesReceived;
        this.onSaved = onSaved;
        this.onFailed = onFailed;
    }

    /** Stop at the next chunk; the partial file is removed. */
    public void cancel() {
        cancellation.cancel();
    }

    @Override
    public void execute(Consumer<CommandResult> onDone) {
        io.execute(() -> {
            try {
                session.downloadOutput(name, destination, onBytesReceived, cancellation);
                log.info("Fetched {} to {}", name, destination);
                onSaved.accept(destination);
                onDone.accept(CommandResult.ok());
            } catch (TransferCancelledException e) {
                log.info("Fetch of {} cancelled", name);
                onFailed.accept(new UserError("Fetch cancelled", name));
                onDone.accept(CommandResult.ok());
            } catch (HttpProtocolException e) {
                onDone.accept(CommandResult.fail(new UserError("Cannot fetch " + name, e.getMessage())));
            } catch (IOException e) {
                onDone.accept(CommandResult.retry(new UserError("Cannot reach server", e.getMessage())));
            }
        });
    }

    @Override
    public void onAbandoned(UserError error) {
        onFailed.accept(error);
    }
}
