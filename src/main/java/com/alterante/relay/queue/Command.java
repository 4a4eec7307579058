package com.alterante.relay.queue;

import java.util.function.Consumer;

/**
 * A unit of work executed by a {@link CommandQueue}.
 *
 * Implementations must report exactly once through {@code onDone}, from any thread,
 * and must never let an exception escape instead of reporting.
 */
public interface Command {

    void execute(Consumer<CommandResult> onDone);

    /**
     * Called on the event loop when the queue drops this command after a terminal failure
     * (retry budget spent or non-retryable).
     */
    default void onAbandoned(UserError error) {
    }
}
