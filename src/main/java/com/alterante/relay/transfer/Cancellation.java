package com.alterante.relay.transfer;

import java.util.function.BooleanSupplier;

/**
 * Cancellation token for one streaming call. Checked at every chunk boundary.
 */
public final class Cancellation implements BooleanSupplier {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public boolean getAsBoolean() {
        return cancelled;
    }
}
