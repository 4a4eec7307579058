package com.alterante.relay.transfer;

/**
 * Progress callbacks. Called on the event loop; implementations must not block.
 */
public interface TransferListener {

    /** After every state change of a leg. */
    default void onSnapshot(TransferSnapshot snapshot) {
    }

    default void onFileCompleted(String leg, String name) {
    }

    /** The leg has nothing left to move and dropped its state. */
    default void onTransferEnded(String leg) {
    }
}
