package com.alterante.relay.transfer;

/**
 * Why a leg is not moving bytes.
 */
public enum PauseReason {
    /** Paused by the user; {@code resume()} continues. */
    USER,
    /** Upload leg only: every remaining entry waits on a download. */
    DEPENDENCY,
    /** Download leg only: the album could not be written. {@code resume()} or a new request clears it. */
    FAILURE,
    /** Upload leg only: the server connection dropped and is being restored. */
    SUSPENDED
}
