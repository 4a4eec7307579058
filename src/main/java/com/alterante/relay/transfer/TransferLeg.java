package com.alterante.relay.transfer;

/**
 * What both legs have in common, for callers that do not care which one they hold.
 */
public interface TransferLeg {

    String name();

    /** Pause by user request. No-op if already paused or idle. */
    void pause();

    /** Resume a user pause. No-op when running; ignored while force-paused. */
    void resume();

    /** Cancel everything and drop the state. */
    void stop();

    /** Latest published snapshot; safe from any thread. */
    TransferSnapshot snapshot();

    /** Update the speed estimate from the bytes moved in the last period. Loop only. */
    void sampleSpeed(long periodMs);

    void addListener(TransferListener listener);
}
