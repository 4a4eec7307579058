package com.alterante.relay.transfer;

/**
 * An upload entry that is not local yet: it waits for the download leg.
 */
public record WaitingFile(String name, long size) implements TransferItem {
}
