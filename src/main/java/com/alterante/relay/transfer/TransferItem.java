package com.alterante.relay.transfer;

/**
 * Anything a leg can move. The name is the identity across both legs.
 */
public interface TransferItem {

    String name();

    long size();
}
