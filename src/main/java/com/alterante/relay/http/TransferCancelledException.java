package com.alterante.relay.http;

import java.io.IOException;

/**
 * A streaming call stopped at a chunk boundary because it was cancelled.
 */
public class TransferCancelledException extends IOException {

    private final long bytesTransferred;

    public TransferCancelledException(long bytesTransferred) {
        super("Transfer cancelled after " + bytesTransferred + " bytes");
        this.bytesTransferred = bytesTransferred;
    }

    public long bytesTransferred() { return bytesTransferred; }
}
