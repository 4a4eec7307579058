package com.alterante.relay.transfer;

import com.alterante.relay.queue.UserError;

final class Notices {

    private Notices() {}

    /** One notice per request, however many files it excluded. */
    static UserError skipped(int count, String reason) {
        return new UserError("Files skipped",
                count + (count == 1 ? " file was" : " files were") + " skipped: " + reason);
    }
}
