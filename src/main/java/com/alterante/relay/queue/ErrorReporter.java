package com.alterante.relay.queue;

/**
 * Collaborator that displays terminal failures and aggregated notices.
 */
@FunctionalInterface
public interface ErrorReporter {

    void report(UserError error);
}
