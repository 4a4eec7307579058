package com.alterante.relay.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default reporter: user errors go to the log.
 */
public class LoggingErrorReporter implements ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorReporter.class);

    @Override
    public void report(UserError error) {
        log.error("{}: {}", error.title(), error.message());
    }
}
