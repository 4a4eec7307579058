package com.alterante.relay.command;

import com.alterante.relay.MediaRelay;
import com.alterante.relay.queue.ErrorReporter;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.transfer.TransferListener;
import com.alterante.relay.transfer.TransferSnapshot;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Console side of a transfer: prints errors, completed files and a progress line, and
 * waits until the relay has settled.
 */
final class TransferWatch implements TransferListener, ErrorReporter {

    private static final long REFRESH_MS = 250;

    private final boolean json;
    private final Set<String> completed = ConcurrentHashMap.newKeySet();
    private final AtomicInteger errors = new AtomicInteger();
    private volatile List<String> legs = List.of();
    private volatile MediaRelay relay;

    TransferWatch(boolean json) {
        this.json = json;
    }

    /** Attach to the relay and report on the given legs ("download", "upload"). */
    void attach(MediaRelay relay, String... legs) {
        this.relay = relay;
        this.legs = List.of(legs);
        relay.downloadLeg().addListener(this);
        relay.uploadLeg().addListener(this);
    }

    /** Block until both legs are idle or stopped by a failure. */
    void await() throws InterruptedException {
        Thread progressThread = new Thread(this::printProgress, "progress");
        progressThread.setDaemon(true);
        progressThread.start();
        try {
            while (!relay.awaitIdle(Duration.ofMinutes(1))) {
                // keep waiting; a suspended upload resumes when the server is back
            }
        } finally {
            progressThread.interrupt();
            progressThread.join(REFRESH_MS * 2);
        }
        if (!json) System.out.println();
    }

    int completed(String leg) {
        int n = 0;
        for (String key : completed) {
            if (key.startsWith(leg + ":")) n++;
        }
        return n;
    }

    int errors() {
        return errors.get();
    }

    @Override
    public void report(UserError error) {
        errors.incrementAndGet();
        if (json) {
            JsonOutput.error(error);
        } else {
            System.err.println();
            System.err.println("Error: " + error);
        }
    }

    @Override
    public void onFileCompleted(String leg, String name) {
        if (!legs.contains(leg) || !completed.add(leg + ":" + name)) return;
        if (json) {
            JsonOutput.fileComplete(leg, name);
        } else {
            System.out.println("\r" + leg + "ed " + name);
        }
    }

    private void printProgress() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                StringBuilder line = new StringBuilder("\r");
                for (String leg : legs) {
                    TransferSnapshot s = leg.equals("download") ? relay.downloadSnapshot() : relay.uploadSnapshot();
                    if (!s.active()) continue;
                    if (json) {
                        JsonOutput.progress(s);
                    } else {
                        line.append(leg).append(' ').append(s.progressBar(30)).append("  ");
                    }
                }
                if (!json && line.length() > 1) {
                    System.out.print(line);
                    System.out.flush();
                }
                Thread.sleep(REFRESH_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
