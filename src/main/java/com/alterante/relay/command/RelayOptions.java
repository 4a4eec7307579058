package com.alterante.relay.command;

import com.alterante.relay.MediaRelay;
import com.alterante.relay.RelayConfig;
import com.alterante.relay.device.DirectoryMediaSource;
import com.alterante.relay.device.MediaFile;
import com.alterante.relay.queue.CommandQueue;
import com.alterante.relay.queue.ErrorReporter;
import com.alterante.relay.storage.LocalMediaStore;
import com.alterante.relay.storage.StorageException;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options shared by every subcommand.
 */
public class RelayOptions {

    @CommandLine.Option(names = {"--device", "-d"}, description = "Device media directory")
    Path device;

    @CommandLine.Option(names = {"--store"}, description = "Local album directory (default: ${DEFAULT-VALUE})",
            defaultValue = "album")
    Path store;

    @CommandLine.Option(names = {"--server"}, description = "Processing server (host:port)")
    String server;

    @CommandLine.Option(names = {"--token"}, description = "Bearer token for the processing server")
    String token;

    @CommandLine.Option(names = {"--session", "-s"}, description = "Session ID sent to the processing server")
    String session;

    @CommandLine.Option(names = {"--retries"}, description = "Retries per step before giving up (default: ${DEFAULT-VALUE})",
            defaultValue = "" + CommandQueue.DEFAULT_RETRIES)
    int retries;

    @CommandLine.Option(names = {"--retry-delay"}, description = "Delay before a retry in ms (default: ${DEFAULT-VALUE})",
            defaultValue = "" + CommandQueue.DEFAULT_RETRY_DELAY_MS)
    long retryDelayMs;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    boolean json;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log transfer activity to stderr")
    void setVerbose(boolean verbose) {
        // Read by slf4j-simple when the first logger is created
        if (verbose) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "info");
        }
    }

    RelayConfig config() {
        RelayConfig config = RelayConfig.defaults().withRetries(retries, retryDelayMs);
        if (server != null) {
            config = config.withServer(RelayConfig.Server.parse(server, token, session));
        }
        return config;
    }

    MediaRelay open(ErrorReporter reporter) throws StorageException {
        DirectoryMediaSource source = device != null ? new DirectoryMediaSource(device) : null;
        return new MediaRelay(config(), source, new LocalMediaStore(store), reporter);
    }

    void requireDevice() {
        if (device == null) {
            throw new IllegalArgumentException("--device is required");
        }
    }

    void requireServer() {
        if (server == null) {
            throw new IllegalArgumentException("--server is required");
        }
    }

    /** The named device files, or all of them when no names are given. */
    static List<MediaFile> select(MediaRelay relay, List<String> names) throws IOException {
        List<MediaFile> media = relay.listMedia();
        if (names == null || names.isEmpty()) {
            return media;
        }
        Map<String, MediaFile> byName = new LinkedHashMap<>();
        for (MediaFile f : media) {
            byName.put(f.name(), f);
        }
        List<MediaFile> selected = new ArrayList<>();
        for (String name : names) {
            MediaFile f = byName.get(name);
            if (f == null) {
                throw new IllegalArgumentException("not on the device: " + name);
            }
            selected.add(f);
        }
        return selected;
    }
}
