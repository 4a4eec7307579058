package com.alterante.relay.command;

import com.alterante.relay.MediaRelay;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

@CommandLine.Command(
        name = "fetch",
        description = "Download a processing output from the server",
        mixinStandardHelpOptions = true
)
public class FetchCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private RelayOptions options;

    @CommandLine.Parameters(index = "0", paramLabel = "NAME", description = "Output file name on the server")
    private String name;

    @CommandLine.Option(names = {"--output", "-o"}, description = "Output directory (default: ${DEFAULT-VALUE})",
            defaultValue = ".")
    private Path outputDir;

    @Override
    public Integer call() throws Exception {
        try {
            return doFetch();
        } catch (Exception e) {
            if (options.json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Integer doFetch() throws Exception {
        options.requireServer();
        Files.createDirectories(outputDir);
        Path destination = outputDir.resolve(Path.of(name).getFileName());

        TransferWatch watch = new TransferWatch(options.json);
        try (MediaRelay relay = options.open(watch)) {
            if (options.json) {
                relay.addServerStateListener(JsonOutput::status);
            }
            if (!options.json) System.out.println("Connecting to " + options.server + "...");
            relay.connectServer();

            long start = System.currentTimeMillis();
            AtomicLong received = new AtomicLong();
            Path saved;
            try {
                saved = relay.fetchOutput(name, destination, n -> {
                    long total = received.addAndGet(n);
                    if (options.json) {
                        JsonOutput.fetchProgress(name, total);
                    } else {
                        System.out.print("\rReceived " + total + " bytes");
                        System.out.flush();
                    }
                }).get();
            } catch (ExecutionException e) {
                // Already printed by the reporter
                return 1;
            }

            long durationMs = System.currentTimeMillis() - start;
            if (options.json) {
                JsonOutput.complete(received.get(), durationMs, saved.toString());
            } else {
                System.out.println();
                System.out.printf("Saved %s (%d bytes) in %.1fs%n", saved, received.get(), durationMs / 1000.0);
            }
            return 0;
        }
    }
}
