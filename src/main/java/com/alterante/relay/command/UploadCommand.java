package com.alterante.relay.command;

import com.alterante.relay.MediaRelay;
import com.alterante.relay.transfer.UploadCoordinator;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "upload",
        description = "Send local files to the processing server",
        mixinStandardHelpOptions = true
)
public class UploadCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private RelayOptions options;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to upload")
    private List<Path> files;

    @Override
    public Integer call() throws Exception {
        try {
            return doUpload();
        } catch (Exception e) {
            if (options.json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Integer doUpload() throws Exception {
        options.requireServer();
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("not a regular file: " + file);
            }
        }

        TransferWatch watch = new TransferWatch(options.json);
        try (MediaRelay relay = options.open(watch)) {
            watch.attach(relay, UploadCoordinator.LEG);
            if (options.json) {
                relay.addServerStateListener(JsonOutput::status);
            }
            Runtime.getRuntime().addShutdownHook(new Thread(relay::close));

            if (!options.json) System.out.println("Connecting to " + options.server + "...");
            relay.connectServer();

            long start = System.currentTimeMillis();
            relay.uploadLocal(files);
            watch.await();

            int done = watch.completed(UploadCoordinator.LEG);
            long durationMs = System.currentTimeMillis() - start;
            if (options.json) {
                JsonOutput.complete(done, files.size() - done, relay.totalRetries(), durationMs);
            } else {
                System.out.printf("Uploaded %d of %d file(s), %d retries, %.1fs%n",
                        done, files.size(), relay.totalRetries(), durationMs / 1000.0);
            }
            return done >= files.size() ? 0 : 1;
        }
    }
}
