package com.alterante.relay.command;

import com.alterante.relay.MediaRelay;
import com.alterante.relay.device.MediaFile;
import com.alterante.relay.transfer.DownloadCoordinator;
import com.alterante.relay.transfer.UploadCoordinator;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "relay",
        description = "Send device media to the processing server, downloading it first where needed",
        mixinStandardHelpOptions = true
)
public class RelayCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private RelayOptions options;

    @CommandLine.Parameters(arity = "0..*", paramLabel = "NAME", description = "Files to relay (default: all)")
    private List<String> names;

    @Override
    public Integer call() throws Exception {
        try {
            return doRelay();
        } catch (Exception e) {
            if (options.json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Integer doRelay() throws Exception {
        options.requireDevice();
        options.requireServer();

        TransferWatch watch = new TransferWatch(options.json);
        try (MediaRelay relay = options.open(watch)) {
            watch.attach(relay, DownloadCoordinator.LEG, UploadCoordinator.LEG);
            if (options.json) {
                relay.addServerStateListener(JsonOutput::status);
            }
            Runtime.getRuntime().addShutdownHook(new Thread(relay::close));

            if (!options.json) System.out.println("Connecting to " + options.server + "...");
            relay.connectServer();

            List<MediaFile> files = RelayOptions.select(relay, names);
            int wanted = (int) files.stream().filter(MediaFile::valid).count();
            if (!options.json) {
                System.out.println("Relaying " + files.size() + " file(s) from " + options.device);
            }
            long start = System.currentTimeMillis();
            relay.uploadFromDevice(files);
            watch.await();

            int done = watch.completed(UploadCoordinator.LEG);
            long durationMs = System.currentTimeMillis() - start;
            if (options.json) {
                JsonOutput.complete(done, wanted - done, relay.totalRetries(), durationMs);
            } else {
                System.out.printf("Uploaded %d of %d file(s), %d retries, %.1fs%n",
                        done, wanted, relay.totalRetries(), durationMs / 1000.0);
            }
            return watch.errors() == 0 ? 0 : 1;
        }
    }
}
