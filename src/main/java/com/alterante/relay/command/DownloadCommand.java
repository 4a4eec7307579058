package com.alterante.relay.command;

import com.alterante.relay.MediaRelay;
import com.alterante.relay.device.MediaFile;
import com.alterante.relay.transfer.DownloadCoordinator;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@CommandLine.Command(
        name = "download",
        description = "Save device media to the album, resuming partial files",
        mixinStandardHelpOptions = true
)
public class DownloadCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private RelayOptions options;

    @CommandLine.Option(names = {"--delete-after"}, description = "Remove files from the device once they are saved")
    private boolean deleteAfter;

    @CommandLine.Parameters(arity = "0..*", paramLabel = "NAME", description = "Files to download (default: all)")
    private List<String> names;

    @Override
    public Integer call() throws Exception {
        try {
            return doDownload();
        } catch (Exception e) {
            if (options.json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Integer doDownload() throws Exception {
        options.requireDevice();
        TransferWatch watch = new TransferWatch(options.json);
        try (MediaRelay relay = options.open(watch)) {
            watch.attach(relay, DownloadCoordinator.LEG);
            Runtime.getRuntime().addShutdownHook(new Thread(relay::close));

            List<MediaFile> files = RelayOptions.select(relay, names);
            int wanted = (int) files.stream()
                    .filter(f -> f.valid() && !relay.store().isSaved(f.name()))
                    .count();
            if (!options.json) {
                System.out.println("Downloading " + files.size() + " file(s) from " + options.device
                        + " to " + options.store);
            }
            long start = System.currentTimeMillis();
            relay.download(files);
            watch.await();

            int done = watch.completed(DownloadCoordinator.LEG);
            if (deleteAfter) {
                List<MediaFile> saved = files.stream()
                        .filter(f -> relay.store().isSaved(f.name()))
                        .collect(Collectors.toList());
                relay.deleteFromDevice(saved);
                if (!options.json) System.out.println("Removed " + saved.size() + " file(s) from the device");
            }
            long durationMs = System.currentTimeMillis() - start;
            if (options.json) {
                JsonOutput.complete(done, wanted - done, relay.totalRetries(), durationMs);
            } else {
                System.out.printf("Saved %d of %d file(s), %d retries, %.1fs%n",
                        done, wanted, relay.totalRetries(), durationMs / 1000.0);
            }
            return done >= wanted ? 0 : 1;
        }
    }
}
