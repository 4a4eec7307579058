package com.alterante.relay.command;

import com.alterante.relay.device.DirectoryMediaSource;
import com.alterante.relay.device.MediaFile;
import com.alterante.relay.storage.LocalMediaStore;
import com.alterante.relay.transfer.TransferSnapshot;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "list",
        description = "List media on the device and whether the album holds it",
        mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private RelayOptions options;

    @Override
    public Integer call() throws Exception {
        try {
            return doList();
        } catch (Exception e) {
            if (options.json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Integer doList() throws Exception {
        options.requireDevice();
        LocalMediaStore store = new LocalMediaStore(options.store);
        List<MediaFile> media = new DirectoryMediaSource(options.device).listMedia();

        for (MediaFile f : media) {
            String status = status(store, f);
            if (options.json) {
                JsonOutput.media(f, status);
            } else {
                System.out.printf("%-40s %10s  %s%n", f.name(), TransferSnapshot.formatSize(f.size()), status);
            }
        }
        if (!options.json) {
            System.out.println(media.size() + " file(s) on " + options.device);
        }
        return 0;
    }

    private static String status(LocalMediaStore store, MediaFile f) {
        if (!f.valid()) return "invalid";
        if (store.isSaved(f.name())) return "saved";
        long partial = store.tempLength(f.name());
        if (partial > 0) {
            return String.format("partial %.0f%%", partial * 100.0 / f.size());
        }
        return "";
    }
}
