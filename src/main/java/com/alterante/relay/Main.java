package com.alterante.relay;

import com.alterante.relay.command.DownloadCommand;
import com.alterante.relay.command.FetchCommand;
import com.alterante.relay.command.ListCommand;
import com.alterante.relay.command.RelayCommand;
import com.alterante.relay.command.UploadCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "alt-relay",
        description = "Resumable media relay for Alterante: device to album to processing server",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                ListCommand.class,
                DownloadCommand.class,
                UploadCommand.class,
                RelayCommand.class,
                FetchCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
