package com.alterante.relay.command;

import com.alterante.relay.device.MediaFile;
import com.alterante.relay.http.ConnectionState;
import com.alterante.relay.queue.UserError;
import com.alterante.relay.transfer.TransferSnapshot;

/**
 * Emits newline-delimited JSON events to stdout for machine-readable output.
 * Used by every subcommand when the --json flag is set.
 */
final class JsonOutput {

    private JsonOutput() {}

    static void status(ConnectionState state) {
        emit("{\"event\":\"status\",\"state\":\"%s\"}", state.name().toLowerCase());
    }

    static void media(MediaFile file, String status) {
        emit("{\"event\":\"media\",\"name\":\"%s\",\"size\":%d,\"valid\":%b,\"status\":\"%s\"}",
                escapeJson(file.name()), file.size(), file.valid(), status);
    }

    static void progress(TransferSnapshot s) {
        emit("{\"event\":\"progress\",\"leg\":\"%s\",\"bytes\":%d,\"total\":%d,\"files\":%d,\"total_files\":%d,"
                        + "\"waiting\":%d,\"current\":\"%s\",\"speed_bps\":%.0f,\"eta_seconds\":%d,\"percent\":%.1f,"
                        + "\"paused\":\"%s\"}",
                s.leg(),
                s.transferredBytes(),
                s.totalBytes(),
                s.transferredFiles(),
                s.totalFiles(),
                s.waitingFiles(),
                escapeJson(s.currentFile()),
                s.speed(),
                s.etaSeconds(),
                s.percentComplete(),
                s.pausedReason() == null ? "" : s.pausedReason().name().toLowerCase());
    }

    static void fetchProgress(String name, long bytes) {
        emit("{\"event\":\"progress\",\"leg\":\"fetch\",\"name\":\"%s\",\"bytes\":%d}", escapeJson(name), bytes);
    }

    static void fileComplete(String leg, String name) {
        emit("{\"event\":\"file_complete\",\"leg\":\"%s\",\"name\":\"%s\"}", leg, escapeJson(name));
    }

    static void complete(int files, int failed, long retries, long durationMs) {
        emit("{\"event\":\"complete\",\"files\":%d,\"failed\":%d,\"retries\":%d,\"duration_ms\":%d}",
                files, failed, retries, durationMs);
    }

    static void complete(long bytes, long durationMs, String path) {
        emit("{\"event\":\"complete\",\"bytes\":%d,\"duration_ms\":%d,\"path\":\"%s\"}",
                bytes, durationMs, escapeJson(path));
    }

    static void error(UserError error) {
        emit("{\"event\":\"error\",\"title\":\"%s\",\"message\":\"%s\"}",
                escapeJson(error.title()), escapeJson(error.message()));
    }

    static void error(String message) {
        emit("{\"event\":\"error\",\"message\":\"%s\"}", escapeJson(message));
    }

    private static void emit(String format, Object... args) {
        System.out.println(String.format(format, args));
        System.out.flush();
    }

    private static String escapeJson(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
