package com.alterante.relay.transfer;

/**
 * Immutable view of one leg, published after every state change.
 *
 * @param leg              "download" or "upload"
 * @param active           false when the leg holds no state (all other fields are zero)
 * @param currentFile      file being moved, or null
 * @param pausedReason     null while running
 * @param speed            bytes per second over the last sampling period
 */
public record TransferSnapshot(String leg,
                               boolean active,
                               long totalBytes,
                               long transferredBytes,
                               int totalFiles,
                               int transferredFiles,
                               int waitingFiles,
                               String currentFile,
                               long currentOffset,
                               PauseReason pausedReason,
                               double speed) {

    public static TransferSnapshot idle(String leg) {
        return new TransferSnapshot(leg, false, 0, 0, 0, 0, 0, null, 0, null, 0);
    }

    public boolean paused() {
        return pausedReason != null;
    }

    public long remainingBytes() {
        return totalBytes - transferredBytes;
    }

    public double percentComplete() {
        if (totalBytes == 0) return active ? 0.0 : 100.0;
        return (transferredBytes * 100.0) / totalBytes;
    }

    /** Human-readable speed string. */
    public String speedString() {
        double bps = speed;
        if (bps >= 1_000_000) return String.format("%.1f MB/s", bps / 1_000_000);
        if (bps >= 1_000) return String.format("%.1f KB/s", bps / 1_000);
        return String.format("%.0f B/s", bps);
    }

    /** Estimated seconds remaining, or -1 if unknown. */
    public long etaSeconds() {
        if (speed <= 0) return -1;
        return (long) (remainingBytes() / speed);
    }

    /** Human-readable ETA. */
    public String etaString() {
        long secs = etaSeconds();
        if (secs < 0) return "?";
        if (secs < 60) return secs + "s";
        if (secs < 3600) return String.format("%d:%02d", secs / 60, secs % 60);
        return String.format("%d:%02d:%02d", secs / 3600, (secs % 3600) / 60, secs % 60);
    }

    /** Progress bar: [=========>       ]  56% 3/7 2.3 MB/s ETA 0:45 */
    public String progressBar(int width) {
        double pct = percentComplete();
        int filled = (int) (width * pct / 100);
        StringBuilder bar = new StringBuilder("[");
        for (int i = 0; i < width; i++) {
            if (i < filled) bar.append('=');
            else if (i == filled) bar.append('>');
            else bar.append(' ');
        }
        bar.append(String.format("] %3.0f%% %d/%d", pct, transferredFiles, totalFiles));
        if (pausedReason != null) {
            bar.append(" paused (").append(pausedReason.name().toLowerCase()).append(')');
        } else {
            bar.append(' ').append(speedString()).append(" ETA ").append(etaString());
        }
        return bar.toString();
    }

    /** Format a byte count: 512 B, 1.5 KB, 3.2 MB, 1.1 GB. */
    public static String formatSize(long bytes) {
        if (bytes >= 1_000_000_000) return String.format("%.1f GB", bytes / 1_000_000_000.0);
        if (bytes >= 1_000_000) return String.format("%.1f MB", bytes / 1_000_000.0);
        if (bytes >= 1_000) return String.format("%.1f KB", bytes / 1_000.0);
        return bytes + " B";
    }
}
