package com.alterante.relay.storage;

import com.alterante.relay.transfer.TransferItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Committed offset of an interrupted download, kept in a .relay-partial sidecar next to
 * the temporary file so a restarted process can resume instead of starting over.
 *
 * <pre>
 * Format:
 * Bytes 0-3:   Magic (0x524C5950 = "RLYP")
 * Bytes 4-7:   Version (1)
 * Bytes 8-15:  File Size (long)
 * Bytes 16-23: Bytes Written (long)
 * Bytes 24-25: Filename Length (short)
 * Bytes 26+:   Filename (UTF-8)
 * </pre>
 */
public class PartialDownloadState {

    private static final Logger log = LoggerFactory.getLogger(PartialDownloadState.class);

    public static final String SUFFIX = ".relay-partial";

    private static final int MAGIC = 0x524C5950; // "RLYP"
    private static final int VERSION = 1;
    private static final int FIXED_SIZE = 4 + 4 + 8 + 8 + 2; // 26 bytes

    private final long fileSize;
    private final long bytesWritten;
    private final String filename;

    public PartialDownloadState(long fileSize, long bytesWritten, String filename) {
        this.fileSize = fileSize;
        this.bytesWritten = bytesWritten;
        this.filename = filename;
    }

    /**
     * Get the sidecar path for a given temporary file.
     */
    public static Path partialPath(Path tempFile) {
        return tempFile.resolveSibling(tempFile.getFileName() + SUFFIX);
    }

    /**
     * Save to the sidecar, via a scratch file renamed into place.
     */
    public void save(Path tempFile) throws IOException {
        byte[] nameBytes = filename.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(FIXED_SIZE + nameBytes.length)
                .order(ByteOrder.BIG_ENDIAN);

        buf.putInt(MAGIC);
        buf.putInt(VERSION);
        buf.putLong(fileSize);
        buf.putLong(bytesWritten);
        buf.putShort((short) nameBytes.length);
        buf.put(nameBytes);

        Path target = partialPath(tempFile);
        Path scratch = target.resolveSibling(target.getFileName() + ".new");
        Files.write(scratch, buf.array());
        Files.move(scratch, target, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Load from the sidecar, or null if not found / invalid.
     */
    public static PartialDownloadState load(Path tempFile) {
        Path partial = partialPath(tempFile);
        if (!Files.exists(partial)) return null;

        try {
            byte[] data = Files.readAllBytes(partial);
            if (data.length < FIXED_SIZE) return null;

            ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
            int magic = buf.getInt();
            int version = buf.getInt();
            if (magic != MAGIC || version != VERSION) return null;

            long fileSize = buf.getLong();
            long bytesWritten = buf.getLong();
            int nameLen = Short.toUnsignedInt(buf.getShort());
            if (data.length < FIXED_SIZE + nameLen) return null;
            if (bytesWritten < 0 || bytesWritten > fileSize) return null;

            byte[] nameBytes = new byte[nameLen];
            buf.get(nameBytes);
            String filename = new String(nameBytes, StandardCharsets.UTF_8);

            return new PartialDownloadState(fileSize, bytesWritten, filename);
        } catch (IOException e) {
            log.debug("Unreadable sidecar {}: {}", partial, e.getMessage());
            return null;
        }
    }

    /**
     * Delete the sidecar file.
     */
    public static void delete(Path tempFile) {
        try {
            Files.deleteIfExists(partialPath(tempFile));
        } catch (IOException e) {
            log.warn("Could not delete sidecar for {}: {}", tempFile.getFileName(), e.getMessage());
        }
    }

    /**
     * Same filename and same size as the item about to be downloaded.
     */
    public boolean matches(TransferItem item) {
        return filename.equals(item.name()) && fileSize == item.size();
    }

    public long fileSize() { return fileSize; }
    public long bytesWritten() { return bytesWritten; }
    public String filename() { return filename; }
}
