package com.alterante.relay.transfer;

import com.alterante.relay.storage.LocalMediaStore;

import java.nio.file.Path;

/**
 * A local file to upload.
 *
 * @param name      logical name, without the temporary prefix
 * @param source    file to read
 * @param size      bytes
 * @param temporary the source only exists for this upload and is deleted afterwards
 */
public record UploadItem(String name, Path source, long size, boolean temporary) implements TransferItem {

    /** An item for a file in the album or a temporary download, named by its logical name. */
    public static UploadItem of(Path source, long size) {
        return new UploadItem(LocalMediaStore.logicalName(source), source, size, LocalMediaStore.isTemporary(source));
    }
}
