package com.alterante.relay.device;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * The removable-storage device, seen through its SDK.
 *
 * All calls block and must not run on the event loop. I/O failures are connectivity
 * errors: the device may come back.
 */
public interface MediaSource {

    /** Enumerate the media currently on the device. */
    List<MediaFile> listMedia() throws IOException;

    /** Open a file for reading, positioned at {@code offset}. */
    MediaStream open(MediaFile file, long offset) throws IOException;

    /** Remove files from the device. */
    void delete(Collection<MediaFile> files) throws IOException;

    boolean isAvailable();
}
