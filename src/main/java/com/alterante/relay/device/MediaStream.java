package com.alterante.relay.device;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sequential read access to one media file, starting at the offset it was opened with.
 */
public interface MediaStream extends Closeable {

    /**
     * Read up to {@code buf.length} bytes.
     *
     * @return number of bytes read, or -1 at end of file
     */
    int read(byte[] buf) throws IOException;
}
