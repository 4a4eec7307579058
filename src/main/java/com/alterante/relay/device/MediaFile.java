package com.alterante.relay.device;

import com.alterante.relay.transfer.TransferItem;

import java.time.Instant;

/**
 * A media file on the device. Two files are the same file when their names match.
 */
public final class MediaFile implements TransferItem {

    private final String name;
    private final long size;
    private final Instant created;
    private final boolean valid;

    public MediaFile(String name, long size, Instant created, boolean valid) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Media file name must not be empty");
        }
        this.name = name;
        this.size = size;
        this.created = created;
        this.valid = valid;
    }

    public MediaFile(String name, long size) {
        this(name, size, Instant.EPOCH, size > 0);
    }

    @Override
    public String name() { return name; }

    @Override
    public long size() { return size; }

    public Instant created() { return created; }

    /** False for files the device reports as unreadable (for example, zero length). */
    public boolean valid() { return valid; }

    @Override
    public boolean equals(Object o) {
        return o instanceof MediaFile other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + " (" + size + " bytes)";
    }
}
