package com.alterante.relay.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The local album: a directory of saved media.
 *
 * A file being downloaded lives under {@code _tmp.<name>} until it is committed. Temporary
 * downloads that only feed an upload keep that name for their whole life.
 */
public class LocalMediaStore {

    private static final Logger log = LoggerFactory.getLogger(LocalMediaStore.class);

    public static final String TEMP_PREFIX = "_tmp.";

    private final Path root;

    public LocalMediaStore(Path root) throws StorageException {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageException("Cannot create media store " + this.root + ": " + e.getMessage(), e);
        }
    }

    public Path root() { return root; }

    public Path finalPath(String name) {
        return root.resolve(name);
    }

    public Path tempPath(String name) {
        return root.resolve(TEMP_PREFIX + name);
    }

    /** True if the album already holds a committed copy. */
    public boolean isSaved(String name) {
        return Files.isRegularFile(finalPath(name));
    }

    public boolean hasTemporary(String name) {
        return Files.isRegularFile(tempPath(name));
    }

    /** Length of the temporary file, 0 if it does not exist. */
    public long tempLength(String name) {
        try {
            return Files.isRegularFile(tempPath(name)) ? Files.size(tempPath(name)) : 0;
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", tempPath(name).getFileName(), e.getMessage());
            return 0;
        }
    }

    /**
     * Open the temporary file for appending at {@code offset}. The file is created if
     * missing and truncated to {@code offset}, so bytes past the committed offset are
     * always overwritten.
     */
    public OutputStream openPartial(String name, long offset) throws StorageException {
        Path temp = tempPath(name);
        try {
            FileChannel ch = FileChannel.open(temp, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            try {
                if (ch.size() < offset) {
                    throw new StorageException("Partial file " + temp.getFileName() + " holds " + ch.size()
                            + " bytes, cannot resume at " + offset);
                }
                ch.truncate(offset);
                ch.position(offset);
            } catch (IOException | StorageException e) {
                ch.close();
                throw e;
            }
            return Channels.newOutputStream(ch);
        } catch (IOException e) {
            throw new StorageException("Cannot open " + temp.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Move a finished download from its temporary name into the album. */
    public Path commit(String name) throws StorageException {
        Path temp = tempPath(name);
        Path target = finalPath(name);
        try {
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot save " + name + ": " + e.getMessage(), e);
        }
        PartialDownloadState.delete(temp);
        log.debug("Committed {}", name);
        return target;
    }

    /**
     * Copy a complete temporary download into the album, leaving the temporary copy in
     * place for the upload that still needs it.
     */
    public Path promoteTemporary(String name) throws StorageException {
        Path target = finalPath(name);
        try {
            Files.copy(tempPath(name), target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Cannot save " + name + ": " + e.getMessage(), e);
        }
        log.debug("Promoted temporary {} into album", name);
        return target;
    }

    /** Remove a temporary file and its sidecar. */
    public void discardPartial(String name) throws StorageException {
        Path temp = tempPath(name);
        PartialDownloadState.delete(temp);
        try {
            if (Files.deleteIfExists(temp)) {
                log.debug("Discarded partial {}", temp.getFileName());
            }
        } catch (IOException e) {
            throw new StorageException("Cannot delete " + temp.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Delete any file (an uploaded temporary source, for instance). */
    public void delete(Path file) throws StorageException {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageException("Cannot delete " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    public PartialDownloadState loadPartialState(String name) {
        return PartialDownloadState.load(tempPath(name));
    }

    public void savePartialState(String name, long size, long offset) throws StorageException {
        try {
            new PartialDownloadState(size, offset, name).save(tempPath(name));
        } catch (IOException e) {
            throw new StorageException("Cannot record progress for " + name + ": " + e.getMessage(), e);
        }
    }

    public void clearPartialState(String name) {
        PartialDownloadState.delete(tempPath(name));
    }

    /** Names of committed files in the album. */
    public List<String> listSaved() throws StorageException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> dir = Files.newDirectoryStream(root)) {
            for (Path p : dir) {
                String name = p.getFileName().toString();
                if (name.startsWith(".") || name.startsWith(TEMP_PREFIX)) continue;
                if (Files.isRegularFile(p)) names.add(name);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot list " + root + ": " + e.getMessage(), e);
        }
        Collections.sort(names);
        return names;
    }

    /** The name a file is known by on the device and the server. */
    public static String logicalName(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(TEMP_PREFIX) ? name.substring(TEMP_PREFIX.length()) : name;
    }

    public static boolean isTemporary(Path path) {
        return path.getFileName().toString().startsWith(TEMP_PREFIX);
    }
}
