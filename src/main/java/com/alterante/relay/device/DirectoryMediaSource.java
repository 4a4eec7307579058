package com.alterante.relay.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * A device exposed as a directory: a mounted card, or a camera in mass-storage mode.
 *
 * Regular, non-hidden files are media. Empty files are reported as invalid.
 */
public class DirectoryMediaSource implements MediaSource {

    private static final Logger log = LoggerFactory.getLogger(DirectoryMediaSource.class);

    private final Path root;

    public DirectoryMediaSource(Path root) {
        this.root = root;
    }

    @Override
    public List<MediaFile> listMedia() throws IOException {
        if (!isAvailable()) {
            throw new IOException("Device not available: " + root);
        }
        List<MediaFile> media = new ArrayList<>();
        try (DirectoryStream<Path> dir = Files.newDirectoryStream(root)) {
            for (Path p : dir) {
                String name = p.getFileName().toString();
                if (name.startsWith(".")) continue;
                BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                if (!attrs.isRegularFile()) continue;
                media.add(new MediaFile(name, attrs.size(), attrs.creationTime().toInstant(), attrs.size() > 0));
            }
        }
        media.sort(Comparator.comparing(MediaFile::created).thenComparing(MediaFile::name));
        log.debug("Listed {} media files in {}", media.size(), root);
        return media;
    }

    @Override
    public MediaStream open(MediaFile file, long offset) throws IOException {
        Path p = resolve(file, true);
        RandomAccessFile raf = new RandomAccessFile(p.toFile(), "r");
        try {
            if (offset > raf.length()) {
                throw new IOException("Offset " + offset + " beyond end of " + file.name() + " (" + raf.length() + " bytes)");
            }
            raf.seek(offset);
        } catch (IOException e) {
            raf.close();
            throw e;
        }
        return new MediaStream() {
            @Override
            public int read(byte[] buf) throws IOException {
                return raf.read(buf);
            }

            @Override
            public void close() throws IOException {
                raf.close();
            }
        };
    }

    @Override
    public void delete(Collection<MediaFile> files) throws IOException {
        for (MediaFile f : files) {
            if (Files.deleteIfExists(resolve(f, false))) {
                log.info("Deleted {} from device", f.name());
            }
        }
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(root);
    }

    public Path root() { return root; }

    private Path resolve(MediaFile file, boolean mustExist) throws IOException {
        Path p = root.resolve(file.name()).normalize();
        if (!p.getParent().equals(root.normalize())) {
            throw new IOException("Media name escapes device root: " + file.name());
        }
        if (mustExist && !Files.isRegularFile(p)) {
            throw new NoSuchFileException(p.toString());
        }
        return p;
    }
}
