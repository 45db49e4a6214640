package domain.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * File-system output location of a task.
 *
 * <p>Writes go to a temporary sibling file that is moved over the final path only after the
 * content was written completely, so an existing path always holds a finished artifact.</p>
 */
public final class LocalTarget {

    private static final Logger log = LoggerFactory.getLogger(LocalTarget.class);

    private final Path path;

    public LocalTarget(Path path) {
        if (path == null) throw new IllegalArgumentException("path is null");
        this.path = path.toAbsolutePath().normalize();
    }

    public Path getPath() {
        return path;
    }

    public boolean exists() {
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    public BufferedReader openForRead() throws IOException {
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    /**
     * Write the whole content atomically (UTF-8).
     *
     * @throws UncheckedIOException if writing or the final move fails; no partial file is left behind
     */
    public void write(Content content) {
        if (content == null) throw new IllegalArgumentException("content is null");

        Path dir = path.getParent();
        Path tmp = null;
        try {
            if (dir != null) Files.createDirectories(dir);
            // default permissions (umask), unlike createTempFile
            Path candidate = path.resolveSibling("." + path.getFileName() + "." + UUID.randomUUID() + ".tmp");
            Writer w = Files.newBufferedWriter(candidate, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            tmp = candidate;
            try (w) {
                content.writeTo(w);
            }
            move(tmp, path);
            log.debug("wrote {}", path);
        } catch (IOException e) {
            deleteTemp(tmp, e);
            throw new UncheckedIOException("failed to write " + path, e);
        } catch (RuntimeException e) {
            deleteTemp(tmp, e);
            throw e;
        }
    }

    /**
     * Delete the artifact.
     *
     * @return false when there was nothing to delete
     * @throws UncheckedIOException for any failure other than the file being absent
     */
    public boolean delete() {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to delete " + path, e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path tmp, Exception primary) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocalTarget)) return false;
        return path.equals(((LocalTarget) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path.toString();
    }

    /** Content producer for {@link #write(Content)}. */
    @FunctionalInterface
    public interface Content {
        void writeTo(Writer out) throws IOException;
    }
}
