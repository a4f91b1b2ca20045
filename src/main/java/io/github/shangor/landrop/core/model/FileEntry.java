package io.github.shangor.landrop.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One item of a transfer manifest.
 *
 * @param name          file or directory name
 * @param size          exact byte count streamed for files; ignored for directories
 * @param directory     whether the entry is a directory marker
 * @param sourcePath    sender-local path, never transmitted; {@code null} on the receiving side
 * @param relativePath  '/'-separated path below the destination root, or {@code null} to use {@code name}
 */
public record FileEntry(String name, long size, boolean directory, Path sourcePath, String relativePath) {

    public FileEntry {
        Objects.requireNonNull(name, "name");
        if (directory) {
            size = 0;
        } else if (size < 0) {
            throw new IllegalArgumentException("Negative size for " + name + ": " + size);
        }
    }

    public static FileEntry file(Path source, long size, String relativePath) {
        return new FileEntry(source.getFileName().toString(), size, false, source, relativePath);
    }

    public static FileEntry directory(Path source, String relativePath) {
        return new FileEntry(source.getFileName().toString(), 0, true, source, relativePath);
    }

    /**
     * Path used on the receiving side: the relative path when present, otherwise the bare name.
     */
    public String targetPath() {
        return relativePath == null || relativePath.isBlank() ? name : relativePath;
    }
}
