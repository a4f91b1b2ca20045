package io.github.shangor.landrop.core.protocol;

import io.github.shangor.landrop.core.model.FileEntry;

public record ManifestEntry(String name, Long size, Boolean isDirectory, String relativePath) {

    public static ManifestEntry from(FileEntry entry) {
        return new ManifestEntry(entry.name(), entry.directory() ? 0L : entry.size(), entry.directory(), entry.relativePath());
    }

    public FileEntry toFileEntry() {
        boolean dir = Boolean.TRUE.equals(isDirectory);
        return new FileEntry(name, dir ? 0 : size, dir, null, relativePath);
    }
}
