package io.github.shangor.landrop.core.util;

import io.github.shangor.landrop.core.model.FileEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Turns picked files and folders into manifest entries.
 */
public final class FileEntries {

    private FileEntries() {
    }

    /**
     * Plain files become single entries. A folder is walked depth-first in name order; every
     * directory is listed before its contents and relative paths are computed against the folder.
     */
    public static List<FileEntry> expand(List<Path> picked) throws IOException {
        List<FileEntry> entries = new ArrayList<>();
        for (Path path : picked) {
            if (Files.isDirectory(path)) {
                scanDirectory(path, path, entries);
            } else if (Files.isRegularFile(path)) {
                entries.add(FileEntry.file(path, Files.size(path), null));
            } else {
                throw new IOException("Not a regular file or directory: " + path);
            }
        }
        return entries;
    }

    private static void scanDirectory(Path dir, Path root, List<FileEntry> entries) throws IOException {
        List<Path> children;
        try (Stream<Path> stream = Files.list(dir)) {
            children = stream.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
        }
        for (Path child : children) {
            String relative = PathUtil.normalizePathSeparators(root.relativize(child).toString());
            if (Files.isDirectory(child)) {
                entries.add(FileEntry.directory(child, relative));
                scanDirectory(child, root, entries);
            } else if (Files.isRegularFile(child)) {
                entries.add(FileEntry.file(child, Files.size(child), relative));
            }
        }
    }
}
