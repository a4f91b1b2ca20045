package io.github.shangor.landrop.core.util;

import io.github.shangor.landrop.core.model.FileEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileEntriesTest {

    @TempDir
    Path dir;

    @Test
    void plainFileHasNoRelativePath() throws IOException {
        Path file = Files.write(dir.resolve("a.txt"), new byte[10]);
        List<FileEntry> entries = FileEntries.expand(List.of(file));
        assertEquals(1, entries.size());
        assertEquals("a.txt", entries.get(0).name());
        assertEquals(10, entries.get(0).size());
        assertNull(entries.get(0).relativePath());
        assertEquals(file, entries.get(0).sourcePath());
    }

    @Test
    void directoryIsWalkedDepthFirstInNameOrder() throws IOException {
        Path picked = Files.createDirectories(dir.resolve("album"));
        Files.createDirectories(picked.resolve("b/inner"));
        Files.write(picked.resolve("b/inner/x.bin"), new byte[3]);
        Files.write(picked.resolve("a.txt"), new byte[5]);
        Files.write(picked.resolve("c.txt"), new byte[0]);

        List<FileEntry> entries = FileEntries.expand(List.of(picked));

        assertEquals(List.of("a.txt", "b", "b/inner", "b/inner/x.bin", "c.txt"),
                entries.stream().map(FileEntry::relativePath).toList());
        assertTrue(entries.get(1).directory());
        assertTrue(entries.get(2).directory());
        assertEquals(3, entries.get(3).size());
        assertEquals(0, entries.get(4).size());
    }

    @Test
    void missingPathFails() {
        assertThrows(IOException.class, () -> FileEntries.expand(List.of(dir.resolve("missing"))));
    }
}
