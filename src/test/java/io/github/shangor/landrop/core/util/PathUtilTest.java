package io.github.shangor.landrop.core.util;

import io.github.shangor.landrop.core.protocol.ProtocolException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PathUtilTest {

    @TempDir
    Path root;

    @Test
    void normalizesSeparators() {
        assertEquals("a/b/c.txt", PathUtil.normalizePathSeparators("a\\b\\\\c.txt"));
        assertEquals("a/b", PathUtil.normalizePathSeparators("/a//b"));
        assertNull(PathUtil.normalizePathSeparators(null));
    }

    @Test
    void resolvesNestedPathBelowRoot() throws Exception {
        Path resolved = PathUtil.resolveUnder(root, "photos/2024/img.jpg");
        assertEquals(root.toAbsolutePath().normalize().resolve("photos").resolve("2024").resolve("img.jpg"), resolved);
    }

    @Test
    void acceptsBackslashSeparators() throws Exception {
        Path resolved = PathUtil.resolveUnder(root, "docs\\notes.txt");
        assertTrue(resolved.startsWith(root.toAbsolutePath().normalize()));
        assertEquals("notes.txt", resolved.getFileName().toString());
    }

    @Test
    void refusesParentTraversal() {
        assertThrows(ProtocolException.class, () -> PathUtil.resolveUnder(root, "../secret"));
        assertThrows(ProtocolException.class, () -> PathUtil.resolveUnder(root, "a/../../secret"));
        assertThrows(ProtocolException.class, () -> PathUtil.resolveUnder(root, "a\\..\\..\\secret"));
    }

    @Test
    void realPathCheckFollowsLinks() throws Exception {
        Path outside = Files.createDirectories(root.resolve("outside"));
        Path inbox = Files.createDirectories(root.resolve("inbox"));
        Files.createSymbolicLink(inbox.resolve("link"), outside);

        Path escaping = PathUtil.resolveUnder(inbox, "link/evil.txt");
        assertThrows(ProtocolException.class, () -> PathUtil.requireInsideRealRoot(inbox, escaping));

        Path nested = PathUtil.resolveUnder(inbox, "new/dir/file.txt");
        assertDoesNotThrow(() -> PathUtil.requireInsideRealRoot(inbox, nested));
    }

    @Test
    void refusesAbsoluteAndEmptyPaths() {
        assertThrows(ProtocolException.class, () -> PathUtil.resolveUnder(root, "/etc/passwd"));
        assertThrows(ProtocolException.class, () -> PathUtil.resolveUnder(root, "C:\\Windows\\win.ini"));
        assertThrows(ProtocolException.class, () -> PathUtil.resolveUnder(root, ""));
        assertThrows(ProtocolException.class, () -> PathUtil.resolveUnder(root, "./."));
        assertThrows(ProtocolException.class, () -> PathUtil.resolveUnder(root, "a\0b"));
    }
}
