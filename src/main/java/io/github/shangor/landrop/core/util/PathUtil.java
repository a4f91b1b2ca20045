package io.github.shangor.landrop.core.util;

import io.github.shangor.landrop.core.protocol.ProtocolException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Cross-platform path handling for manifest entries. Paths travel with '/' separators and are
 * only ever materialised below a destination root.
 */
public final class PathUtil {

    private PathUtil() {
    }

    /**
     * Normalizes path separators to forward slashes (/) for platform-independent transmission.
     * Converts backslashes, collapses repeated separators and drops a leading slash.
     *
     * @param path the input path with any separator format
     * @return path with normalized forward slash separators
     */
    public static String normalizePathSeparators(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        String normalized = path.replace('\\', '/');
        normalized = normalized.replaceAll("/+", "/");
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    /**
     * Resolves a manifest path below {@code root}. Absolute paths, drive letters, {@code ..}
     * segments and anything else that would land outside the root are refused.
     *
     * @throws ProtocolException if the path is empty or escapes the root
     */
    public static Path resolveUnder(Path root, String relativePath) throws ProtocolException {
        if (relativePath == null || relativePath.isBlank()) {
            throw new ProtocolException("Empty path in manifest");
        }
        if (relativePath.indexOf('\0') >= 0) {
            throw new ProtocolException("Illegal character in path: " + relativePath);
        }
        String unified = relativePath.replace('\\', '/');
        if (unified.startsWith("/") || unified.matches("^[A-Za-z]:.*")) {
            throw new ProtocolException("Absolute path not allowed: " + relativePath);
        }
        Path base = root.toAbsolutePath().normalize();
        Path target = base;
        boolean hasSegment = false;
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new ProtocolException("Parent directory traversal not allowed: " + relativePath);
            }
            if (segment.indexOf(':') >= 0) {
                throw new ProtocolException("Illegal character in path: " + relativePath);
            }
            target = target.resolve(segment);
            hasSegment = true;
        }
        target = target.normalize();
        if (!hasSegment || target.equals(base) || !target.startsWith(base)) {
            throw new ProtocolException("Path escapes destination root: " + relativePath);
        }
        return target;
    }

    /**
     * Checks the filesystem view of {@code target}: the closest existing ancestor, with links
     * resolved, must still lie inside {@code root}. Call it right before creating or opening the
     * target; {@link #resolveUnder(Path, String)} only inspects the text of the path.
     *
     * @throws ProtocolException if a link already on disk leads outside the root
     */
    public static void requireInsideRealRoot(Path root, Path target) throws IOException {
        Path realRoot = root.toRealPath();
        Path existing = target.toAbsolutePath().normalize();
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null || !existing.toRealPath().startsWith(realRoot)) {
            throw new ProtocolException("Path leaves destination root through a link: " + target);
        }
    }
}
