package io.github.shangor.landrop.core.net;

/**
 * The single newline-terminated JSON record that opens each direction of a transfer connection.
 */
public record ControlLine(String text) {
}
