package io.github.shangor.landrop.core.net;

/**
 * The zero-length frame that follows the last byte of the last file.
 */
public enum EndOfTransfer {
    INSTANCE
}
