package io.github.shangor.landrop.core.service;

/**
 * Progress snapshot for one task.
 *
 * @param fraction    transferred / total, exactly 1.0 only when every entry is finished
 * @param bytesPerSecond throughput measured over the last sampling window
 */
public record TransferProgress(String taskId, long transferred, long total, double fraction, double bytesPerSecond) {
}
