package io.github.shangor.landrop.core.protocol;

import io.github.shangor.landrop.core.model.FileEntry;
import io.github.shangor.landrop.core.model.TransferTask;

import java.util.ArrayList;
import java.util.List;

/**
 * Control record sent by the initiator. {@code taskId}, {@code senderId} and {@code senderName}
 * are optional; older peers only send the manifest.
 */
public record TransferRequestMessage(String kind,
                                     String taskId,
                                     String senderId,
                                     String senderName,
                                     Long totalSize,
                                     List<ManifestEntry> files) {

    public static TransferRequestMessage of(String taskId, String senderId, String senderName, List<FileEntry> entries) {
        List<ManifestEntry> manifest = new ArrayList<>(entries.size());
        for (FileEntry entry : entries) {
            manifest.add(ManifestEntry.from(entry));
        }
        return new TransferRequestMessage(MessageKind.TRANSFER_REQUEST, taskId, senderId, senderName,
                TransferTask.totalSize(entries), manifest);
    }

    public List<FileEntry> toFileEntries() {
        List<FileEntry> entries = new ArrayList<>(files.size());
        for (ManifestEntry entry : files) {
            entries.add(entry.toFileEntry());
        }
        return entries;
    }
}
