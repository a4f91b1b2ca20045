package io.github.shangor.landrop.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

public class TransferTask {
    private final String taskId;
    private final Device peer;
    private final List<FileEntry> files;
    private final long totalBytes;
    private final TransferDirection direction;
    private final AtomicLong bytesTransferred = new AtomicLong(0);
    private final Instant createdAt;
    private volatile TransferStatus status;
    private volatile double bytesPerSecond;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String reason = "";

    public TransferTask(String taskId, Device peer, List<FileEntry> files, TransferDirection direction) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.peer = Objects.requireNonNull(peer, "peer");
        this.files = List.copyOf(files);
        this.direction = Objects.requireNonNull(direction, "direction");
        this.totalBytes = totalSize(this.files);
        this.status = TransferStatus.PENDING;
        this.createdAt = Instant.now();
    }

    /**
     * Sum of the declared sizes of every non-directory entry.
     *
     * @throws ArithmeticException if the sum does not fit in a {@code long}
     */
    public static long totalSize(List<FileEntry> files) {
        long total = 0;
        for (FileEntry entry : files) {
            if (!entry.directory()) {
                total = Math.addExact(total, entry.size());
            }
        }
        return total;
    }

    public String getTaskId() {
        return taskId;
    }

    public Device getPeer() {
        return peer;
    }

    public List<FileEntry> getFiles() {
        return files;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public TransferDirection getDirection() {
        return direction;
    }

    public TransferStatus getStatus() {
        return status;
    }

    public void setStatus(TransferStatus status) {
        this.status = status;
        Instant now = Instant.now();
        if (status == TransferStatus.TRANSFERRING && startedAt == null) {
            startedAt = now;
        }
        if (status.isTerminal() && finishedAt == null) {
            finishedAt = now;
        }
    }

    public long getBytesTransferred() {
        return bytesTransferred.get();
    }

    public long addBytesTransferred(long delta) {
        return bytesTransferred.addAndGet(delta);
    }

    public double getBytesPerSecond() {
        return bytesPerSecond;
    }

    public void setBytesPerSecond(double bytesPerSecond) {
        this.bytesPerSecond = bytesPerSecond;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason == null ? "" : reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration getDuration() {
        Instant start = startedAt != null ? startedAt : createdAt;
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(start, end);
    }

    /**
     * Fraction of the declared bytes applied so far. Exactly {@code 1.0} only once the task completed.
     */
    public double getProgress() {
        if (status == TransferStatus.COMPLETED) {
            return 1.0d;
        }
        if (totalBytes <= 0) {
            return 0d;
        }
        double ratio = (double) bytesTransferred.get() / totalBytes;
        return Math.min(ratio, Math.nextDown(1.0d));
    }

    @Override
    public String toString() {
        return "TransferTask[" + taskId + ", " + direction + ", " + status + ", "
                + bytesTransferred.get() + "/" + totalBytes + " bytes, peer=" + peer.getName() + "]";
    }
}
