package io.github.shangor.landrop.core.service;

/**
 * Throughput sampler. Bytes are accumulated continuously; a sample is taken at most once per
 * interval, using the time elapsed since the previous sample.
 */
public class ProgressMeter {
    private final long intervalNanos;
    private long lastSampleNanos;
    private long bytesSinceSample;
    private double bytesPerSecond;

    public ProgressMeter(long intervalMillis, long startNanos) {
        this.intervalNanos = intervalMillis * 1_000_000L;
        this.lastSampleNanos = startNanos;
    }

    /**
     * Adds applied bytes.
     *
     * @return {@code true} if a new throughput sample was taken
     */
    public boolean record(long bytes, long nowNanos) {
        bytesSinceSample += bytes;
        long elapsed = nowNanos - lastSampleNanos;
        if (elapsed < intervalNanos || elapsed <= 0) {
            return false;
        }
        bytesPerSecond = bytesSinceSample / (elapsed / 1_000_000_000.0d);
        bytesSinceSample = 0;
        lastSampleNanos = nowNanos;
        return true;
    }

    public double bytesPerSecond() {
        return bytesPerSecond;
    }
}
