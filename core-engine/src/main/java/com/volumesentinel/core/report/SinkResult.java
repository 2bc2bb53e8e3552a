package com.volumesentinel.core.report;

/**
 * Outcome of one {@link AlertSink#persist} call.
 */
public final class SinkResult {

    private static final SinkResult EMPTY = new SinkResult(0, 0);

    private final int persisted;
    private final int failed;

    private SinkResult(int persisted, int failed) {
        if (persisted < 0 || failed < 0) {
            throw new IllegalArgumentException(
                    "counts must be >= 0, got persisted=" + persisted + " failed=" + failed);
        }
        this.persisted = persisted;
        this.failed = failed;
    }

    public static SinkResult of(int persisted, int failed) {
        return new SinkResult(persisted, failed);
    }

    public static SinkResult empty() {
        return EMPTY;
    }

    public int getPersisted() {
        return persisted;
    }

    public int getFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return "SinkResult{persisted=" + persisted + ", failed=" + failed + '}';
    }
}
