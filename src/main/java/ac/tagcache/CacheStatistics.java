package ac.tagcache;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for the fetch path, the write path and the tag index.
 * Thread-safe implementation using atomic operations.
 */
public class CacheStatistics {
    // Fetch path
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong producerInvocations = new AtomicLong(0);
    private final AtomicLong sharedProductions = new AtomicLong(0);

    // Write path
    private final AtomicLong writes = new AtomicLong(0);
    private final AtomicLong rejectedWrites = new AtomicLong(0);

    // Tag index
    private final AtomicLong tagAssociations = new AtomicLong(0);
    private final AtomicLong danglingTagEntriesDropped = new AtomicLong(0);

    // Timing
    private volatile LocalDateTime createdAt = LocalDateTime.now();
    private volatile LocalDateTime lastResetAt = createdAt;

    // ==================== FETCH PATH ====================

    public void incrementHits() {
        hits.incrementAndGet();
    }

    public void incrementMisses() {
        misses.incrementAndGet();
    }

    public void incrementProducerInvocations() {
        producerInvocations.incrementAndGet();
    }

    public void incrementSharedProductions() {
        sharedProductions.incrementAndGet();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getProducerInvocations() {
        return producerInvocations.get();
    }

    public long getSharedProductions() {
        return sharedProductions.get();
    }

    public long getTotalRequests() {
        return getHits() + getMisses();
    }

    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }

    public double getMissRate() {
        return getTotalRequests() == 0 ? 0.0 : 1.0 - getHitRate();
    }

    // ==================== WRITE PATH ====================

    public void incrementWrites() {
        writes.incrementAndGet();
    }

    public void incrementRejectedWrites() {
        rejectedWrites.incrementAndGet();
    }

    public long getWrites() {
        return writes.get();
    }

    public long getRejectedWrites() {
        return rejectedWrites.get();
    }

    // ==================== TAG INDEX ====================

    public void incrementTagAssociations() {
        tagAssociations.incrementAndGet();
    }

    public void addDanglingTagEntriesDropped(long count) {
        danglingTagEntriesDropped.addAndGet(count);
    }

    public long getTagAssociations() {
        return tagAssociations.get();
    }

    public long getDanglingTagEntriesDropped() {
        return danglingTagEntriesDropped.get();
    }

    // ==================== LIFECYCLE ====================

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getLastResetAt() {
        return lastResetAt;
    }

    /**
     * Zeroes every counter. The creation time is kept.
     */
    public void reset() {
        hits.set(0);
        misses.set(0);
        producerInvocations.set(0);
        sharedProductions.set(0);
        writes.set(0);
        rejectedWrites.set(0);
        tagAssociations.set(0);
        danglingTagEntriesDropped.set(0);
        lastResetAt = LocalDateTime.now();
    }

    public CacheStatisticsSnapshot getSnapshot() {
        return new CacheStatisticsSnapshot(this);
    }

    @Override
    public String toString() {
        return String.format("CacheStatistics{hits=%d, misses=%d, hitRate=%.2f%%, producerInvocations=%d, " +
                        "writes=%d, rejectedWrites=%d, tagAssociations=%d, danglingDropped=%d}",
                getHits(), getMisses(), getHitRate() * 100, getProducerInvocations(),
                getWrites(), getRejectedWrites(), getTagAssociations(), getDanglingTagEntriesDropped());
    }

    /**
     * Immutable copy of the counters at one point in time.
     */
    public static class CacheStatisticsSnapshot {
        private final long hits;
        private final long misses;
        private final long producerInvocations;
        private final long sharedProductions;
        private final long writes;
        private final long rejectedWrites;
        private final long tagAssociations;
        private final long danglingTagEntriesDropped;
        private final LocalDateTime snapshotAt;

        private CacheStatisticsSnapshot(CacheStatistics stats) {
            this.hits = stats.getHits();
            this.misses = stats.getMisses();
            this.producerInvocations = stats.getProducerInvocations();
            this.sharedProductions = stats.getSharedProductions();
            this.writes = stats.getWrites();
            this.rejectedWrites = stats.getRejectedWrites();
            this.tagAssociations = stats.getTagAssociations();
            this.danglingTagEntriesDropped = stats.getDanglingTagEntriesDropped();
            this.snapshotAt = LocalDateTime.now();
        }

        public long getHits() { return hits; }
        public long getMisses() { return misses; }
        public long getProducerInvocations() { return producerInvocations; }
        public long getSharedProductions() { return sharedProductions; }
        public long getWrites() { return writes; }
        public long getRejectedWrites() { return rejectedWrites; }
        public long getTagAssociations() { return tagAssociations; }
        public long getDanglingTagEntriesDropped() { return danglingTagEntriesDropped; }
        public LocalDateTime getSnapshotAt() { return snapshotAt; }

        public double getHitRatio() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
