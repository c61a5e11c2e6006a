package ac.tagcache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class CacheStatisticsTest {

    private CacheStatistics statistics;

    @BeforeEach
    void setUp() {
        statistics = new CacheStatistics();
    }

    @Test
    void testHitRate() {
        // Given
        statistics.incrementHits();
        statistics.incrementHits();
        statistics.incrementHits();
        statistics.incrementMisses();

        // Then
        assertThat(statistics.getTotalRequests()).isEqualTo(4);
        assertThat(statistics.getHitRate()).isEqualTo(0.75);
        assertThat(statistics.getMissRate()).isEqualTo(0.25);
    }

    @Test
    void testRatesWithoutRequests() {
        assertThat(statistics.getHitRate()).isEqualTo(0.0);
        assertThat(statistics.getMissRate()).isEqualTo(0.0);
    }

    @Test
    void testReset() {
        // Given
        statistics.incrementHits();
        statistics.incrementMisses();
        statistics.incrementProducerInvocations();
        statistics.incrementSharedProductions();
        statistics.incrementWrites();
        statistics.incrementRejectedWrites();
        statistics.incrementTagAssociations();
        statistics.addDanglingTagEntriesDropped(3);
        LocalDateTime beforeReset = LocalDateTime.now();

        // When
        statistics.reset();

        // Then
        assertThat(statistics.getHits()).isZero();
        assertThat(statistics.getMisses()).isZero();
        assertThat(statistics.getProducerInvocations()).isZero();
        assertThat(statistics.getSharedProductions()).isZero();
        assertThat(statistics.getWrites()).isZero();
        assertThat(statistics.getRejectedWrites()).isZero();
        assertThat(statistics.getTagAssociations()).isZero();
        assertThat(statistics.getDanglingTagEntriesDropped()).isZero();
        assertThat(statistics.getLastResetAt()).isAfterOrEqualTo(beforeReset);
        assertThat(statistics.getCreatedAt()).isBeforeOrEqualTo(statistics.getLastResetAt());
    }

    @Test
    void testSnapshotIsDetached() {
        // Given
        statistics.incrementHits();
        statistics.incrementMisses();
        statistics.addDanglingTagEntriesDropped(2);

        // When
        CacheStatistics.CacheStatisticsSnapshot snapshot = statistics.getSnapshot();
        statistics.incrementHits();

        // Then
        assertThat(snapshot.getHits()).isEqualTo(1);
        assertThat(snapshot.getMisses()).isEqualTo(1);
        assertThat(snapshot.getDanglingTagEntriesDropped()).isEqualTo(2);
        assertThat(snapshot.getHitRatio()).isEqualTo(0.5);
        assertThat(snapshot.getSnapshotAt()).isNotNull();
        assertThat(statistics.getHits()).isEqualTo(2);
    }

    @Test
    void testToString() {
        statistics.incrementHits();

        assertThat(statistics.toString()).contains("hits=1").contains("misses=0");
    }
}
