package com.ble.positioning.repository;

import com.ble.positioning.model.RawSignal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Signal Store Tests")
class SignalStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private SignalStore store;

    @BeforeEach
    void setUp() {
        store = new SignalStore(100);
    }

    @Nested
    @DisplayName("Append Tests")
    class AppendTests {

        @Test
        @DisplayName("should assign increasing sequences")
        void shouldAssignIncreasingSequences() {
            RawSignal first = store.append(RawSignal.of("b1", "g1", -60, T0));
            RawSignal second = store.append(RawSignal.of("b2", "g1", -61, T0));

            assertThat(first.sequence()).isPositive();
            assertThat(second.sequence()).isGreaterThan(first.sequence());
            assertThat(store.size()).isEqualTo(2);
            assertThat(store.beaconCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject incomplete signals")
        void shouldRejectIncompleteSignals() {
            assertThatThrownBy(() -> store.append(null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.append(RawSignal.of(null, "g1", -60, T0)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.append(RawSignal.of("b1", "g1", -60, null)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should evict the oldest signals beyond capacity when the next cut is taken")
        void shouldEvictOldestBeyondCapacity() {
            SignalStore small = new SignalStore(3);
            for (int i = 0; i < 5; i++) {
                small.append(RawSignal.of("b1", "g1", -60 - i, T0.plusSeconds(i)));
            }
            assertThat(small.size()).isEqualTo(5);

            small.snapshot();

            List<RawSignal> retained = small.queryRawSignals("b1", T0, T0.plusSeconds(10));
            assertThat(retained).extracting(RawSignal::rssiDbm).containsExactly(-62, -63, -64);
            assertThat(small.evictedCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should keep a cut's signals intact when later appends overflow the capacity")
        void shouldKeepCutStableWhenCapacityOverflows() {
            SignalStore small = new SignalStore(3);
            for (int i = 0; i < 3; i++) {
                small.append(RawSignal.of("b1", "g1", -60 - i, T0.plusSeconds(i)));
            }
            long cut = small.snapshot();
            List<RawSignal> before = small.signals("b1", T0, T0.plusSeconds(10), cut);

            small.append(RawSignal.of("b1", "g1", -70, T0.plusSeconds(3)));
            small.append(RawSignal.of("b1", "g1", -71, T0.plusSeconds(4)));

            assertThat(small.signals("b1", T0, T0.plusSeconds(10), cut)).isEqualTo(before).hasSize(3);
            assertThat(small.evictedCount()).isZero();

            long next = small.snapshot();
            assertThat(small.signals("b1", T0, T0.plusSeconds(10), next))
                    .extracting(RawSignal::rssiDbm).containsExactly(-62, -70, -71);
            assertThat(small.evictedCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject a capacity below two")
        void shouldRejectTinyCapacity() {
            assertThatThrownBy(() -> new SignalStore(1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Snapshot Cut Tests")
    class SnapshotCutTests {

        @Test
        @DisplayName("should hide signals appended after the cut")
        void shouldHideSignalsAfterCut() {
            store.append(RawSignal.of("b1", "g1", -60, T0));
            long cut = store.snapshot();
            store.append(RawSignal.of("b1", "g2", -70, T0));

            assertThat(store.signals("b1", T0, T0, cut)).extracting(RawSignal::gatewayId).containsExactly("g1");
            assertThat(store.queryRawSignals("b1", T0, T0)).hasSize(2);
        }

        @Test
        @DisplayName("should bound reads by observation time inclusively")
        void shouldBoundByObservationTime() {
            store.append(RawSignal.of("b1", "g1", -60, T0.minusSeconds(6)));
            store.append(RawSignal.of("b1", "g1", -61, T0.minusSeconds(5)));
            store.append(RawSignal.of("b1", "g1", -62, T0));
            store.append(RawSignal.of("b1", "g1", -63, T0.plusSeconds(1)));

            assertThat(store.signals("b1", T0.minusSeconds(5), T0, store.snapshot()))
                    .extracting(RawSignal::rssiDbm)
                    .containsExactly(-61, -62);
        }

        @Test
        @DisplayName("should list beacons with signals between two cuts")
        void shouldListFreshBeacons() {
            store.append(RawSignal.of("b2", "g1", -60, T0));
            long first = store.snapshot();
            store.append(RawSignal.of("b3", "g1", -60, T0));
            store.append(RawSignal.of("b1", "g1", -60, T0));
            long second = store.snapshot();
            store.append(RawSignal.of("b4", "g1", -60, T0));

            assertThat(store.beaconsWithSignalsBetween(0, first)).containsExactly("b2");
            assertThat(store.beaconsWithSignalsBetween(first, second)).containsExactly("b1", "b3");
            assertThat(store.beaconsWithSignalsBetween(second, second)).isEmpty();
        }

        @Test
        @DisplayName("should return an empty list for an unknown beacon")
        void shouldReturnEmptyForUnknownBeacon() {
            assertThat(store.signals("unknown", T0, T0, store.snapshot())).isEmpty();
        }

        @Test
        @DisplayName("should see every append that completed before the cut under concurrency")
        void shouldSeeEveryCompletedAppend() throws Exception {
            SignalStore large = new SignalStore(10_000);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch done = new CountDownLatch(4);
            try {
                for (int t = 0; t < 4; t++) {
                    String gateway = "g" + t;
                    pool.submit(() -> {
                        for (int i = 0; i < 500; i++) {
                            large.append(RawSignal.of("b1", gateway, -60, T0));
                        }
                        done.countDown();
                    });
                }
                assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            } finally {
                pool.shutdownNow();
            }

            long cut = large.snapshot();
            assertThat(large.signals("b1", T0, T0, cut)).hasSize(2000);
            assertThat(cut).isEqualTo(2000);
        }
    }

    @Nested
    @DisplayName("Retention Tests")
    class RetentionTests {

        @Test
        @DisplayName("should purge old signals and forget empty beacons")
        void shouldPurgeOldSignals() {
            store.append(RawSignal.of("b1", "g1", -60, T0.minusSeconds(120)));
            store.append(RawSignal.of("b1", "g1", -61, T0));
            store.append(RawSignal.of("b2", "g1", -62, T0.minusSeconds(90)));

            int removed = store.purgeOlderThan(T0.minusSeconds(60));

            assertThat(removed).isEqualTo(2);
            assertThat(store.size()).isEqualTo(1);
            assertThat(store.beaconCount()).isEqualTo(1);
            assertThat(store.queryRawSignals("b1", T0.minusSeconds(600), T0))
                    .extracting(RawSignal::rssiDbm).containsExactly(-61);
        }

        @Test
        @DisplayName("should purge nothing when everything is recent")
        void shouldPurgeNothingWhenRecent() {
            store.append(RawSignal.of("b1", "g1", -60, T0));

            assertThat(store.purgeOlderThan(T0.minusSeconds(1))).isZero();
            assertThat(store.size()).isEqualTo(1);
        }
    }
}
