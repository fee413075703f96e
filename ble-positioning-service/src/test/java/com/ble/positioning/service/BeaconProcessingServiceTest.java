package com.ble.positioning.service;

import com.ble.positioning.TestTopology;
import com.ble.positioning.config.TopologyProperties;
import com.ble.positioning.dto.PositionMessage;
import com.ble.positioning.model.AlertType;
import com.ble.positioning.model.EstimationMethod;
import com.ble.positioning.model.Point;
import com.ble.positioning.model.PositionEstimate;
import com.ble.positioning.model.RawSignal;
import com.ble.positioning.model.RecoveredCondition;
import com.ble.positioning.model.SmoothedPosition;
import com.ble.positioning.model.ZoneAlertEvent;
import com.ble.positioning.topology.ConfiguredTopologyProvider;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.ble.positioning.TestTopology.BEACON;
import static com.ble.positioning.TestTopology.GATEWAY_A;
import static com.ble.positioning.TestTopology.GATEWAY_B;
import static com.ble.positioning.TestTopology.GATEWAY_C;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Beacon Processing Service Tests")
class BeaconProcessingServiceTest {

    private static final Point A = Point.of(0, 0);
    private static final Point B = Point.of(10, 0);
    private static final Point C = Point.of(0, 10);

    private PipelineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture(TestTopology.triangleProvider());
    }

    @Nested
    @DisplayName("Located Beacon Tests")
    class LocatedBeaconTests {

        @Test
        @DisplayName("should locate a beacon heard by three gateways")
        void shouldLocateBeacon() {
            Instant now = fixture.now();
            fixture.observe(BEACON, Point.of(3.5, 3.5), 3, now, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);

            BeaconOutcome outcome = fixture.service.process(BEACON, now, fixture.store.snapshot());

            assertThat(outcome).isEqualTo(BeaconOutcome.LOCATED);
            SmoothedPosition position = fixture.smoother.current(BEACON).orElseThrow();
            assertThat(position.x()).isCloseTo(3.5, within(0.5));
            assertThat(position.y()).isCloseTo(3.5, within(0.5));
            assertThat(position.floorId()).isEqualTo(TestTopology.FLOOR);
            assertThat(fixture.repository.positionHistory(BEACON))
                    .extracting(PositionEstimate::method)
                    .containsExactly(EstimationMethod.LEAST_SQUARES);
            assertThat(fixture.publisher.queueSize()).isEqualTo(1);
            assertThat(fixture.repository.alerts()).isEmpty();
        }

        @Test
        @DisplayName("should name the beacon's floor in the published position")
        void shouldPublishFloorName() {
            Instant now = fixture.now();
            fixture.observe(BEACON, Point.of(3.5, 3.5), 3, now, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);
            fixture.publisher.start();

            fixture.service.process(BEACON, now, fixture.store.snapshot());
            fixture.publisher.stop();

            assertThat(fixture.delivered).singleElement()
                    .isInstanceOfSatisfying(PositionMessage.class, message -> {
                        assertThat(message.location().floorId()).isEqualTo(TestTopology.FLOOR);
                        assertThat(message.location().floorName()).isEqualTo(TestTopology.FLOOR);
                    });
        }

        @Test
        @DisplayName("should store and publish a zone entry alert")
        void shouldPublishZoneEntry() {
            Instant now = fixture.now();
            fixture.observe(BEACON, Point.of(6, 6), 3, now, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);

            assertThat(fixture.service.process(BEACON, now, fixture.store.snapshot()))
                    .isEqualTo(BeaconOutcome.LOCATED);

            assertThat(fixture.repository.alerts()).singleElement().satisfies(alert -> {
                assertThat(alert.alertType()).isEqualTo(AlertType.ENTRY);
                assertThat(alert.zoneId()).isEqualTo(TestTopology.ZONE);
            });
            assertThat(fixture.publisher.queueSize()).isEqualTo(2);
        }

        @Test
        @DisplayName("should use circle intersection with two gateways")
        void shouldUseTwoPointWithTwoGateways() {
            Instant now = fixture.now();
            fixture.observe(BEACON, Point.of(5, 2), 2, now, GATEWAY_A, A, GATEWAY_B, B);

            assertThat(fixture.service.process(BEACON, now, fixture.store.snapshot()))
                    .isEqualTo(BeaconOutcome.LOCATED);
            assertThat(fixture.repository.positionHistory(BEACON))
                    .extracting(PositionEstimate::method)
                    .containsExactly(EstimationMethod.TWO_POINT);
        }

        @Test
        @DisplayName("should ignore signals appended after the cut")
        void shouldIgnoreSignalsAfterCut() {
            Instant now = fixture.now();
            long cut = fixture.store.snapshot();
            fixture.observe(BEACON, Point.of(3.5, 3.5), 3, now, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);

            assertThat(fixture.service.process(BEACON, now, cut)).isEqualTo(BeaconOutcome.INSUFFICIENT);
        }
    }

    @Nested
    @DisplayName("Recovered Condition Tests")
    class RecoveredConditionTests {

        @Test
        @DisplayName("should keep the previous position when only one gateway hears the beacon")
        void shouldKeepPreviousPositionWithOneGateway() {
            Instant first = fixture.now();
            fixture.observe(BEACON, Point.of(3.5, 3.5), 3, first, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);
            fixture.service.process(BEACON, first, fixture.store.snapshot());
            SmoothedPosition before = fixture.smoother.current(BEACON).orElseThrow();

            Instant later = first.plusSeconds(30);
            fixture.observe(BEACON, Point.of(9, 9), 3, later, GATEWAY_A, A);

            BeaconOutcome outcome = fixture.service.process(BEACON, later, fixture.store.snapshot());

            assertThat(outcome).isEqualTo(BeaconOutcome.INSUFFICIENT);
            assertThat(fixture.smoother.current(BEACON)).contains(before);
            assertThat(fixture.repository.positionHistory(BEACON)).hasSize(1);
            assertThat(fixture.metrics.recoveredCount(RecoveredCondition.INSUFFICIENT_GATEWAYS)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should leave out gateways with a single sample")
        void shouldSkipSingleSampleGateways() {
            Instant now = fixture.now();
            fixture.observe(BEACON, Point.of(3.5, 3.5), 3, now, GATEWAY_A, A);
            fixture.observe(BEACON, Point.of(3.5, 3.5), 1, now, GATEWAY_B, B, GATEWAY_C, C);

            assertThat(fixture.service.process(BEACON, now, fixture.store.snapshot()))
                    .isEqualTo(BeaconOutcome.INSUFFICIENT);
        }

        @Test
        @DisplayName("should range uncalibrated gateways with nominal values and count it")
        void shouldCountMissingCalibration() {
            TopologyProperties properties = TestTopology.triangle();
            properties.getGateways().get(1).setReferencePower(null);
            fixture = new PipelineFixture(new ConfiguredTopologyProvider(properties));
            Instant now = fixture.now();
            fixture.observe(BEACON, Point.of(3.5, 3.5), 3, now, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);

            assertThat(fixture.service.process(BEACON, now, fixture.store.snapshot()))
                    .isEqualTo(BeaconOutcome.LOCATED);
            assertThat(fixture.metrics.recoveredCount(RecoveredCondition.MISSING_CALIBRATION)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should ignore signals from inactive gateways")
        void shouldIgnoreInactiveGateways() {
            TopologyProperties properties = TestTopology.triangle();
            properties.getGateways().get(2).setActive(false);
            fixture = new PipelineFixture(new ConfiguredTopologyProvider(properties));
            Instant now = fixture.now();
            fixture.observe(BEACON, Point.of(5, 2), 3, now, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);

            fixture.service.process(BEACON, now, fixture.store.snapshot());

            assertThat(fixture.repository.positionHistory(BEACON))
                    .extracting(PositionEstimate::method)
                    .containsExactly(EstimationMethod.TWO_POINT);
        }

        @Test
        @DisplayName("should report unknown beacons")
        void shouldReportUnknownBeacon() {
            Instant now = fixture.now();
            fixture.store.append(RawSignal.of("stranger", GATEWAY_A, -60, now));
            fixture.store.append(RawSignal.of("stranger", GATEWAY_A, -60, now));

            assertThat(fixture.service.process("stranger", now, fixture.store.snapshot()))
                    .isEqualTo(BeaconOutcome.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("should skip a beacon whose previous evaluation is still running")
        void shouldSkipBusyBeacon() throws Exception {
            ReentrantLock lock = fixture.locks.lockFor(BEACON);
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                lock.lock();
                try {
                    held.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock();
                }
            });
            holder.start();
            try {
                assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

                BeaconOutcome outcome = fixture.service.process(BEACON, fixture.now(), fixture.store.snapshot());

                assertThat(outcome).isEqualTo(BeaconOutcome.BUSY);
            } finally {
                release.countDown();
                holder.join(5000);
            }
            assertThat(lock.isLocked()).isFalse();
        }

        @Test
        @DisplayName("should release the beacon lock after processing")
        void shouldReleaseLock() {
            fixture.service.process(BEACON, fixture.now(), fixture.store.snapshot());

            assertThat(fixture.locks.lockFor(BEACON).isLocked()).isFalse();
        }
    }

    @Test
    @DisplayName("should record zone alerts in the alert log in emission order")
    void shouldRecordAlertsInOrder() {
        Instant first = fixture.now();
        fixture.observe(BEACON, Point.of(6, 6), 3, first, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);
        fixture.service.process(BEACON, first, fixture.store.snapshot());

        Instant later = first.plusSeconds(60);
        fixture.observe(BEACON, Point.of(2, 2), 3, later, GATEWAY_A, A, GATEWAY_B, B, GATEWAY_C, C);
        for (int i = 0; i < 30; i++) {
            fixture.service.process(BEACON, later.plusSeconds(i), fixture.store.snapshot());
        }

        assertThat(fixture.repository.alerts()).extracting(ZoneAlertEvent::alertType)
                .containsExactly(AlertType.ENTRY, AlertType.EXIT);
    }
}
