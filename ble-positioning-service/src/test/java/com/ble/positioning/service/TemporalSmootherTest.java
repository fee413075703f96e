package com.ble.positioning.service;

import com.ble.positioning.model.EstimationMethod;
import com.ble.positioning.model.Point;
import com.ble.positioning.model.PositionEstimate;
import com.ble.positioning.model.SmoothedPosition;
import java.time.Duration;
import java.time.Instant;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Temporal Smoother Tests")
class TemporalSmootherTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String BEACON = "beacon-1";

    private TemporalSmoother smoother;

    @BeforeEach
    void setUp() {
        smoother = new TemporalSmoother(0.3, 0.5, Duration.ofSeconds(10), 0.5);
    }

    @Nested
    @DisplayName("First Observation Tests")
    class FirstObservationTests {

        @Test
        @DisplayName("should adopt the raw position with no movement")
        void shouldAdoptRawPosition() {
            SmoothedPosition position = smoother.update(BEACON, raw(4, 5, 0, "floor-1"));

            assertThat(position.point()).isEqualTo(Point.of(4, 5));
            assertThat(position.speed()).isZero();
            assertThat(position.heading()).isNull();
            assertThat(position.hasHeading()).isFalse();
            assertThat(position.accuracy()).isEqualTo(1.0);
            assertThat(smoother.current(BEACON)).contains(position);
        }

        @Test
        @DisplayName("should have no current position for an unseen beacon")
        void shouldHaveNoCurrentPositionForUnseenBeacon() {
            assertThat(smoother.current("never-seen")).isEmpty();
        }

        @Test
        @DisplayName("should restart smoothing when the floor changes")
        void shouldResetOnFloorChange() {
            smoother.update(BEACON, raw(0, 0, 0, "floor-1"));
            smoother.update(BEACON, raw(10, 0, 1, "floor-1"));

            SmoothedPosition upstairs = smoother.update(BEACON, raw(2, 2, 2, "floor-2"));

            assertThat(upstairs.floorId()).isEqualTo("floor-2");
            assertThat(upstairs.point()).isEqualTo(Point.of(2, 2));
            assertThat(upstairs.speed()).isZero();
            assertThat(upstairs.heading()).isNull();
        }

        @Test
        @DisplayName("should treat the next estimate after a reset as a first observation")
        void shouldForgetOnReset() {
            smoother.update(BEACON, raw(0, 0, 0, "floor-1"));
            smoother.reset(BEACON);

            assertThat(smoother.current(BEACON)).isEmpty();
            assertThat(smoother.update(BEACON, raw(9, 9, 1, "floor-1")).point()).isEqualTo(Point.of(9, 9));
        }
    }

    @Nested
    @DisplayName("Movement Tests")
    class MovementTests {

        @Test
        @DisplayName("should blend toward the raw position and derive velocity")
        void shouldBlendAndDeriveVelocity() {
            smoother.update(BEACON, raw(0, 0, 0, "floor-1"));

            SmoothedPosition moved = smoother.update(BEACON, raw(10, 0, 1, "floor-1"));

            assertThat(moved.x()).isCloseTo(3.0, within(1e-9));
            assertThat(moved.y()).isCloseTo(0.0, within(1e-9));
            assertThat(moved.velocityX()).isCloseTo(3.0, within(1e-9));
            assertThat(moved.speed()).isCloseTo(3.0, within(1e-9));
            assertThat(moved.heading()).isCloseTo(0.0, within(1e-9));
        }

        @Test
        @DisplayName("should report a heading in [0, 360) whenever the beacon moves")
        void shouldKeepHeadingInRange() {
            Random random = new Random(7);
            smoother.update(BEACON, raw(10, 10, 0, "floor-1"));
            for (int i = 1; i <= 200; i++) {
                SmoothedPosition position = smoother.update(BEACON,
                        raw(random.nextDouble() * 20, random.nextDouble() * 20, i, "floor-1"));
                if (position.speed() > 0) {
                    assertThat(position.heading()).isBetween(0.0, 359.999999);
                } else {
                    assertThat(position.heading()).isNull();
                }
            }
        }

        @Test
        @DisplayName("should hold the position and decay velocity for small jitter")
        void shouldHoldPositionForJitter() {
            smoother.update(BEACON, raw(0, 0, 0, "floor-1"));
            smoother.update(BEACON, raw(10, 0, 1, "floor-1"));

            SmoothedPosition held = smoother.update(BEACON, raw(3.1, 0, 2, "floor-1"));

            assertThat(held.x()).isCloseTo(3.0, within(1e-9));
            assertThat(held.velocityX()).isCloseTo(1.5, within(1e-9));
            assertThat(held.updatedAt()).isEqualTo(T0.plusSeconds(2));
        }

        @Test
        @DisplayName("should keep the previous velocity when time does not advance")
        void shouldKeepVelocityWithoutElapsedTime() {
            smoother.update(BEACON, raw(0, 0, 0, "floor-1"));
            smoother.update(BEACON, raw(10, 0, 1, "floor-1"));

            SmoothedPosition same = smoother.update(BEACON, raw(10, 0, 1, "floor-1"));

            assertThat(same.velocityX()).isCloseTo(3.0, within(1e-9));
            assertThat(same.x()).isCloseTo(5.1, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Convergence Tests")
    class ConvergenceTests {

        @Test
        @DisplayName("should converge to a constant raw position despite the stability hold")
        void shouldConvergeToConstantInput() {
            smoother.update(BEACON, raw(0, 0, 0, "floor-1"));

            SmoothedPosition position = null;
            for (int i = 1; i <= 400; i++) {
                position = smoother.update(BEACON, raw(0.4, 0, i, "floor-1"));
            }

            assertThat(position.x()).isCloseTo(0.4, within(1e-3));
            assertThat(position.y()).isCloseTo(0.0, within(1e-9));
            assertThat(position.speed()).isZero();
            assertThat(position.heading()).isNull();
        }

        @Test
        @DisplayName("should converge to a constant raw position when moving in")
        void shouldConvergeFromFarAway() {
            smoother.update(BEACON, raw(15, 15, 0, "floor-1"));

            SmoothedPosition position = null;
            for (int i = 1; i <= 400; i++) {
                position = smoother.update(BEACON, raw(2, 3, i, "floor-1"));
            }

            assertThat(position.point().distanceTo(Point.of(2, 3))).isLessThan(0.5);
            assertThat(position.speed()).isLessThan(0.1);
        }
    }

    @Test
    @DisplayName("should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new TemporalSmoother(0.0, 0.5, Duration.ofSeconds(10), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TemporalSmoother(1.5, 0.5, Duration.ofSeconds(10), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TemporalSmoother(0.3, 0.5, Duration.ofSeconds(10), 2.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static PositionEstimate raw(double x, double y, long secondsAfterStart, String floorId) {
        return new PositionEstimate(BEACON, floorId, x, y, 1.0, EstimationMethod.LEAST_SQUARES,
                T0.plusSeconds(secondsAfterStart));
    }
}
