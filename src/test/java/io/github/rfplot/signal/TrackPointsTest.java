package io.github.rfplot.signal;

import io.github.rfplot.coord.Point;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackPointsTest {

    @Test
    void keepsPointsSortedByTime() {
        final var points = TrackPoints.empty()
                .with(Point.of(5.0, 100.0))
                .with(Point.of(1.0, 200.0))
                .with(Point.of(3.0, 300.0));

        assertThat(points.points()).extracting(Point::x).containsExactly(1.0, 3.0, 5.0);
    }

    @Test
    void pointAtExistingTimeReplacesIt() {
        final var points = TrackPoints.empty()
                .with(Point.of(1.0, 200.0))
                .with(Point.of(1.0, -50.0));

        assertThat(points.size()).isEqualTo(1);
        assertThat(points.points().get(0).y()).isEqualTo(-50.0);
    }

    @Test
    void withLeavesOriginalUntouched() {
        final var empty = TrackPoints.empty();

        final var one = empty.with(Point.of(1.0, 1.0));

        assertThat(empty.isEmpty()).isTrue();
        assertThat(one.size()).isEqualTo(1);
        assertThatThrownBy(() -> one.points().add(Point.of(2.0, 2.0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
