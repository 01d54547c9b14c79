package io.github.rfplot.coord;

import java.util.Optional;

/**
 * Liang–Barsky clipping of a line segment against an axis-aligned rectangle.
 */
public final class LineClipper {

    public record Segment<S extends CoordinateSpace>(Point<S> start, Point<S> end) {
    }

    private LineClipper() {
    }

    public static <S extends CoordinateSpace> Optional<Segment<S>> clip(final Rect<S> bounds,
                                                                        final Point<S> a,
                                                                        final Point<S> b) {
        final var delta = b.minus(a);
        final double[] p = {-delta.x(), delta.x(), -delta.y(), delta.y()};
        final double[] q = {
                a.x() - bounds.minX(),
                bounds.maxX() - a.x(),
                a.y() - bounds.minY(),
                bounds.maxY() - a.y()
        };

        var u1 = 0.0;
        var u2 = 1.0;
        for (var i = 0; i < 4; i++) {
            if (p[i] == 0.0) {
                // parallel to this edge: either fully outside or irrelevant
                if (q[i] < 0.0) {
                    return Optional.empty();
                }
                continue;
            }
            final var u = q[i] / p[i];
            if (p[i] < 0.0) {
                u1 = Math.max(u1, u);
            } else {
                u2 = Math.min(u2, u);
            }
        }

        if (u1 > u2) {
            return Optional.empty();
        }
        return Optional.of(new Segment<>(a.plus(delta.times(u1)), a.plus(delta.times(u2))));
    }
}
