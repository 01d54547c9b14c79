package io.github.rfplot.coord;

public record Point<S extends CoordinateSpace>(double x, double y) {

    public static <S extends CoordinateSpace> Point<S> of(final double x, final double y) {
        return new Point<>(x, y);
    }

    public Point<S> plus(final Vector<S> v) {
        return new Point<>(x + v.x(), y + v.y());
    }

    public Point<S> minus(final Vector<S> v) {
        return new Point<>(x - v.x(), y - v.y());
    }

    public Vector<S> minus(final Point<S> other) {
        return new Vector<>(x - other.x, y - other.y);
    }
}
