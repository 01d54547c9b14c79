package io.github.rfplot.coord;

public record Vector<S extends CoordinateSpace>(double x, double y) {

    public static <S extends CoordinateSpace> Vector<S> of(final double x, final double y) {
        return new Vector<>(x, y);
    }

    public Vector<S> plus(final Vector<S> other) {
        return new Vector<>(x + other.x, y + other.y);
    }

    public Vector<S> minus(final Vector<S> other) {
        return new Vector<>(x - other.x, y - other.y);
    }

    public Vector<S> times(final double factor) {
        return new Vector<>(x * factor, y * factor);
    }
}
