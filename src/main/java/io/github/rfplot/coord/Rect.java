package io.github.rfplot.coord;

/**
 * Axis-aligned rectangle anchored at {@code origin} (the corner with the smallest coordinates
 * for positive sizes).
 */
public record Rect<S extends CoordinateSpace>(Point<S> origin, Size<S> size) {

    public static <S extends CoordinateSpace> Rect<S> of(final double x, final double y,
                                                         final double width, final double height) {
        return new Rect<>(new Point<>(x, y), new Size<>(width, height));
    }

    public double x() {
        return origin.x();
    }

    public double y() {
        return origin.y();
    }

    public double width() {
        return size.width();
    }

    public double height() {
        return size.height();
    }

    public double minX() {
        return Math.min(x(), x() + width());
    }

    public double maxX() {
        return Math.max(x(), x() + width());
    }

    public double minY() {
        return Math.min(y(), y() + height());
    }

    public double maxY() {
        return Math.max(y(), y() + height());
    }

    public Point<S> center() {
        return new Point<>(x() + width() / 2.0, y() + height() / 2.0);
    }

    public boolean contains(final Point<S> p) {
        return p.x() >= minX() && p.x() <= maxX() && p.y() >= minY() && p.y() <= maxY();
    }
}
