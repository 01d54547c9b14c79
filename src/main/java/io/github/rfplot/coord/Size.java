package io.github.rfplot.coord;

public record Size<S extends CoordinateSpace>(double width, double height) {

    public static <S extends CoordinateSpace> Size<S> of(final double width, final double height) {
        return new Size<>(width, height);
    }
}
