package io.github.rfplot.coord;

import io.github.rfplot.coord.CoordinateSpace.DataAbsolute;
import io.github.rfplot.coord.CoordinateSpace.DataNormalized;
import io.github.rfplot.coord.CoordinateSpace.PlotArea;
import io.github.rfplot.coord.CoordinateSpace.Screen;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TransformsTest {

    private static final double EPS = 1e-9;

    private static final Size<Screen> WIDGET = Size.of(800.0, 600.0);
    private static final Rect<DataNormalized> VIEW = Rect.of(0.25, 0.5, 0.5, 0.25);
    private static final Rect<DataAbsolute> BOUNDS = Rect.of(0.0, -24_000.0, 120.0, 48_000.0);

    @Test
    void screenOriginIsTopLeftOfPlotArea() {
        final var t = Transforms.screenToPlotArea(WIDGET);

        final Point<PlotArea> topLeft = t.apply(Point.<Screen>of(0.0, 0.0));
        final Point<PlotArea> bottomRight = t.apply(Point.<Screen>of(800.0, 600.0));

        assertThat(topLeft.x()).isCloseTo(0.0, within(EPS));
        assertThat(topLeft.y()).isCloseTo(1.0, within(EPS));
        assertThat(bottomRight.x()).isCloseTo(1.0, within(EPS));
        assertThat(bottomRight.y()).isCloseTo(0.0, within(EPS));
    }

    @Test
    void plotAreaCornersMapToViewWindowCorners() {
        final var t = Transforms.plotAreaToDataNormalized(VIEW);

        final var lower = t.apply(Point.<PlotArea>of(0.0, 0.0));
        final var upper = t.apply(Point.<PlotArea>of(1.0, 1.0));

        assertThat(lower.x()).isCloseTo(0.25, within(EPS));
        assertThat(lower.y()).isCloseTo(0.5, within(EPS));
        assertThat(upper.x()).isCloseTo(0.75, within(EPS));
        assertThat(upper.y()).isCloseTo(0.75, within(EPS));
    }

    @Test
    void normalizedCenterIsCenterFrequencyAtMidTime() {
        final var p = Transforms.dataNormalizedToDataAbsolute(BOUNDS).apply(Point.<DataNormalized>of(0.5, 0.5));

        assertThat(p.x()).isCloseTo(60.0, within(EPS));
        assertThat(p.y()).isCloseTo(0.0, within(EPS));
    }

    @Test
    void screenToDataAbsoluteRoundTrips() {
        final var forward = Transforms.screenToDataAbsolute(WIDGET, VIEW, BOUNDS);
        final var backward = Transforms.dataAbsoluteToScreen(WIDGET, VIEW, BOUNDS);

        for (final var p : new double[][]{{0, 0}, {800, 600}, {123.5, 456.25}, {-40, 900}}) {
            final var back = backward.apply(forward.apply(Point.<Screen>of(p[0], p[1])));
            assertThat(back.x()).isCloseTo(p[0], within(1e-6));
            assertThat(back.y()).isCloseTo(p[1], within(1e-6));
        }
    }

    @Test
    void everyInverseUndoesItsForwardMap() {
        final var p = Point.<PlotArea>of(0.3, 0.8);

        final var viaNormalized = Transforms.dataNormalizedToPlotArea(VIEW)
                .apply(Transforms.plotAreaToDataNormalized(VIEW).apply(p));
        final var viaAbsolute = Transforms.dataAbsoluteToPlotArea(VIEW, BOUNDS)
                .apply(Transforms.plotAreaToDataAbsolute(VIEW, BOUNDS).apply(p));
        final var viaScreen = Transforms.screenToPlotArea(WIDGET)
                .apply(Transforms.plotAreaToScreen(WIDGET).apply(p));

        for (final var back : List.of(viaNormalized, viaAbsolute, viaScreen)) {
            assertThat(back.x()).isCloseTo(p.x(), within(EPS));
            assertThat(back.y()).isCloseTo(p.y(), within(EPS));
        }

        final var n = Point.<DataNormalized>of(0.1, 0.9);
        final var n2 = Transforms.screenToDataNormalized(WIDGET, VIEW)
                .apply(Transforms.dataNormalizedToScreen(WIDGET, VIEW).apply(n));
        final var n3 = Transforms.dataAbsoluteToDataNormalized(BOUNDS)
                .apply(Transforms.dataNormalizedToDataAbsolute(BOUNDS).apply(n));
        assertThat(n2.x()).isCloseTo(n.x(), within(EPS));
        assertThat(n2.y()).isCloseTo(n.y(), within(EPS));
        assertThat(n3.x()).isCloseTo(n.x(), within(EPS));
        assertThat(n3.y()).isCloseTo(n.y(), within(EPS));
    }

    @Test
    void vectorsIgnoreTranslation() {
        final var t = Transforms.dataNormalizedToDataAbsolute(BOUNDS);

        final var v = t.apply(Vector.<DataNormalized>of(0.5, 0.25));
        final var s = t.apply(Size.<DataNormalized>of(1.0, 1.0));

        assertThat(v.x()).isCloseTo(60.0, within(EPS));
        assertThat(v.y()).isCloseTo(12_000.0, within(EPS));
        assertThat(s.width()).isCloseTo(120.0, within(EPS));
        assertThat(s.height()).isCloseTo(48_000.0, within(EPS));
    }

    @Test
    void rectangleMapsOriginAsPointAndSizeAsSize() {
        final var mapped = Transforms.dataNormalizedToDataAbsolute(BOUNDS).apply(Rect.<DataNormalized>of(0.0, 0.0, 1.0, 1.0));

        assertThat(mapped.x()).isCloseTo(BOUNDS.x(), within(EPS));
        assertThat(mapped.y()).isCloseTo(BOUNDS.y(), within(EPS));
        assertThat(mapped.width()).isCloseTo(BOUNDS.width(), within(EPS));
        assertThat(mapped.height()).isCloseTo(BOUNDS.height(), within(EPS));
    }

    @Test
    void compositionAppliesLeftThenRight() {
        final Transform<PlotArea, PlotArea> scale = Transform.scaleTranslate(2.0, 2.0, 0.0, 0.0);
        final Transform<PlotArea, PlotArea> shift = Transform.scaleTranslate(1.0, 1.0, 1.0, 0.0);

        final var p = scale.then(shift).apply(Point.<PlotArea>of(1.0, 1.0));

        assertThat(p.x()).isCloseTo(3.0, within(EPS));
        assertThat(p.y()).isCloseTo(2.0, within(EPS));
        assertThat(Transform.<PlotArea>identity().apply(p)).isEqualTo(p);
    }
}
