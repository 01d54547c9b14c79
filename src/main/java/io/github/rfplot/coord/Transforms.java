package io.github.rfplot.coord;

import io.github.rfplot.coord.CoordinateSpace.DataAbsolute;
import io.github.rfplot.coord.CoordinateSpace.DataNormalized;
import io.github.rfplot.coord.CoordinateSpace.PlotArea;
import io.github.rfplot.coord.CoordinateSpace.Screen;

/**
 * Constructors for every ordered pair of coordinate spaces.
 *
 * <p>Three elementary maps carry all the information:
 * <ul>
 *   <li>{@code Screen → PlotArea}: {@code x / width}, {@code 1 − y / height}</li>
 *   <li>{@code PlotArea → DataNormalized}: scale/translate by the current view window</li>
 *   <li>{@code DataNormalized → DataAbsolute}: scale/translate by the spectrogram bounds</li>
 * </ul>
 * Everything else is a product of those or an inverse of such a product.
 */
public final class Transforms {

    private Transforms() {
    }

    public static Transform<Screen, PlotArea> screenToPlotArea(final Size<Screen> widget) {
        return Transform.scaleTranslate(1.0 / widget.width(), -1.0 / widget.height(), 0.0, 1.0);
    }

    public static Transform<PlotArea, DataNormalized> plotAreaToDataNormalized(
            final Rect<DataNormalized> view) {
        return Transform.scaleTranslate(view.width(), view.height(), view.x(), view.y());
    }

    public static Transform<DataNormalized, DataAbsolute> dataNormalizedToDataAbsolute(
            final Rect<DataAbsolute> bounds) {
        return Transform.scaleTranslate(bounds.width(), bounds.height(), bounds.x(), bounds.y());
    }

    public static Transform<Screen, DataNormalized> screenToDataNormalized(
            final Size<Screen> widget, final Rect<DataNormalized> view) {
        return screenToPlotArea(widget).then(plotAreaToDataNormalized(view));
    }

    public static Transform<Screen, DataAbsolute> screenToDataAbsolute(
            final Size<Screen> widget, final Rect<DataNormalized> view, final Rect<DataAbsolute> bounds) {
        return screenToDataNormalized(widget, view).then(dataNormalizedToDataAbsolute(bounds));
    }

    public static Transform<PlotArea, DataAbsolute> plotAreaToDataAbsolute(
            final Rect<DataNormalized> view, final Rect<DataAbsolute> bounds) {
        return plotAreaToDataNormalized(view).then(dataNormalizedToDataAbsolute(bounds));
    }

    public static Transform<PlotArea, Screen> plotAreaToScreen(final Size<Screen> widget) {
        return screenToPlotArea(widget).inverse();
    }

    public static Transform<DataNormalized, Screen> dataNormalizedToScreen(
            final Size<Screen> widget, final Rect<DataNormalized> view) {
        return screenToDataNormalized(widget, view).inverse();
    }

    public static Transform<DataNormalized, PlotArea> dataNormalizedToPlotArea(
            final Rect<DataNormalized> view) {
        return plotAreaToDataNormalized(view).inverse();
    }

    public static Transform<DataAbsolute, Screen> dataAbsoluteToScreen(
            final Size<Screen> widget, final Rect<DataNormalized> view, final Rect<DataAbsolute> bounds) {
        return screenToDataAbsolute(widget, view, bounds).inverse();
    }

    public static Transform<DataAbsolute, PlotArea> dataAbsoluteToPlotArea(
            final Rect<DataNormalized> view, final Rect<DataAbsolute> bounds) {
        return plotAreaToDataAbsolute(view, bounds).inverse();
    }

    public static Transform<DataAbsolute, DataNormalized> dataAbsoluteToDataNormalized(
            final Rect<DataAbsolute> bounds) {
        return dataNormalizedToDataAbsolute(bounds).inverse();
    }
}
