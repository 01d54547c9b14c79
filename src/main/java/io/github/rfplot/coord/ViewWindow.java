package io.github.rfplot.coord;

import io.github.rfplot.coord.CoordinateSpace.DataNormalized;
import io.github.rfplot.coord.CoordinateSpace.PlotArea;

/**
 * Pan/zoom state of the plot: a per-axis log₂ zoom level and the center of the visible window,
 * both in {@link DataNormalized} space.
 *
 * <p>The window size on each axis is {@code 2^-zoom}. After every mutation the window is
 * snapped back inside the unit square by moving its center; the size is never changed by
 * snapping. Not thread-safe: callers hand copies ({@link #copy()}) to other threads.
 */
public final class ViewWindow {

    public static final double ZOOM_MIN = 0.0;
    public static final double ZOOM_MAX = 8.0;
    public static final double ZOOM_WHEEL_SCALE = 0.2;

    private double zoomX = ZOOM_MIN;
    private double zoomY = ZOOM_MIN;
    private Point<DataNormalized> center = Point.of(0.5, 0.5);

    public ViewWindow copy() {
        final var copy = new ViewWindow();
        copy.zoomX = zoomX;
        copy.zoomY = zoomY;
        copy.center = center;
        return copy;
    }

    public double zoomX() {
        return zoomX;
    }

    public double zoomY() {
        return zoomY;
    }

    public Point<DataNormalized> center() {
        return center;
    }

    public Size<DataNormalized> size() {
        return Size.of(Math.pow(2.0, -zoomX), Math.pow(2.0, -zoomY));
    }

    public Rect<DataNormalized> bounds() {
        final var size = size();
        return new Rect<>(Point.of(center.x() - size.width() / 2.0, center.y() - size.height() / 2.0), size);
    }

    public Transform<PlotArea, DataNormalized> plotAreaToDataNormalized() {
        return Transforms.plotAreaToDataNormalized(bounds());
    }

    /**
     * Moves the window opposite to a drag of {@code delta} in plot-area units, so the data
     * under the cursor follows the cursor.
     */
    public void pan(final Vector<PlotArea> delta) {
        center = center.minus(plotAreaToDataNormalized().apply(delta));
        snapToBounds();
    }

    /**
     * Zooms both axes by {@code delta} wheel steps, keeping the data point under {@code at} fixed.
     */
    public void zoom(final Point<PlotArea> at, final double delta) {
        final var old = plotAreaToDataNormalized().apply(at);
        zoomX = clampZoom(zoomX + delta * ZOOM_WHEEL_SCALE);
        zoomY = clampZoom(zoomY + delta * ZOOM_WHEEL_SCALE);
        final var now = plotAreaToDataNormalized().apply(at);
        center = center.plus(old.minus(now));
        snapToBounds();
    }

    public void zoomX(final Point<PlotArea> at, final double delta) {
        final var oldX = plotAreaToDataNormalized().apply(at).x();
        zoomX = clampZoom(zoomX + delta * ZOOM_WHEEL_SCALE);
        final var newX = plotAreaToDataNormalized().apply(at).x();
        center = Point.of(center.x() + oldX - newX, center.y());
        snapToBounds();
    }

    public void zoomY(final Point<PlotArea> at, final double delta) {
        final var oldY = plotAreaToDataNormalized().apply(at).y();
        zoomY = clampZoom(zoomY + delta * ZOOM_WHEEL_SCALE);
        final var newY = plotAreaToDataNormalized().apply(at).y();
        center = Point.of(center.x(), center.y() + oldY - newY);
        snapToBounds();
    }

    public void setZoomX(final double level) {
        zoomX = clampZoom(level);
        snapToBounds();
    }

    public void setZoomY(final double level) {
        zoomY = clampZoom(level);
        snapToBounds();
    }

    public void reset() {
        zoomX = ZOOM_MIN;
        zoomY = ZOOM_MIN;
        center = Point.of(0.5, 0.5);
    }

    private static double clampZoom(final double level) {
        return Math.max(ZOOM_MIN, Math.min(ZOOM_MAX, level));
    }

    private void snapToBounds() {
        final var bounds = bounds();
        final double dx;
        if (bounds.x() < 0.0) {
            dx = -bounds.x();
        } else if (bounds.x() + bounds.width() > 1.0) {
            dx = 1.0 - (bounds.x() + bounds.width());
        } else {
            dx = 0.0;
        }
        final double dy;
        if (bounds.y() < 0.0) {
            dy = -bounds.y();
        } else if (bounds.y() + bounds.height() > 1.0) {
            dy = 1.0 - (bounds.y() + bounds.height());
        } else {
            dy = 0.0;
        }
        center = Point.of(center.x() + dx, center.y() + dy);
    }

    @Override
    public String toString() {
        return "ViewWindow[zoom=(%.2f, %.2f), center=(%.4f, %.4f)]"
                .formatted(zoomX, zoomY, center.x(), center.y());
    }
}
