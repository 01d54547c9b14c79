package io.github.rfplot.dto;

import io.github.rfplot.coord.CoordinateSpace.DataAbsolute;
import io.github.rfplot.coord.Point;

/**
 * @param time      seconds since the spectrogram start
 * @param frequency offset from the center frequency in Hz
 */
public record SignalPoint(double time, double frequency) {

    public static SignalPoint of(final Point<DataAbsolute> point) {
        return new SignalPoint(point.x(), point.y());
    }
}
