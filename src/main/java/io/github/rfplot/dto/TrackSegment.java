package io.github.rfplot.dto;

import io.github.rfplot.coord.CoordinateSpace.DataNormalized;
import io.github.rfplot.coord.LineClipper.Segment;

/**
 * Visible part of one track segment, in normalized data coordinates ({@code [0, 1]} on both axes
 * over the whole spectrogram).
 */
public record TrackSegment(double startX, double startY, double endX, double endY) {

    public static TrackSegment of(final Segment<DataNormalized> segment) {
        return new TrackSegment(segment.start().x(), segment.start().y(), segment.end().x(), segment.end().y());
    }
}
