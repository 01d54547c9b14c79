package io.github.rfplot.signal;

import io.github.rfplot.coord.CoordinateSpace.DataAbsolute;
import io.github.rfplot.coord.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * User-placed anchor points of a signal track, kept sorted by time. A point placed at the same
 * time as an existing one replaces it.
 *
 * <p>Immutable: {@link #with} returns a new instance, so a session can swap the current set
 * atomically and hand snapshots to worker threads.
 */
public final class TrackPoints {

    private static final TrackPoints EMPTY = new TrackPoints(List.of());
    private static final Comparator<Point<DataAbsolute>> BY_TIME = Comparator.comparingDouble(Point::x);

    private final List<Point<DataAbsolute>> points;

    private TrackPoints(final List<Point<DataAbsolute>> points) {
        this.points = points;
    }

    public static TrackPoints empty() {
        return EMPTY;
    }

    public TrackPoints with(final Point<DataAbsolute> point) {
        final var copy = new ArrayList<>(points);
        final var idx = Collections.binarySearch(copy, point, BY_TIME);
        if (idx >= 0) {
            copy.set(idx, point);
        } else {
            copy.add(-idx - 1, point);
        }
        return new TrackPoints(Collections.unmodifiableList(copy));
    }

    public List<Point<DataAbsolute>> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Override
    public String toString() {
        return "TrackPoints" + points;
    }
}
