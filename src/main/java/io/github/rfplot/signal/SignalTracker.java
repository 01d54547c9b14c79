package io.github.rfplot.signal;

import io.github.rfplot.coord.CoordinateSpace.DataAbsolute;
import io.github.rfplot.coord.Point;
import io.github.rfplot.spectrogram.Spectrogram;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans a spectrogram along a user-drawn track for drifting narrowband signals.
 *
 * <p>Track points are converted to (slice, channel) indices. Between consecutive points the
 * expected channel is interpolated linearly in index space, and at every slice a window of
 * {@code ±halfBandwidth} around it is handed to a {@link SignalDetector}. Each slice is scanned
 * at most once, even where two segments meet.
 */
@Slf4j
public final class SignalTracker {

    private SignalTracker() {
    }

    /**
     * @param spectrogram   data to scan
     * @param trackPoints   anchor points sorted by time; fewer than two yields no signals
     * @param halfBandwidth half width of the search window in Hz
     * @param detector      per-slice detection method
     * @return detected peaks in absolute data coordinates, in time order
     * @throws IllegalArgumentException if the track points are not sorted by time or the half
     *                                  bandwidth is negative
     */
    public static List<Point<DataAbsolute>> findSignals(final Spectrogram spectrogram,
                                                        final List<Point<DataAbsolute>> trackPoints,
                                                        final double halfBandwidth,
                                                        final SignalDetector detector) {
        if (!(halfBandwidth >= 0.0)) {
            throw new IllegalArgumentException("Half bandwidth must be non-negative, got " + halfBandwidth);
        }
        if (trackPoints.size() < 2) {
            return List.of();
        }
        final var data = spectrogram.data();
        final var nt = data.rows();
        final var nf = data.columns();
        if (nt == 0) {
            return List.of();
        }

        final var bw = spectrogram.bandwidth();
        final var tScale = nt / spectrogram.lengthSeconds();
        final var fScale = nf / bw;
        // a window wider than the band covers all of it
        final var halfBins = (int) Math.min(nf, Math.floor(halfBandwidth * fScale));

        final var indices = trackPoints.stream()
                .map(p -> new int[]{toIndex(p.x() * tScale, nt), toIndex((p.y() + bw / 2.0) * fScale, nf)})
                .toList();

        final var signals = new ArrayList<Point<DataAbsolute>>();
        var lastScanned = -1;
        for (var i = 0; i + 1 < indices.size(); i++) {
            final var a = indices.get(i);
            final var b = indices.get(i + 1);
            if (b[0] < a[0]) {
                throw new IllegalArgumentException("Track points must be sorted by time");
            }
            final var slope = b[0] == a[0] ? 0.0 : (double) (b[1] - a[1]) / (b[0] - a[0]);
            for (var t = Math.max(a[0], lastScanned + 1); t <= b[0]; t++) {
                final var center = (int) Math.round(a[1] + slope * (t - a[0]));
                final var from = Math.max(0, center - halfBins);
                final var to = Math.min(nf - 1, center + halfBins);
                final var window = data.copyRange(t, from, to + 1);
                for (final var peak : detector.detect(window)) {
                    signals.add(Point.of(t / tScale, (peak + from) / fScale - bw / 2.0));
                }
            }
            lastScanned = Math.max(lastScanned, b[0]);
        }

        log.debug("Scanned slices {}..{} with {} bins each side, {} peaks",
                indices.get(0)[0], lastScanned, halfBins, signals.size());
        return signals;
    }

    static int toIndex(final double value, final int length) {
        final var rounded = Math.round(value);
        return (int) Math.max(0, Math.min(length - 1, rounded));
    }
}
