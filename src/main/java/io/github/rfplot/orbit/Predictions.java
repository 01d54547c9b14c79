package io.github.rfplot.orbit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-satellite Doppler and visibility series over one shared time grid. Arrays are copied in and
 * out, so a published instance cannot be changed by its readers.
 *
 * @param times  sample times in seconds since the spectrogram start
 * @param series NORAD ID → series, in satellite order; samples where propagation failed are NaN
 */
public record Predictions(double[] times, Map<Integer, SatellitePrediction> series) {

    public Predictions {
        times = times.clone();
        series = Collections.unmodifiableMap(new LinkedHashMap<>(series));
    }

    @Override
    public double[] times() {
        return times.clone();
    }

    /**
     * @param frequency   Doppler-shifted downlink frequency in Hz
     * @param zenithAngle topocentric zenith angle in radians
     */
    public record SatellitePrediction(double[] frequency, double[] zenithAngle) {

        public SatellitePrediction {
            frequency = frequency.clone();
            zenithAngle = zenithAngle.clone();
        }

        @Override
        public double[] frequency() {
            return frequency.clone();
        }

        @Override
        public double[] zenithAngle() {
            return zenithAngle.clone();
        }
    }

    public Optional<SatellitePrediction> forId(final int noradId) {
        return Optional.ofNullable(series.get(noradId));
    }
}
