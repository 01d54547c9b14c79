package io.github.rfplot.orbit;

import io.github.rfplot.orbit.Predictions.SatellitePrediction;
import lombok.extern.slf4j.Slf4j;
import org.orekit.errors.OrekitException;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScales;
import org.orekit.utils.PVCoordinates;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Predicts the Doppler-shifted frequency and zenith angle of each satellite over the span of a
 * spectrogram, on a fixed grid of {@value #SAMPLES} samples.
 *
 * <p>Satellite states come from SGP4/SDP4; the site state comes from {@link SiteModel}. A sample
 * whose propagation fails is set to NaN in both series and the run continues.
 */
@Slf4j
@Service
public class SatellitePredictor {

    public static final int SAMPLES = 1000;

    /** Source of satellite states in the inertial frame of date. */
    @FunctionalInterface
    interface Ephemeris {
        PVCoordinates at(AbsoluteDate date);
    }

    private final TimeScale utc;

    public SatellitePredictor(final TimeScales timeScales) {
        this.utc = timeScales.getUTC();
    }

    public Predictions predict(final List<Satellite> satellites, final Instant startTime,
                               final double durationSeconds, final Site site) {
        final var times = timeGrid(durationSeconds);
        final var startDate = toDate(startTime);

        final var jd0 = SiteModel.julianDate(startTime);
        final var siteStates = new PVCoordinates[times.length];
        for (var i = 0; i < times.length; i++) {
            siteStates[i] = SiteModel.inertialState(site, jd0 + times[i] / 86400.0);
        }

        final var series = new LinkedHashMap<Integer, SatellitePrediction>();
        for (final var satellite : satellites) {
            final var propagator = satellite.newPropagator();
            final Ephemeris ephemeris = date -> propagator.propagate(date).getPVCoordinates();
            series.put(satellite.noradId(),
                    predictSeries(satellite, ephemeris, startDate, times, siteStates));
        }

        log.debug("Predicted {} satellites over {} s", satellites.size(), durationSeconds);
        return new Predictions(times, series);
    }

    SatellitePrediction predictSeries(final Satellite satellite, final Ephemeris ephemeris,
                                      final AbsoluteDate startDate, final double[] times,
                                      final PVCoordinates[] siteStates) {
        final var frequency = new double[times.length];
        final var zenithAngle = new double[times.length];
        var failures = 0;
        for (var i = 0; i < times.length; i++) {
            try {
                final var state = ephemeris.at(startDate.shiftedBy(times[i]));
                final var observation = LineOfSight.observe(state, siteStates[i], satellite.txFrequency());
                frequency[i] = observation.frequency();
                zenithAngle[i] = observation.zenithAngle();
            } catch (final OrekitException e) {
                frequency[i] = Double.NaN;
                zenithAngle[i] = Double.NaN;
                failures++;
            }
        }
        if (failures > 0) {
            log.warn("[{}] Propagation failed for {} of {} samples", satellite.displayName(), failures, times.length);
        }
        return new SatellitePrediction(frequency, zenithAngle);
    }

    static double[] timeGrid(final double durationSeconds) {
        final var times = new double[SAMPLES];
        for (var i = 0; i < SAMPLES; i++) {
            times[i] = durationSeconds * i / (SAMPLES - 1);
        }
        return times;
    }

    AbsoluteDate toDate(final Instant instant) {
        final var subMillis = (instant.getNano() % 1_000_000) / 1e9;
        return new AbsoluteDate(Date.from(instant), utc).shiftedBy(subMillis);
    }
}
