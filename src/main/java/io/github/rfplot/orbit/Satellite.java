package io.github.rfplot.orbit;

import org.orekit.attitudes.FrameAlignedProvider;
import org.orekit.frames.Frame;
import org.orekit.frames.Transform;
import org.orekit.propagation.Propagator;
import org.orekit.propagation.analytical.tle.TLE;
import org.orekit.propagation.analytical.tle.TLEPropagator;

/**
 * A tracked object with its element set and downlink frequency.
 *
 * @param noradId     NORAD catalog number
 * @param name        title line of the TLE, or {@code null} for two-line records
 * @param tle         parsed element set
 * @param txFrequency downlink transmit frequency in Hz
 */
public record Satellite(int noradId, String name, TLE tle, double txFrequency) {

    /**
     * Inertial frame the SGP4 output is expressed in. It is attached to the root frame without
     * any Earth-orientation model, so propagation never needs EOP data; the predictor only reads
     * coordinates in this frame and never converts them.
     */
    static final Frame TEME = new Frame(Frame.getRoot(), Transform.IDENTITY, "TEME", true);

    /**
     * Builds a new SGP4/SDP4 propagator. Propagators are stateful, so each prediction run gets
     * its own.
     *
     * @throws org.orekit.errors.OrekitException if the elements cannot be initialized
     */
    public TLEPropagator newPropagator() {
        return TLEPropagator.selectExtrapolator(tle, new FrameAlignedProvider(TEME),
                Propagator.DEFAULT_MASS, TEME);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "%05d".formatted(noradId) : name;
    }
}
