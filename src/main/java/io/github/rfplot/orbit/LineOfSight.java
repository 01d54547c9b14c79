package io.github.rfplot.orbit;

import org.orekit.utils.Constants;
import org.orekit.utils.PVCoordinates;

/**
 * Doppler shift and zenith angle of a satellite seen from a site, both given in the same
 * inertial frame.
 */
public final class LineOfSight {

    public record Observation(double frequency, double zenithAngle, double range, double rangeRate) {
    }

    private LineOfSight() {
    }

    public static Observation observe(final PVCoordinates satellite, final PVCoordinates site,
                                      final double txFrequency) {
        final var los = satellite.getPosition().subtract(site.getPosition());
        final var range = los.getNorm();
        final var relativeVelocity = satellite.getVelocity().subtract(site.getVelocity());
        final var rangeRate = relativeVelocity.dotProduct(los) / range;

        final var frequency = (1.0 - rangeRate / Constants.SPEED_OF_LIGHT) * txFrequency;

        final var cosZenith = los.dotProduct(site.getPosition())
                / (range * Constants.WGS84_EARTH_EQUATORIAL_RADIUS);
        final var zenithAngle = Math.acos(Math.max(-1.0, Math.min(1.0, cosZenith)));

        return new Observation(frequency, zenithAngle, range, rangeRate);
    }
}
