package io.github.rfplot.orbit;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.utils.Constants;
import org.orekit.utils.PVCoordinates;

import java.time.Instant;

/**
 * Inertial position and velocity of a ground site on the WGS-84 ellipsoid, rotated by Greenwich
 * Mean Sidereal Time (IAU 1982). The resulting frame is the true-equator, mean-equinox frame
 * SGP4 produces its states in, to the accuracy GMST allows.
 */
public final class SiteModel {

    private static final double JD_UNIX_EPOCH = 2440587.5;
    private static final double JD_J2000 = 2451545.0;
    private static final double DAYS_PER_CENTURY = 36525.0;
    private static final double SECONDS_PER_DAY = 86400.0;

    /** Earth rotation rate (rad/s) at J2000 and its secular drift per Julian century. */
    private static final double OMEGA_EARTH = 7.2921158553e-5;
    private static final double OMEGA_EARTH_DRIFT = 4.3e-15;

    private SiteModel() {
    }

    public static double julianDate(final Instant instant) {
        return JD_UNIX_EPOCH + (instant.getEpochSecond() + instant.getNano() / 1e9) / SECONDS_PER_DAY;
    }

    /**
     * @param jd Julian date (UT1, approximated by UTC)
     * @return Greenwich Mean Sidereal Time in radians, in {@code [0, 2π)}
     */
    public static double gmst(final double jd) {
        final var d = jd - JD_J2000;
        final var t = d / DAYS_PER_CENTURY;
        final var degrees = 280.46061837
                + 360.98564736629 * d
                + 0.000387933 * t * t
                - t * t * t / 38710000.0;
        final var wrapped = Math.toRadians(degrees % 360.0);
        return wrapped < 0.0 ? wrapped + 2.0 * Math.PI : wrapped;
    }

    /**
     * Site position (m) and velocity (m/s) in the inertial frame of date.
     *
     * @param site ground station
     * @param jd   Julian date of the sample
     */
    public static PVCoordinates inertialState(final Site site, final double jd) {
        final var f = Constants.WGS84_EARTH_FLATTENING;
        final var a = Constants.WGS84_EARTH_EQUATORIAL_RADIUS;
        final var sinLat = Math.sin(site.latitude());
        final var cosLat = Math.cos(site.latitude());
        final var c = 1.0 / Math.sqrt(1.0 - (2.0 - f) * f * sinLat * sinLat);
        final var s = (1.0 - f) * (1.0 - f) * c;
        final var h = site.altitudeKm() * 1000.0;

        final var theta = gmst(jd) + site.longitude();
        final var rxy = (a * c + h) * cosLat;
        final var position = new Vector3D(
                rxy * Math.cos(theta),
                rxy * Math.sin(theta),
                (a * s + h) * sinLat);

        final var omega = OMEGA_EARTH + OMEGA_EARTH_DRIFT * (jd - JD_J2000) / DAYS_PER_CENTURY;
        final var velocity = new Vector3D(-omega * position.getY(), omega * position.getX(), 0.0);
        return new PVCoordinates(position, velocity);
    }
}
