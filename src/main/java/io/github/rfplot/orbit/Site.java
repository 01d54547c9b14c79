package io.github.rfplot.orbit;

/**
 * Geodetic position of the ground station.
 *
 * @param latitude   geodetic latitude in radians
 * @param longitude  east longitude in radians
 * @param altitudeKm height above the ellipsoid in km
 */
public record Site(double latitude, double longitude, double altitudeKm) {

    public static Site ofDegrees(final double latitudeDeg, final double longitudeDeg, final double altitudeKm) {
        return new Site(Math.toRadians(latitudeDeg), Math.toRadians(longitudeDeg), altitudeKm);
    }
}
