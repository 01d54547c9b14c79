package io.github.rfplot.config;

import io.github.rfplot.orbit.Site;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Optional;

/**
 * Settings bound from {@code rfplot.*}.
 *
 * @param site      observer location; predictions are skipped while it is unset
 * @param detection signal search defaults
 * @param executors worker pool sizes
 */
@ConfigurationProperties(prefix = "rfplot")
public record RfPlotProperties(SiteProperties site,
                               @DefaultValue Detection detection,
                               @DefaultValue Executors executors) {

    /**
     * @param latitude  geodetic latitude in degrees
     * @param longitude longitude in degrees, east positive
     * @param altitude  altitude above the ellipsoid in km
     */
    public record SiteProperties(Double latitude, Double longitude, @DefaultValue("0.0") double altitude) {
    }

    /**
     * @param sigma         FitTrace threshold in standard deviations
     * @param halfBandwidth half width of the track search window in Hz
     */
    public record Detection(@DefaultValue("5.0") double sigma, @DefaultValue("10000.0") double halfBandwidth) {
    }

    /**
     * @param spectrogramIo threads reading spectrogram files
     * @param analysis      threads running signal searches and predictions
     */
    public record Executors(@DefaultValue("4") int spectrogramIo, @DefaultValue("2") int analysis) {
    }

    public Optional<Site> configuredSite() {
        if (site == null || site.latitude() == null || site.longitude() == null) {
            return Optional.empty();
        }
        return Optional.of(Site.ofDegrees(site.latitude(), site.longitude(), site.altitude()));
    }
}
