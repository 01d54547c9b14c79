package io.github.rfplot.dto;

import io.github.rfplot.orbit.Satellite;

public record SatelliteInfo(int noradId, String name, double txFrequency) {

    public static SatelliteInfo of(final Satellite satellite) {
        return new SatelliteInfo(satellite.noradId(), satellite.displayName(), satellite.txFrequency());
    }
}
