package io.github.rfplot.dto;

/**
 * @param tlePath       two- or three-line element file
 * @param frequencyPath {@code <norad_id> <MHz>} table covering every satellite in the TLE file
 */
public record SatelliteRequest(String tlePath, String frequencyPath) {
}
