package io.github.rfplot.dto;

import java.util.List;

/**
 * @param status     {@code "ACTIVE"} if the satellites replaced the current set, {@code "REJECTED"} otherwise
 * @param message    human-readable detail about the result
 * @param satellites loaded satellites, empty on rejection
 */
public record SatelliteResponse(String status, String message, List<SatelliteInfo> satellites) {
}
