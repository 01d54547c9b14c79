package io.github.rfplot.dto;

/**
 * Outcome of a session command.
 *
 * @param status  {@code "ACTIVE"}, {@code "ACCEPTED"} for started background work, or {@code "REJECTED"}
 * @param message human-readable detail about the result
 */
public record PlotResponse(String status, String message) {
}
