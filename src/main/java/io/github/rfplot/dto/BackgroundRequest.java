package io.github.rfplot.dto;

/**
 * @param windowHz width of the running median window in Hz
 */
public record BackgroundRequest(Double windowHz) {
}
