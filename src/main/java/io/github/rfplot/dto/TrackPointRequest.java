package io.github.rfplot.dto;

/**
 * @param time      seconds since the spectrogram start
 * @param frequency offset from the center frequency in Hz
 */
public record TrackPointRequest(Double time, Double frequency) {
}
