package io.github.rfplot.dto;

import io.github.rfplot.spectrogram.Spectrogram;

/**
 * Metadata of the installed spectrogram.
 *
 * @param startTime       ISO-8601 UTC timestamp of the first slice
 * @param centerFrequency center frequency in Hz
 * @param bandwidth       total bandwidth in Hz
 * @param sliceDuration   duration of one slice in seconds
 * @param channelCount    frequency channels per slice
 * @param sliceCount      number of slices
 * @param minPower        lowest power in dB
 * @param maxPower        highest power in dB
 */
public record SpectrogramInfo(String startTime, double centerFrequency, double bandwidth, double sliceDuration,
                              int channelCount, int sliceCount, float minPower, float maxPower) {

    public static SpectrogramInfo of(final Spectrogram spectrogram) {
        return new SpectrogramInfo(spectrogram.startTime().toString(), spectrogram.centerFrequency(),
                spectrogram.bandwidth(), spectrogram.sliceDuration(), spectrogram.channelCount(),
                spectrogram.sliceCount(), spectrogram.minPower(), spectrogram.maxPower());
    }
}
