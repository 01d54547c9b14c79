package io.github.rfplot.spectrogram;

import org.hipparchus.stat.descriptive.rank.Median;

/**
 * Removes the slowly varying background along the frequency axis by subtracting a running
 * median from every slice. Edges are padded with the nearest channel value.
 */
public final class MedianFilter {

    private MedianFilter() {
    }

    /**
     * @param spectrogram input, left untouched
     * @param windowHz    width of the median window in Hz
     * @return a new spectrogram holding {@code value − median} in dB
     */
    public static Spectrogram subtract(final Spectrogram spectrogram, final double windowHz) {
        final var nchan = spectrogram.channelCount();
        final var window = Math.max(1, (int) Math.round(nchan * windowHz / spectrogram.bandwidth()));
        final var before = window / 2;
        final var matrix = spectrogram.data();
        final var result = new float[matrix.rows() * nchan];
        final var median = new Median();
        final var padded = new double[nchan + window - 1];

        for (var slice = 0; slice < matrix.rows(); slice++) {
            final var row = matrix.row(slice);
            for (var i = 0; i < padded.length; i++) {
                final var channel = Math.max(0, Math.min(nchan - 1, i - before));
                padded[i] = row[channel];
            }
            for (var channel = 0; channel < nchan; channel++) {
                final var background = median.evaluate(padded, channel, window);
                result[slice * nchan + channel] = (float) (row[channel] - background);
            }
        }
        return spectrogram.withDecibels(result);
    }
}
