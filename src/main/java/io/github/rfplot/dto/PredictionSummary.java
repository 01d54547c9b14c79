package io.github.rfplot.dto;

import io.github.rfplot.orbit.Predictions.SatellitePrediction;

/**
 * Condensed view of one satellite's prediction series. Extremes are {@code null} when no sample
 * could be propagated.
 *
 * @param noradId         NORAD catalog number
 * @param validSamples    samples with a finite prediction
 * @param minZenithAngle  closest approach to zenith in radians
 * @param minFrequency    lowest predicted frequency in Hz
 * @param maxFrequency    highest predicted frequency in Hz
 */
public record PredictionSummary(int noradId, int validSamples, Double minZenithAngle,
                                Double minFrequency, Double maxFrequency) {

    public static PredictionSummary of(final int noradId, final SatellitePrediction prediction) {
        var valid = 0;
        var minZenith = Double.POSITIVE_INFINITY;
        var minFrequency = Double.POSITIVE_INFINITY;
        var maxFrequency = Double.NEGATIVE_INFINITY;
        final var frequencies = prediction.frequency();
        final var zenithAngles = prediction.zenithAngle();
        for (var i = 0; i < frequencies.length; i++) {
            final var frequency = frequencies[i];
            final var zenith = zenithAngles[i];
            if (Double.isNaN(frequency) || Double.isNaN(zenith)) {
                continue;
            }
            valid++;
            minZenith = Math.min(minZenith, zenith);
            minFrequency = Math.min(minFrequency, frequency);
            maxFrequency = Math.max(maxFrequency, frequency);
        }
        if (valid == 0) {
            return new PredictionSummary(noradId, 0, null, null, null);
        }
        return new PredictionSummary(noradId, valid, minZenith, minFrequency, maxFrequency);
    }
}
