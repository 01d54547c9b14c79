package io.github.rfplot.signal;

import org.hipparchus.stat.descriptive.moment.Mean;
import org.hipparchus.stat.descriptive.moment.StandardDeviation;

import java.util.List;

/**
 * Reports the strongest bin of a window when it stands out from the rest of the window by more
 * than {@code sigmaThreshold} standard deviations, measured in linear power.
 *
 * <p>Mean and population standard deviation are taken over all samples except the maximum.
 * When those samples are all identical the deviation is zero: a maximum above that floor is
 * reported (its sigma is unbounded), while a completely flat window is not. Windows with fewer
 * than two samples never report anything.
 *
 * @param sigmaThreshold detection threshold in standard deviations
 */
public record FitTraceDetector(double sigmaThreshold) implements SignalDetector {

    public static final double DEFAULT_SIGMA = 5.0;

    @Override
    public List<Integer> detect(final float[] window) {
        if (window.length < 2) {
            return List.of();
        }

        final var linear = new double[window.length];
        var maxIdx = 0;
        for (var i = 0; i < window.length; i++) {
            linear[i] = Math.pow(10.0, window[i] / 10.0);
            if (linear[i] > linear[maxIdx]) {
                maxIdx = i;
            }
        }
        final var max = linear[maxIdx];

        final var rest = new double[linear.length - 1];
        var restMin = Double.POSITIVE_INFINITY;
        var restMax = Double.NEGATIVE_INFINITY;
        for (int i = 0, j = 0; i < linear.length; i++) {
            if (i != maxIdx) {
                rest[j++] = linear[i];
                restMin = Math.min(restMin, linear[i]);
                restMax = Math.max(restMax, linear[i]);
            }
        }

        if (restMin == restMax) {
            return max > restMax ? List.of(maxIdx) : List.of();
        }

        final var mean = new Mean().evaluate(rest);
        final var stdDev = new StandardDeviation(false).evaluate(rest, mean);
        if (!(stdDev > 0.0)) {
            return List.of();
        }
        final var sigma = (max - mean) / stdDev;
        return sigma > sigmaThreshold ? List.of(maxIdx) : List.of();
    }
}
