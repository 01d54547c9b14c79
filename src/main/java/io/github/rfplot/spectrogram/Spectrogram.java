package io.github.rfplot.spectrogram;

import io.github.rfplot.coord.CoordinateSpace.DataAbsolute;
import io.github.rfplot.coord.Rect;
import io.github.rfplot.exception.InconsistentDataException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Immutable time × frequency power matrix in dB, plus acquisition metadata.
 *
 * <p>The number of slices is always derived from the buffer length and the channel count.
 * Instances are never mutated after construction, so a spectrogram may be handed to worker
 * threads as-is.
 */
public final class Spectrogram {

    /** Contiguity tolerance between consecutive slices and files. */
    public static final Duration TIME_TOLERANCE = Duration.ofMillis(10);

    private static final double POWER_FLOOR = 1e-12;

    private final Instant startTime;
    private final double centerFrequency;
    private final double bandwidth;
    private final double sliceDuration;
    private final int channelCount;
    private final float[] data;
    private final float minPower;
    private final float maxPower;

    private Spectrogram(final Instant startTime, final double centerFrequency, final double bandwidth,
                        final double sliceDuration, final int channelCount, final float[] data,
                        final float minPower, final float maxPower) {
        this.startTime = startTime;
        this.centerFrequency = centerFrequency;
        this.bandwidth = bandwidth;
        this.sliceDuration = sliceDuration;
        this.channelCount = channelCount;
        this.data = data;
        this.minPower = minPower;
        this.maxPower = maxPower;
    }

    /**
     * Builds a spectrogram from values that are already in dB. The values are copied.
     */
    public static Spectrogram ofDecibels(final Instant startTime, final double centerFrequency,
                                         final double bandwidth, final double sliceDuration,
                                         final int channelCount, final float[] decibels) {
        return wrap(startTime, centerFrequency, bandwidth, sliceDuration, channelCount, decibels.clone());
    }

    /**
     * Takes ownership of {@code decibels}; callers must not keep a reference to it.
     */
    private static Spectrogram wrap(final Instant startTime, final double centerFrequency,
                                    final double bandwidth, final double sliceDuration,
                                    final int channelCount, final float[] decibels) {
        if (channelCount <= 0 || decibels.length % channelCount != 0) {
            throw new IllegalArgumentException(
                    "Buffer of " + decibels.length + " values is not a whole number of "
                            + channelCount + "-channel slices");
        }
        var min = Float.POSITIVE_INFINITY;
        var max = Float.NEGATIVE_INFINITY;
        for (final var v : decibels) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new Spectrogram(startTime, centerFrequency, bandwidth, sliceDuration, channelCount,
                decibels, min, max);
    }

    /**
     * Converts linear power as stored on disk to dB ({@code 10·log10(v + 1e-12)}) in place and
     * wraps the result.
     */
    static Spectrogram fromLinear(final SpectrogramHeader header, final float[] linear) {
        for (var i = 0; i < linear.length; i++) {
            linear[i] = (float) (10.0 * Math.log10(linear[i] + POWER_FLOOR));
        }
        return wrap(header.startTime(), header.frequency(), header.bandwidth(), header.length(),
                header.channelCount(), linear);
    }

    static float toLinear(final float decibels) {
        return (float) (Math.pow(10.0, decibels / 10.0) - POWER_FLOOR);
    }

    /**
     * Joins spectrograms end to end in the given order.
     *
     * @throws InconsistentDataException if acquisition parameters differ or a part does not
     *                                   start within 10 ms of the previous part's end
     * @throws IllegalArgumentException  if {@code parts} is empty
     */
    public static Spectrogram concatenate(final List<Spectrogram> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("No spectrograms to concatenate");
        }
        final var first = parts.get(0);
        if (parts.size() == 1) {
            return first;
        }

        var total = 0;
        for (var i = 0; i < parts.size(); i++) {
            final var part = parts.get(i);
            if (i > 0) {
                first.requireSameParameters(part, i);
                final var prev = parts.get(i - 1);
                final var gap = Duration.between(prev.endTime(), part.startTime).abs();
                if (gap.compareTo(TIME_TOLERANCE) >= 0) {
                    throw new InconsistentDataException(
                            "Non-contiguous spectrograms during concatenation: part %d starts at %s, expected %s"
                                    .formatted(i, part.startTime, prev.endTime()));
                }
            }
            total += part.data.length;
        }

        final var joined = new float[total];
        var offset = 0;
        var min = Float.POSITIVE_INFINITY;
        var max = Float.NEGATIVE_INFINITY;
        for (final var part : parts) {
            System.arraycopy(part.data, 0, joined, offset, part.data.length);
            offset += part.data.length;
            min = Math.min(min, part.minPower);
            max = Math.max(max, part.maxPower);
        }
        return new Spectrogram(first.startTime, first.centerFrequency, first.bandwidth,
                first.sliceDuration, first.channelCount, joined, min, max);
    }

    private void requireSameParameters(final Spectrogram other, final int index) {
        if (centerFrequency != other.centerFrequency
                || bandwidth != other.bandwidth
                || sliceDuration != other.sliceDuration
                || channelCount != other.channelCount) {
            throw new InconsistentDataException(
                    "Inconsistent spectrogram parameters during concatenation: part %d has freq=%s bw=%s length=%s nchan=%d, expected freq=%s bw=%s length=%s nchan=%d"
                            .formatted(index, other.centerFrequency, other.bandwidth, other.sliceDuration,
                                    other.channelCount, centerFrequency, bandwidth, sliceDuration, channelCount));
        }
    }

    /**
     * Same metadata, new values. Used by filters that produce a derived spectrogram; the array is
     * taken over as-is.
     */
    Spectrogram withDecibels(final float[] decibels) {
        if (decibels.length != data.length) {
            throw new IllegalArgumentException(
                    "Expected " + data.length + " values, got " + decibels.length);
        }
        return wrap(startTime, centerFrequency, bandwidth, sliceDuration, channelCount, decibels);
    }

    public PowerMatrix data() {
        return new PowerMatrix(data, channelCount);
    }

    public Instant startTime() {
        return startTime;
    }

    public double centerFrequency() {
        return centerFrequency;
    }

    public double bandwidth() {
        return bandwidth;
    }

    public double sliceDuration() {
        return sliceDuration;
    }

    public int channelCount() {
        return channelCount;
    }

    public int sliceCount() {
        return data.length / channelCount;
    }

    public float minPower() {
        return minPower;
    }

    public float maxPower() {
        return maxPower;
    }

    public Duration length() {
        return Duration.ofNanos(Math.round(sliceDuration * 1e9 * sliceCount()));
    }

    public double lengthSeconds() {
        return sliceDuration * sliceCount();
    }

    public Instant endTime() {
        return startTime.plus(length());
    }

    /**
     * Absolute extent of the data: time {@code [0, length]} on X, frequency offset
     * {@code [-bw/2, bw/2]} on Y.
     */
    public Rect<DataAbsolute> bounds() {
        return Rect.of(0.0, -bandwidth / 2.0, lengthSeconds(), bandwidth);
    }

    @Override
    public String toString() {
        return "Spectrogram[start=%s, freq=%.1f Hz, bw=%.1f Hz, slice=%.3f s, nchan=%d, nslices=%d, power=(%.1f, %.1f) dB]"
                .formatted(startTime, centerFrequency, bandwidth, sliceDuration, channelCount, sliceCount(),
                        minPower, maxPower);
    }
}
