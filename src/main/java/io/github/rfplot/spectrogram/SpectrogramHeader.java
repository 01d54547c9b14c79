package io.github.rfplot.spectrogram;

import io.github.rfplot.exception.MalformedDataException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The fixed-size ASCII block that precedes every data block of a spectrogram file.
 *
 * @param startTime    UTC time of the slice that follows
 * @param frequency    center frequency in Hz
 * @param bandwidth    total bandwidth in Hz
 * @param length       slice duration in seconds
 * @param channelCount number of frequency channels in the data block
 */
public record SpectrogramHeader(Instant startTime, double frequency, double bandwidth,
                                double length, int channelCount) {

    public static final int SIZE = 256;

    private static final Pattern FORMAT = Pattern.compile(
            "HEADER\\s+UTC_START\\s+(\\S+)\\s+FREQ\\s+(\\S+)\\s+Hz\\s+BW\\s+(\\S+)\\s+Hz"
                    + "\\s+LENGTH\\s+(\\S+)\\s+s\\s+NCHAN\\s+(\\d+)(?:\\s+NSUB\\s+\\d+)?\\s+END");

    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS", Locale.ROOT).withZone(ZoneOffset.UTC);

    /**
     * Parses one header block. Trailing NULs and whitespace are ignored; anything else that
     * deviates from the expected layout is rejected.
     *
     * @throws MalformedDataException if the text does not match, a field is not a finite decimal
     *                                number, or BW or LENGTH is not positive
     */
    public static SpectrogramHeader parse(final byte[] block) {
        final var text = stripTrailingNuls(new String(block, StandardCharsets.US_ASCII)).strip();
        final var matcher = FORMAT.matcher(text);
        if (!matcher.matches()) {
            throw new MalformedDataException("Incorrect header format: '" + abbreviate(text) + "'");
        }
        return new SpectrogramHeader(
                parseTimestamp(matcher.group(1)),
                parseNumber("FREQ", matcher.group(2)),
                parsePositive("BW", matcher.group(3)),
                parsePositive("LENGTH", matcher.group(4)),
                parseCount(matcher.group(5)));
    }

    /**
     * Renders this header as a NUL-padded block of {@link #SIZE} bytes.
     */
    public byte[] encode() {
        final var text = String.format(Locale.ROOT,
                "HEADER\nUTC_START    %s\nFREQ         %f Hz\nBW           %f Hz\nLENGTH       %f s\nNCHAN        %d\nEND\n",
                TIMESTAMP.format(startTime), frequency, bandwidth, length, channelCount);
        final var bytes = text.getBytes(StandardCharsets.US_ASCII);
        if (bytes.length > SIZE) {
            throw new IllegalStateException("Header text exceeds " + SIZE + " bytes");
        }
        final var block = new byte[SIZE];
        System.arraycopy(bytes, 0, block, 0, bytes.length);
        return block;
    }

    public boolean sameParameters(final SpectrogramHeader other) {
        return frequency == other.frequency
                && bandwidth == other.bandwidth
                && channelCount == other.channelCount;
    }

    /**
     * Expected start time of the {@code nth} slice after this one.
     */
    public Instant nthFollowing(final long nth) {
        return startTime.plus(Duration.ofNanos(Math.round(length * 1e9 * nth)));
    }

    private static Instant parseTimestamp(final String value) {
        try {
            if (value.endsWith("Z")) {
                return Instant.parse(value);
            }
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException e) {
            throw new MalformedDataException("Invalid start_time: " + value, e);
        }
    }

    private static double parseNumber(final String field, final String value) {
        if (!NUMBER.matcher(value).matches()) {
            throw new MalformedDataException("Invalid " + field + ": " + value);
        }
        final var number = Double.parseDouble(value);
        if (!Double.isFinite(number)) {
            throw new MalformedDataException("Invalid " + field + ": " + value + " is out of range");
        }
        return number;
    }

    private static double parsePositive(final String field, final String value) {
        final var number = parseNumber(field, value);
        if (number <= 0.0) {
            throw new MalformedDataException("Invalid " + field + ": " + value + " must be positive");
        }
        return number;
    }

    private static int parseCount(final String value) {
        try {
            final var count = Integer.parseInt(value);
            if (count <= 0) {
                throw new MalformedDataException("Invalid NCHAN: " + value);
            }
            return count;
        } catch (final NumberFormatException e) {
            throw new MalformedDataException("Invalid NCHAN: " + value, e);
        }
    }

    private static String stripTrailingNuls(final String text) {
        var end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\0') {
            end--;
        }
        return text.substring(0, end);
    }

    private static String abbreviate(final String text) {
        final var oneLine = text.replaceAll("\\s+", " ");
        return oneLine.length() > 80 ? oneLine.substring(0, 80) + "..." : oneLine;
    }
}
