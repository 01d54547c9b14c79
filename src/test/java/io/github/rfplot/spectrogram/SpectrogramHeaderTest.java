package io.github.rfplot.spectrogram;

import io.github.rfplot.exception.ErrorKind;
import io.github.rfplot.exception.MalformedDataException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpectrogramHeaderTest {

    private static byte[] block(final String text) {
        return Arrays.copyOf(text.getBytes(StandardCharsets.US_ASCII), SpectrogramHeader.SIZE);
    }

    @Test
    void parsesRecorderHeader() {
        final var header = SpectrogramHeader.parse(block("""
                HEADER
                UTC_START    2023-03-14T15:09:26.535
                FREQ         437800000.000000 Hz
                BW           48000.000000 Hz
                LENGTH       0.250000 s
                NCHAN        512
                NSUB         60
                END
                """));

        assertThat(header.startTime()).isEqualTo(Instant.parse("2023-03-14T15:09:26.535Z"));
        assertThat(header.frequency()).isEqualTo(437_800_000.0);
        assertThat(header.bandwidth()).isEqualTo(48_000.0);
        assertThat(header.length()).isEqualTo(0.25);
        assertThat(header.channelCount()).isEqualTo(512);
    }

    @Test
    void acceptsExponentNotation() {
        final var header = SpectrogramHeader.parse(block(
                "HEADER\nUTC_START 2023-03-14T15:09:26\nFREQ 4.378e8 Hz\nBW 4.8E4 Hz\nLENGTH 1 s\nNCHAN 8\nEND\n"));

        assertThat(header.frequency()).isEqualTo(4.378e8);
        assertThat(header.bandwidth()).isEqualTo(48_000.0);
        assertThat(header.startTime()).isEqualTo(Instant.parse("2023-03-14T15:09:26Z"));
    }

    @Test
    void encodedHeaderParsesBack() {
        final var header = new SpectrogramHeader(Instant.parse("2024-01-02T03:04:05.678Z"),
                145_900_000.0, 20_000.0, 0.5, 1024);

        final var encoded = header.encode();

        assertThat(encoded).hasSize(SpectrogramHeader.SIZE);
        assertThat(encoded[SpectrogramHeader.SIZE - 1]).isZero();
        assertThat(SpectrogramHeader.parse(encoded)).isEqualTo(header);
    }

    @Test
    void rejectsNonNumericField() {
        assertThatThrownBy(() -> SpectrogramHeader.parse(block(
                "HEADER\nUTC_START 2023-03-14T15:09:26\nFREQ abc Hz\nBW 48000 Hz\nLENGTH 1 s\nNCHAN 8\nEND\n")))
                .isInstanceOf(MalformedDataException.class)
                .hasMessageContaining("FREQ")
                .satisfies(e -> assertThat(((MalformedDataException) e).kind()).isEqualTo(ErrorKind.PARSE));
    }

    @Test
    void rejectsNonDecimalOrNonFiniteFrequency() {
        for (final var value : List.of("NaN", "Infinity", "-Infinity", "4.378e8d", "0x1p20", "1e400")) {
            assertThatThrownBy(() -> SpectrogramHeader.parse(block(
                    "HEADER\nUTC_START 2023-03-14T15:09:26\nFREQ " + value + " Hz\nBW 48000 Hz\nLENGTH 1 s\nNCHAN 8\nEND\n")))
                    .as(value)
                    .isInstanceOf(MalformedDataException.class)
                    .hasMessageContaining("FREQ");
        }
    }

    @Test
    void rejectsNonPositiveBandwidthAndLength() {
        assertThatThrownBy(() -> SpectrogramHeader.parse(block(
                "HEADER\nUTC_START 2023-03-14T15:09:26\nFREQ 437800000 Hz\nBW -48000 Hz\nLENGTH 1 s\nNCHAN 8\nEND\n")))
                .isInstanceOf(MalformedDataException.class)
                .hasMessageContaining("BW")
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> SpectrogramHeader.parse(block(
                "HEADER\nUTC_START 2023-03-14T15:09:26\nFREQ 437800000 Hz\nBW 48000 Hz\nLENGTH 0 s\nNCHAN 8\nEND\n")))
                .isInstanceOf(MalformedDataException.class)
                .hasMessageContaining("LENGTH");
    }

    @Test
    void rejectsMissingField() {
        assertThatThrownBy(() -> SpectrogramHeader.parse(block(
                "HEADER\nUTC_START 2023-03-14T15:09:26\nFREQ 437800000 Hz\nLENGTH 1 s\nNCHAN 8\nEND\n")))
                .isInstanceOf(MalformedDataException.class)
                .hasMessageContaining("Incorrect header format");
    }

    @Test
    void rejectsBadTimestamp() {
        assertThatThrownBy(() -> SpectrogramHeader.parse(block(
                "HEADER\nUTC_START yesterday\nFREQ 437800000 Hz\nBW 48000 Hz\nLENGTH 1 s\nNCHAN 8\nEND\n")))
                .isInstanceOf(MalformedDataException.class)
                .hasMessageContaining("yesterday");
    }

    @Test
    void expectedSliceTimeAdvancesByLength() {
        final var header = new SpectrogramHeader(Instant.parse("2024-01-01T00:00:00Z"), 1.0, 1.0, 0.1, 1);

        assertThat(header.nthFollowing(30)).isEqualTo(Instant.parse("2024-01-01T00:00:03Z"));
    }
}
