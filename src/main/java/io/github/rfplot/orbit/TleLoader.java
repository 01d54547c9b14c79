package io.github.rfplot.orbit;

import io.github.rfplot.exception.MalformedDataException;
import io.github.rfplot.exception.MissingFrequencyException;
import io.github.rfplot.exception.DataIoException;
import lombok.extern.slf4j.Slf4j;
import org.orekit.errors.OrekitException;
import org.orekit.propagation.analytical.tle.TLE;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScales;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads two-line and three-line element sets. A title line may carry a leading {@code "0 "}
 * marker, which is dropped. Every record must have a transmit frequency in the supplied table.
 */
@Slf4j
@Service
public class TleLoader {

    private enum State {
        AWAIT_LINE1_OR_TITLE,
        AWAIT_LINE1,
        AWAIT_LINE2
    }

    private final TimeScale utc;

    public TleLoader(final TimeScales timeScales) {
        this.utc = timeScales.getUTC();
    }

    /**
     * @param path        TLE file
     * @param frequencies NORAD ID → transmit frequency in Hz
     * @return satellites in file order
     * @throws MalformedDataException     if a record is out of sequence or fails to parse
     * @throws MissingFrequencyException  if a record has no frequency entry
     */
    public List<Satellite> load(final Path path, final Map<Integer, Double> frequencies) {
        final List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.US_ASCII);
        } catch (final IOException e) {
            throw new DataIoException(path, e);
        }
        final var satellites = parse(lines, frequencies);
        log.info("Loaded {} satellites from {}", satellites.size(), path);
        return satellites;
    }

    List<Satellite> parse(final List<String> lines, final Map<Integer, Double> frequencies) {
        final var satellites = new ArrayList<Satellite>();
        var state = State.AWAIT_LINE1_OR_TITLE;
        String title = null;
        String line1 = null;

        for (final var raw : lines) {
            final var line = raw.stripTrailing();
            if (line.isBlank()) {
                continue;
            }
            state = switch (state) {
                case AWAIT_LINE1_OR_TITLE -> {
                    if (line.startsWith("1 ")) {
                        title = null;
                        line1 = line;
                        yield State.AWAIT_LINE2;
                    }
                    if (line.startsWith("2 ")) {
                        throw new MalformedDataException("Expected line 1 of TLE, got: " + line);
                    }
                    title = line.startsWith("0 ") ? line.substring(2).strip() : line.strip();
                    yield State.AWAIT_LINE1;
                }
                case AWAIT_LINE1 -> {
                    if (!line.startsWith("1 ")) {
                        throw new MalformedDataException("Expected line 1 of TLE, got: " + line);
                    }
                    line1 = line;
                    yield State.AWAIT_LINE2;
                }
                case AWAIT_LINE2 -> {
                    if (!line.startsWith("2 ")) {
                        throw new MalformedDataException("Expected line 2 of TLE, got: " + line);
                    }
                    satellites.add(toSatellite(title, line1, line, frequencies));
                    yield State.AWAIT_LINE1_OR_TITLE;
                }
            };
        }

        if (state != State.AWAIT_LINE1_OR_TITLE) {
            throw new MalformedDataException("TLE file ends in the middle of a record");
        }
        return satellites;
    }

    private Satellite toSatellite(final String title, final String line1, final String line2,
                                  final Map<Integer, Double> frequencies) {
        final TLE tle;
        try {
            if (!TLE.isFormatOK(line1, line2)) {
                throw new MalformedDataException("TLE format or checksum check failed:\n" + line1 + "\n" + line2);
            }
            tle = new TLE(line1, line2, utc);
        } catch (final OrekitException | IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new MalformedDataException("Failed to parse TLE: " + e.getMessage(), e);
        }

        final var frequency = frequencies.get(tle.getSatelliteNumber());
        if (frequency == null) {
            throw new MissingFrequencyException(tle.getSatelliteNumber());
        }

        final var satellite = new Satellite(tle.getSatelliteNumber(), title, tle, frequency);
        try {
            satellite.newPropagator();
        } catch (final OrekitException e) {
            throw new MalformedDataException(
                    "Failed to derive SGP4 constants for " + satellite.displayName() + ": " + e.getMessage(), e);
        }
        log.debug("Parsed TLE for [{}], epoch {}", satellite.displayName(), tle.getDate());
        return satellite;
    }
}
