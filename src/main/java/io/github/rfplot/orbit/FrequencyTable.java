package io.github.rfplot.orbit;

import io.github.rfplot.exception.MalformedDataException;
import io.github.rfplot.exception.DataIoException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code <norad_id> <frequency_MHz>} lines into a NORAD ID → Hz map. {@code #} starts a
 * comment and blank lines are skipped.
 */
@Slf4j
public final class FrequencyTable {

    private FrequencyTable() {
    }

    public static Map<Integer, Double> load(final Path path) {
        final List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new DataIoException(path, e);
        }
        final var frequencies = parse(lines, path.toString());
        log.info("Loaded frequencies for {} satellites from {}", frequencies.size(), path);
        return frequencies;
    }

    static Map<Integer, Double> parse(final List<String> lines, final String source) {
        final var frequencies = new HashMap<Integer, Double>();
        for (var i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            final var comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.strip();
            if (line.isEmpty()) {
                continue;
            }
            final var fields = line.split("\\s+");
            if (fields.length != 2) {
                throw malformed(source, i, lines.get(i));
            }
            try {
                frequencies.put(Integer.parseInt(fields[0]), Double.parseDouble(fields[1]) * 1e6);
            } catch (final NumberFormatException e) {
                throw malformed(source, i, lines.get(i));
            }
        }
        return Map.copyOf(frequencies);
    }

    private static MalformedDataException malformed(final String source, final int index, final String line) {
        return new MalformedDataException(
                "Malformed frequency line %s:%d: '%s'".formatted(source, index + 1, line));
    }
}
