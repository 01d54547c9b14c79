package io.github.rfplot.spectrogram;

import io.github.rfplot.exception.DataIoException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes a spectrogram in the same record layout {@link SpectrogramLoader} reads: one header
 * per slice, values converted back to linear power.
 */
@Slf4j
public final class SpectrogramWriter {

    private SpectrogramWriter() {
    }

    public static void save(final Spectrogram spectrogram, final Path path) {
        final var nchan = spectrogram.channelCount();
        final var matrix = spectrogram.data();
        final var record = ByteBuffer.allocate(SpectrogramHeader.SIZE + nchan * Float.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN);
        final var first = new SpectrogramHeader(spectrogram.startTime(), spectrogram.centerFrequency(),
                spectrogram.bandwidth(), spectrogram.sliceDuration(), nchan);

        try (var channel = FileChannel.open(path, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (var slice = 0; slice < matrix.rows(); slice++) {
                final var header = new SpectrogramHeader(first.nthFollowing(slice), first.frequency(),
                        first.bandwidth(), first.length(), nchan);
                record.clear();
                record.put(header.encode());
                for (final var v : matrix.row(slice)) {
                    record.putFloat(Spectrogram.toLinear(v));
                }
                record.flip();
                while (record.hasRemaining()) {
                    channel.write(record);
                }
            }
        } catch (final IOException e) {
            throw new DataIoException(path, e);
        }
        log.info("Saved {} slices to {}", matrix.rows(), path);
    }
}
