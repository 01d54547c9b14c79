package io.github.rfplot.spectrogram;

import io.github.rfplot.exception.InconsistentDataException;
import io.github.rfplot.exception.MalformedDataException;
import io.github.rfplot.exception.RfPlotException;
import io.github.rfplot.exception.DataIoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Reads spectrogram files (256-byte ASCII header + {@code nchan} little-endian float32 values,
 * repeated once per time slice) and joins them into one {@link Spectrogram}.
 *
 * <p>Each file is read by its own task on the I/O executor; the loader waits for all of them
 * before concatenating, so callers never observe a partial result.
 */
@Slf4j
@Service
public class SpectrogramLoader {

    private final Executor ioExecutor;

    public SpectrogramLoader(@Qualifier("spectrogramIoExecutor") final Executor ioExecutor) {
        this.ioExecutor = ioExecutor;
    }

    /**
     * Loads and concatenates the given files in order.
     *
     * @param paths files to read, in time order
     * @return the joined spectrogram
     * @throws DataIoException     if a file cannot be read
     * @throws MalformedDataException     if a header is malformed or no paths are given
     * @throws InconsistentDataException  if blocks or files do not line up
     */
    public Spectrogram load(final List<Path> paths) {
        if (paths.isEmpty()) {
            throw new MalformedDataException("No files provided");
        }
        log.debug("Parsing files {}", paths);

        final var tasks = paths.stream()
                .map(path -> CompletableFuture.supplyAsync(() -> loadFile(path), ioExecutor))
                .toList();

        final var parts = new ArrayList<Spectrogram>(tasks.size());
        for (final var task : tasks) {
            try {
                parts.add(task.join());
            } catch (final CompletionException e) {
                if (e.getCause() instanceof RfPlotException cause) {
                    throw cause;
                }
                throw e;
            }
        }

        final var spectrogram = Spectrogram.concatenate(parts);
        log.info("Loaded {} from {} file(s)", spectrogram, paths.size());
        return spectrogram;
    }

    Spectrogram loadFile(final Path path) {
        try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
            final var fileSize = channel.size();
            final var headerBlock = ByteBuffer.allocate(SpectrogramHeader.SIZE);

            final var first = readHeader(channel, headerBlock, path, 0);
            log.debug("Parsed header of {}: {}", path, first);

            final var blockSize = SpectrogramHeader.SIZE + (long) first.channelCount() * Float.BYTES;
            final var blocks = fileSize / blockSize;
            if (fileSize % blockSize != 0) {
                log.warn("Ignoring {} trailing bytes in {}", fileSize % blockSize, path);
            }
            if (blocks == 0) {
                throw new MalformedDataException("File " + path + " is shorter than one record");
            }
            if (blocks * first.channelCount() > Integer.MAX_VALUE) {
                throw new MalformedDataException("File " + path + " is too large to load");
            }

            final var nchan = first.channelCount();
            final var values = new float[(int) (blocks * nchan)];
            final var dataBlock = ByteBuffer.allocate(nchan * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);

            readData(channel, dataBlock, values, 0);
            for (var slice = 1; slice < blocks; slice++) {
                final var header = readHeader(channel, headerBlock, path, slice);
                if (!first.sameParameters(header)) {
                    throw new InconsistentDataException(
                            "Inconsistent spectrogram parameters in %s at slice %d: freq=%s bw=%s nchan=%d, expected freq=%s bw=%s nchan=%d"
                                    .formatted(path, slice, header.frequency(), header.bandwidth(),
                                            header.channelCount(), first.frequency(), first.bandwidth(),
                                            first.channelCount()));
                }
                final var expected = first.nthFollowing(slice);
                if (Duration.between(expected, header.startTime()).abs().compareTo(Spectrogram.TIME_TOLERANCE) >= 0) {
                    throw new InconsistentDataException(
                            "Unexpected spectrogram slice time in %s at slice %d: expected %s, got %s"
                                    .formatted(path, slice, expected, header.startTime()));
                }
                readData(channel, dataBlock, values, slice * nchan);
            }

            return Spectrogram.fromLinear(first, values);
        } catch (final IOException e) {
            throw new DataIoException(path, e);
        }
    }

    private static SpectrogramHeader readHeader(final FileChannel channel, final ByteBuffer block,
                                                final Path path, final long slice) throws IOException {
        block.clear();
        readFully(channel, block);
        try {
            return SpectrogramHeader.parse(block.array());
        } catch (final MalformedDataException e) {
            throw new MalformedDataException(
                    "Failed to parse header of slice " + slice + " in " + path + ": " + e.getMessage(), e);
        }
    }

    private static void readData(final FileChannel channel, final ByteBuffer block, final float[] target,
                                 final int offset) throws IOException {
        block.clear();
        readFully(channel, block);
        block.flip();
        block.asFloatBuffer().get(target, offset, block.remaining() / Float.BYTES);
    }

    private static void readFully(final FileChannel channel, final ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                throw new EOFException("Unexpected end of file");
            }
        }
    }
}
