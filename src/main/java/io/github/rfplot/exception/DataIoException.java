package io.github.rfplot.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A file could not be opened or read.
 */
public class DataIoException extends RfPlotException {

    private final Path path;

    public DataIoException(final Path path, final IOException cause) {
        super("I/O failure on " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.IO;
    }
}
