package io.github.rfplot.exception;

/**
 * Input text did not have the expected shape: a spectrogram header, a TLE record or a
 * frequency-table line.
 */
public class MalformedDataException extends RfPlotException {

    public MalformedDataException(final String message) {
        super(message);
    }

    public MalformedDataException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PARSE;
    }
}
