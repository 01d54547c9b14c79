package io.github.rfplot.exception;

/**
 * Base type of every fatal loader and concatenation failure. None of these are retried; the
 * caller decides whether to report and abort or skip.
 */
public abstract class RfPlotException extends RuntimeException {

    protected RfPlotException(final String message) {
        super(message);
    }

    protected RfPlotException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
