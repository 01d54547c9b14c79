package io.github.rfplot.exception;

/**
 * A TLE references a NORAD ID that has no entry in the frequency table.
 */
public class MissingFrequencyException extends RfPlotException {

    private final int noradId;

    public MissingFrequencyException(final int noradId) {
        super("No transmit frequency known for NORAD ID " + noradId);
        this.noradId = noradId;
    }

    public int noradId() {
        return noradId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MISSING_REFERENCE;
    }
}
