package io.github.rfplot.exception;

/**
 * Segments that should line up do not: different acquisition parameters, or timestamps that are
 * not contiguous within 10 ms.
 */
public class InconsistentDataException extends RfPlotException {

    public InconsistentDataException(final String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONSISTENCY;
    }
}
