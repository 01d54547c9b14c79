package io.github.rfplot.spectrogram;

import java.util.Arrays;

/**
 * Read-only view of a spectrogram's power values, shape {@code (rows = time slices,
 * columns = frequency channels)}, row-major.
 */
public final class PowerMatrix {

    private final float[] values;
    private final int rows;
    private final int columns;

    PowerMatrix(final float[] values, final int columns) {
        this.values = values;
        this.columns = columns;
        this.rows = columns == 0 ? 0 : values.length / columns;
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public float get(final int row, final int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException(
                    "(%d, %d) outside (%d, %d)".formatted(row, column, rows, columns));
        }
        return values[row * columns + column];
    }

    public float[] row(final int row) {
        return copyRange(row, 0, columns);
    }

    /**
     * Copies columns {@code [from, to)} of one row.
     */
    public float[] copyRange(final int row, final int from, final int to) {
        if (row < 0 || row >= rows || from < 0 || to > columns || from > to) {
            throw new IndexOutOfBoundsException(
                    "row %d, columns [%d, %d) outside (%d, %d)".formatted(row, from, to, rows, columns));
        }
        final var offset = row * columns;
        return Arrays.copyOfRange(values, offset + from, offset + to);
    }

    public float[] toArray() {
        return values.clone();
    }
}
