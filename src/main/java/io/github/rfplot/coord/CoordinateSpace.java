package io.github.rfplot.coord;

/**
 * Phantom tag for the four 2D coordinate systems of the plot.
 *
 * <p>The tags are never instantiated. They only parameterize {@link Point}, {@link Vector},
 * {@link Size}, {@link Rect} and {@link Transform} so the compiler rejects mixing coordinates
 * from different spaces.
 */
public interface CoordinateSpace {

    /** Device pixels, origin top-left, Y grows downward. */
    final class Screen implements CoordinateSpace {
        private Screen() {
        }
    }

    /** Normalized [0,1]² within the drawable plot region, origin bottom-left. */
    final class PlotArea implements CoordinateSpace {
        private PlotArea() {
        }
    }

    /** Normalized [0,1]² over the full data extent; the view window lives here. */
    final class DataNormalized implements CoordinateSpace {
        private DataNormalized() {
        }
    }

    /** Seconds since spectrogram start (X) and Hz offset from the center frequency (Y). */
    final class DataAbsolute implements CoordinateSpace {
        private DataAbsolute() {
        }
    }
}
