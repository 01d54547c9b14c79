package io.github.rfplot.signal;

import java.util.List;

/**
 * Finds signal peaks in one time slice's frequency window.
 */
public interface SignalDetector {

    /**
     * @param window power values in dB, one per frequency bin
     * @return indices into {@code window} of detected peaks, possibly empty, never null
     */
    List<Integer> detect(float[] window);
}
