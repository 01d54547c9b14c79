package io.github.rfplot.dto;

import java.util.List;

/**
 * Spectrogram files to load, concatenated in the given order.
 *
 * @param paths file system paths of the {@code .bin} files
 */
public record SpectrogramRequest(List<String> paths) {
}
