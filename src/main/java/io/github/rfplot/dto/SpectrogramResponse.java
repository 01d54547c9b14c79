package io.github.rfplot.dto;

/**
 * @param status      {@code "ACTIVE"} if the spectrogram was installed, {@code "REJECTED"} otherwise
 * @param message     human-readable detail about the result
 * @param spectrogram metadata of the installed spectrogram, {@code null} on rejection
 */
public record SpectrogramResponse(String status, String message, SpectrogramInfo spectrogram) {
}
