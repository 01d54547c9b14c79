package io.github.rfplot.dto;

/**
 * @param path destination file; an existing file is overwritten
 */
public record SaveRequest(String path) {
}
