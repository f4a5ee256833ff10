package io.github.jakubt4.lumen.noise;

/**
 * Noise gains of an up-the-ramp read.
 *
 * @param nRead     non-destructive reads per frame, at least 2
 * @param readGain  read noise variance gain
 * @param shotGain  shot noise variance gain
 */
public record MultiaccumGains(double nRead, double readGain, double shotGain) {
}
