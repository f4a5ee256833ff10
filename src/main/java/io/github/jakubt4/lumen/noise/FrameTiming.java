package io.github.jakubt4.lumen.noise;

/**
 * @param saturationTime per-bin time to fill the well [s]
 * @param frameTime      frame time shared by every bin of the channel [s]
 */
public record FrameTiming(double[] saturationTime, double frameTime) {
}
