package io.github.jakubt4.lumen.optics;

import io.github.jakubt4.lumen.signal.Signal;

/**
 * Channel quantities shared by every diffuse-light conversion.
 *
 * @param pixelArea    pixel area [m^2]
 * @param omegaPix     pixel solid angle [sr]
 * @param qe           detector quantum efficiency
 * @param transmission channel transmission
 */
public record DiffuseLightContext(double pixelArea, double omegaPix, Signal qe, Signal transmission) {
}
