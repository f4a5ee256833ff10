package io.github.jakubt4.lumen.optics;

import io.github.jakubt4.lumen.signal.Signal;

/**
 * Radiance emitted by one element as it reaches the detector, after attenuation by every
 * element downstream of it. Snapshots are never modified once chained.
 *
 * @param elementName  emitting element
 * @param position     position of the emitting element
 * @param acceptance   solid angle override [sr], {@code null} for the position default
 * @param radiance     attenuated radiance [W m^-2 µm^-1 sr^-1]
 * @param slitAffected whether a slit sits downstream of the element
 * @param slitWidth    width [µm] of that slit, {@code null} when not slit affected
 */
public record InstrumentRadiance(String elementName, ElementPosition position, Double acceptance,
                                 Signal radiance, boolean slitAffected, Double slitWidth) {

    public double solidAngle(final double omegaPix) {
        return acceptance != null ? acceptance : position.acceptance(omegaPix);
    }
}
