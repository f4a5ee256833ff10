package io.github.jakubt4.lumen.dto;

import io.github.jakubt4.lumen.target.StarParameters;
import io.github.jakubt4.lumen.target.Target;

/**
 * One target to observe.
 *
 * @param name        target name
 * @param temperature star effective temperature [K]
 * @param radius      star radius [R_sun]
 * @param mass        star mass [M_sun]
 * @param distance    star distance [pc]
 * @param magK        K magnitude, optional
 * @param ra          right ascension [deg], optional
 * @param dec         declination [deg], optional
 */
public record TargetRequest(String name, Double temperature, Double radius, Double mass, Double distance,
                            Double magK, Double ra, Double dec) {

    /**
     * @throws IllegalArgumentException if a star parameter is missing or not positive
     */
    public Target toTarget() {
        final var star = StarParameters.builder()
                .temperature(temperature)
                .radius(radius)
                .mass(mass)
                .distance(distance)
                .magK(magK)
                .build();
        return new Target(name, star, ra, dec);
    }
}
