package io.github.jakubt4.lumen.target;

/**
 * An observation target.
 *
 * @param name target name, used as output key
 * @param star host star
 * @param ra   right ascension [deg], optional
 * @param dec  declination [deg], optional
 */
public record Target(String name, StarParameters star, Double ra, Double dec) {

    public Target {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("target name is required");
        }
        if (star == null) {
            throw new IllegalArgumentException("target '" + name + "' has no star");
        }
    }

    public Target(final String name, final StarParameters star) {
        this(name, star, null, null);
    }

    public boolean hasPointing() {
        return ra != null && dec != null;
    }
}
