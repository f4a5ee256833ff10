package io.github.jakubt4.lumen.optics;

/**
 * Where an emitting element sits relative to the detector.
 */
public enum ElementPosition {
    /** Detector enclosure, seen over the full hemisphere. */
    DETECTOR,
    /** Instrument enclosure, seen outside the beam. */
    OPTICS_BOX,
    /** Element in the beam, seen through the pixel solid angle. */
    PATH;

    /**
     * Acceptance solid angle [sr] for an element at this position.
     *
     * @param omegaPix solid angle of the beam seen by one pixel [sr]
     */
    public double acceptance(final double omegaPix) {
        return switch (this) {
            case DETECTOR -> Math.PI;
            case OPTICS_BOX -> Math.PI - omegaPix;
            case PATH -> omegaPix;
        };
    }
}
