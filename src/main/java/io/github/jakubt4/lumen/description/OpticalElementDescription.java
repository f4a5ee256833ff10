package io.github.jakubt4.lumen.description;

import io.github.jakubt4.lumen.optics.ElementType;
import lombok.Builder;

/**
 * One optical component as written in the payload.
 *
 * @param name         unique element name within its path
 * @param type         element type, decides the acceptance geometry
 * @param temperature  element temperature [K]; absent means no self-emission
 * @param emissivity   constant emissivity
 * @param transmission constant transmission
 * @param reflectivity constant reflectivity, used like a transmission
 * @param use          selects {@code transmission} or {@code reflectivity} when both are given,
 *                     or the transmission column of {@code data}
 * @param wlMin        lower bound [µm] of a constant transmission
 * @param wlMax        upper bound [µm] of a constant transmission
 * @param solidAngle   explicit acceptance solid angle [sr], overrides the position default
 * @param width        slit width [µm], slit elements only
 * @param wlColumn     wavelength column name in {@code data}
 * @param data         tabulated transmission and/or emissivity
 */
@Builder
public record OpticalElementDescription(
        String name,
        ElementType type,
        Double temperature,
        Double emissivity,
        Double transmission,
        Double reflectivity,
        String use,
        Double wlMin,
        Double wlMax,
        Double solidAngle,
        Double width,
        String wlColumn,
        TabulatedData data) {

    public OpticalElementDescription {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("optical element without a name");
        }
        if (type == null) {
            type = ElementType.SURFACE;
        }
    }
}
