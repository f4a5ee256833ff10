package io.github.jakubt4.lumen.foreground;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.TabulatedData;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

import java.io.IOException;

/**
 * Zodiacal scale factors tabulated over the sky, as {@code ra}, {@code dec} [deg] and
 * {@code coefficient} columns.
 */
public final class ZodiacalMap {

    private final Vector3D[] directions;
    private final double[] coefficients;

    ZodiacalMap(final double[] ra, final double[] dec, final double[] coefficients) {
        if (ra.length == 0) {
            throw new ConfigurationException("zodiacal map is empty");
        }
        this.directions = new Vector3D[ra.length];
        for (int i = 0; i < ra.length; i++) {
            directions[i] = new Vector3D(FastMath.toRadians(ra[i]), FastMath.toRadians(dec[i]));
        }
        this.coefficients = coefficients.clone();
    }

    /**
     * Reads a map from a JSON classpath resource.
     *
     * @throws IOException            if the resource is missing or unreadable
     * @throws ConfigurationException if a column is missing
     */
    public static ZodiacalMap load(final ObjectMapper mapper, final String resource) throws IOException {
        try (var in = ZodiacalMap.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("zodiacal map '" + resource + "' not found on classpath");
            }
            final var table = mapper.readValue(in, TabulatedData.class);
            return new ZodiacalMap(table.column("ra"), table.column("dec"), table.column("coefficient"));
        }
    }

    public int size() {
        return coefficients.length;
    }

    /**
     * Coefficient of the map point with the smallest angular separation from the pointing.
     */
    public double coefficientAt(final double ra, final double dec) {
        final var pointing = new Vector3D(FastMath.toRadians(ra), FastMath.toRadians(dec));
        var best = 0;
        var bestAngle = Double.POSITIVE_INFINITY;
        for (int i = 0; i < directions.length; i++) {
            final var angle = Vector3D.angle(pointing, directions[i]);
            if (angle < bestAngle) {
                bestAngle = angle;
                best = i;
            }
        }
        return coefficients[best];
    }
}
