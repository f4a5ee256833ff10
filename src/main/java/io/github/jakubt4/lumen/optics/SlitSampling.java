package io.github.jakubt4.lumen.optics;

/**
 * Detector sampling of a slit spectrometer, needed to convolve diffuse light with the slit.
 *
 * @param wlPixCenter        wavelength at each pixel centre [µm]
 * @param pixelBandwidth     wavelength span of each pixel [µm]
 * @param windowSpatialWidth spatial window width of each output bin [pixels]
 * @param deltaPix           pixel pitch [µm]
 * @param slitWidth          slit width [µm]
 */
public record SlitSampling(double[] wlPixCenter, double[] pixelBandwidth, double[] windowSpatialWidth,
                           double deltaPix, double slitWidth) {

    /**
     * Slit width in pixels, at least one.
     */
    public int kernelWidth() {
        return Math.max(1, (int) (slitWidth / deltaPix));
    }
}
