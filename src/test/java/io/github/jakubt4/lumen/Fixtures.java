package io.github.jakubt4.lumen;

import io.github.jakubt4.lumen.description.ApertureDescription;
import io.github.jakubt4.lumen.description.ChannelDescription;
import io.github.jakubt4.lumen.description.CommonDescription;
import io.github.jakubt4.lumen.description.DetectorDescription;
import io.github.jakubt4.lumen.description.OpticalElementDescription;
import io.github.jakubt4.lumen.description.OpticsDescription;
import io.github.jakubt4.lumen.description.PayloadDescription;
import io.github.jakubt4.lumen.description.QuantumEfficiencyDescription;
import io.github.jakubt4.lumen.description.ResolvingPowerDescription;
import io.github.jakubt4.lumen.description.TabulatedData;
import io.github.jakubt4.lumen.instrument.ChannelKind;
import io.github.jakubt4.lumen.target.StarParameters;
import io.github.jakubt4.lumen.target.Target;

import java.util.List;

/**
 * Small payloads shared by the tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static DetectorDescription.DetectorDescriptionBuilder detector(final double wlMin, final double cutOff) {
        return DetectorDescription.builder()
                .wlMin(wlMin)
                .cutOff(cutOff)
                .deltaPix(18.0)
                .qe(QuantumEfficiencyDescription.constant(0.55))
                .wellDepth(100_000.0)
                .wellDepthFraction(0.9)
                .ndrFrequency(0.0)
                .darkCurrent(1.0)
                .readNoise(10.0);
    }

    public static ChannelDescription.ChannelDescriptionBuilder photometer() {
        return ChannelDescription.builder()
                .name("Phot")
                .kind(ChannelKind.PHOTOMETER)
                .wlMin(0.5)
                .wlMax(0.6)
                .fnumX(20.0)
                .fnumY(20.0)
                .aperture(ApertureDescription.ofEncircledEnergy(0.83))
                .detector(detector(0.45, 0.7).build());
    }

    public static ChannelDescription.ChannelDescriptionBuilder spectrometer() {
        return ChannelDescription.builder()
                .name("Spec")
                .kind(ChannelKind.SPECTROMETER)
                .wlMin(1.0)
                .wlMax(2.2)
                .targetR(ResolvingPowerDescription.fixed(20.0))
                .fnumX(15.0)
                .fnumY(15.0)
                .wlSolution(linearSolution(false))
                .detector(detector(0.9, 2.3).qe(QuantumEfficiencyDescription.constant(0.7)).build());
    }

    /**
     * Pixel position x = (λ - 0.9) * 1800 µm, or its mirror image when {@code descending}.
     */
    public static TabulatedData linearSolution(final boolean descending) {
        final var x = descending ? new double[]{2520.0, 0.0} : new double[]{0.0, 2520.0};
        return TabulatedData.of("Wavelength", new double[]{0.9, 2.3}, "x", x);
    }

    public static OpticalElementDescription mirror(final String name, final double temperature) {
        return OpticalElementDescription.builder()
                .name(name)
                .temperature(temperature)
                .reflectivity(0.97)
                .emissivity(0.03)
                .build();
    }

    public static PayloadDescription payload(final ChannelDescription... channels) {
        return PayloadDescription.builder()
                .common(CommonDescription.builder().wlMin(0.45).wlMax(2.2).build())
                .optics(OpticsDescription.builder().telescopeArea(0.63).elements(List.of()).build())
                .channels(List.of(channels))
                .build();
    }

    public static Target sunLike(final String name) {
        return new Target(name, StarParameters.builder()
                .temperature(5772.0)
                .radius(1.0)
                .mass(1.0)
                .distance(10.0)
                .magK(3.3)
                .build());
    }
}
