package io.github.jakubt4.lumen.optics;

import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.DetectorDescription;
import io.github.jakubt4.lumen.description.OpticalElementDescription;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered chain of optical elements, source side first.
 *
 * <p>The path is assembled once ({@link #prependOpticalElements}), then {@link #chain()}
 * propagates the thermal emission of every element to the detector and
 * {@link #computeSignal} converts it into detected signal. After that the path is only read.
 */
@Slf4j
public class OpticalPath {

    /** Samples of the refined wavelength grid. */
    public static final int GRID_POINTS = 6000;

    private final double[] wavelength;
    private final LinkedHashMap<String, OpticalElement> elements = new LinkedHashMap<>();

    private List<InstrumentRadiance> radiances = List.of();
    private Double slitWidth;
    private SelfEmission selfEmission;

    /**
     * @param descriptions elements in light-path order
     * @param wavelength   sampling grid [µm]; a single value is replaced by the refined
     *                     detector grid
     * @param detector     detector used to refine a single-value grid
     */
    public OpticalPath(final List<OpticalElementDescription> descriptions, final double[] wavelength,
                       final DetectorDescription detector) {
        this.wavelength = refineGrid(wavelength, detector);
        for (final var description : descriptions) {
            elements.put(description.name(), OpticalElement.create(description, this.wavelength));
        }
        log.debug("Optical path created with elements {}", elements.keySet());
    }

    /**
     * Logarithmic grid of {@value #GRID_POINTS} samples over the detector response range,
     * used whenever a path is sampled on a single wavelength.
     */
    public static double[] refineGrid(final double[] wavelength, final DetectorDescription detector) {
        if (wavelength.length > 1) {
            return wavelength.clone();
        }
        return detectorGrid(detector);
    }

    public static double[] detectorGrid(final DetectorDescription detector) {
        return SpectralMath.logspace(detector.wlMin(), detector.cutOff(), GRID_POINTS);
    }

    public double[] wavelength() {
        return wavelength.clone();
    }

    public Map<String, OpticalElement> elements() {
        return Collections.unmodifiableMap(elements);
    }

    /**
     * Puts the elements of {@code upstream} in front of this path, keeping their order. An
     * element of this path with the same name as an upstream one replaces it in place.
     */
    public void prependOpticalElements(final OpticalPath upstream) {
        final var merged = new LinkedHashMap<String, OpticalElement>();
        for (final var element : upstream.elements.values()) {
            merged.put(element.name(), OpticalElement.resample(element, wavelength));
        }
        merged.putAll(elements);
        elements.clear();
        elements.putAll(merged);
        log.debug("Optical path after prepend: {}", elements.keySet());
    }

    public TransmissionTable buildTransmissionTable() {
        final var perElement = new LinkedHashMap<String, Signal>();
        var total = Signal.constant(wavelength, 1.0);
        for (final var element : elements.values()) {
            perElement.put(element.name(), element.transmission());
            total = total.times(element.transmission());
        }
        return new TransmissionTable(Collections.unmodifiableMap(perElement), total);
    }

    /**
     * Propagates the self-emission of every element with a temperature to the detector.
     * Each radiance is attenuated by the transmission of all downstream elements and is
     * flagged when one of them is a slit.
     *
     * @return one immutable snapshot per emitting element, in path order
     * @throws ConfigurationException if a downstream slit has no width
     */
    public List<InstrumentRadiance> chain() {
        final var ordered = new ArrayList<>(elements.values());
        final var out = new ArrayList<InstrumentRadiance>();
        for (int i = 0; i < ordered.size(); i++) {
            final var element = ordered.get(i);
            if (element.temperature() == null) {
                continue;
            }
            var radiance = element.selfEmission();
            var slitAffected = false;
            Double width = null;
            for (final var downstream : ordered.subList(i + 1, ordered.size())) {
                radiance = radiance.times(downstream.transmission());
                if (downstream.isSlit()) {
                    if (downstream.slitWidth() == null) {
                        throw new ConfigurationException("slit '" + downstream.name() + "' has no width");
                    }
                    slitAffected = true;
                    width = downstream.slitWidth();
                    slitWidth = width;
                }
            }
            out.add(new InstrumentRadiance(element.name(), element.position(), element.solidAngle(), radiance,
                    slitAffected, width));
            log.debug("Element [{}] chained, slit affected: {}", element.name(), slitAffected);
        }
        radiances = List.copyOf(out);
        return radiances;
    }

    public List<InstrumentRadiance> radiances() {
        return radiances;
    }

    /**
     * Width [µm] of the slit found while chaining, if any emitting element sits upstream of one.
     */
    public Optional<Double> slitWidth() {
        return Optional.ofNullable(slitWidth);
    }

    /**
     * Converts the chained radiances into detected signal.
     *
     * @param context channel conversion quantities
     * @param bins    output bins of the channel
     * @param slit    slit sampling of the channel, empty for slitless channels
     */
    public SelfEmission computeSignal(final DiffuseLightContext context, final SpectralBins bins,
                                      final Optional<SlitSampling> slit) {
        final var perElement = new LinkedHashMap<String, PropagatedSignal>();
        var total = PropagatedSignal.zero(bins.size());
        for (final var radiance : radiances) {
            final PropagatedSignal signal;
            if (radiance.slitAffected() && slit.isPresent()) {
                signal = DiffuseLightPropagation.convolveWithSlit(context, bins, slit.get(), radiance.radiance());
            } else {
                final var rate = DiffuseLightPropagation.photonRate(context, radiance.radiance(),
                        radiance.solidAngle(context.omegaPix()));
                signal = DiffuseLightPropagation.integrateLight(rate, bins);
            }
            perElement.put(radiance.elementName(), signal);
            total = total.plus(signal);
        }
        selfEmission = new SelfEmission(Collections.unmodifiableMap(perElement), total);
        return selfEmission;
    }

    public Optional<SelfEmission> selfEmission() {
        return Optional.ofNullable(selfEmission);
    }
}
