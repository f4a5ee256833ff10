package io.github.jakubt4.lumen.instrument;

import io.github.jakubt4.lumen.description.ChannelDescription;
import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.PayloadDescription;
import io.github.jakubt4.lumen.optics.DiffuseLightContext;
import io.github.jakubt4.lumen.optics.DiffuseLightPropagation;
import io.github.jakubt4.lumen.optics.OpticalPath;
import io.github.jakubt4.lumen.optics.PropagatedSignal;
import io.github.jakubt4.lumen.optics.SlitSampling;
import io.github.jakubt4.lumen.optics.SpectralBins;
import io.github.jakubt4.lumen.output.OutputGroup;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;
import io.github.jakubt4.lumen.table.ChannelTable;
import io.github.jakubt4.lumen.target.TargetObservation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Optional;

/**
 * One instrument channel.
 *
 * <p>{@link #build()} runs the kind-specific {@link #layout()} (wavelength bins, QE, PSF and
 * window geometry) and then the optical path shared by every kind (transmission,
 * self-emission). A built or loaded channel is only read, so it can serve several
 * targets at once.
 */
@Slf4j
public abstract class Instrument {

    protected static final String WAVELENGTH = "Wavelength";
    protected static final String BANDWIDTH = "Bandwidth";
    protected static final String LEFT_BIN_EDGE = "LeftBinEdge";
    protected static final String RIGHT_BIN_EDGE = "RightBinEdge";
    protected static final String WINDOW_SIZE = "WindowSize";

    protected final ChannelDescription description;
    protected final PayloadDescription payload;

    private InstrumentState state;
    private ChannelTable table;
    private BuiltInstrument built;

    protected Instrument(final ChannelDescription description, final PayloadDescription payload) {
        this.description = description;
        this.payload = payload;
        this.state = InstrumentState.UNBUILT;
    }

    protected Instrument(final ChannelDescription description, final PayloadDescription payload,
                         final ChannelTable table, final BuiltInstrument built) {
        this.description = description;
        this.payload = payload;
        this.table = table;
        this.built = built;
        this.state = InstrumentState.LOADED;
        log.info("Channel [{}] loaded with {} bins", description.name(), table.rows());
    }

    public String name() {
        return description.name();
    }

    public abstract ChannelKind kind();

    public ChannelDescription description() {
        return description;
    }

    public InstrumentState state() {
        return state;
    }

    /**
     * @throws InstrumentStateException if the channel is not built or loaded yet
     */
    public ChannelTable table() {
        requireReady();
        return table;
    }

    /**
     * @throws InstrumentStateException if the channel is not built or loaded yet
     */
    public BuiltInstrument built() {
        requireReady();
        return built;
    }

    /**
     * Builds the channel from its description.
     *
     * @throws InstrumentStateException if the channel is already built or was loaded
     * @throws ConfigurationException   if the description is incomplete or unsupported
     */
    public final void build() {
        state.requireBuildable(name());
        log.info("Building {} channel [{}]", kind().label(), name());
        final var layout = layout();
        table = layout.table();
        built = layout.artifacts().build();
        buildOpticalPath();
        state = InstrumentState.BUILT;
        log.info("Channel [{}] built: {} bins, {} instrument signal columns", name(), table.rows(),
                table.columnNames().size());
    }

    /**
     * Kind-specific part of the build.
     */
    protected abstract Layout layout();

    /**
     * Propagates the target star light through the channel.
     *
     * @return per-bin columns for this channel, starting with {@code starFlux}
     */
    public abstract ChannelTable propagateTarget(TargetObservation target);

    /**
     * Result of {@link #layout()}: the bin table and the artifacts gathered so far.
     */
    protected record Layout(ChannelTable table, BuiltInstrument.BuiltInstrumentBuilder artifacts) {
    }

    private void buildOpticalPath() {
        final var detector = description.detector();
        final var grid = OpticalPath.detectorGrid(detector);
        final var common = new OpticalPath(payload.optics().elements(), grid, detector);
        final var path = new OpticalPath(description.optics().elements(), grid, detector);
        path.prependOpticalElements(common);

        final var transmissionTable = path.buildTransmissionTable();
        var transmission = transmissionTable.total();
        final var tr = binned(transmission, 0.0);
        if (forceChannelEdges()) {
            transmission = transmission.zeroOutside(description.wlMin(), description.wlMax());
        }
        table = table.with("TR", tr);

        path.chain();
        final var artifacts = built.toBuilder()
                .transmissionData(transmission)
                .transmissionTable(transmissionTable);
        path.slitWidth().ifPresent(artifacts::slitWidth);
        built = artifacts.build();

        final var emission = path.computeSignal(diffuseContext(), bins(), slitSampling());
        table = table.with("instrument_signal", emission.total().signal())
                .with("instrument_MaxSignal_inPixel", emission.total().maxSignalInPixel());
        built = built.toBuilder().selfEmission(emission).build();
    }

    /**
     * Propagates every diffuse foreground registered on the target to the detector.
     * Foregrounds are visited from the one closest to the telescope back to the first
     * registered; each one is seen through the channel and through every foreground
     * registered after it.
     *
     * @return per-bin {@code <name>_signal} and {@code <name>_MaxSignal_inPixel} columns
     */
    public ChannelTable propagateDiffuseForeground(final TargetObservation target) {
        requireReady();
        var out = ChannelTable.forChannel(name(), table.rows());
        final var context = diffuseContext();
        final var bins = bins();
        final var slit = slitSampling();
        var transmission = built.getTransmissionData();

        final var foregrounds = new ArrayList<>(target.foregrounds());
        Collections.reverse(foregrounds);
        for (final var foreground : foregrounds) {
            final var radiance = foreground.radiance();
            final var grid = radiance.wavelength();
            final var attenuated = radiance.times(transmission.rebin(grid));
            final PropagatedSignal signal = slit
                    .map(sampling -> DiffuseLightPropagation.convolveWithSlit(context, bins, sampling, attenuated))
                    .orElseGet(() -> DiffuseLightPropagation.integrateLight(
                            DiffuseLightPropagation.photonRate(context, attenuated, context.omegaPix()), bins));
            out = out.with(foreground.name() + "_signal", signal.signal())
                    .with(foreground.name() + "_MaxSignal_inPixel", signal.maxSignalInPixel());
            log.debug("Foreground [{}] propagated through channel [{}]", foreground.name(), name());

            final var channelGrid = transmission.wavelength();
            final var current = transmission;
            transmission = foreground.transmission()
                    .map(own -> current.times(own.interpolate(channelGrid, 1.0)))
                    .orElse(current);
        }
        return out;
    }

    /**
     * Writes the table and the built artifacts under a group named after the channel.
     */
    public void write(final OutputGroup output) {
        requireReady();
        final var group = output.createGroup(name());
        group.writeTable("table", table);
        built.write(group.createGroup("built_instr"));
    }

    protected DiffuseLightContext diffuseContext() {
        return DiffuseLightPropagation.prepare(description.detector(), description.fnumX(), description.fnumY(),
                built.getQeData(), built.getTransmissionData());
    }

    protected SpectralBins bins() {
        return new SpectralBins(table.column(WAVELENGTH), table.column(LEFT_BIN_EDGE), table.column(RIGHT_BIN_EDGE),
                table.column(WINDOW_SIZE));
    }

    protected Optional<SlitSampling> slitSampling() {
        return built.slitSampling(description.detector().deltaPix());
    }

    /**
     * Detector QE on its native grid: tabulated (column named after the channel, or
     * {@code QE}) or constant over the detector range.
     */
    protected Signal loadQe() {
        final var qe = description.detector().qe();
        if (qe == null) {
            throw new ConfigurationException("channel [" + name() + "] has no detector qe");
        }
        if (qe.data() != null) {
            final var data = qe.data();
            final var wl = data.column(data.firstPresent(WAVELENGTH, "wavelength")
                    .orElseThrow(() -> new ConfigurationException("qe table of [" + name() + "] has no wavelength")));
            final var column = data.firstPresent(name(), "QE")
                    .orElseThrow(() -> new ConfigurationException(
                            "qe table of [" + name() + "] has no '" + name() + "' or 'QE' column"));
            return new Signal(wl, data.column(column));
        }
        if (qe.value() == null) {
            throw new ConfigurationException("channel [" + name() + "] qe has neither value nor data");
        }
        return Signal.constant(OpticalPath.detectorGrid(description.detector()), qe.value());
    }

    /**
     * QE and transmission resampled on {@code wavelength}, the transmission including the
     * accumulated sky transmission of the target.
     */
    protected Efficiency efficiency(final double[] wavelength, final TargetObservation target) {
        final var qe = built.getQeData().rebin(wavelength);
        var transmission = built.getTransmissionData().rebin(wavelength);
        final var sky = target.skyTransmission();
        if (sky.isPresent()) {
            transmission = transmission.times(sky.get().interpolate(wavelength, 1.0));
        }
        return new Efficiency(qe.data(), transmission.data());
    }

    /**
     * Per-bin sky transmission, when the target has one.
     */
    protected Optional<double[]> foregroundTransmission(final TargetObservation target) {
        return target.skyTransmission().map(sky -> binned(sky, 1.0));
    }

    /**
     * {@code curve} averaged over each output bin. With forced channel edges, bins centred
     * outside the channel band are zeroed.
     */
    protected double[] binned(final Signal curve, final double fill) {
        final var values = SpectralMath.binAverage(table.column(LEFT_BIN_EDGE), table.column(RIGHT_BIN_EDGE),
                curve.wavelength(), curve.data(), fill);
        if (forceChannelEdges()) {
            final var centres = table.column(WAVELENGTH);
            for (int i = 0; i < centres.length; i++) {
                if (centres[i] < description.wlMin() || centres[i] > description.wlMax()) {
                    values[i] = 0.0;
                }
            }
        }
        return values;
    }

    protected boolean forceChannelEdges() {
        return payload.optics().forcesChannelEdges();
    }

    protected record Efficiency(double[] qe, double[] transmission) {
    }

    private void requireReady() {
        if (!state.isReady()) {
            throw new InstrumentStateException("channel [" + name() + "] is not built");
        }
    }
}
