package io.github.jakubt4.lumen.noise;

import io.github.jakubt4.lumen.description.ChannelDescription;
import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.CustomNoiseDescription;
import io.github.jakubt4.lumen.description.DetectorDescription;
import io.github.jakubt4.lumen.signal.SpectralMath;
import io.github.jakubt4.lumen.table.ChannelTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detector noise budget of one channel.
 *
 * <p>Noise terms are expressed for one hour of integration: a term of {@code N} means a
 * relative precision of {@code N / sqrt(hours)} once divided by the signal. The total is
 * relative to the star signal in the aperture.
 */
@Slf4j
public class NoiseModel {

    static final double SECONDS_PER_HOUR = 3600.0;
    static final String SIGNAL_MARKER = "signal";
    static final String NOISE_SUFFIX = "_noise";
    static final String TOTAL_NOISE = "total_noise";

    private final ChannelDescription channel;
    private final DetectorDescription detector;
    private final List<CustomNoiseDescription> customNoise;

    /**
     * @param channel      channel description
     * @param commonNoise  custom noise terms shared by every channel
     * @throws ConfigurationException if the detector lacks a noise parameter
     */
    public NoiseModel(final ChannelDescription channel, final List<CustomNoiseDescription> commonNoise) {
        this.channel = channel;
        this.detector = channel.detector();
        if (detector.ndrFrequency() == null) {
            throw new ConfigurationException("channel [" + channel.name() + "] detector has no freqNDR");
        }
        if (detector.darkCurrent() == null || detector.readNoise() == null) {
            throw new ConfigurationException("channel [" + channel.name() + "] detector needs darkCurrent and readNoise");
        }
        if (detector.frameTime() == null && (detector.wellDepth() == null || detector.wellDepthFraction() == null)) {
            throw new ConfigurationException("channel [" + channel.name()
                    + "] detector needs either frameTime or wellDepth and fWellDepth");
        }
        final var terms = new ArrayList<>(commonNoise);
        terms.addAll(channel.customNoise());
        this.customNoise = List.copyOf(terms);
    }

    public String channelName() {
        return channel.name();
    }

    /**
     * Noise columns for the rows of this channel in {@code table}, which must already hold
     * the signal columns, {@code WindowSize}, {@code star_signal_inAperture} and
     * {@link MaxSignalEstimator#MAX_SIGNAL_COLUMN}.
     *
     * @throws IllegalStateException if no finite positive frame time can be derived
     */
    public ChannelTable estimate(final ChannelTable table) {
        final var rows = table.select(channel.name());
        log.debug("Estimating noise in [{}]", channel.name());
        final var timing = frameTime(rows.column(MaxSignalEstimator.MAX_SIGNAL_COLUMN));
        final var gains = multiaccum(timing.frameTime());
        log.debug("Channel [{}]: frame time {} s, nRead {}, read gain {}, shot gain {}", channel.name(),
                timing.frameTime(), gains.nRead(), gains.readGain(), gains.shotGain());

        final var size = rows.rows();
        final var frame = new double[size];
        Arrays.fill(frame, timing.frameTime());
        var out = ChannelTable.forChannel(channel.name(), size)
                .with("saturation_time", timing.saturationTime())
                .with("frameTime", frame);

        final var photon = photonNoise(rows, gains.shotGain());
        final var photonVariance = new double[size];
        for (final var entry : photon.entrySet()) {
            out = out.with(entry.getKey(), entry.getValue());
            for (int i = 0; i < size; i++) {
                photonVariance[i] += entry.getValue()[i] * entry.getValue()[i];
            }
        }

        final var window = rows.column("WindowSize");
        final var dark = new double[size];
        final var read = new double[size];
        final var readNoise = detector.readNoise();
        for (int i = 0; i < size; i++) {
            dark[i] = Math.sqrt(gains.shotGain() * window[i] * detector.darkCurrent() / SECONDS_PER_HOUR);
            read[i] = Math.sqrt(gains.readGain() * readNoise * readNoise * window[i] / timing.frameTime()
                    / SECONDS_PER_HOUR);
        }
        out = out.with("darkcurrent_noise", dark).with("read_noise", read);

        final var noiseX = channel.noiseX() != null ? channel.noiseX() : 0.0;
        final var signal = rows.column("star_signal_inAperture");
        final var total = new double[size];
        for (int i = 0; i < size; i++) {
            final var denominator = signal[i] == 0.0 ? Double.NaN : signal[i];
            total[i] = Math.sqrt(dark[i] * dark[i] + (1.0 + noiseX) * photonVariance[i] + read[i] * read[i])
                    / denominator;
        }
        out = out.with(TOTAL_NOISE, total);
        return addCustomNoise(out, rows.column("Wavelength"));
    }

    /**
     * Saturation time of each bin and the channel frame time: the configured fixed frame
     * time, or the well-depth fraction of the shortest saturation time.
     *
     * @throws IllegalStateException if the frame time is not finite and positive
     */
    public FrameTiming frameTime(final double[] maxSignalInPixel) {
        final var saturation = new double[maxSignalInPixel.length];
        var shortest = Double.POSITIVE_INFINITY;
        for (int i = 0; i < saturation.length; i++) {
            saturation[i] = detector.wellDepth() != null ? detector.wellDepth() / maxSignalInPixel[i] : Double.NaN;
            if (!Double.isNaN(saturation[i])) {
                shortest = Math.min(shortest, saturation[i]);
            }
        }
        final double frameTime = detector.frameTime() != null
                ? detector.frameTime()
                : detector.wellDepthFraction() * shortest;
        if (!Double.isFinite(frameTime) || frameTime <= 0.0) {
            throw new IllegalStateException("channel [" + channel.name() + "]: invalid frame time " + frameTime
                    + " s, is the pixel signal zero?");
        }
        return new FrameTiming(saturation, frameTime);
    }

    /**
     * Read and shot noise gains for a frame of {@code frameTime} seconds, sampled at the
     * detector NDR frequency. Fewer than two reads fall back to a correlated double sample.
     */
    public MultiaccumGains multiaccum(final double frameTime) {
        final var nRead = Math.max(2.0, Math.floor(frameTime * detector.ndrFrequency()));
        final double m = detector.multiaccumM() != null ? detector.multiaccumM() : 1.0;
        final var groupTime = detector.groupFrameTime() != null ? detector.groupFrameTime() : 0.0;
        final var n2 = nRead * nRead;
        final var readGain = 12.0 * (nRead - 1.0) / (n2 + nRead) / m;
        final var shotGain = 6.0 * (n2 + 1.0) / (n2 + nRead) / 5.0
                * (1.0 - 5.0 / 3.0 * (m * m - 1.0) / m / (n2 + 1.0) * groupTime / (nRead - 1.0) / frameTime);
        return new MultiaccumGains(nRead, readGain, shotGain);
    }

    /**
     * Photon noise of every signal column, keyed {@code <column>_noise}. Columns whose name
     * contains {@code signal} count as signals; earlier noise columns are skipped.
     */
    public Map<String, double[]> photonNoise(final ChannelTable rows, final double shotGain) {
        final var out = new LinkedHashMap<String, double[]>();
        for (final var column : rows.columnNames()) {
            if (!column.contains(SIGNAL_MARKER) || column.endsWith(NOISE_SUFFIX)) {
                continue;
            }
            final var values = rows.column(column);
            final var noise = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                noise[i] = Math.sqrt(shotGain * values[i] / SECONDS_PER_HOUR);
            }
            out.put(column + NOISE_SUFFIX, noise);
        }
        return out;
    }

    /**
     * Adds every custom noise term in quadrature to the total noise.
     */
    ChannelTable addCustomNoise(final ChannelTable out, final double[] wavelength) {
        var result = out;
        for (final var term : customNoise) {
            final var noise = customNoise(term, wavelength);
            final var name = customNoiseName(term);
            final var total = result.column(TOTAL_NOISE);
            for (int i = 0; i < total.length; i++) {
                total[i] = Math.sqrt(total[i] * total[i] + noise[i] * noise[i]);
            }
            result = result.with(name + NOISE_SUFFIX, noise).with(TOTAL_NOISE, total);
            log.debug("Custom noise [{}] added to channel [{}]", name, channel.name());
        }
        return result;
    }

    private static double[] customNoise(final CustomNoiseDescription term, final double[] wavelength) {
        if (term.data() != null) {
            final var data = term.data();
            final var column = noiseColumn(term);
            return SpectralMath.rebin(wavelength, data.column("Wavelength"), data.column(column));
        }
        if (term.value() == null) {
            throw new ConfigurationException("custom noise [" + term.name() + "] has neither value nor data");
        }
        final var noise = new double[wavelength.length];
        Arrays.fill(noise, term.value() * 1.0e-6);
        return noise;
    }

    private static String customNoiseName(final CustomNoiseDescription term) {
        if (term.name() != null && !term.name().isBlank()) {
            return term.name();
        }
        if (term.data() != null) {
            return noiseColumn(term);
        }
        throw new ConfigurationException("custom noise term without a name");
    }

    private static String noiseColumn(final CustomNoiseDescription term) {
        return term.data().columns().keySet().stream()
                .filter(name -> !name.equals("Wavelength"))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("custom noise table has no noise column"));
    }
}
