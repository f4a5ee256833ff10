package io.github.jakubt4.lumen.signal;

import lombok.extern.slf4j.Slf4j;
import org.hipparchus.analysis.interpolation.LinearInterpolator;
import org.hipparchus.analysis.interpolation.SplineInterpolator;
import org.hipparchus.analysis.polynomials.PolynomialSplineFunction;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Numerical helpers for sampled spectra: grids, trapezoidal integration, interpolation
 * with fill values, rebinning and 'same'-mode convolution.
 *
 * <p>Abscissae handed to the interpolation helpers may be unsorted and may contain
 * duplicates; they are sorted and de-duplicated (first occurrence wins) before use.
 */
@Slf4j
public final class SpectralMath {

    private SpectralMath() {
    }

    public static double[] linspace(final double start, final double stop, final int count) {
        if (count == 1) {
            return new double[]{start};
        }
        final var out = new double[count];
        final var step = (stop - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            out[i] = start + i * step;
        }
        out[count - 1] = stop;
        return out;
    }

    /**
     * Logarithmically spaced grid including both end points.
     */
    public static double[] logspace(final double start, final double stop, final int count) {
        final var exponents = linspace(Math.log10(start), Math.log10(stop), count);
        final var out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = Math.pow(10.0, exponents[i]);
        }
        out[0] = start;
        out[count - 1] = stop;
        return out;
    }

    /**
     * Trapezoidal rule, same convention as the antiderivative of a discrete function.
     */
    public static double trapz(final double[] y, final double[] x) {
        if (y.length != x.length) {
            throw new IllegalArgumentException("datums lengths must match");
        }
        var sum = 0.0;
        for (int i = 1; i < x.length; i++) {
            sum += 0.5 * (y[i - 1] + y[i]) * (x[i] - x[i - 1]);
        }
        return sum;
    }

    /**
     * Linear interpolation of {@code y(x)} onto {@code xNew}; points outside the sampled
     * range take {@code fill}.
     */
    public static double[] interpolate(final double[] x, final double[] y, final double[] xNew, final double fill) {
        final var sorted = sortedUnique(x, y);
        final var xs = sorted[0];
        final var ys = sorted[1];
        final var out = new double[xNew.length];
        if (xs.length == 0) {
            Arrays.fill(out, fill);
            return out;
        }
        if (xs.length == 1) {
            for (int i = 0; i < xNew.length; i++) {
                out[i] = xNew[i] == xs[0] ? ys[0] : fill;
            }
            return out;
        }
        final PolynomialSplineFunction function = new LinearInterpolator().interpolate(xs, ys);
        for (int i = 0; i < xNew.length; i++) {
            out[i] = function.isValidPoint(xNew[i]) ? function.value(xNew[i]) : fill;
        }
        return out;
    }

    public static double interpolate(final double[] x, final double[] y, final double xNew, final double fill) {
        return interpolate(x, y, new double[]{xNew}, fill)[0];
    }

    /**
     * Linear interpolation that extends the first and last segments beyond the sampled range.
     */
    public static double[] interpolateExtrapolate(final double[] x, final double[] y, final double[] xNew) {
        final var sorted = sortedUnique(x, y);
        final var xs = sorted[0];
        final var ys = sorted[1];
        if (xs.length < 2) {
            throw new IllegalArgumentException("at least two distinct points are needed to extrapolate");
        }
        final var out = new double[xNew.length];
        for (int i = 0; i < xNew.length; i++) {
            final var segment = segmentIndex(xs, xNew[i]);
            final var slope = (ys[segment + 1] - ys[segment]) / (xs[segment + 1] - xs[segment]);
            out[i] = ys[segment] + (xNew[i] - xs[segment]) * slope;
        }
        return out;
    }

    public static double interpolateExtrapolate(final double[] x, final double[] y, final double xNew) {
        return interpolateExtrapolate(x, y, new double[]{xNew})[0];
    }

    /**
     * Natural cubic spline through the samples, clamped to the end values outside the range.
     * Fewer than three distinct samples fall back to a line, one sample to a constant.
     *
     * <p>The natural end condition sets the second derivative to zero at both ends, where a
     * not-a-knot spline would carry the curvature of the neighbouring segment through. On a
     * smooth curve the two only differ noticeably in the first and last segments, so values
     * interpolated close to the ends of the sampled range are slightly different.
     */
    public static double[] cubic(final double[] x, final double[] y, final double[] xNew) {
        final var sorted = sortedUnique(x, y);
        if (sorted[0].length == 1) {
            final var out = new double[xNew.length];
            Arrays.fill(out, sorted[1][0]);
            return out;
        }
        if (sorted[0].length < 3) {
            return interpolateExtrapolate(x, y, xNew);
        }
        final var xs = sorted[0];
        final var ys = sorted[1];
        final var function = new SplineInterpolator().interpolate(xs, ys);
        final var out = new double[xNew.length];
        for (int i = 0; i < xNew.length; i++) {
            final var clamped = Math.max(xs[0], Math.min(xs[xs.length - 1], xNew[i]));
            out[i] = function.value(clamped);
        }
        return out;
    }

    /**
     * Resamples {@code fp(xp)} onto {@code x}.
     *
     * <p>When the source grid is finer than the target one the samples are averaged in bins
     * centred on the target points (empty bins give 0); otherwise they are interpolated
     * linearly with 0 outside the source range. Source samples further than 10% outside the
     * target range are ignored.
     */
    public static double[] rebin(final double[] x, final double[] xp, final double[] fp) {
        var lower = Double.POSITIVE_INFINITY;
        var upper = Double.NEGATIVE_INFINITY;
        for (final var value : x) {
            lower = Math.min(lower, value);
            upper = Math.max(upper, value);
        }
        final var lo = 0.9 * lower;
        final var hi = 1.1 * upper;
        final var kept = IntStream.range(0, xp.length)
                .filter(i -> !Double.isNaN(xp[i]) && xp[i] > lo && xp[i] < hi)
                .toArray();
        final var sorted = sortedUnique(
                Arrays.stream(kept).mapToDouble(i -> xp[i]).toArray(),
                Arrays.stream(kept).mapToDouble(i -> fp[i]).toArray());
        final var xs = sorted[0];
        final var ys = sorted[1];

        if (x.length > 1 && xs.length > 1 && maxStep(xs) < minStep(x)) {
            log.trace("binning {} samples onto {} points", xs.length, x.length);
            return binnedMean(x, xs, ys);
        }
        final var out = interpolate(xs, ys, x, 0.0);
        for (int i = 0; i < out.length; i++) {
            if (Double.isNaN(out[i])) {
                out[i] = 0.0;
            }
        }
        return out;
    }

    /**
     * Mean of the samples of {@code fp(xp)} falling in each bin {@code [left, right)}. A bin
     * holding no sample takes the value interpolated at its centre, {@code fill} outside the
     * sampled range.
     */
    public static double[] binAverage(final double[] left, final double[] right, final double[] xp,
                                      final double[] fp, final double fill) {
        if (left.length != right.length) {
            throw new IllegalArgumentException("bin edge lengths must match: " + left.length + " != " + right.length);
        }
        if (xp.length != fp.length) {
            throw new IllegalArgumentException("datums lengths must match");
        }
        final var out = new double[left.length];
        for (int k = 0; k < left.length; k++) {
            var sum = 0.0;
            var count = 0;
            for (int i = 0; i < xp.length; i++) {
                if (xp[i] >= left[k] && xp[i] < right[k]) {
                    sum += fp[i];
                    count++;
                }
            }
            out[k] = count > 0 ? sum / count : interpolate(xp, fp, 0.5 * (left[k] + right[k]), fill);
        }
        return out;
    }

    /**
     * Convolution of {@code a} with {@code kernel}, returning the central part with the
     * length of {@code a}.
     */
    public static double[] convolveSame(final double[] a, final double[] kernel) {
        final var n = kernel.length;
        final var offset = (n - 1) / 2;
        final var out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            var sum = 0.0;
            for (int j = 0; j < n; j++) {
                final var k = i + offset - j;
                if (k >= 0 && k < a.length) {
                    sum += a[k] * kernel[j];
                }
            }
            out[i] = sum;
        }
        return out;
    }

    public static double min(final double[] values) {
        var min = Double.POSITIVE_INFINITY;
        for (final var value : values) {
            min = Math.min(min, value);
        }
        return min;
    }

    public static double max(final double[] values) {
        var max = Double.NEGATIVE_INFINITY;
        for (final var value : values) {
            max = Math.max(max, value);
        }
        return max;
    }

    public static double[] multiply(final double[] a, final double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("array lengths must match: " + a.length + " != " + b.length);
        }
        final var out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] * b[i];
        }
        return out;
    }

    public static double[] scale(final double[] a, final double factor) {
        final var out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] * factor;
        }
        return out;
    }

    public static double[] add(final double[] a, final double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("array lengths must match: " + a.length + " != " + b.length);
        }
        final var out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] + b[i];
        }
        return out;
    }

    private static double[] binnedMean(final double[] x, final double[] xs, final double[] ys) {
        final var edges = new double[x.length + 1];
        for (int i = 1; i < x.length; i++) {
            edges[i] = 0.5 * (x[i - 1] + x[i]);
        }
        edges[0] = x[0] - (edges[1] - x[0]) / 2.0;
        edges[x.length] = x[x.length - 1] + (x[x.length - 1] - edges[x.length - 1]) / 2.0;

        final var sums = new double[x.length];
        final var counts = new int[x.length];
        var bin = 0;
        for (int i = 0; i < xs.length; i++) {
            if (xs[i] < edges[0] || xs[i] > edges[x.length]) {
                continue;
            }
            while (bin < x.length - 1 && xs[i] >= edges[bin + 1]) {
                bin++;
            }
            sums[bin] += ys[i];
            counts[bin]++;
        }
        final var out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = counts[i] == 0 ? 0.0 : sums[i] / counts[i];
        }
        return out;
    }

    private static int segmentIndex(final double[] xs, final double value) {
        if (value < xs[0]) {
            return 0;
        }
        if (value >= xs[xs.length - 1]) {
            return xs.length - 2;
        }
        final var found = Arrays.binarySearch(xs, value);
        final var index = found >= 0 ? found : -found - 2;
        return Math.min(index, xs.length - 2);
    }

    private static double maxStep(final double[] values) {
        var max = Double.NEGATIVE_INFINITY;
        for (int i = 1; i < values.length; i++) {
            max = Math.max(max, values[i] - values[i - 1]);
        }
        return max;
    }

    private static double minStep(final double[] values) {
        var min = Double.POSITIVE_INFINITY;
        for (int i = 1; i < values.length; i++) {
            min = Math.min(min, Math.abs(values[i] - values[i - 1]));
        }
        return min;
    }

    private static double[][] sortedUnique(final double[] x, final double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("datums lengths must match");
        }
        final var order = IntStream.range(0, x.length)
                .filter(i -> !Double.isNaN(x[i]))
                .boxed()
                .sorted(Comparator.comparingDouble(i -> x[i]))
                .mapToInt(Integer::intValue)
                .toArray();
        final var xs = new double[order.length];
        final var ys = new double[order.length];
        var count = 0;
        for (final var index : order) {
            if (count > 0 && xs[count - 1] == x[index]) {
                continue;
            }
            xs[count] = x[index];
            ys[count] = y[index];
            count++;
        }
        return new double[][]{Arrays.copyOf(xs, count), Arrays.copyOf(ys, count)};
    }
}
