package com.imagebuilder.metrics.derived;

/**
 * Numerical smoothing primitives for count series. The two are not interchangeable:
 * {@link #runningMean(double[])} is an expanding mean, {@link #gaussianTrend(double[], double)}
 * is a Gaussian-weighted convolution over the whole series.
 */
public final class Smoothing {
    public static final double DEFAULT_TREND_STD = 7.0;

    private Smoothing() {}

    /**
     * {@code out[i] = sum(values[0..i]) / (i + 1)}.
     */
    public static double[] runningMean(double[] values) {
        double[] out = new double[values.length];
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            out[i] = sum / (i + 1);
        }
        return out;
    }

    public static double[] gaussianTrend(double[] values) {
        return gaussianTrend(values, DEFAULT_TREND_STD);
    }

    /**
     * Trend line from a normalized Gaussian kernel as long as the series.
     *
     * <p>The series is padded on the right with {@code n / 2} copies of its last value, convolved
     * with the kernel keeping the padded length (centered), and the padding is then removed so the
     * output has {@code n} points. A single point is returned unchanged.
     */
    public static double[] gaussianTrend(double[] values, double std) {
        if (!(std > 0.0)) {
            throw new IllegalArgumentException("std must be positive, got " + std);
        }
        int n = values.length;
        if (n <= 1) {
            return values.clone();
        }
        double[] kernel = gaussianKernel(n, std);

        int half = n / 2;
        double[] padded = new double[n + half];
        System.arraycopy(values, 0, padded, 0, n);
        for (int i = n; i < padded.length; i++) {
            padded[i] = values[n - 1];
        }

        int offset = (n - 1) / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int k = i + offset;
            double acc = 0.0;
            int jFrom = Math.max(0, k - (n - 1));
            int jTo = Math.min(padded.length - 1, k);
            for (int j = jFrom; j <= jTo; j++) {
                acc += padded[j] * kernel[k - j];
            }
            out[i] = acc;
        }
        return out;
    }

    static double[] gaussianKernel(int size, double std) {
        double[] kernel = new double[size];
        double center = (size - 1) / 2.0;
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            double x = (i - center) / std;
            kernel[i] = Math.exp(-0.5 * x * x);
            sum += kernel[i];
        }
        for (int i = 0; i < size; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }
}
