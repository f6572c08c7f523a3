package com.metrics.anomaly.engine.reconstruction;

import java.util.Arrays;

/**
 * Learned representation of a metric's normal behaviour.
 *
 * Training standardises each feature and keeps the standardised training points. A point is
 * reconstructed as the mean of its k nearest training points; the reconstruction error is the
 * Euclidean distance between the standardised point and its reconstruction. The anomaly
 * threshold is calibrated from leave-one-out reconstruction errors over the training set:
 * {@code max(quantile(errors) * margin, minThreshold)}.
 *
 * Instances are immutable and safe to share across threads.
 */
public final class ReconstructionModel {

    private final double[] means;
    private final double[] scales;
    private final double[][] normalized;
    private final int neighbours;
    private final double threshold;
    private final long trainedAt;

    private ReconstructionModel(double[] means, double[] scales, double[][] normalized,
                                int neighbours, double threshold, long trainedAt) {
        this.means = means;
        this.scales = scales;
        this.normalized = normalized;
        this.neighbours = neighbours;
        this.threshold = threshold;
        this.trainedAt = trainedAt;
    }

    /**
     * Train a model.
     *
     * @param data         training rows, each a feature vector of equal length
     * @param neighbours   k used for reconstruction
     * @param quantile     quantile of leave-one-out errors used for calibration (0-1]
     * @param margin       multiplier applied to the calibrated quantile
     * @param minThreshold lower bound for the threshold
     * @param trainedAt    training timestamp in epoch milliseconds
     * @throws IllegalArgumentException if there are not more rows than neighbours or rows differ in length
     */
    public static ReconstructionModel train(double[][] data, int neighbours, double quantile,
                                            double margin, double minThreshold, long trainedAt) {
        if (neighbours <= 0) {
            throw new IllegalArgumentException("neighbours must be > 0, got: " + neighbours);
        }
        if (data.length <= neighbours) {
            throw new IllegalArgumentException(
                    "Need more than " + neighbours + " training rows, got: " + data.length);
        }
        int dims = data[0].length;
        for (double[] row : data) {
            if (row.length != dims) {
                throw new IllegalArgumentException("Inconsistent feature vector length in training data");
            }
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Training data contains a non-finite feature");
                }
            }
        }

        double[] means = new double[dims];
        double[] scales = new double[dims];
        for (int f = 0; f < dims; f++) {
            double sum = 0;
            for (double[] row : data) sum += row[f];
            double mean = sum / data.length;
            double sq = 0;
            for (double[] row : data) {
                double d = row[f] - mean;
                sq += d * d;
            }
            double sd = Math.sqrt(sq / data.length);
            means[f] = mean;
            // A constant feature carries no spread; leave it unscaled
            scales[f] = sd > 0 ? sd : 1.0;
        }

        double[][] normalized = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            normalized[i] = standardize(data[i], means, scales);
        }

        double[] errors = new double[normalized.length];
        for (int i = 0; i < normalized.length; i++) {
            errors[i] = error(normalized[i], normalized, neighbours, i);
        }
        Arrays.sort(errors);
        int idx = (int) Math.ceil(quantile * errors.length) - 1;
        idx = Math.max(0, Math.min(errors.length - 1, idx));
        double threshold = Math.max(errors[idx] * margin, minThreshold);

        return new ReconstructionModel(means, scales, normalized, neighbours, threshold, trainedAt);
    }

    public double reconstructionError(double[] point) {
        if (point.length != means.length) {
            throw new IllegalArgumentException("Expected " + means.length
                    + " features, got: " + point.length);
        }
        return error(standardize(point, means, scales), normalized, neighbours, -1);
    }

    private static double error(double[] point, double[][] training, int k, int excludeIndex) {
        int[] nearest = nearest(point, training, k, excludeIndex);
        double[] reconstruction = new double[point.length];
        int used = 0;
        for (int idx : nearest) {
            if (idx < 0) break;
            for (int f = 0; f < point.length; f++) {
                reconstruction[f] += training[idx][f];
            }
            used++;
        }
        for (int f = 0; f < point.length; f++) {
            reconstruction[f] /= used;
        }
        return Math.sqrt(squaredDistance(point, reconstruction));
    }

    // Indices of the k closest rows, closest first; unused slots stay -1
    private static int[] nearest(double[] point, double[][] training, int k, int excludeIndex) {
        int[] indices = new int[Math.min(k, training.length)];
        double[] best = new double[indices.length];
        Arrays.fill(indices, -1);
        Arrays.fill(best, Double.POSITIVE_INFINITY);

        for (int i = 0; i < training.length; i++) {
            if (i == excludeIndex) continue;
            double d = squaredDistance(point, training[i]);
            for (int j = 0; j < indices.length; j++) {
                if (d < best[j]) {
                    // Shift down
                    for (int s = indices.length - 1; s > j; s--) {
                        indices[s] = indices[s - 1];
                        best[s] = best[s - 1];
                    }
                    indices[j] = i;
                    best[j] = d;
                    break;
                }
            }
        }
        return indices;
    }

    private static double[] standardize(double[] point, double[] means, double[] scales) {
        double[] out = new double[point.length];
        for (int f = 0; f < point.length; f++) {
            out[f] = (point[f] - means[f]) / scales[f];
        }
        return out;
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0;
        for (int f = 0; f < a.length; f++) {
            double d = a[f] - b[f];
            sum += d * d;
        }
        return sum;
    }

    public double getThreshold() { return threshold; }
    public int getFeatureCount() { return means.length; }
    public int getTrainingSamples() { return normalized.length; }
    public int getNeighbours() { return neighbours; }
    public long getTrainedAt() { return trainedAt; }
}
