package com.z254.argus.ranker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Zero-mean, unit-variance standardization with training-time statistics.
 * Constant columns keep a scale of 1.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StandardScaler {

    private double[] mean = new double[0];
    private double[] scale = new double[0];

    public static StandardScaler fit(double[][] rows) {
        int columns = rows[0].length;
        double[] mean = new double[columns];
        double[] scale = new double[columns];
        for (double[] row : rows) {
            for (int c = 0; c < columns; c++) {
                mean[c] += row[c];
            }
        }
        for (int c = 0; c < columns; c++) {
            mean[c] /= rows.length;
        }
        for (double[] row : rows) {
            for (int c = 0; c < columns; c++) {
                double d = row[c] - mean[c];
                scale[c] += d * d;
            }
        }
        for (int c = 0; c < columns; c++) {
            double std = Math.sqrt(scale[c] / rows.length);
            scale[c] = std < 1e-12 ? 1.0 : std;
        }
        return new StandardScaler(mean, scale);
    }

    public double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int c = 0; c < row.length; c++) {
            out[c] = (row[c] - mean[c]) / scale[c];
        }
        return out;
    }

    public int columns() {
        return mean.length;
    }
}
