package com.tony.gamePredictor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tony.gamePredictor.exception.DataContractException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Standardisation (x - moyenne) / écart-type, colonne par colonne.
 * Ajustée une seule fois sur la partition d'entraînement, puis réutilisée telle quelle.
 */
public final class ScalingState {

    private final double[] mean;
    private final double[] scale;

    @JsonCreator
    public ScalingState(@JsonProperty("mean") double[] mean, @JsonProperty("scale") double[] scale) {
        if (mean == null || scale == null || mean.length != scale.length) {
            throw new IllegalArgumentException("mean et scale doivent avoir la même taille");
        }
        this.mean = mean.clone();
        this.scale = scale.clone();
    }

    /**
     * Écart-type de population ; une colonne constante garde une échelle de 1.
     */
    public static ScalingState fit(double[][] matrix) {
        if (matrix == null || matrix.length == 0) {
            throw new IllegalArgumentException("Impossible d'ajuster le scaler sur une matrice vide");
        }
        int width = matrix[0].length;
        double[] mean = new double[width];
        double[] scale = new double[width];
        Mean meanStat = new Mean();
        StandardDeviation stdStat = new StandardDeviation(false);

        for (int j = 0; j < width; j++) {
            double[] column = new double[matrix.length];
            for (int i = 0; i < matrix.length; i++) column[i] = matrix[i][j];

            mean[j] = meanStat.evaluate(column);
            double std = stdStat.evaluate(column, mean[j]);
            scale[j] = (std > 0.0 && Double.isFinite(std)) ? std : 1.0;
        }
        return new ScalingState(mean, scale);
    }

    public double[] transform(double[] row) {
        if (row.length != mean.length) {
            throw new DataContractException(String.format(
                    "Ligne de %d valeurs pour un scaler de %d colonnes", row.length, mean.length));
        }
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - mean[j]) / scale[j];
        }
        return out;
    }

    public double[][] transform(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) out[i] = transform(matrix[i]);
        return out;
    }

    @JsonProperty("mean")
    public double[] getMean() {
        return mean.clone();
    }

    @JsonProperty("scale")
    public double[] getScale() {
        return scale.clone();
    }

    public int width() {
        return mean.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalingState)) return false;
        ScalingState other = (ScalingState) o;
        return Arrays.equals(mean, other.mean) && Arrays.equals(scale, other.scale);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(mean) + Arrays.hashCode(scale);
    }
}
