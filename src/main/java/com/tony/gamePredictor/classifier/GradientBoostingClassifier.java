package com.tony.gamePredictor.classifier;

import com.tony.gamePredictor.exception.TrainingCancelledException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import smile.classification.GradientTreeBoost;
import smile.data.DataFrame;
import smile.data.Tuple;
import smile.data.formula.Formula;
import smile.data.vector.IntVector;
import smile.math.MathEx;

import java.util.stream.IntStream;

/**
 * Gradient boosting binaire (déviance binomiale) délégué à smile {@link GradientTreeBoost}.
 * <p>
 * Les colonnes sont nommées {@code f0..fN} et le label {@code home_win} : le schéma est reconstruit
 * à l'identique pour chaque prédiction. Sous-échantillonnage désactivé pour un modèle reproductible.
 * L'importance d'une feature est la réduction d'impureté cumulée par smile, normalisée à 1.
 */
@Slf4j
@Getter
public class GradientBoostingClassifier implements BinaryClassifier {

    public static final String TYPE = "gradient_boosting";

    static final String LABEL = "home_win";
    private static final Formula FORMULA = Formula.lhs(LABEL);
    private static final double SUBSAMPLE = 1.0;

    private final int estimators;
    private final double learningRate;
    private final int maxDepth;
    private final int minSamplesLeaf;
    private final long seed;

    public GradientBoostingClassifier(int estimators, double learningRate, int maxDepth, int minSamplesLeaf, long seed) {
        if (estimators < 1 || learningRate <= 0.0 || learningRate > 1.0 || maxDepth < 2 || minSamplesLeaf < 1) {
            throw new IllegalArgumentException(String.format(
                    "Hyper-paramètres invalides (estimators=%d, learningRate=%s, maxDepth=%d, minSamplesLeaf=%d)",
                    estimators, learningRate, maxDepth, minSamplesLeaf));
        }
        this.estimators = estimators;
        this.learningRate = learningRate;
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = minSamplesLeaf;
        this.seed = seed;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ClassifierState fit(double[][] features, int[] labels) {
        validateInput(features, labels);
        int d = features[0].length;

        checkInterrupted("avant l'entraînement");
        MathEx.setSeed(seed);
        DataFrame data = frame(features, labels);
        // Arbre binaire de profondeur maxDepth : au plus 2^maxDepth feuilles
        int maxNodes = 1 << Math.min(maxDepth, 16);
        GradientTreeBoost model = GradientTreeBoost.fit(
                FORMULA, data, estimators, maxDepth, maxNodes, minSamplesLeaf, learningRate, SUBSAMPLE);
        // smile n'expose pas de point d'annulation entre les étages
        checkInterrupted("après l'entraînement");

        double[] importances = normalize(model.importance());
        log.debug("Boosting terminé : {} arbres, {} lignes, {} features", estimators, features.length, d);
        return GradientBoostingState.of(model, d, importances);
    }

    @Override
    public double predictProbability(ClassifierState state, double[] row) {
        GradientBoostingState gb = asGradientBoosting(state);
        if (row.length != gb.getFeatureCount()) {
            throw new IllegalArgumentException(String.format(
                    "Ligne de %d valeurs, modèle entraîné sur %d features", row.length, gb.getFeatureCount()));
        }
        // Même schéma qu'à l'entraînement, label factice compris
        Tuple tuple = frame(new double[][]{row}, new int[]{0}).get(0);
        double[] posteriori = new double[2];
        gb.model().predict(tuple, posteriori);
        return posteriori[1];
    }

    @Override
    public double[] featureImportances(ClassifierState state) {
        return asGradientBoosting(state).getFeatureImportances().stream().mapToDouble(Double::doubleValue).toArray();
    }

    private GradientBoostingState asGradientBoosting(ClassifierState state) {
        if (!(state instanceof GradientBoostingState)) {
            throw new IllegalArgumentException("État de classifieur non supporté : "
                    + (state == null ? "null" : state.getClass().getSimpleName()));
        }
        return (GradientBoostingState) state;
    }

    private static DataFrame frame(double[][] features, int[] labels) {
        String[] names = IntStream.range(0, features[0].length).mapToObj(j -> "f" + j).toArray(String[]::new);
        return DataFrame.of(features, names).merge(IntVector.of(LABEL, labels));
    }

    private void validateInput(double[][] features, int[] labels) {
        if (features == null || labels == null || features.length == 0) {
            throw new IllegalArgumentException("Aucune ligne d'entraînement");
        }
        if (features.length != labels.length) {
            throw new IllegalArgumentException(String.format(
                    "%d lignes pour %d labels", features.length, labels.length));
        }
        boolean hasZero = false, hasOne = false;
        for (int label : labels) {
            if (label == 0) hasZero = true;
            else if (label == 1) hasOne = true;
            else throw new IllegalArgumentException("Label hors {0,1} : " + label);
        }
        if (!hasZero || !hasOne) {
            throw new IllegalArgumentException("Les deux classes doivent être présentes");
        }
    }

    private void checkInterrupted(String when) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TrainingCancelledException("Entraînement interrompu " + when);
        }
    }

    private static double[] normalize(double[] raw) {
        double[] out = new double[raw.length];
        double total = 0.0;
        for (int j = 0; j < raw.length; j++) {
            out[j] = Double.isFinite(raw[j]) ? Math.max(0.0, raw[j]) : 0.0;
            total += out[j];
        }
        if (total > 0.0) {
            for (int j = 0; j < out.length; j++) out[j] /= total;
        }
        return out;
    }
}
