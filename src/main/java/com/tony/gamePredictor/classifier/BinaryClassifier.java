package com.tony.gamePredictor.classifier;

/**
 * Capacité de classification binaire, interchangeable sans toucher au pipeline de features.
 * Les lignes reçues sont déjà standardisées et dans l'ordre du schéma.
 */
public interface BinaryClassifier {

    /**
     * @param features matrice n x d
     * @param labels   0 ou 1, un par ligne
     * @return l'état entraîné, immuable et sérialisable
     */
    ClassifierState fit(double[][] features, int[] labels);

    /**
     * @return P(label = 1) pour une ligne
     */
    double predictProbability(ClassifierState state, double[] row);

    /**
     * Importance par feature, positionnellement alignée sur les colonnes d'entraînement.
     */
    double[] featureImportances(ClassifierState state);

    String type();
}
