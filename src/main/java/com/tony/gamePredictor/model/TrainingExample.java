package com.tony.gamePredictor.model;

/**
 * Une ligne d'entraînement : label 1 = victoire de l'équipe à domicile.
 */
public record TrainingExample(FeatureVector features, int label) {

    public TrainingExample {
        if (features == null) throw new IllegalArgumentException("features obligatoires");
        if (label != 0 && label != 1) throw new IllegalArgumentException("Label hors {0,1} : " + label);
    }
}
