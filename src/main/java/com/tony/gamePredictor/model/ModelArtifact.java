package com.tony.gamePredictor.model;

import com.tony.gamePredictor.classifier.ClassifierState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Unité de persistance : état du classifieur + scaler + schéma. Les trois voyagent ensemble
 * et l'instance n'est jamais modifiée après construction (remplacée d'un bloc).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelArtifact {

    ClassifierState classifierState;
    ScalingState scalingState;
    List<String> featureNames;
    String classifierType;
    Instant trainedAt;
    TrainingMetrics metrics;

    /**
     * Complété par Lombok ; la liste des features est copiée pour ne jamais partager
     * la liste (mutable) fournie par l'appelant ou par Jackson.
     */
    public static class ModelArtifactBuilder {
        public ModelArtifactBuilder featureNames(List<String> featureNames) {
            this.featureNames = featureNames == null ? null : List.copyOf(featureNames);
            return this;
        }
    }

    public FeatureSchema schema() {
        return FeatureSchema.of(featureNames);
    }

    /**
     * @throws IllegalStateException si les trois composants ne sont pas cohérents entre eux
     */
    public void validate() {
        if (classifierState == null || scalingState == null || featureNames == null) {
            throw new IllegalStateException("Artefact incomplet (classifieur, scaler ou schéma manquant)");
        }
        if (!schema().isCanonical()) {
            throw new IllegalStateException("Schéma de l'artefact différent du schéma canonique : " + featureNames);
        }
        int width = featureNames.size();
        if (scalingState.width() != width) {
            throw new IllegalStateException(String.format(
                    "Scaler de %d colonnes pour un schéma de %d features", scalingState.width(), width));
        }
        if (classifierState.getFeatureCount() != width) {
            throw new IllegalStateException(String.format(
                    "Classifieur entraîné sur %d features pour un schéma de %d", classifierState.getFeatureCount(), width));
        }
        classifierState.validate();
    }
}
