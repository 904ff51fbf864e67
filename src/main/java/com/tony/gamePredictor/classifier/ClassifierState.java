package com.tony.gamePredictor.classifier;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GradientBoostingState.class, name = GradientBoostingClassifier.TYPE)
})
public interface ClassifierState {

    /** Nombre de colonnes vues à l'entraînement. */
    int getFeatureCount();

    /**
     * @throws IllegalStateException si l'état est incomplet ou incohérent (fichier modifié à la main, tronqué...)
     */
    void validate();
}
