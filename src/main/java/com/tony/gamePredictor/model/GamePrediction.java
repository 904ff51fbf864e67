package com.tony.gamePredictor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Prédiction complète d'un match : probabilités + explication du modèle.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GamePrediction {
    private PredictionResult prediction;
    private Map<String, Double> featureImportance;
}
