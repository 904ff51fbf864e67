package com.tony.gamePredictor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelInfo {
    private List<String> features;
    private String modelType;
    private ModelState state;
    private Instant trainedAt;
    private Map<String, Double> importance;   // null tant qu'aucun modèle n'est prêt
    private TrainingMetrics lastMetrics;
}
