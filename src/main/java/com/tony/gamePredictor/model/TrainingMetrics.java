package com.tony.gamePredictor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Métriques calculées sur la partition de test, figées à la construction.
 * Le rapport est indexé par "0", "1", "macro avg" et "weighted avg".
 */
@Value
public class TrainingMetrics {

    double accuracy;

    @JsonProperty("classification_report")
    Map<String, ClassReport> classificationReport;

    int trainSize;
    int testSize;

    @Builder(toBuilder = true)
    @JsonCreator
    public TrainingMetrics(@JsonProperty("accuracy") double accuracy,
                           @JsonProperty("classification_report") Map<String, ClassReport> classificationReport,
                           @JsonProperty("trainSize") int trainSize,
                           @JsonProperty("testSize") int testSize) {
        this.accuracy = accuracy;
        this.classificationReport = classificationReport == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(classificationReport));
        this.trainSize = trainSize;
        this.testSize = testSize;
    }
}
