package com.tony.gamePredictor.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrainingMetricsTest {

    @Test
    @DisplayName("Le rapport est copié : modifier la map source ne change pas les métriques")
    void reportIsCopiedAtConstruction() {
        Map<String, ClassReport> source = new LinkedHashMap<>();
        source.put("1", new ClassReport(0.8, 0.7, 0.75, 10));

        TrainingMetrics metrics = TrainingMetrics.builder().accuracy(0.8).classificationReport(source).build();
        source.put("0", new ClassReport(0.1, 0.1, 0.1, 1));

        assertThat(metrics.getClassificationReport()).containsOnlyKeys("1");
    }

    @Test
    @DisplayName("Le rapport exposé est en lecture seule")
    void reportIsUnmodifiable() {
        TrainingMetrics metrics = TrainingMetrics.builder()
                .classificationReport(Map.of("1", new ClassReport(0.8, 0.7, 0.75, 10)))
                .build();

        assertThatThrownBy(() -> metrics.getClassificationReport().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(TrainingMetrics.builder().build().getClassificationReport()).isEmpty();
    }
}
