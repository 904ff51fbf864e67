package com.tony.gamePredictor.service;

import com.tony.gamePredictor.model.ClassReport;
import com.tony.gamePredictor.model.TrainingMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ClassificationReportTest {

    @Test
    @DisplayName("Précision, rappel et F1 par classe, puis moyennes")
    void computesPerClassAndAverages() {
        int[] actual = {1, 1, 1, 0, 0};
        int[] predicted = {1, 1, 0, 0, 1};

        TrainingMetrics metrics = ClassificationReport.evaluate(actual, predicted);

        assertThat(metrics.getAccuracy()).isEqualTo(0.6);
        assertThat(metrics.getClassificationReport()).containsOnlyKeys("0", "1", "macro avg", "weighted avg");

        ClassReport home = metrics.getClassificationReport().get("1");
        assertThat(home.getPrecision()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(home.getRecall()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(home.getSupport()).isEqualTo(3.0);

        ClassReport away = metrics.getClassificationReport().get("0");
        assertThat(away.getPrecision()).isEqualTo(0.5);
        assertThat(away.getF1Score()).isEqualTo(0.5);

        ClassReport macro = metrics.getClassificationReport().get("macro avg");
        assertThat(macro.getRecall()).isCloseTo((2.0 / 3.0 + 0.5) / 2.0, within(1e-12));
        assertThat(macro.getSupport()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Classe jamais prédite : 0 au lieu d'une division par zéro")
    void zeroDivisionGivesZero() {
        TrainingMetrics metrics = ClassificationReport.evaluate(new int[]{0, 1}, new int[]{0, 0});

        ClassReport home = metrics.getClassificationReport().get("1");
        assertThat(home.getPrecision()).isZero();
        assertThat(home.getF1Score()).isZero();
    }
}
