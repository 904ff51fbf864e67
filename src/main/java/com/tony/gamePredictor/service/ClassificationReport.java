package com.tony.gamePredictor.service;

import com.tony.gamePredictor.model.ClassReport;
import com.tony.gamePredictor.model.TrainingMetrics;
import smile.validation.metric.Accuracy;
import smile.validation.metric.Precision;
import smile.validation.metric.Recall;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accuracy + précision/rappel/F1 par classe (métriques binaires smile, classe évaluée = positive),
 * moyennes macro et pondérée. Une division par zéro (classe jamais prédite, absente du test) donne 0.
 */
final class ClassificationReport {

    private static final int[] CLASSES = {0, 1};

    private ClassificationReport() {
    }

    static TrainingMetrics evaluate(int[] actual, int[] predicted) {
        if (actual.length != predicted.length || actual.length == 0) {
            throw new IllegalArgumentException("Jeux réel/prédit vides ou de tailles différentes");
        }
        int n = actual.length;

        Map<String, ClassReport> report = new LinkedHashMap<>();
        double macroP = 0, macroR = 0, macroF = 0;
        double weightedP = 0, weightedR = 0, weightedF = 0;

        for (int c : CLASSES) {
            // smile ne connaît que la classe positive 1 : on recode pour la classe 0
            int[] truth = c == 1 ? actual : flip(actual);
            int[] prediction = c == 1 ? predicted : flip(predicted);

            double support = Arrays.stream(truth).sum();
            double precision = zeroIfNaN(Precision.of(truth, prediction));
            double recall = zeroIfNaN(Recall.of(truth, prediction));
            double f1 = (precision + recall) > 0 ? 2 * precision * recall / (precision + recall) : 0.0;

            report.put(String.valueOf(c), new ClassReport(precision, recall, f1, support));

            macroP += precision / CLASSES.length;
            macroR += recall / CLASSES.length;
            macroF += f1 / CLASSES.length;
            weightedP += precision * support / n;
            weightedR += recall * support / n;
            weightedF += f1 * support / n;
        }
        report.put("macro avg", new ClassReport(macroP, macroR, macroF, n));
        report.put("weighted avg", new ClassReport(weightedP, weightedR, weightedF, n));

        return TrainingMetrics.builder()
                .accuracy(Accuracy.of(actual, predicted))
                .classificationReport(report)
                .build();
    }

    private static int[] flip(int[] labels) {
        return Arrays.stream(labels).map(y -> 1 - y).toArray();
    }

    private static double zeroIfNaN(double v) {
        return Double.isNaN(v) ? 0.0 : v;
    }
}
