package com.tony.gamePredictor.job;

import com.tony.gamePredictor.config.PredictorProperties;
import com.tony.gamePredictor.model.GameRecord;
import com.tony.gamePredictor.model.TrainingDataset;
import com.tony.gamePredictor.model.TrainingMetrics;
import com.tony.gamePredictor.service.GameRecordCsvReader;
import com.tony.gamePredictor.service.PredictiveModel;
import com.tony.gamePredictor.service.TrainingDatasetAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Future;

@Component
@RequiredArgsConstructor
@Slf4j
public class ModelTrainingJob {

    private final PredictorProperties properties;
    private final GameRecordCsvReader csvReader;
    private final TrainingDatasetAssembler datasetAssembler;
    private final PredictiveModel predictiveModel;

    /**
     * Ré-entraînement planifié à partir du CSV d'historique configuré.
     * L'entraînement part sur l'exécuteur dédié : les prédictions ne sont pas bloquées.
     */
    @Scheduled(cron = "${predictor.training.cron:-}")
    public void retrain() {
        startRetraining();
    }

    public Optional<Future<TrainingMetrics>> startRetraining() {
        String datasetPath = properties.getTraining().getDatasetPath();
        if (datasetPath == null || datasetPath.isBlank()) {
            log.warn("⏰ [CRON] Aucun dataset configuré (predictor.training.dataset-path), ré-entraînement ignoré");
            return Optional.empty();
        }
        log.info("⏰ [CRON] Ré-entraînement du modèle depuis {}", datasetPath);
        try {
            Path csv = Paths.get(datasetPath);
            List<GameRecord> games = csvReader.read(csv);
            TrainingDataset dataset = datasetAssembler.assemble(games);
            return Optional.of(predictiveModel.trainInBackground(dataset));
        } catch (Exception e) {
            log.error("❌ [CRON] Echec de préparation du ré-entraînement", e);
            return Optional.empty();
        }
    }
}
