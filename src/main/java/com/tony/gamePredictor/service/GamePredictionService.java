package com.tony.gamePredictor.service;

import com.tony.gamePredictor.model.FeatureVector;
import com.tony.gamePredictor.model.GamePrediction;
import com.tony.gamePredictor.model.GameRecord;
import com.tony.gamePredictor.model.TrainingDataset;
import com.tony.gamePredictor.model.TrainingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Façade exposée à la couche de service : features + prédiction + explication en un appel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GamePredictionService {

    private final FeatureVectorBuilder featureVectorBuilder;
    private final TrainingDatasetAssembler datasetAssembler;
    private final GameRecordCsvReader csvReader;
    private final PredictiveModel predictiveModel;

    public FeatureVector buildFeatureVector(GameRecord game, List<GameRecord> historicalGames) {
        return featureVectorBuilder.build(game, historicalGames);
    }

    public GamePrediction predictGame(GameRecord game, List<GameRecord> historicalGames) {
        log.info("🔮 Prédiction : {} vs {}", game == null ? "?" : game.getHomeTeamId(), game == null ? "?" : game.getAwayTeamId());

        FeatureVector features = featureVectorBuilder.build(game, historicalGames);
        return predictiveModel.predictExplained(features);
    }

    public TrainingMetrics trainFromGames(List<GameRecord> games) {
        TrainingDataset dataset = datasetAssembler.assemble(games);
        return predictiveModel.train(dataset);
    }

    public TrainingMetrics trainFromCsv(Path csvFile) {
        return trainFromGames(csvReader.read(csvFile));
    }
}
