package com.tony.gamePredictor;

import com.tony.gamePredictor.config.PredictorProperties;
import com.tony.gamePredictor.model.Feature;
import com.tony.gamePredictor.model.FeatureVector;
import com.tony.gamePredictor.model.GameRecord;
import com.tony.gamePredictor.model.GameStats;
import com.tony.gamePredictor.model.GameWinner;
import com.tony.gamePredictor.model.TrainingDataset;

import java.time.LocalDate;
import java.util.Random;

public final class TestFixtures {

    private TestFixtures() {
    }

    public static PredictorProperties defaultProperties() {
        return new PredictorProperties();
    }

    public static GameRecord game(String home, String away, int homeScore, int awayScore) {
        return GameRecord.builder()
                .homeTeamId(home)
                .awayTeamId(away)
                .homeScore(homeScore)
                .awayScore(awayScore)
                .winner(homeScore > awayScore ? GameWinner.HOME : homeScore < awayScore ? GameWinner.AWAY : GameWinner.UNKNOWN)
                .stats(new GameStats(360, 300, 1, 2))
                .date(LocalDate.of(2024, 9, 8))
                .build();
    }

    /**
     * Jeu synthétique : l'équipe domicile gagne quand son win rate dépasse celui de l'adversaire.
     * Le bruit sur les autres features est là pour que le modèle ait à trier.
     */
    public static TrainingDataset separableDataset(int size, long seed) {
        Random random = new Random(seed);
        TrainingDataset.Builder builder = TrainingDataset.builder();
        for (int i = 0; i < size; i++) {
            double homeRate = random.nextDouble();
            double awayRate = random.nextDouble();
            builder.add(vector(homeRate, awayRate, random), homeRate > awayRate);
        }
        return builder.build();
    }

    public static FeatureVector vector(double homeWinRate, double awayWinRate, Random noise) {
        FeatureVector.Builder builder = FeatureVector.builder();
        for (Feature feature : Feature.values()) {
            builder.set(feature, noise.nextDouble() * 10.0);
        }
        return builder
                .set(Feature.HOME_WIN_RATE, homeWinRate)
                .set(Feature.AWAY_WIN_RATE, awayWinRate)
                .set(Feature.IS_DIVISION_GAME, noise.nextBoolean() ? 1.0 : 0.0)
                .set(Feature.IS_PRIMETIME, 0.0)
                .build();
    }
}
