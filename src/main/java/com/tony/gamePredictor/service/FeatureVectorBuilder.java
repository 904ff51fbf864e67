package com.tony.gamePredictor.service;

import com.tony.gamePredictor.config.PredictorProperties;
import com.tony.gamePredictor.exception.DataContractException;
import com.tony.gamePredictor.model.Feature;
import com.tony.gamePredictor.model.FeatureVector;
import com.tony.gamePredictor.model.GameRecord;
import com.tony.gamePredictor.model.SentimentFeatures;
import com.tony.gamePredictor.model.TeamStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Point d'entrée des données amont : valide le match puis assemble le vecteur canonique de 18 features.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeatureVectorBuilder {

    private final TeamStatsAggregator teamStatsAggregator;
    private final SentimentFeatureExtractor sentimentExtractor;
    private final PredictorProperties properties;

    public FeatureVector build(GameRecord game, List<GameRecord> historicalGames) {
        if (game == null) {
            throw new DataContractException("Match à analyser manquant");
        }
        if (game.getHomeTeamId() == null || game.getHomeTeamId().isBlank()) {
            throw new DataContractException("Identifiant de l'équipe domicile manquant");
        }
        if (game.getAwayTeamId() == null || game.getAwayTeamId().isBlank()) {
            throw new DataContractException("Identifiant de l'équipe extérieur manquant");
        }
        List<GameRecord> history = historicalGames == null ? List.of() : historicalGames;

        // 1. Forme des deux équipes
        TeamStats home = teamStatsAggregator.compute(history, game.getHomeTeamId());
        TeamStats away = teamStatsAggregator.compute(history, game.getAwayTeamId());

        // 2. Sentiment & analystes
        SentimentFeatures sentiment = sentimentExtractor.extract(game.getSentiment());

        // 3. Contexte
        PredictorProperties.Features cfg = properties.getFeatures();
        int homeRest = game.getHomeRestDays() != null ? game.getHomeRestDays() : cfg.getDefaultRestDays();
        int awayRest = game.getAwayRestDays() != null ? game.getAwayRestDays() : cfg.getDefaultRestDays();

        // 4. Yards par action : yards/match divisé par un nombre d'actions fixe (approximation)
        double playsPerGame = cfg.getPlaysPerGame();

        FeatureVector vector = FeatureVector.builder()
                .set(Feature.HOME_WIN_RATE, home.getWinRate())
                .set(Feature.AWAY_WIN_RATE, away.getWinRate())
                .set(Feature.HOME_POINTS_SCORED_AVG, home.getPointsScoredAvg())
                .set(Feature.AWAY_POINTS_SCORED_AVG, away.getPointsScoredAvg())
                .set(Feature.HOME_POINTS_ALLOWED_AVG, home.getPointsAllowedAvg())
                .set(Feature.AWAY_POINTS_ALLOWED_AVG, away.getPointsAllowedAvg())
                .set(Feature.HOME_YARDS_PER_PLAY, home.getYardsPerGame() / playsPerGame)
                .set(Feature.AWAY_YARDS_PER_PLAY, away.getYardsPerGame() / playsPerGame)
                .set(Feature.HOME_TURNOVER_DIFF, home.getTurnoverDiff())
                .set(Feature.AWAY_TURNOVER_DIFF, away.getTurnoverDiff())
                .set(Feature.HOME_SENTIMENT_SCORE, sentiment.getHomeSentimentScore())
                .set(Feature.AWAY_SENTIMENT_SCORE, sentiment.getAwaySentimentScore())
                .set(Feature.ANALYST_CONFIDENCE_HOME, sentiment.getAnalystConfidenceHome())
                .set(Feature.ANALYST_CONFIDENCE_AWAY, sentiment.getAnalystConfidenceAway())
                .set(Feature.IS_DIVISION_GAME, game.isDivisionGame() ? 1.0 : 0.0)
                .set(Feature.IS_PRIMETIME, game.isPrimetime() ? 1.0 : 0.0)
                .set(Feature.HOME_REST_DAYS, homeRest)
                .set(Feature.AWAY_REST_DAYS, awayRest)
                .build();

        log.debug("Features {} vs {} : {}", game.getHomeTeamId(), game.getAwayTeamId(), vector);
        return vector;
    }
}
