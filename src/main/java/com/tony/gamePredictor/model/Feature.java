package com.tony.gamePredictor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Les 18 features du modèle, dans l'ordre canonique.
 * L'ordre des constantes EST le contrat du modèle : le modifier invalide tout modèle sauvegardé.
 */
@Getter
@RequiredArgsConstructor
public enum Feature {
    // Performance des équipes
    HOME_WIN_RATE("home_win_rate"),
    AWAY_WIN_RATE("away_win_rate"),
    HOME_POINTS_SCORED_AVG("home_points_scored_avg"),
    AWAY_POINTS_SCORED_AVG("away_points_scored_avg"),
    HOME_POINTS_ALLOWED_AVG("home_points_allowed_avg"),
    AWAY_POINTS_ALLOWED_AVG("away_points_allowed_avg"),
    // Stats avancées
    HOME_YARDS_PER_PLAY("home_yards_per_play"),
    AWAY_YARDS_PER_PLAY("away_yards_per_play"),
    HOME_TURNOVER_DIFF("home_turnover_diff"),
    AWAY_TURNOVER_DIFF("away_turnover_diff"),
    // Sentiment
    HOME_SENTIMENT_SCORE("home_sentiment_score"),
    AWAY_SENTIMENT_SCORE("away_sentiment_score"),
    ANALYST_CONFIDENCE_HOME("analyst_confidence_home"),
    ANALYST_CONFIDENCE_AWAY("analyst_confidence_away"),
    // Contexte du match
    IS_DIVISION_GAME("is_division_game"),
    IS_PRIMETIME("is_primetime"),
    HOME_REST_DAYS("home_rest_days"),
    AWAY_REST_DAYS("away_rest_days");

    private final String columnName;
}
