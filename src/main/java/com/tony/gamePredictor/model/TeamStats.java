package com.tony.gamePredictor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Forme récente d'une équipe, recalculée à chaque requête depuis la fenêtre d'historique.
 * Jamais persistée.
 */
@Value
@Builder
@AllArgsConstructor
public class TeamStats {

    public static final TeamStats EMPTY = new TeamStats(0.0, 0.0, 0.0, 0.0, 0.0);

    double winRate;            // [0, 1]
    double pointsScoredAvg;
    double pointsAllowedAvg;
    double yardsPerGame;
    double turnoverDiff;       // moyenne des turnovers de l'équipe sur la fenêtre
}
