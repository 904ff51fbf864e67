package com.tony.gamePredictor.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Un match historique (ou à venir) tel que fourni par le collecteur de données.
 * Seuls les identifiants d'équipes sont obligatoires, le reste a une valeur par défaut.
 */
@Value
@Builder(toBuilder = true)
public class GameRecord {

    String homeTeamId;
    String awayTeamId;

    Integer homeScore;
    Integer awayScore;

    @Builder.Default
    GameWinner winner = GameWinner.UNKNOWN;

    GameStats stats;

    LocalDate date;

    boolean primetime;
    boolean divisionGame;

    // null = inconnu (7 jours par défaut à la construction des features)
    Integer homeRestDays;
    Integer awayRestDays;

    SentimentPayload sentiment;

    public GameStats statsOrEmpty() {
        return stats != null ? stats : GameStats.EMPTY;
    }

    public GameWinner winnerOrUnknown() {
        return winner != null ? winner : GameWinner.UNKNOWN;
    }
}
