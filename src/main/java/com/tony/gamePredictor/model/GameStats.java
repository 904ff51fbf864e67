package com.tony.gamePredictor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Stats brutes d'un match (yards et turnovers par camp). Tous les champs sont optionnels.
 */
@Value
@Builder
@AllArgsConstructor
public class GameStats {

    public static final GameStats EMPTY = new GameStats(null, null, null, null);

    @JsonProperty("home_yards_total")
    Integer homeYardsTotal;

    @JsonProperty("away_yards_total")
    Integer awayYardsTotal;

    @JsonProperty("home_turnovers")
    Integer homeTurnovers;

    @JsonProperty("away_turnovers")
    Integer awayTurnovers;
}
