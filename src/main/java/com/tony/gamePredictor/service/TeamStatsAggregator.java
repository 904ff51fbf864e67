package com.tony.gamePredictor.service;

import com.tony.gamePredictor.config.PredictorProperties;
import com.tony.gamePredictor.exception.DataContractException;
import com.tony.gamePredictor.model.GameRecord;
import com.tony.gamePredictor.model.GameStats;
import com.tony.gamePredictor.model.GameWinner;
import com.tony.gamePredictor.model.TeamStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TeamStatsAggregator {

    private final PredictorProperties properties;

    public TeamStats compute(List<GameRecord> historicalGames, String teamId) {
        return compute(historicalGames, teamId, properties.getFeatures().getWindowSize());
    }

    /**
     * Forme récente d'une équipe sur ses {@code windowSize} derniers matchs.
     * L'appelant fournit l'historique dans l'ordre chronologique : aucun tri n'est fait ici.
     */
    public TeamStats compute(List<GameRecord> historicalGames, String teamId, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize doit être >= 1 (reçu " + windowSize + ")");
        }
        if (teamId == null || teamId.isBlank()) {
            throw new DataContractException("Identifiant d'équipe manquant");
        }
        if (historicalGames == null || historicalGames.isEmpty()) {
            return TeamStats.EMPTY;
        }

        // 1. Vue relative à l'équipe, match par match
        List<TeamGame> teamGames = new ArrayList<>();
        for (GameRecord game : historicalGames) {
            requireTeamIds(game);

            boolean isHome = game.getHomeTeamId().equals(teamId);
            boolean isAway = game.getAwayTeamId().equals(teamId);
            if (!isHome && !isAway) continue;

            GameStats stats = game.statsOrEmpty();
            int homeScore = safeInt(game.getHomeScore());
            int awayScore = safeInt(game.getAwayScore());

            teamGames.add(isHome
                    ? new TeamGame(homeScore, awayScore, safeInt(stats.getHomeYardsTotal()),
                            safeInt(stats.getHomeTurnovers()), game.winnerOrUnknown() == GameWinner.HOME)
                    : new TeamGame(awayScore, homeScore, safeInt(stats.getAwayYardsTotal()),
                            safeInt(stats.getAwayTurnovers()), game.winnerOrUnknown() == GameWinner.AWAY));
        }

        // 2. Fenêtre glissante : les N derniers dans l'ordre fourni
        List<TeamGame> window = teamGames.subList(Math.max(0, teamGames.size() - windowSize), teamGames.size());
        if (window.isEmpty()) {
            log.debug("Aucun match trouvé pour l'équipe {}, stats à zéro", teamId);
            return TeamStats.EMPTY;
        }

        // 3. Moyennes
        double wins = 0, scored = 0, allowed = 0, yards = 0, turnovers = 0;
        for (TeamGame g : window) {
            if (g.won()) wins++;
            scored += g.pointsScored();
            allowed += g.pointsAllowed();
            yards += g.yards();
            turnovers += g.turnovers();
        }
        int n = window.size();

        return TeamStats.builder()
                .winRate(wins / n)
                .pointsScoredAvg(scored / n)
                .pointsAllowedAvg(allowed / n)
                .yardsPerGame(yards / n)
                .turnoverDiff(turnovers / n)
                .build();
    }

    private void requireTeamIds(GameRecord game) {
        if (game == null) {
            throw new DataContractException("Match null dans l'historique");
        }
        if (game.getHomeTeamId() == null || game.getHomeTeamId().isBlank()
                || game.getAwayTeamId() == null || game.getAwayTeamId().isBlank()) {
            throw new DataContractException("Match du " + game.getDate() + " sans identifiant d'équipe domicile/extérieur");
        }
    }

    private int safeInt(Integer val) { return val == null ? 0 : val; }

    private record TeamGame(int pointsScored, int pointsAllowed, int yards, int turnovers, boolean won) {}
}
