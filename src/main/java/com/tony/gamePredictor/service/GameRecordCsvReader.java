package com.tony.gamePredictor.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.gamePredictor.exception.DataContractException;
import com.tony.gamePredictor.exception.DataSourceException;
import com.tony.gamePredictor.model.GameRecord;
import com.tony.gamePredictor.model.GameStats;
import com.tony.gamePredictor.model.GameWinner;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Import d'un historique de matchs au format CSV (une ligne par match, ordre chronologique).
 */
@Service
@Slf4j
public class GameRecordCsvReader {

    public List<GameRecord> read(Path csvFile) {
        log.info("📥 Import de l'historique depuis {}", csvFile);
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new DataSourceException("Lecture impossible du fichier " + csvFile, e);
        }
    }

    public List<GameRecord> read(Reader reader) {
        List<GameRow> rows;
        try {
            rows = new CsvToBeanBuilder<GameRow>(reader)
                    .withType(GameRow.class).withSeparator(',').withIgnoreLeadingWhiteSpace(true).build().parse();
        } catch (RuntimeException e) {
            throw new DataContractException("CSV d'historique invalide : " + e.getMessage(), e);
        }

        List<GameRecord> games = new ArrayList<>(rows.size());
        int line = 1; // en-tête
        for (GameRow row : rows) {
            line++;
            games.add(toRecord(row, line));
        }
        log.info("✅ {} matchs importés", games.size());
        return games;
    }

    private GameRecord toRecord(GameRow row, int line) {
        if (isBlank(row.getHomeTeamId()) || isBlank(row.getAwayTeamId())) {
            throw new DataContractException("Ligne " + line + " : identifiant d'équipe manquant");
        }
        LocalDate date = null;
        if (!isBlank(row.getDate())) {
            try {
                date = LocalDate.parse(row.getDate().trim());
            } catch (DateTimeParseException e) {
                throw new DataContractException("Ligne " + line + " : date illisible '" + row.getDate() + "'", e);
            }
        }

        return GameRecord.builder()
                .homeTeamId(row.getHomeTeamId().trim())
                .awayTeamId(row.getAwayTeamId().trim())
                .homeScore(row.getHomeScore())
                .awayScore(row.getAwayScore())
                .winner(resolveWinner(row))
                .stats(new GameStats(row.getHomeYardsTotal(), row.getAwayYardsTotal(),
                        row.getHomeTurnovers(), row.getAwayTurnovers()))
                .date(date)
                .primetime(Boolean.TRUE.equals(row.getPrimetime()))
                .divisionGame(Boolean.TRUE.equals(row.getDivisionGame()))
                .homeRestDays(row.getHomeRestDays())
                .awayRestDays(row.getAwayRestDays())
                .build();
    }

    /**
     * Colonne winner si renseignée, sinon déduite du score (égalité ou score absent = inconnu).
     */
    private GameWinner resolveWinner(GameRow row) {
        if (!isBlank(row.getWinner())) return GameWinner.fromCode(row.getWinner());
        if (row.getHomeScore() == null || row.getAwayScore() == null) return GameWinner.UNKNOWN;
        if (row.getHomeScore() > row.getAwayScore()) return GameWinner.HOME;
        if (row.getAwayScore() > row.getHomeScore()) return GameWinner.AWAY;
        return GameWinner.UNKNOWN;
    }

    private boolean isBlank(String s) { return s == null || s.isBlank(); }

    @Data
    public static class GameRow {
        @CsvBindByName(column = "date") private String date;
        @CsvBindByName(column = "home_team_id") private String homeTeamId;
        @CsvBindByName(column = "away_team_id") private String awayTeamId;
        @CsvBindByName(column = "home_score") private Integer homeScore;
        @CsvBindByName(column = "away_score") private Integer awayScore;
        @CsvBindByName(column = "winner") private String winner;
        @CsvBindByName(column = "home_yards_total") private Integer homeYardsTotal;
        @CsvBindByName(column = "away_yards_total") private Integer awayYardsTotal;
        @CsvBindByName(column = "home_turnovers") private Integer homeTurnovers;
        @CsvBindByName(column = "away_turnovers") private Integer awayTurnovers;
        @CsvBindByName(column = "is_primetime") private Boolean primetime;
        @CsvBindByName(column = "is_division_game") private Boolean divisionGame;
        @CsvBindByName(column = "home_rest_days") private Integer homeRestDays;
        @CsvBindByName(column = "away_rest_days") private Integer awayRestDays;
    }
}
