package com.tony.gamePredictor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GameWinner {
    HOME,
    AWAY,
    UNKNOWN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lecture tolérante : null, vide ou valeur inconnue donnent UNKNOWN.
     */
    @JsonCreator
    public static GameWinner fromCode(String code) {
        if (code == null || code.isBlank()) return UNKNOWN;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "home" -> HOME;
            case "away" -> AWAY;
            default -> UNKNOWN;
        };
    }
}
