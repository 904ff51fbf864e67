package com.tony.gamePredictor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionResult {
    // Somme = 1.0
    private double homeWinProbability;
    private double awayWinProbability;

    private GameWinner predictedWinner; // HOME ou AWAY, jamais UNKNOWN
    private double confidence;          // max des deux probabilités
}
