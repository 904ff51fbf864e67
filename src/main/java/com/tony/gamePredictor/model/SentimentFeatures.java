package com.tony.gamePredictor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class SentimentFeatures {

    public static final SentimentFeatures EMPTY = new SentimentFeatures(0.0, 0.0, 0.0, 0.0);

    double homeSentimentScore;
    double awaySentimentScore;

    // Sommes (pas des moyennes) : le volume d'analystes est un signal
    double analystConfidenceHome;
    double analystConfidenceAway;
}
