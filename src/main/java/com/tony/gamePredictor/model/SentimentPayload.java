package com.tony.gamePredictor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload produit par le pipeline de sentiment externe :
 * {@code {tweets: {home_team: [...], away_team: [...]}, analyst_opinions: [...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SentimentPayload {

    private Tweets tweets = new Tweets();

    @JsonProperty("analyst_opinions")
    private List<AnalystOpinion> analystOpinions = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Tweets {
        @JsonProperty("home_team")
        private List<TweetSentiment> homeTeam = new ArrayList<>();

        @JsonProperty("away_team")
        private List<TweetSentiment> awayTeam = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TweetSentiment {
        @JsonProperty("sentiment_score")
        private Double sentimentScore;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AnalystOpinion {
        private String pick;        // "home" ou autre chose (= away)
        private Double confidence;
    }
}
