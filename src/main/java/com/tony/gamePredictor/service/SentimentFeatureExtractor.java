package com.tony.gamePredictor.service;

import com.tony.gamePredictor.exception.DataContractException;
import com.tony.gamePredictor.model.SentimentFeatures;
import com.tony.gamePredictor.model.SentimentPayload;
import com.tony.gamePredictor.model.SentimentPayload.AnalystOpinion;
import com.tony.gamePredictor.model.SentimentPayload.TweetSentiment;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SentimentFeatureExtractor {

    private static final String HOME_PICK = "home";

    /**
     * Agrège le sentiment des tweets (moyenne par camp) et la confiance des analystes (somme par camp).
     * Aucune normalisation : le scaler du modèle s'en charge.
     */
    public SentimentFeatures extract(SentimentPayload payload) {
        if (payload == null) return SentimentFeatures.EMPTY;

        SentimentPayload.Tweets tweets = payload.getTweets();
        double homeSentiment = tweets == null ? 0.0 : meanSentiment(tweets.getHomeTeam(), "home_team");
        double awaySentiment = tweets == null ? 0.0 : meanSentiment(tweets.getAwayTeam(), "away_team");

        double homeConfidence = 0.0;
        double awayConfidence = 0.0;
        List<AnalystOpinion> opinions = payload.getAnalystOpinions();
        if (opinions != null) {
            for (AnalystOpinion opinion : opinions) {
                if (opinion == null) {
                    throw new DataContractException("Avis d'analyste null dans analyst_opinions");
                }
                double confidence = safeDouble(opinion.getConfidence());
                // Tout ce qui n'est pas explicitement "home" compte pour l'extérieur
                if (HOME_PICK.equals(opinion.getPick())) homeConfidence += confidence;
                else awayConfidence += confidence;
            }
        }

        return SentimentFeatures.builder()
                .homeSentimentScore(homeSentiment)
                .awaySentimentScore(awaySentiment)
                .analystConfidenceHome(homeConfidence)
                .analystConfidenceAway(awayConfidence)
                .build();
    }

    private double meanSentiment(List<TweetSentiment> tweets, String side) {
        if (tweets == null || tweets.isEmpty()) return 0.0;
        double sum = 0.0;
        for (TweetSentiment tweet : tweets) {
            if (tweet == null) {
                throw new DataContractException("Tweet null dans tweets." + side);
            }
            sum += safeDouble(tweet.getSentimentScore());
        }
        return sum / tweets.size();
    }

    private double safeDouble(Double val) { return val == null ? 0.0 : val; }
}
