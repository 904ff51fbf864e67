package com.tony.gamePredictor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "predictor")
@Validated
@Data
public class PredictorProperties {

    @Valid
    private Features features = new Features();

    @Valid
    private Model model = new Model();

    @Valid
    private Store store = new Store();

    @Valid
    private Training training = new Training();

    @Data
    public static class Features {
        // --- Forme récente ---
        @Min(1)
        private int windowSize = 5;

        // --- Contexte ---
        @Min(0)
        private int defaultRestDays = 7;

        // Approximation du nombre d'actions par match (yards/match -> yards/action)
        @DecimalMin(value = "0.0", inclusive = false)
        private double playsPerGame = 60.0;
    }

    @Data
    public static class Model {
        // --- Boosting ---
        @Min(1)
        private int estimators = 100;

        @DecimalMin(value = "0.0", inclusive = false)
        private double learningRate = 0.1;

        @Min(2)
        private int maxDepth = 5;

        @Min(1)
        private int minSamplesLeaf = 5;

        // --- Split train/test ---
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double testSize = 0.2;

        private long randomSeed = 42L;
    }

    @Data
    public static class Store {
        @NotBlank
        private String path = "models/saved/game_predictor.json";
    }

    @Data
    public static class Training {
        // CSV d'historique utilisé par le job de ré-entraînement (vide = job inactif)
        private String datasetPath = "";

        // "-" désactive le cron
        private String cron = "-";
    }
}
