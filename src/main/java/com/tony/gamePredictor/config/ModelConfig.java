package com.tony.gamePredictor.config;

import com.tony.gamePredictor.classifier.BinaryClassifier;
import com.tony.gamePredictor.classifier.GradientBoostingClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ModelConfig {

    public static final String TRAINING_EXECUTOR = "modelTrainingExecutor";

    @Bean
    public BinaryClassifier binaryClassifier(PredictorProperties properties) {
        PredictorProperties.Model m = properties.getModel();
        return new GradientBoostingClassifier(m.getEstimators(), m.getLearningRate(), m.getMaxDepth(), m.getMinSamplesLeaf(), m.getRandomSeed());
    }

    /**
     * Un seul thread : l'entraînement n'est pas ré-entrant et ne doit pas bloquer les prédictions.
     */
    @Bean(name = TRAINING_EXECUTOR)
    public ThreadPoolTaskExecutor modelTrainingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("model-training-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
