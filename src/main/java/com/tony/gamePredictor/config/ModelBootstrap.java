package com.tony.gamePredictor.config;

import com.tony.gamePredictor.exception.StoreException;
import com.tony.gamePredictor.service.PredictiveModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Au démarrage, recharge le dernier modèle sauvegardé s'il existe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelBootstrap implements CommandLineRunner {

    private final PredictiveModel predictiveModel;

    @Override
    public void run(String... args) {
        try {
            predictiveModel.reload();
        } catch (StoreException e) {
            // Pas bloquant : le service démarre non entraîné
            log.warn("🌱 Aucun modèle utilisable au démarrage : {}", e.getMessage());
        }
    }
}
