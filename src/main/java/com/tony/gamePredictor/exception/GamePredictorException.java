package com.tony.gamePredictor.exception;

/**
 * Racine des erreurs du pipeline de prédiction. Aucune n'est retentée dans le coeur.
 */
public abstract class GamePredictorException extends RuntimeException {

    protected GamePredictorException(String message) {
        super(message);
    }

    protected GamePredictorException(String message, Throwable cause) {
        super(message, cause);
    }
}
