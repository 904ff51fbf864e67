package com.tony.gamePredictor.exception;

/**
 * Aucun modèle en mémoire et aucun modèle chargeable.
 */
public class NotReadyException extends GamePredictorException {

    public NotReadyException(String message) {
        super(message);
    }

    public NotReadyException(String message, Throwable cause) {
        super(message, cause);
    }
}
