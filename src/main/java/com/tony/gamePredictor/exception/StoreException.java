package com.tony.gamePredictor.exception;

/**
 * Échec de lecture/écriture de l'artefact. Le modèle en mémoire reste la référence.
 */
public class StoreException extends GamePredictorException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
