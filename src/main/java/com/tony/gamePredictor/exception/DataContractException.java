package com.tony.gamePredictor.exception;

/**
 * Donnée amont structurellement invalide (identifiant d'équipe manquant, date illisible...).
 * Jamais remplacée par une valeur par défaut.
 */
public class DataContractException extends GamePredictorException {

    public DataContractException(String message) {
        super(message);
    }

    public DataContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
