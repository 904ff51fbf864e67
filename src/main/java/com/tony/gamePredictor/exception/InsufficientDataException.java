package com.tony.gamePredictor.exception;

/**
 * Jeu d'entraînement vide ou mono-classe : un modèle entraîné dessus n'aurait aucun sens.
 */
public class InsufficientDataException extends TrainingException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
