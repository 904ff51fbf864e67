package com.tony.gamePredictor.exception;

/**
 * Source de données amont illisible (fichier absent, droits, disque). Le contenu n'a pas été vu.
 */
public class DataSourceException extends GamePredictorException {

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
