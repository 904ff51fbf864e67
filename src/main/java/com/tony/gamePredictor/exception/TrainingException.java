package com.tony.gamePredictor.exception;

public class TrainingException extends GamePredictorException {

    public TrainingException(String message) {
        super(message);
    }

    public TrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
