package com.tony.gamePredictor.exception;

public class TrainingCancelledException extends TrainingException {

    public TrainingCancelledException(String message) {
        super(message);
    }
}
