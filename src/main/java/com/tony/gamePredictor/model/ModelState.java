package com.tony.gamePredictor.model;

public enum ModelState {
    UNTRAINED,
    TRAINING,
    READY
}
