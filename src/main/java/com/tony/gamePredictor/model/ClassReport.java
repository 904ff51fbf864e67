package com.tony.gamePredictor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ClassReport {

    double precision;
    double recall;

    @JsonProperty("f1-score")
    double f1Score;

    double support;

    @JsonCreator
    public ClassReport(@JsonProperty("precision") double precision,
                       @JsonProperty("recall") double recall,
                       @JsonProperty("f1-score") double f1Score,
                       @JsonProperty("support") double support) {
        this.precision = precision;
        this.recall = recall;
        this.f1Score = f1Score;
        this.support = support;
    }
}
