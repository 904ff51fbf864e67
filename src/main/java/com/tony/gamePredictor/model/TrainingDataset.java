package com.tony.gamePredictor.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Collection ordonnée et immuable d'exemples. Construite pour un entraînement puis jetée.
 */
public final class TrainingDataset {

    private final List<TrainingExample> examples;

    private TrainingDataset(List<TrainingExample> examples) {
        this.examples = List.copyOf(examples);
    }

    public static TrainingDataset of(List<TrainingExample> examples) {
        return new TrainingDataset(examples == null ? List.of() : examples);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TrainingExample> examples() {
        return examples;
    }

    public int size() {
        return examples.size();
    }

    public boolean isEmpty() {
        return examples.isEmpty();
    }

    public long countLabel(int label) {
        return examples.stream().filter(e -> e.label() == label).count();
    }

    public static final class Builder {
        private final List<TrainingExample> examples = new ArrayList<>();

        public Builder add(FeatureVector features, int label) {
            examples.add(new TrainingExample(features, label));
            return this;
        }

        public Builder add(FeatureVector features, boolean homeWon) {
            return add(features, homeWon ? 1 : 0);
        }

        public TrainingDataset build() {
            return new TrainingDataset(examples);
        }
    }
}
