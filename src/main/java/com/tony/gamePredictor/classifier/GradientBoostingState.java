package com.tony.gamePredictor.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import smile.classification.GradientTreeBoost;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Modèle smile sérialisé (base64 dans le JSON) + importances normalisées.
 * Le modèle n'est désérialisé qu'une fois, au premier usage.
 */
public final class GradientBoostingState implements ClassifierState {

    private final int featureCount;
    private final byte[] model;
    private final List<Double> featureImportances;

    @JsonIgnore
    private transient volatile GradientTreeBoost decoded;

    @JsonCreator
    public GradientBoostingState(@JsonProperty("featureCount") int featureCount,
                                 @JsonProperty("model") byte[] model,
                                 @JsonProperty("featureImportances") List<Double> featureImportances) {
        this.featureCount = featureCount;
        this.model = model == null ? null : model.clone();
        this.featureImportances = featureImportances == null ? null : List.copyOf(featureImportances);
    }

    static GradientBoostingState of(GradientTreeBoost model, int featureCount, double[] importances) {
        GradientBoostingState state = new GradientBoostingState(
                featureCount, encode(model), Arrays.stream(importances).boxed().toList());
        state.decoded = model;
        return state;
    }

    @Override
    public int getFeatureCount() {
        return featureCount;
    }

    public byte[] getModel() {
        return model == null ? null : model.clone();
    }

    public List<Double> getFeatureImportances() {
        return featureImportances;
    }

    GradientTreeBoost model() {
        GradientTreeBoost m = decoded;
        if (m == null) {
            m = decode(model);
            decoded = m;
        }
        return m;
    }

    @Override
    public void validate() {
        if (featureCount < 1) {
            throw new IllegalStateException("Nombre de features invalide : " + featureCount);
        }
        if (model == null || model.length == 0) {
            throw new IllegalStateException("Modèle de boosting absent");
        }
        if (featureImportances == null || featureImportances.size() != featureCount) {
            throw new IllegalStateException(String.format("%s importances pour %d features",
                    featureImportances == null ? "Aucune" : String.valueOf(featureImportances.size()), featureCount));
        }
        for (Double v : featureImportances) {
            if (v == null || !Double.isFinite(v) || v < 0.0) {
                throw new IllegalStateException("Importance invalide : " + v);
            }
        }
        GradientTreeBoost m;
        try {
            m = model();
        } catch (UncheckedIOException | ClassCastException e) {
            throw new IllegalStateException("Modèle de boosting illisible : " + e.getMessage(), e);
        }
        if (m.importance().length != featureCount) {
            throw new IllegalStateException(String.format(
                    "Modèle entraîné sur %d colonnes, état déclaré sur %d", m.importance().length, featureCount));
        }
    }

    private static byte[] encode(GradientTreeBoost model) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(model);
        } catch (IOException e) {
            throw new UncheckedIOException("Sérialisation du modèle impossible", e);
        }
        return bytes.toByteArray();
    }

    private static GradientTreeBoost decode(byte[] bytes) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            return (GradientTreeBoost) in.readObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Désérialisation du modèle impossible", e);
        } catch (ClassNotFoundException e) {
            throw new UncheckedIOException(new IOException("Classe du modèle introuvable", e));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GradientBoostingState)) return false;
        GradientBoostingState other = (GradientBoostingState) o;
        return featureCount == other.featureCount
                && Arrays.equals(model, other.model)
                && Objects.equals(featureImportances, other.featureImportances);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * featureCount + Arrays.hashCode(model)) + Objects.hashCode(featureImportances);
    }
}
