package com.tony.gamePredictor.model;

import com.tony.gamePredictor.exception.DataContractException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vecteur de features nommé et ordonné. Immuable une fois construit.
 */
public final class FeatureVector {

    private final FeatureSchema schema;
    private final double[] values;

    private FeatureVector(FeatureSchema schema, double[] values) {
        this.schema = schema;
        this.values = values;
    }

    public static FeatureVector of(FeatureSchema schema, double[] values) {
        if (schema == null || values == null) {
            throw new DataContractException("Schéma et valeurs sont obligatoires");
        }
        if (schema.size() != values.length) {
            throw new DataContractException(String.format(
                    "Vecteur de %d valeurs pour un schéma de %d features", values.length, schema.size()));
        }
        return new FeatureVector(schema, values.clone());
    }

    public static Builder builder() {
        return new Builder();
    }

    public FeatureSchema schema() {
        return schema;
    }

    public int size() {
        return values.length;
    }

    public double get(Feature feature) {
        return get(feature.getColumnName());
    }

    public double get(String name) {
        int idx = schema.indexOf(name);
        if (idx < 0) throw new IllegalArgumentException("Feature inconnue : " + name);
        return values[idx];
    }

    public double[] toArray() {
        return values.clone();
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(schema.names().get(i), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        FeatureVector other = (FeatureVector) o;
        return schema.equals(other.schema) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * schema.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + asMap();
    }

    /**
     * Remplit le vecteur canonique feature par feature ; toutes doivent être renseignées.
     */
    public static final class Builder {
        private final EnumMap<Feature, Double> entries = new EnumMap<>(Feature.class);

        public Builder set(Feature feature, double value) {
            entries.put(feature, value);
            return this;
        }

        public FeatureVector build() {
            Feature[] features = Feature.values();
            double[] values = new double[features.length];
            for (Feature f : features) {
                Double v = entries.get(f);
                if (v == null) throw new IllegalStateException("Feature non renseignée : " + f.getColumnName());
                values[f.ordinal()] = v;
            }
            return new FeatureVector(FeatureSchema.CANONICAL, values);
        }
    }
}
