package com.tony.gamePredictor.model;

import com.tony.gamePredictor.exception.DataContractException;
import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.List;

/**
 * Liste ordonnée des noms de features. Voyage avec le modèle sauvegardé.
 */
@EqualsAndHashCode
public final class FeatureSchema {

    public static final FeatureSchema CANONICAL = new FeatureSchema(
            Arrays.stream(Feature.values()).map(Feature::getColumnName).toList());

    private final List<String> names;

    private FeatureSchema(List<String> names) {
        this.names = List.copyOf(names);
    }

    public static FeatureSchema of(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new DataContractException("Schéma de features vide");
        }
        return new FeatureSchema(names);
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public int indexOf(String name) {
        return names.indexOf(name);
    }

    public boolean isCanonical() {
        return CANONICAL.equals(this);
    }

    /**
     * Vérifie nom par nom et position par position.
     */
    public void requireSameAs(FeatureSchema expected) {
        if (!expected.equals(this)) {
            throw new DataContractException(String.format(
                    "Schéma de features incompatible : attendu %s, reçu %s", expected.names, names));
        }
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
