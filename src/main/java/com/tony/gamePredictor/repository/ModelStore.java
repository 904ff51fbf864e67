package com.tony.gamePredictor.repository;

import com.tony.gamePredictor.model.ModelArtifact;

import java.util.Optional;

/**
 * Persistance durable de l'artefact complet (classifieur + scaler + schéma), en un seul bloc.
 */
public interface ModelStore {

    /**
     * @throws com.tony.gamePredictor.exception.StoreException si l'écriture échoue
     */
    void save(ModelArtifact artifact);

    /**
     * @return vide si rien n'a jamais été sauvegardé
     * @throws com.tony.gamePredictor.exception.StoreException si l'artefact existe mais est illisible ou incohérent
     */
    Optional<ModelArtifact> load();
}
