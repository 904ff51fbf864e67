package com.tony.gamePredictor.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.gamePredictor.config.PredictorProperties;
import com.tony.gamePredictor.exception.StoreException;
import com.tony.gamePredictor.model.ModelArtifact;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Un fichier JSON versionné. L'écriture passe par un fichier temporaire du même dossier
 * puis un rename : un lecteur voit l'ancien ou le nouvel artefact, jamais un fichier tronqué.
 */
@Repository
@Slf4j
public class FileSystemModelStore implements ModelStore {

    static final int FORMAT_VERSION = 1;

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public FileSystemModelStore(PredictorProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(Paths.get(properties.getStore().getPath()), objectMapper, clock);
    }

    public FileSystemModelStore(Path path, ObjectMapper objectMapper, Clock clock) {
        this.path = path.toAbsolutePath();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void save(ModelArtifact artifact) {
        if (artifact == null) throw new IllegalArgumentException("Artefact null");

        Path dir = path.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");

            try (OutputStream out = Files.newOutputStream(tmp)) {
                objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValue(out, new StoredArtifact(FORMAT_VERSION, Instant.now(clock), artifact));
            }
            moveIntoPlace(tmp);
            log.info("💾 Modèle sauvegardé dans {}", path);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StoreException("Impossible d'écrire le modèle dans " + path, e);
        }
    }

    @Override
    public Optional<ModelArtifact> load() {
        StoredArtifact stored;
        try (InputStream in = Files.newInputStream(path)) {
            stored = objectMapper.readValue(in, StoredArtifact.class);
        } catch (NoSuchFileException e) {
            log.debug("Aucun modèle sauvegardé dans {}", path);
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("Modèle illisible ou corrompu : " + path, e);
        }

        if (stored == null || stored.getArtifact() == null) {
            throw new StoreException("Fichier modèle vide : " + path);
        }
        if (stored.getFormatVersion() != FORMAT_VERSION) {
            throw new StoreException(String.format("Version de format %d non supportée (attendu %d) : %s",
                    stored.getFormatVersion(), FORMAT_VERSION, path));
        }
        try {
            stored.getArtifact().validate();
        } catch (IllegalStateException e) {
            throw new StoreException("Modèle incohérent dans " + path + " : " + e.getMessage(), e);
        }

        log.info("📂 Modèle chargé depuis {} (sauvegardé le {})", path, stored.getSavedAt());
        return Optional.of(stored.getArtifact());
    }

    public Path getPath() {
        return path;
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Rename atomique non supporté sur {}, remplacement simple", path.getParent());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Fichier temporaire non supprimé : {}", tmp, e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class StoredArtifact {
        private int formatVersion;
        private Instant savedAt;
        private ModelArtifact artifact;
    }
}
