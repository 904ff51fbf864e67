package com.tony.gamePredictor.service;

import com.tony.gamePredictor.classifier.BinaryClassifier;
import com.tony.gamePredictor.classifier.ClassifierState;
import com.tony.gamePredictor.config.ModelConfig;
import com.tony.gamePredictor.config.PredictorProperties;
import com.tony.gamePredictor.exception.DataContractException;
import com.tony.gamePredictor.exception.InsufficientDataException;
import com.tony.gamePredictor.exception.NotReadyException;
import com.tony.gamePredictor.exception.StoreException;
import com.tony.gamePredictor.exception.TrainingException;
import com.tony.gamePredictor.model.FeatureSchema;
import com.tony.gamePredictor.model.FeatureVector;
import com.tony.gamePredictor.model.GamePrediction;
import com.tony.gamePredictor.model.GameWinner;
import com.tony.gamePredictor.model.ModelArtifact;
import com.tony.gamePredictor.model.ModelInfo;
import com.tony.gamePredictor.model.ModelState;
import com.tony.gamePredictor.model.PredictionResult;
import com.tony.gamePredictor.model.ScalingState;
import com.tony.gamePredictor.model.TrainingDataset;
import com.tony.gamePredictor.model.TrainingExample;
import com.tony.gamePredictor.model.TrainingMetrics;
import com.tony.gamePredictor.repository.ModelStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.IntStream;

/**
 * Cycle de vie du modèle : entraînement, prédiction, persistance, rechargement, explication.
 * <p>
 * L'artefact actif est un instantané immuable derrière une {@link AtomicReference} :
 * les lectures ne prennent aucun verrou et ne voient jamais un scaler sans son classifieur.
 * Seuls {@link #train} et {@link #reload} le remplacent, d'un seul échange de référence.
 */
@Service
@Slf4j
public class PredictiveModel {

    private final BinaryClassifier classifier;
    private final ModelStore modelStore;
    private final PredictorProperties properties;
    private final AsyncTaskExecutor trainingExecutor;
    private final Clock clock;

    private final AtomicReference<ModelArtifact> current = new AtomicReference<>();
    private final ReentrantLock trainingLock = new ReentrantLock();

    public PredictiveModel(BinaryClassifier classifier,
                           ModelStore modelStore,
                           PredictorProperties properties,
                           @Qualifier(ModelConfig.TRAINING_EXECUTOR) AsyncTaskExecutor trainingExecutor,
                           Clock clock) {
        this.classifier = classifier;
        this.modelStore = modelStore;
        this.properties = properties;
        this.trainingExecutor = trainingExecutor;
        this.clock = clock;
    }

    public ModelState getState() {
        if (trainingLock.isLocked()) return ModelState.TRAINING;
        return current.get() == null ? ModelState.UNTRAINED : ModelState.READY;
    }

    // -----------------------------------------------------------
    // ENTRAÎNEMENT
    // -----------------------------------------------------------

    /**
     * Entraîne un nouveau modèle, le rend actif puis le sauvegarde.
     * En cas d'échec de l'entraînement, le modèle précédent reste actif.
     * En cas d'échec de la sauvegarde, le nouveau modèle reste actif et l'erreur est remontée.
     */
    public TrainingMetrics train(TrainingDataset dataset) {
        if (!trainingLock.tryLock()) {
            throw new TrainingException("Un entraînement est déjà en cours");
        }
        try {
            ModelArtifact artifact = fitArtifact(dataset);

            // Échange atomique : les prédictions en vol gardent l'ancien instantané
            current.set(artifact);
            TrainingMetrics metrics = artifact.getMetrics();
            log.info("✅ Modèle entraîné : accuracy {} ({} train / {} test)",
                    String.format("%.4f", metrics.getAccuracy()), metrics.getTrainSize(), metrics.getTestSize());

            try {
                modelStore.save(artifact);
            } catch (StoreException e) {
                log.error("❌ Modèle entraîné mais non sauvegardé, la version en mémoire reste active", e);
                throw e;
            }
            return metrics;
        } finally {
            trainingLock.unlock();
        }
    }

    /**
     * Lance {@link #train} hors du chemin des requêtes. {@code future.cancel(true)} interrompt
     * le boosting entre deux étages ; le modèle précédent reste alors actif.
     */
    public Future<TrainingMetrics> trainInBackground(TrainingDataset dataset) {
        log.info("🚀 Entraînement en tâche de fond sur {} exemples", dataset == null ? 0 : dataset.size());
        return trainingExecutor.submit(() -> train(dataset));
    }

    private ModelArtifact fitArtifact(TrainingDataset dataset) {
        if (dataset == null || dataset.isEmpty()) {
            throw new InsufficientDataException("Aucun exemple d'entraînement");
        }
        long homeWins = dataset.countLabel(1);
        if (homeWins == 0 || homeWins == dataset.size()) {
            throw new InsufficientDataException(String.format(
                    "Jeu mono-classe (%d victoires domicile sur %d matchs) : split impossible", homeWins, dataset.size()));
        }

        FeatureSchema schema = FeatureSchema.CANONICAL;
        List<TrainingExample> examples = dataset.examples();
        for (TrainingExample example : examples) {
            example.features().schema().requireSameAs(schema);
        }

        // 1. Split reproductible (graine fixe)
        PredictorProperties.Model cfg = properties.getModel();
        int n = examples.size();
        int testCount = (int) Math.ceil(n * cfg.getTestSize());
        int trainCount = n - testCount;
        if (trainCount < 1) {
            throw new InsufficientDataException("Pas assez d'exemples pour un split train/test (n=" + n + ")");
        }

        int[] order = IntStream.range(0, n).toArray();
        MathArrays.shuffle(order, new MersenneTwister(cfg.getRandomSeed()));

        double[][] trainX = new double[trainCount][];
        int[] trainY = new int[trainCount];
        double[][] testX = new double[testCount][];
        int[] testY = new int[testCount];
        for (int i = 0; i < n; i++) {
            TrainingExample example = examples.get(order[i]);
            if (i < testCount) {
                testX[i] = example.features().toArray();
                testY[i] = example.label();
            } else {
                trainX[i - testCount] = example.features().toArray();
                trainY[i - testCount] = example.label();
            }
        }

        int trainPositives = 0;
        for (int y : trainY) trainPositives += y;
        if (trainPositives == 0 || trainPositives == trainCount) {
            throw new InsufficientDataException(String.format(
                    "Partition d'entraînement mono-classe après split (%d exemples)", trainCount));
        }

        // 2. Scaler ajusté sur la partition d'entraînement uniquement
        ScalingState scaling = ScalingState.fit(trainX);
        double[][] scaledTrain = scaling.transform(trainX);
        double[][] scaledTest = scaling.transform(testX);

        // 3. Classifieur
        log.info("🧮 Entraînement {} sur {} exemples ({} features)...", classifier.type(), trainCount, schema.size());
        ClassifierState state = classifier.fit(scaledTrain, trainY);

        // 4. Évaluation sur la partition de test
        int[] predicted = new int[testCount];
        for (int i = 0; i < testCount; i++) {
            predicted[i] = classifier.predictProbability(state, scaledTest[i]) > 0.5 ? 1 : 0;
        }
        TrainingMetrics metrics = ClassificationReport.evaluate(testY, predicted).toBuilder()
                .trainSize(trainCount)
                .testSize(testCount)
                .build();

        ModelArtifact artifact = ModelArtifact.builder()
                .classifierState(state)
                .scalingState(scaling)
                .featureNames(schema.names())
                .classifierType(classifier.type())
                .trainedAt(Instant.now(clock))
                .metrics(metrics)
                .build();
        artifact.validate();
        return artifact;
    }

    // -----------------------------------------------------------
    // PRÉDICTION
    // -----------------------------------------------------------

    public PredictionResult predict(FeatureVector features) {
        if (features == null) {
            throw new DataContractException("Vecteur de features manquant");
        }
        return predictWith(readyArtifactOrLoad(), features);
    }

    /**
     * Prédiction et importances tirées du même instantané : un entraînement ou un rechargement
     * concurrent ne peut pas mélanger deux modèles dans une même réponse.
     */
    public GamePrediction predictExplained(FeatureVector features) {
        if (features == null) {
            throw new DataContractException("Vecteur de features manquant");
        }
        ModelArtifact artifact = readyArtifactOrLoad();
        return GamePrediction.builder()
                .prediction(predictWith(artifact, features))
                .featureImportance(importancesOf(artifact))
                .build();
    }

    private PredictionResult predictWith(ModelArtifact artifact, FeatureVector features) {
        features.schema().requireSameAs(artifact.schema());
        double[] row = features.toArray();
        for (int j = 0; j < row.length; j++) {
            if (!Double.isFinite(row[j])) {
                throw new DataContractException("Valeur non finie pour " + features.schema().names().get(j));
            }
        }

        // Transformation seule : le scaler n'est jamais ré-ajusté ici
        double[] scaled = artifact.getScalingState().transform(row);
        double homeProb = clampProbability(classifier.predictProbability(artifact.getClassifierState(), scaled));
        double awayProb = 1.0 - homeProb;

        return PredictionResult.builder()
                .homeWinProbability(homeProb)
                .awayWinProbability(awayProb)
                .predictedWinner(homeProb > awayProb ? GameWinner.HOME : GameWinner.AWAY)
                .confidence(Math.max(homeProb, awayProb))
                .build();
    }

    /**
     * Importance par feature, dans l'ordre du schéma. Exige un modèle prêt (pas de chargement implicite).
     */
    public Map<String, Double> featureImportances() {
        ModelArtifact artifact = current.get();
        if (artifact == null) {
            throw new NotReadyException("Modèle non entraîné ni chargé");
        }
        return importancesOf(artifact);
    }

    public ModelInfo describe() {
        ModelArtifact artifact = current.get();
        return ModelInfo.builder()
                .features(artifact != null ? artifact.getFeatureNames() : FeatureSchema.CANONICAL.names())
                .modelType(artifact != null ? artifact.getClassifierType() : classifier.type())
                .state(getState())
                .trainedAt(artifact != null ? artifact.getTrainedAt() : null)
                .importance(artifact != null ? importancesOf(artifact) : null)
                .lastMetrics(artifact != null ? artifact.getMetrics() : null)
                .build();
    }

    private Map<String, Double> importancesOf(ModelArtifact artifact) {
        List<String> names = artifact.getFeatureNames();
        double[] scores = classifier.featureImportances(artifact.getClassifierState());

        // L'appariement est positionnel : on refuse toute divergence de taille
        if (scores.length != names.size()) {
            throw new IllegalStateException(String.format(
                    "%d scores d'importance pour %d features", scores.length, names.size()));
        }
        Map<String, Double> importances = new LinkedHashMap<>();
        for (int i = 0; i < scores.length; i++) {
            importances.put(names.get(i), Math.max(0.0, scores[i]));
        }
        return Collections.unmodifiableMap(importances);
    }

    // -----------------------------------------------------------
    // PERSISTANCE
    // -----------------------------------------------------------

    public void persist() {
        ModelArtifact artifact = current.get();
        if (artifact == null) {
            throw new NotReadyException("Aucun modèle en mémoire à sauvegarder");
        }
        modelStore.save(artifact);
    }

    public void reload() {
        ModelArtifact loaded = modelStore.load()
                .orElseThrow(() -> new StoreException("Aucun modèle sauvegardé à recharger"));
        current.set(loaded);
        log.info("🔄 Modèle rechargé (entraîné le {})", loaded.getTrainedAt());
    }

    private ModelArtifact readyArtifactOrLoad() {
        ModelArtifact artifact = current.get();
        if (artifact != null) return artifact;

        Optional<ModelArtifact> loaded;
        try {
            loaded = modelStore.load();
        } catch (StoreException e) {
            throw new NotReadyException("Modèle non entraîné et chargement impossible", e);
        }
        ModelArtifact fromStore = loaded.orElseThrow(
                () -> new NotReadyException("Modèle non entraîné et aucun modèle sauvegardé"));

        // Ne pas écraser un modèle entraîné entre-temps
        if (current.compareAndSet(null, fromStore)) {
            log.info("📂 Modèle chargé à la demande (entraîné le {})", fromStore.getTrainedAt());
        }
        return current.get();
    }

    private double clampProbability(double p) {
        if (Double.isNaN(p)) {
            throw new IllegalStateException("Probabilité NaN renvoyée par le classifieur");
        }
        return Math.min(1.0, Math.max(0.0, p));
    }
}
