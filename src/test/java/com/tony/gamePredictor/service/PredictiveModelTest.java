package com.tony.gamePredictor.service;

import com.tony.gamePredictor.TestFixtures;
import com.tony.gamePredictor.classifier.GradientBoostingClassifier;
import com.tony.gamePredictor.config.PredictorProperties;
import com.tony.gamePredictor.exception.DataContractException;
import com.tony.gamePredictor.exception.InsufficientDataException;
import com.tony.gamePredictor.exception.NotReadyException;
import com.tony.gamePredictor.exception.StoreException;
import com.tony.gamePredictor.exception.TrainingCancelledException;
import com.tony.gamePredictor.model.FeatureSchema;
import com.tony.gamePredictor.model.FeatureVector;
import com.tony.gamePredictor.model.GamePrediction;
import com.tony.gamePredictor.model.GameWinner;
import com.tony.gamePredictor.model.ModelArtifact;
import com.tony.gamePredictor.model.ModelInfo;
import com.tony.gamePredictor.model.ModelState;
import com.tony.gamePredictor.model.PredictionResult;
import com.tony.gamePredictor.model.TrainingDataset;
import com.tony.gamePredictor.model.TrainingMetrics;
import com.tony.gamePredictor.repository.ModelStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PredictiveModelTest {

    private static final Instant NOW = Instant.parse("2024-09-08T17:00:00Z");

    @Mock
    private ModelStore modelStore;

    private PredictorProperties properties;
    private PredictiveModel model;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.defaultProperties();
        properties.getModel().setEstimators(30);
        properties.getModel().setMaxDepth(3);
        model = newModel(modelStore);
    }

    private PredictiveModel newModel(ModelStore store) {
        PredictorProperties.Model m = properties.getModel();
        return new PredictiveModel(
                new GradientBoostingClassifier(m.getEstimators(), m.getLearningRate(), m.getMaxDepth(), m.getMinSamplesLeaf(), m.getRandomSeed()),
                store,
                properties,
                new SimpleAsyncTaskExecutor("test-training-"),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static FeatureVector strongHome() {
        return TestFixtures.vector(0.9, 0.1, new Random(1));
    }

    @Test
    @DisplayName("Sans modèle ni sauvegarde : NotReadyException à la prédiction")
    void predictWithoutModel() {
        when(modelStore.load()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> model.predict(strongHome())).isInstanceOf(NotReadyException.class);
        assertThat(model.getState()).isEqualTo(ModelState.UNTRAINED);
    }

    @Test
    @DisplayName("Sauvegarde illisible : NotReadyException, pas d'erreur de stockage brute")
    void predictWithCorruptStore() {
        when(modelStore.load()).thenThrow(new StoreException("corrompu"));

        assertThatThrownBy(() -> model.predict(strongHome()))
                .isInstanceOf(NotReadyException.class)
                .hasCauseInstanceOf(StoreException.class);
    }

    @Test
    @DisplayName("Entraînement : split 80/20, modèle actif et sauvegardé")
    void trainActivatesAndSaves() {
        TrainingMetrics metrics = model.train(TestFixtures.separableDataset(100, 7L));

        assertThat(metrics.getTrainSize()).isEqualTo(80);
        assertThat(metrics.getTestSize()).isEqualTo(20);
        assertThat(metrics.getAccuracy()).isBetween(0.0, 1.0);
        assertThat(metrics.getClassificationReport()).containsKeys("0", "1", "macro avg", "weighted avg");
        assertThat(model.getState()).isEqualTo(ModelState.READY);

        ArgumentCaptor<ModelArtifact> saved = ArgumentCaptor.forClass(ModelArtifact.class);
        verify(modelStore).save(saved.capture());
        assertThat(saved.getValue().getFeatureNames()).isEqualTo(FeatureSchema.CANONICAL.names());
        assertThat(saved.getValue().getTrainedAt()).isEqualTo(NOW);
        assertThat(saved.getValue().getClassifierType()).isEqualTo(GradientBoostingClassifier.TYPE);
    }

    @Test
    @DisplayName("Probabilités complémentaires, confiance = max")
    void predictionIsConsistent() {
        model.train(TestFixtures.separableDataset(200, 7L));

        PredictionResult home = model.predict(strongHome());
        PredictionResult away = model.predict(TestFixtures.vector(0.1, 0.9, new Random(2)));

        for (PredictionResult r : new PredictionResult[]{home, away}) {
            assertThat(r.getHomeWinProbability() + r.getAwayWinProbability()).isCloseTo(1.0, within(1e-9));
            assertThat(r.getConfidence()).isEqualTo(Math.max(r.getHomeWinProbability(), r.getAwayWinProbability()));
            assertThat(r.getConfidence()).isGreaterThanOrEqualTo(0.5);
        }
        assertThat(home.getPredictedWinner()).isEqualTo(GameWinner.HOME);
        assertThat(away.getPredictedWinner()).isEqualTo(GameWinner.AWAY);
        // Même entrée, même sortie
        assertThat(model.predict(strongHome())).isEqualTo(home);
    }

    @Test
    @DisplayName("Jeu mono-classe (tout domicile ou tout extérieur) : refusé, le modèle précédent reste actif")
    void singleClassKeepsPreviousModel() {
        model.train(TestFixtures.separableDataset(100, 7L));
        PredictionResult before = model.predict(strongHome());

        TrainingDataset.Builder onlyHomeWins = TrainingDataset.builder();
        Random random = new Random(3);
        for (int i = 0; i < 20; i++) onlyHomeWins.add(TestFixtures.vector(0.8, 0.2, random), true);

        TrainingDataset.Builder onlyAwayWins = TrainingDataset.builder();
        for (int i = 0; i < 20; i++) onlyAwayWins.add(TestFixtures.vector(0.2, 0.8, random), false);

        assertThatThrownBy(() -> model.train(onlyHomeWins.build())).isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> model.train(onlyAwayWins.build())).isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> model.train(TrainingDataset.of(null))).isInstanceOf(InsufficientDataException.class);

        assertThat(model.getState()).isEqualTo(ModelState.READY);
        assertThat(model.predict(strongHome())).isEqualTo(before);
    }

    @Test
    @DisplayName("Entraînement interrompu : le modèle précédent reste actif")
    void interruptedTrainingKeepsPreviousModel() {
        model.train(TestFixtures.separableDataset(100, 7L));
        PredictionResult before = model.predict(strongHome());

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> model.train(TestFixtures.separableDataset(100, 99L)))
                    .isInstanceOf(TrainingCancelledException.class);
        } finally {
            Thread.interrupted();
        }

        assertThat(model.getState()).isEqualTo(ModelState.READY);
        assertThat(model.predict(strongHome())).isEqualTo(before);
    }

    @Test
    @DisplayName("Échec de sauvegarde : erreur remontée mais modèle en mémoire utilisable")
    void storeFailureKeepsModelReady() {
        doThrow(new StoreException("disque plein")).when(modelStore).save(any());

        assertThatThrownBy(() -> model.train(TestFixtures.separableDataset(100, 7L)))
                .isInstanceOf(StoreException.class);

        assertThat(model.getState()).isEqualTo(ModelState.READY);
        assertThat(model.predict(strongHome()).getPredictedWinner()).isNotNull();
    }

    @Test
    @DisplayName("Schéma différent : erreur de contrat, pas de réordonnancement")
    void rejectsForeignSchema() {
        model.train(TestFixtures.separableDataset(100, 7L));

        FeatureVector shorter = FeatureVector.of(FeatureSchema.of(Arrays.asList("home_win_rate", "away_win_rate")), new double[]{0.5, 0.5});
        assertThatThrownBy(() -> model.predict(shorter)).isInstanceOf(DataContractException.class);

        double[] values = strongHome().toArray();
        values[3] = Double.NaN;
        assertThatThrownBy(() -> model.predict(FeatureVector.of(FeatureSchema.CANONICAL, values)))
                .isInstanceOf(DataContractException.class);
    }

    @Test
    @DisplayName("Importances : une entrée par feature, stables d'un appel à l'autre")
    void importancesAreStable() {
        assertThatThrownBy(() -> model.featureImportances()).isInstanceOf(NotReadyException.class);

        model.train(TestFixtures.separableDataset(100, 7L));
        Map<String, Double> first = model.featureImportances();

        assertThat(first.keySet()).containsExactlyElementsOf(FeatureSchema.CANONICAL.names());
        assertThat(first.values()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
        assertThat(model.featureImportances()).isEqualTo(first);
    }

    @Test
    @DisplayName("Chargement paresseux depuis le store : mêmes prédictions que le modèle d'origine")
    void lazyLoadReproducesPredictions() {
        model.train(TestFixtures.separableDataset(100, 7L));
        ArgumentCaptor<ModelArtifact> saved = ArgumentCaptor.forClass(ModelArtifact.class);
        verify(modelStore).save(saved.capture());
        PredictionResult expected = model.predict(strongHome());

        ModelStore other = mock(ModelStore.class);
        when(other.load()).thenReturn(Optional.of(saved.getValue()));
        PredictiveModel restarted = newModel(other);

        assertThat(restarted.getState()).isEqualTo(ModelState.UNTRAINED);
        assertThat(restarted.predict(strongHome())).isEqualTo(expected);
        assertThat(restarted.getState()).isEqualTo(ModelState.READY);
    }

    @Test
    @DisplayName("persist / reload / describe")
    void persistReloadDescribe() {
        assertThatThrownBy(() -> model.persist()).isInstanceOf(NotReadyException.class);
        when(modelStore.load()).thenReturn(Optional.empty());
        assertThatThrownBy(() -> model.reload()).isInstanceOf(StoreException.class);

        ModelInfo untrained = model.describe();
        assertThat(untrained.getState()).isEqualTo(ModelState.UNTRAINED);
        assertThat(untrained.getFeatures()).hasSize(18);
        assertThat(untrained.getTrainedAt()).isNull();

        model.train(TestFixtures.separableDataset(100, 7L));
        model.persist();
        verify(modelStore, times(2)).save(any());

        ModelInfo ready = model.describe();
        assertThat(ready.getState()).isEqualTo(ModelState.READY);
        assertThat(ready.getTrainedAt()).isEqualTo(NOW);
        assertThat(ready.getLastMetrics().getTestSize()).isEqualTo(20);
    }

    @Test
    @DisplayName("Entraînement en tâche de fond")
    void trainsInBackground() throws Exception {
        Future<TrainingMetrics> future = model.trainInBackground(TestFixtures.separableDataset(100, 7L));

        TrainingMetrics metrics = future.get(60, TimeUnit.SECONDS);

        assertThat(metrics.getTrainSize() + metrics.getTestSize()).isEqualTo(100);
        assertThat(model.getState()).isEqualTo(ModelState.READY);
    }

    @Test
    @DisplayName("Les métriques et le schéma exposés ne permettent pas de modifier le modèle actif")
    void exposedSnapshotIsImmutable() {
        TrainingMetrics metrics = model.train(TestFixtures.separableDataset(100, 7L));
        ArgumentCaptor<ModelArtifact> saved = ArgumentCaptor.forClass(ModelArtifact.class);
        verify(modelStore).save(saved.capture());
        PredictionResult before = model.predict(strongHome());

        assertThatThrownBy(() -> metrics.getClassificationReport().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        ModelInfo info = model.describe();
        assertThatThrownBy(() -> info.getFeatures().set(0, "renamed"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> info.getLastMetrics().getClassificationReport().put("x", null))
                .isInstanceOf(UnsupportedOperationException.class);

        // Un artefact relu avec une liste mutable ne la partage pas
        List<String> names = new ArrayList<>(FeatureSchema.CANONICAL.names());
        ModelArtifact rebuilt = saved.getValue().toBuilder().featureNames(names).build();
        names.set(0, "renamed");
        when(modelStore.load()).thenReturn(Optional.of(rebuilt));
        model.reload();

        assertThat(model.describe().getFeatures()).isEqualTo(FeatureSchema.CANONICAL.names());
        assertThat(model.describe().getLastMetrics()).isEqualTo(metrics);
        assertThat(model.predict(strongHome())).isEqualTo(before);
    }

    @Test
    @DisplayName("Prédiction expliquée : prédiction et importances du même modèle, chargé au besoin")
    void predictExplainedUsesOneSnapshot() {
        model.train(TestFixtures.separableDataset(100, 7L));
        ArgumentCaptor<ModelArtifact> saved = ArgumentCaptor.forClass(ModelArtifact.class);
        verify(modelStore).save(saved.capture());

        ModelStore other = mock(ModelStore.class);
        when(other.load()).thenReturn(Optional.of(saved.getValue()));
        PredictiveModel restarted = newModel(other);

        GamePrediction explained = restarted.predictExplained(strongHome());

        assertThat(explained.getPrediction()).isEqualTo(model.predict(strongHome()));
        assertThat(explained.getFeatureImportance()).isEqualTo(model.featureImportances());
        assertThat(explained.getFeatureImportance()).hasSize(18);
    }

    @Test
    @DisplayName("Vecteur null : erreur de contrat avant tout chargement")
    void nullVector() {
        assertThatThrownBy(() -> model.predict(null)).isInstanceOf(DataContractException.class);
        verify(modelStore, never()).load();
    }
}
