package com.tony.gamePredictor.service;

import com.tony.gamePredictor.model.FeatureVector;
import com.tony.gamePredictor.model.GameRecord;
import com.tony.gamePredictor.model.GameWinner;
import com.tony.gamePredictor.model.TrainingDataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingDatasetAssembler {

    private final FeatureVectorBuilder featureVectorBuilder;

    /**
     * Transforme une liste chronologique de matchs joués en exemples d'entraînement.
     * Chaque match ne voit que les matchs qui le précèdent (isolation temporelle, pas de fuite).
     * Les matchs sans vainqueur connu servent d'historique mais ne deviennent pas des exemples.
     */
    public TrainingDataset assemble(List<GameRecord> games) {
        TrainingDataset.Builder dataset = TrainingDataset.builder();
        if (games == null || games.isEmpty()) return dataset.build();

        int skipped = 0;
        for (int i = 0; i < games.size(); i++) {
            GameRecord game = games.get(i);
            GameWinner winner = game == null ? GameWinner.UNKNOWN : game.winnerOrUnknown();
            if (winner == GameWinner.UNKNOWN) {
                skipped++;
                continue;
            }
            FeatureVector features = featureVectorBuilder.build(game, games.subList(0, i));
            dataset.add(features, winner == GameWinner.HOME);
        }

        TrainingDataset built = dataset.build();
        log.info("📊 Dataset : {} exemples ({} victoires domicile), {} matchs sans vainqueur ignorés",
                built.size(), built.countLabel(1), skipped);
        return built;
    }
}
