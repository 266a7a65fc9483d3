package com.drawforecast.common.predictor;

import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.training.OccurrenceTable;

import java.util.List;
import java.util.Optional;

/**
 * Variable-order Markov lookup over digit states, highest order first.
 *
 * <p>The first order whose state was seen at least {@value #MIN_OCCURRENCES} times predicts the
 * label of its most frequent follower with confidence = follower share. Without a usable
 * state the model falls back to the opposite of the newest label (anti-persistence), at
 * confidence {@value #FALLBACK_CONFIDENCE}.
 */
public class MarkovPredictor implements Predictor {

    public static final String NAME = "markov";

    static final int    MIN_OCCURRENCES     = 2;
    static final double FALLBACK_CONFIDENCE = 0.51;

    private final int maxOrder;

    public MarkovPredictor(int maxOrder) {
        this.maxOrder = maxOrder;
    }

    @Override
    public String modelName() { return NAME; }

    @Override
    public ModelOutput predict(ModelInput input) {
        List<OutcomeRecord> records = input.records();
        OccurrenceTable table = input.trainedModels().markovChains();

        for (int order = maxOrder; order >= 1; order--) {
            if (records.size() < order + 1) continue;
            String state = OccurrenceTable.key(records, 0, order, OccurrenceTable.MARKOV_SEPARATOR);
            Optional<OccurrenceTable.Counts> counts = table.lookup(state);
            if (counts.isPresent() && counts.get().total() >= MIN_OCCURRENCES) {
                return ModelOutput.of(OutcomeLabel.fromDigit(counts.get().majorityDigit()),
                    counts.get().majorityShare(), "markov_order" + order);
            }
        }
        return ModelOutput.of(records.get(0).label().opposite(), FALLBACK_CONFIDENCE, "markov_fallback");
    }
}
