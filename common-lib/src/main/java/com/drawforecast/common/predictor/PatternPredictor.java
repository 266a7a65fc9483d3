package com.drawforecast.common.predictor;

import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.training.OccurrenceTable;

import java.util.List;
import java.util.Optional;

/**
 * Looks up the newest L digits in the pattern table for every configured L.
 *
 * <p>A length qualifies when its key was seen at least {@value #MIN_OCCURRENCES} times. The
 * candidate with the highest majority share wins; only a strictly greater share replaces the
 * current best, so on a tie the first qualifying (shortest) length is kept.
 *
 * <p>Fallback: majority label of the ten newest draws, confidence {@value #FALLBACK_CONFIDENCE}.
 */
public class PatternPredictor implements Predictor {

    public static final String NAME = "pattern";

    static final int    MIN_OCCURRENCES     = 3;
    static final int    FALLBACK_WINDOW     = 10;
    static final int    FALLBACK_BIG_VOTES  = 5;
    static final double FALLBACK_CONFIDENCE = 0.52;

    private final List<Integer> lengths;

    public PatternPredictor(List<Integer> lengths) {
        this.lengths = List.copyOf(lengths);
    }

    @Override
    public String modelName() { return NAME; }

    @Override
    public ModelOutput predict(ModelInput input) {
        List<OutcomeRecord> records = input.records();
        OccurrenceTable table = input.trainedModels().patterns();

        double bestConfidence = 0.0;
        OutcomeLabel bestLabel = null;
        for (int length : lengths) {
            if (records.size() < length + 1) continue;
            String key = OccurrenceTable.key(records, 0, length, OccurrenceTable.PATTERN_SEPARATOR);
            Optional<OccurrenceTable.Counts> counts = table.lookup(key);
            if (counts.isEmpty() || counts.get().total() < MIN_OCCURRENCES) continue;

            double confidence = counts.get().majorityShare();
            if (confidence > bestConfidence) {
                bestConfidence = confidence;
                bestLabel = OutcomeLabel.fromDigit(counts.get().majorityDigit());
            }
        }
        if (bestLabel != null) {
            return ModelOutput.of(bestLabel, bestConfidence, NAME);
        }

        long recentBig = records.stream().limit(FALLBACK_WINDOW).filter(OutcomeRecord::isBig).count();
        OutcomeLabel label = recentBig >= FALLBACK_BIG_VOTES ? OutcomeLabel.BIG : OutcomeLabel.SMALL;
        return ModelOutput.of(label, FALLBACK_CONFIDENCE, "pattern_fallback");
    }
}
