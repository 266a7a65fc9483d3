package com.drawforecast.common.predictor;

import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.model.OutcomeRecord;

import java.util.List;

/**
 * Multi-window BIG-ratio vote.
 *
 * <p>Each window of 10, 20 and 30 draws (skipped when longer than the buffer) votes BIG when
 * at least half its draws are BIG, with strength |ratio − 0.5|·2 and weight 1/window, so
 * shorter windows dominate. The side with the larger weighted strength wins;
 * confidence = winning share + 0.05, capped at {@value #MAX_CONFIDENCE}.
 */
public class FrequencyPredictor implements Predictor {

    public static final String NAME = "frequency";

    static final int[]  WINDOWS        = {10, 20, 30};
    static final double BOOST          = 0.05;
    static final double MAX_CONFIDENCE = 0.75;

    @Override
    public String modelName() { return NAME; }

    @Override
    public ModelOutput predict(ModelInput input) {
        List<OutcomeRecord> records = input.records();

        double bigScore   = 0.0;
        double smallScore = 0.0;
        int usedWindows   = 0;
        for (int window : WINDOWS) {
            if (records.size() < window) continue;
            usedWindows++;
            long bigCount = records.stream().limit(window).filter(OutcomeRecord::isBig).count();
            double ratio = (double) bigCount / window;
            double score = Math.abs(ratio - 0.5) * 2.0 * (1.0 / window);
            if (bigCount >= window / 2.0) bigScore += score;
            else smallScore += score;
        }
        if (usedWindows == 0) {
            return ModelOutput.neutral("frequency_insufficient");
        }

        double total = bigScore + smallScore;
        double share = total > 0.0 ? Math.max(bigScore, smallScore) / total : 0.5;
        OutcomeLabel label = bigScore > smallScore ? OutcomeLabel.BIG : OutcomeLabel.SMALL;
        return ModelOutput.of(label, Math.min(share + BOOST, MAX_CONFIDENCE), NAME);
    }
}
