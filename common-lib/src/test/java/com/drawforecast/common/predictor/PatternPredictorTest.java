package com.drawforecast.common.predictor;

import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.training.OccurrenceTable;
import com.drawforecast.common.training.TrainedModels;
import com.drawforecast.common.training.TrendWindows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.drawforecast.common.OutcomeFixtures.newestFirst;
import static org.junit.jupiter.api.Assertions.*;

class PatternPredictorTest {

    private final PatternPredictor predictor = new PatternPredictor(List.of(3, 4));

    @Test
    @DisplayName("qualifying key predicts the label of its majority follower")
    void majorityFollower() {
        OccurrenceTable table = OccurrenceTable.builder()
            .record("123", 7).record("123", 7).record("123", 7).record("123", 2)
            .build();

        ModelOutput out = predictor.predict(input("12345678", table));

        assertEquals(ModelOutput.of(OutcomeLabel.BIG, 0.75, "pattern"), out);
    }

    @Test
    @DisplayName("on equal confidence the shorter length is kept")
    void tieKeepsShorterLength() {
        OccurrenceTable table = OccurrenceTable.builder()
            .record("123", 7).record("123", 7).record("123", 7).record("123", 2)
            .record("1234", 1).record("1234", 1).record("1234", 1).record("1234", 8)
            .build();

        ModelOutput out = predictor.predict(input("12345678", table));

        assertEquals(OutcomeLabel.BIG, out.prediction());
        assertEquals(0.75, out.confidence(), 1e-9);
    }

    @Test
    @DisplayName("a strictly higher share on a longer length wins")
    void higherShareWins() {
        OccurrenceTable table = OccurrenceTable.builder()
            .record("123", 7).record("123", 7).record("123", 7).record("123", 2)
            .record("1234", 1).record("1234", 1).record("1234", 1)
            .build();

        ModelOutput out = predictor.predict(input("12345678", table));

        assertEquals(ModelOutput.of(OutcomeLabel.SMALL, 1.0, "pattern"), out);
    }

    @Test
    @DisplayName("keys seen fewer than three times fall back to the recent majority")
    void rareKeyFallsBack() {
        OccurrenceTable table = OccurrenceTable.builder().record("123", 7).record("123", 7).build();

        ModelOutput out = predictor.predict(input("12345678", table));

        assertEquals(ModelOutput.of(OutcomeLabel.SMALL, 0.52, "pattern_fallback"), out);
    }

    @Test
    @DisplayName("a length longer than the buffer allows is skipped")
    void shortBufferSkipsLength() {
        OccurrenceTable table = OccurrenceTable.builder()
            .record("123", 7).record("123", 7).record("123", 7)
            .build();

        ModelOutput out = predictor.predict(input("123", table));

        assertEquals("pattern_fallback", out.source());
    }

    @Test
    @DisplayName("fallback votes BIG when at least five of the ten newest are BIG")
    void fallbackBig() {
        ModelOutput out = predictor.predict(input("5555500000", OccurrenceTable.empty()));
        assertEquals(ModelOutput.of(OutcomeLabel.BIG, 0.52, "pattern_fallback"), out);
    }

    private static ModelInput input(String digits, OccurrenceTable patterns) {
        TrainedModels models = new TrainedModels(patterns, OccurrenceTable.empty(), TrendWindows.empty(), Instant.EPOCH);
        return new ModelInput(newestFirst(digits), models, MarketState.initial());
    }
}
