package com.drawforecast.common.predictor;

import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.context.ForecastSettings;
import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.training.TrainedModels;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static com.drawforecast.common.OutcomeFixtures.newestFirst;
import static com.drawforecast.common.OutcomeFixtures.repeat;
import static org.junit.jupiter.api.Assertions.*;

class RecurrentCellPredictorTest {

    private static final String TWENTY = repeat("7290", 5);

    @Nested
    @DisplayName("predictor")
    class PredictorBehaviour {

        private final ForecastContext context = ForecastContext.withDefaults();
        private final RecurrentCellPredictor predictor = new RecurrentCellPredictor(context);

        @Test
        @DisplayName("fewer than 20 draws give the insufficient-data output")
        void insufficient() {
            ModelOutput out = predict(repeat("7", 19));

            assertEquals(ModelOutput.of(OutcomeLabel.BIG, 0.50, "lstm_insufficient"), out);
            assertNull(context.recurrentCell());
        }

        @Test
        @DisplayName("the first call with enough data only initialises the cell")
        void lazyInitialisation() {
            ModelOutput out = predict(TWENTY);

            assertEquals(ModelOutput.of(OutcomeLabel.BIG, 0.50, "lstm_uninitialized"), out);
            assertNotNull(context.recurrentCell());
        }

        @Test
        @DisplayName("subsequent calls run the cell within the confidence bounds")
        void forwardPass() {
            predict(TWENTY);
            ModelOutput out = predict(TWENTY);

            assertEquals("lstm", out.source());
            assertTrue(out.confidence() >= 0.10 && out.confidence() <= 0.80, "confidence=" + out.confidence());
        }

        @Test
        @DisplayName("hidden state carries over between calls")
        void statePersists() {
            predict(TWENTY);
            predict(TWENTY);
            double[] afterFirst = context.recurrentCell().hiddenState();
            predict(TWENTY);
            double[] afterSecond = context.recurrentCell().hiddenState();

            assertFalse(Arrays.equals(afterFirst, afterSecond));
        }

        @Test
        @DisplayName("the same seed reproduces the same output")
        void seededReproducibility() {
            ForecastContext twin = new ForecastContext(ForecastSettings.withSeed(ForecastSettings.DEFAULT_SEED));
            RecurrentCellPredictor twinPredictor = new RecurrentCellPredictor(twin);
            ModelInput input = input(TWENTY);

            predictor.predict(input);
            twinPredictor.predict(input);

            assertEquals(predictor.predict(input), twinPredictor.predict(input));
        }

        private ModelOutput predict(String digits) {
            return predictor.predict(input(digits));
        }
    }

    @Nested
    @DisplayName("cell")
    class Cell {

        @Test
        @DisplayName("sigmoid saturates instead of overflowing")
        void sigmoidSaturates() {
            assertEquals(1.0, RecurrentCell.sigmoid(1_000));
            assertEquals(0.0, RecurrentCell.sigmoid(-1_000));
            assertEquals(0.5, RecurrentCell.sigmoid(0), 1e-12);
        }

        @Test
        @DisplayName("input of the wrong size is rejected")
        void wrongInputSize() {
            RecurrentCell cell = RecurrentCell.randomlyInitialized(4, 3, new Random(1));
            assertThrows(IllegalArgumentException.class, () -> cell.forward(new double[5]));
        }

        @Test
        @DisplayName("an all-zero input from a zero state stays at zero")
        void zeroFixedPoint() {
            RecurrentCell cell = RecurrentCell.randomlyInitialized(4, 3, new Random(1));
            assertArrayEquals(new double[3], cell.forward(new double[4]));
        }
    }

    private static ModelInput input(String digits) {
        return new ModelInput(newestFirst(digits), TrainedModels.empty(), MarketState.initial());
    }
}
