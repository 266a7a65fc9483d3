package com.drawforecast.common.adaptation;

import com.drawforecast.common.context.ForecastSettings;
import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.ModelPerformance;
import com.drawforecast.common.model.OutcomeLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static com.drawforecast.common.OutcomeFixtures.decision;
import static com.drawforecast.common.OutcomeFixtures.output;
import static org.junit.jupiter.api.Assertions.*;

class WeightAdapterTest {

    private WeightAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new WeightAdapter(ForecastSettings.defaultWeights());
    }

    @Test
    @DisplayName("a correct prediction raises the model's weight and accuracy")
    void correctRaisesWeight() {
        assertTrue(adapter.record("pattern", true));

        ModelPerformance perf = adapter.performanceSnapshot().get("pattern");
        assertEquals(1, perf.wins());
        assertEquals(1, perf.total());
        assertEquals(0.55, perf.recentAccuracy(), 1e-9);
        assertTrue(adapter.weightsSnapshot().get("pattern") > 0.15);
    }

    @Test
    @DisplayName("a wrong prediction lowers the model's weight")
    void wrongLowersWeight() {
        adapter.record("neural", false);

        assertEquals(0.45, adapter.performanceSnapshot().get("neural").recentAccuracy(), 1e-9);
        assertTrue(adapter.weightsSnapshot().get("neural") < 0.20);
    }

    @Test
    @DisplayName("unknown models are ignored")
    void unknownModel() {
        Map<String, Double> before = adapter.weightsSnapshot();

        assertFalse(adapter.record("oracle", true));
        assertEquals(before, adapter.weightsSnapshot());
    }

    @Test
    @DisplayName("weights stay a probability vector over many updates")
    void sumsToOne() {
        Random random = new Random(42);
        String[] models = adapter.weightsSnapshot().keySet().toArray(new String[0]);
        for (int i = 0; i < 500; i++) {
            adapter.record(models[random.nextInt(models.length)], random.nextBoolean());

            double sum = 0;
            for (double w : adapter.weightsSnapshot().values()) {
                assertTrue(w >= 0.0 && w <= 1.0);
                sum += w;
            }
            assertEquals(1.0, sum, 1e-6);
        }
    }

    @Test
    @DisplayName("recordAll scores every member of a decision")
    void recordAll() {
        Map<String, ModelOutput> outputs = new LinkedHashMap<>();
        outputs.put("pattern", output(OutcomeLabel.BIG));
        outputs.put("markov", output(OutcomeLabel.SMALL));
        outputs.put("unknown", output(OutcomeLabel.BIG));

        int updated = adapter.recordAll(decision("1", OutcomeLabel.BIG, outputs), OutcomeLabel.BIG);

        assertEquals(2, updated);
        assertEquals(1, adapter.performanceSnapshot().get("pattern").wins());
        assertEquals(0, adapter.performanceSnapshot().get("markov").wins());
        assertEquals(1, adapter.performanceSnapshot().get("markov").total());
    }

    @Test
    @DisplayName("snapshots keep ensemble order")
    void order() {
        assertEquals(ForecastSettings.defaultWeights().keySet().stream().toList(),
            adapter.weightsSnapshot().keySet().stream().toList());
    }
}
