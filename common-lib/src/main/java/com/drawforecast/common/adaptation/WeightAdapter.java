package com.drawforecast.common.adaptation;

import com.drawforecast.common.model.EnsembleDecision;
import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.ModelPerformance;
import com.drawforecast.common.model.OutcomeLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the ensemble weight vector and per-model rolling accuracy, and turns resolved
 * outcomes into revised weights.
 *
 * <h3>Update rule</h3>
 * For a resolved (model, correct) pair:
 * <pre>
 *   perf[model]  ← perf[model].record(correct)              (EWMA, decay 0.9)
 *   target[m]    = acc[m] / Σ acc                            for every model m
 *   weight[m]    ← weight[m] × 0.7 + target[m] × 0.3
 *   weight       ← weight / Σ weight                         (all 0.15 when Σ = 0)
 * </pre>
 * Unknown model names are ignored.
 *
 * <p>Thread-safe: every read and update holds the instance monitor.
 */
public final class WeightAdapter {

    private static final Logger log = LoggerFactory.getLogger(WeightAdapter.class);

    static final double RETAIN_COEFF    = 0.7;
    static final double TARGET_COEFF    = 0.3;
    static final double FALLBACK_WEIGHT = 0.15;

    private final Map<String, Double> weights = new LinkedHashMap<>();
    private final Map<String, ModelPerformance> performance = new LinkedHashMap<>();

    public WeightAdapter(Map<String, Double> initialWeights) {
        initialWeights.forEach((model, weight) -> {
            weights.put(model, weight);
            performance.put(model, ModelPerformance.initial());
        });
    }

    /**
     * @return {@code true} if the model was known and the weights were updated
     */
    public synchronized boolean record(String modelName, boolean wasCorrect) {
        ModelPerformance perf = performance.get(modelName);
        if (perf == null) {
            return false;
        }
        performance.put(modelName, perf.record(wasCorrect));

        double totalAccuracy = performance.values().stream()
            .mapToDouble(ModelPerformance::recentAccuracy)
            .sum();
        for (Map.Entry<String, ModelPerformance> entry : performance.entrySet()) {
            double target = totalAccuracy > 0.0 ? entry.getValue().recentAccuracy() / totalAccuracy : 0.0;
            weights.computeIfPresent(entry.getKey(), (m, w) -> w * RETAIN_COEFF + target * TARGET_COEFF);
        }
        renormalize();

        log.info("Model weights updated. model={} correct={} weight={} recentAccuracy={}",
                 modelName, wasCorrect,
                 String.format("%.3f", weights.get(modelName)),
                 String.format("%.3f", performance.get(modelName).recentAccuracy()));
        return true;
    }

    /**
     * Feeds every model output of a resolved decision into {@link #record(String, boolean)}.
     *
     * @return number of models whose weights were updated
     */
    public int recordAll(EnsembleDecision decision, OutcomeLabel actual) {
        int updated = 0;
        for (Map.Entry<String, ModelOutput> entry : decision.modelOutputs().entrySet()) {
            if (record(entry.getKey(), entry.getValue().prediction() == actual)) {
                updated++;
            }
        }
        return updated;
    }

    public synchronized Map<String, Double> weightsSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public synchronized Map<String, ModelPerformance> performanceSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(performance));
    }

    private void renormalize() {
        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        weights.replaceAll((m, w) -> total > 0.0 ? w / total : FALLBACK_WEIGHT);
    }
}
