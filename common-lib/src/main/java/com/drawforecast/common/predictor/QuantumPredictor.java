package com.drawforecast.common.predictor;

import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.model.OutcomeRecord;

import java.util.List;

/**
 * Entropy-sensitive heuristic dressed in amplitude language.
 *
 * <pre>
 *   amplitudeBig = √P(BIG)                       over the whole buffer
 *   decoherence  = 1 − market entropy
 *   observedP    = amplitudeBig² · decoherence + 0.5 · (1 − decoherence)
 * </pre>
 * BIG iff observedP ≥ 0.5; confidence |observedP − 0.5|·2 + 0.05, capped at
 * {@value #MAX_CONFIDENCE}. The formula is kept as is for compatibility with recorded
 * decisions; it is not a derived probability model.
 */
public class QuantumPredictor implements Predictor {

    public static final String NAME = "quantum";

    static final double BOOST          = 0.05;
    static final double MAX_CONFIDENCE = 0.80;

    @Override
    public String modelName() { return NAME; }

    @Override
    public ModelOutput predict(ModelInput input) {
        List<OutcomeRecord> records = input.records();
        double pBig = (double) records.stream().filter(OutcomeRecord::isBig).count() / records.size();
        double amplitudeBig = Math.sqrt(pBig);
        double decoherence = 1.0 - input.marketState().entropy();
        double observedP = amplitudeBig * amplitudeBig * decoherence + 0.5 * (1.0 - decoherence);

        OutcomeLabel label = observedP >= 0.5 ? OutcomeLabel.BIG : OutcomeLabel.SMALL;
        double confidence = Math.abs(observedP - 0.5) * 2.0 + BOOST;
        return ModelOutput.of(label, Math.min(confidence, MAX_CONFIDENCE), NAME);
    }
}
