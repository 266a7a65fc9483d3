package com.drawforecast.common.predictor;

import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.training.TrendWindows;

/**
 * Short/medium/long BIG-ratio comparison over the trained {@link TrendWindows}.
 *
 * <pre>
 *   |short − medium| &gt; 0.3 → reversal: opposite of short's direction relative to medium,
 *                             confidence min(deviation + 0.20, 0.75)
 *   otherwise               → blend = 0.5·short + 0.3·medium + 0.2·long, BIG iff blend ≥ 0.5,
 *                             confidence |blend − 0.5|·2 + 0.05
 * </pre>
 * Final confidence is clamped to [0.52, 0.78].
 */
public class TrendPredictor implements Predictor {

    public static final String NAME = "trend";

    static final double REVERSAL_DEVIATION = 0.3;
    static final double MIN_CONFIDENCE     = 0.52;
    static final double MAX_CONFIDENCE     = 0.78;

    @Override
    public String modelName() { return NAME; }

    @Override
    public ModelOutput predict(ModelInput input) {
        TrendWindows windows = input.trainedModels().trendWindows();
        double shortRatio  = TrendWindows.bigRatio(windows.shortTerm());
        double mediumRatio = TrendWindows.bigRatio(windows.mediumTerm());
        double longRatio   = TrendWindows.bigRatio(windows.longTerm());

        double deviation = Math.abs(shortRatio - mediumRatio);
        OutcomeLabel label;
        double confidence;
        if (deviation > REVERSAL_DEVIATION) {
            label = shortRatio > mediumRatio ? OutcomeLabel.SMALL : OutcomeLabel.BIG;
            confidence = Math.min(deviation + 0.20, 0.75);
        } else {
            double blend = shortRatio * 0.5 + mediumRatio * 0.3 + longRatio * 0.2;
            label = blend >= 0.5 ? OutcomeLabel.BIG : OutcomeLabel.SMALL;
            confidence = Math.abs(blend - 0.5) * 2.0 + 0.05;
        }
        return ModelOutput.of(label, Math.max(MIN_CONFIDENCE, Math.min(confidence, MAX_CONFIDENCE)), NAME);
    }
}
