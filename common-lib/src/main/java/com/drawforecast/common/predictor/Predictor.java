package com.drawforecast.common.predictor;

import com.drawforecast.common.model.ModelOutput;

/**
 * One member of the forecasting ensemble.
 *
 * <p>Implementations must be total over any non-empty buffer: when a model lacks the data
 * it needs it returns a low-confidence fallback with a distinguishing source tag instead of
 * throwing.
 */
public interface Predictor {

    ModelOutput predict(ModelInput input);

    /** Key of this model in the weight vector, e.g. {@code "pattern"}. */
    String modelName();
}
