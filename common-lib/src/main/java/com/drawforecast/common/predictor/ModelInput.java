package com.drawforecast.common.predictor;

import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.training.TrainedModels;

import java.util.List;

/**
 * Everything a predictor may read for one ensemble run.
 *
 * @param records       buffer snapshot, newest first, never empty
 * @param trainedModels current trained generation
 * @param marketState   current market state
 */
public record ModelInput(List<OutcomeRecord> records, TrainedModels trainedModels, MarketState marketState) {

    public ModelInput {
        records = List.copyOf(records);
    }
}
