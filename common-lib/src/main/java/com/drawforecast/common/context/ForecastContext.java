package com.drawforecast.common.context;

import com.drawforecast.common.adaptation.WeightAdapter;
import com.drawforecast.common.buffer.DataBuffer;
import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.RunStreak;
import com.drawforecast.common.predictor.RecurrentCell;
import com.drawforecast.common.training.TrainedModels;

import java.util.Random;

/**
 * Owned state of one forecasting engine instance: the buffer, the current trained-model
 * generation, the market state, the weight adapter, the run streak and the recurrent cell.
 *
 * <p>Trained models and market state are swapped as whole values through volatile fields.
 * Independent instances share nothing, so tests can run engines side by side.
 */
public final class ForecastContext {

    private final ForecastSettings settings;
    private final DataBuffer buffer;
    private final WeightAdapter weightAdapter;
    private final RunStreak runStreak = new RunStreak();
    private final Random random;

    private volatile TrainedModels trainedModels = TrainedModels.empty();
    private volatile MarketState marketState = MarketState.initial();

    private RecurrentCell recurrentCell;

    public ForecastContext(ForecastSettings settings) {
        this.settings      = settings;
        this.buffer        = new DataBuffer(settings.bufferCapacity());
        this.weightAdapter = new WeightAdapter(settings.initialWeights());
        this.random        = new Random(settings.recurrentCellSeed());
    }

    public static ForecastContext withDefaults() {
        return new ForecastContext(ForecastSettings.defaults());
    }

    public ForecastSettings settings()    { return settings; }
    public DataBuffer buffer()            { return buffer; }
    public WeightAdapter weightAdapter()  { return weightAdapter; }
    public RunStreak runStreak()          { return runStreak; }
    public TrainedModels trainedModels()  { return trainedModels; }
    public MarketState marketState()      { return marketState; }

    /** Replaces the trained generation and the market state together. */
    public synchronized void publish(TrainedModels models, MarketState state) {
        this.trainedModels = models;
        this.marketState   = state;
    }

    /** @return the recurrent cell, or {@code null} before its first use */
    public synchronized RecurrentCell recurrentCell() {
        return recurrentCell;
    }

    /** Creates the recurrent cell once; later calls return the existing instance. */
    public synchronized RecurrentCell initRecurrentCell(int inputSize, int hiddenSize) {
        if (recurrentCell == null) {
            recurrentCell = RecurrentCell.randomlyInitialized(inputSize, hiddenSize, random);
        }
        return recurrentCell;
    }
}
