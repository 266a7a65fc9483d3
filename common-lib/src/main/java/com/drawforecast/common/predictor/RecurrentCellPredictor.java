package com.drawforecast.common.predictor;

import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.model.OutcomeRecord;

import java.util.List;

/**
 * Ensemble member backed by the context's {@link RecurrentCell}.
 *
 * <ul>
 *   <li>Fewer than {@value #INPUT_SIZE} draws → BIG / 0.50, {@code lstm_insufficient}.</li>
 *   <li>First call with enough data creates the cell and returns BIG / 0.50,
 *       {@code lstm_uninitialized}.</li>
 *   <li>Afterwards the newest {@value #INPUT_SIZE} bits drive one recurrent step;
 *       output = σ(mean hidden), confidence min(|output − 0.5|·2 + 0.10, 0.80).</li>
 * </ul>
 * Each call advances the shared hidden state, so repeated calls on the same buffer may differ.
 */
public class RecurrentCellPredictor implements Predictor {

    public static final String NAME = "neural";

    static final int    INPUT_SIZE     = 20;
    static final int    HIDDEN_SIZE    = 15;
    static final double BOOST          = 0.10;
    static final double MAX_CONFIDENCE = 0.80;

    private final ForecastContext context;

    public RecurrentCellPredictor(ForecastContext context) {
        this.context = context;
    }

    @Override
    public String modelName() { return NAME; }

    @Override
    public ModelOutput predict(ModelInput input) {
        List<OutcomeRecord> records = input.records();
        if (records.size() < INPUT_SIZE) {
            return ModelOutput.neutral("lstm_insufficient");
        }
        RecurrentCell cell = context.recurrentCell();
        if (cell == null) {
            context.initRecurrentCell(INPUT_SIZE, HIDDEN_SIZE);
            return ModelOutput.neutral("lstm_uninitialized");
        }

        double[] bits = new double[INPUT_SIZE];
        for (int i = 0; i < INPUT_SIZE; i++) {
            bits[i] = records.get(i).bit();
        }
        double[] hidden = cell.forward(bits);
        double sum = 0;
        for (double h : hidden) sum += h;
        double output = RecurrentCell.sigmoid(sum / hidden.length);

        OutcomeLabel label = output >= 0.5 ? OutcomeLabel.BIG : OutcomeLabel.SMALL;
        double confidence = Math.abs(output - 0.5) * 2.0;
        return ModelOutput.of(label, Math.min(confidence + BOOST, MAX_CONFIDENCE), "lstm");
    }
}
