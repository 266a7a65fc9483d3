package com.drawforecast.common.predictor;

import java.util.Random;

/**
 * LSTM-shaped recurrent cell with fixed random weights.
 *
 * <p>This is a heuristic signal generator, not a trained network: the weights are drawn once
 * from [−0.1, 0.1) and never updated. Only the hidden and cell vectors evolve, and they
 * persist across calls, so every forward pass is conditioned on all previous ones.
 *
 * <pre>
 *   i = σ(Wi·x + Ui·h + bi)     f = σ(Wf·x + Uf·h + bf)
 *   g = tanh(Wc·x + Uc·h + bc)  o = σ(Wo·x + Uo·h + bo)
 *   c' = f·c + i·g              h' = o·tanh(c')
 * </pre>
 */
public final class RecurrentCell {

    static final double INIT_RANGE = 0.1;

    private final int inputSize;
    private final int hiddenSize;

    private final double[][] wi, wf, wo, wc;
    private final double[][] ui, uf, uo, uc;
    private final double[] bi, bf, bo, bc;

    private double[] hidden;
    private double[] cell;

    private RecurrentCell(int inputSize, int hiddenSize, Random random) {
        this.inputSize  = inputSize;
        this.hiddenSize = hiddenSize;
        this.wi = matrix(hiddenSize, inputSize, random);
        this.wf = matrix(hiddenSize, inputSize, random);
        this.wo = matrix(hiddenSize, inputSize, random);
        this.wc = matrix(hiddenSize, inputSize, random);
        this.ui = matrix(hiddenSize, hiddenSize, random);
        this.uf = matrix(hiddenSize, hiddenSize, random);
        this.uo = matrix(hiddenSize, hiddenSize, random);
        this.uc = matrix(hiddenSize, hiddenSize, random);
        this.bi = new double[hiddenSize];
        this.bf = new double[hiddenSize];
        this.bo = new double[hiddenSize];
        this.bc = new double[hiddenSize];
        this.hidden = new double[hiddenSize];
        this.cell   = new double[hiddenSize];
    }

    public static RecurrentCell randomlyInitialized(int inputSize, int hiddenSize, Random random) {
        return new RecurrentCell(inputSize, hiddenSize, random);
    }

    /**
     * Advances the cell by one step and returns a copy of the new hidden vector.
     */
    public synchronized double[] forward(double[] input) {
        if (input.length != inputSize) {
            throw new IllegalArgumentException("expected input of size " + inputSize + " but got " + input.length);
        }
        double[] newHidden = new double[hiddenSize];
        double[] newCell   = new double[hiddenSize];
        for (int j = 0; j < hiddenSize; j++) {
            double inputGate  = sigmoid(affine(wi[j], input) + affine(ui[j], hidden) + bi[j]);
            double forgetGate = sigmoid(affine(wf[j], input) + affine(uf[j], hidden) + bf[j]);
            double candidate  = Math.tanh(affine(wc[j], input) + affine(uc[j], hidden) + bc[j]);
            double c          = forgetGate * cell[j] + inputGate * candidate;
            double outputGate = sigmoid(affine(wo[j], input) + affine(uo[j], hidden) + bo[j]);
            newCell[j]   = c;
            newHidden[j] = outputGate * Math.tanh(c);
        }
        hidden = newHidden;
        cell   = newCell;
        return hidden.clone();
    }

    public synchronized double[] hiddenState() {
        return hidden.clone();
    }

    /** Logistic function, saturated beyond ±700 to avoid overflow. */
    public static double sigmoid(double x) {
        if (x > 700) return 1.0;
        if (x < -700) return 0.0;
        return 1.0 / (1.0 + Math.exp(-x));
    }

    private static double affine(double[] weights, double[] values) {
        double sum = 0;
        for (int i = 0; i < weights.length; i++) sum += weights[i] * values[i];
        return sum;
    }

    private static double[][] matrix(int rows, int cols, Random random) {
        double[][] m = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                m[r][c] = (random.nextDouble() * 2 - 1) * INIT_RANGE;
            }
        }
        return m;
    }
}
