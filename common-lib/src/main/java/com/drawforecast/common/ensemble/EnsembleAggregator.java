package com.drawforecast.common.ensemble;

import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.model.ConfidenceTier;
import com.drawforecast.common.model.EnsembleDecision;
import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.ModelOutput;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.model.RecoveryMode;
import com.drawforecast.common.model.RunStreak;
import com.drawforecast.common.predictor.FrequencyPredictor;
import com.drawforecast.common.predictor.MarkovPredictor;
import com.drawforecast.common.predictor.ModelInput;
import com.drawforecast.common.predictor.PatternPredictor;
import com.drawforecast.common.predictor.Predictor;
import com.drawforecast.common.predictor.QuantumPredictor;
import com.drawforecast.common.predictor.RecurrentCellPredictor;
import com.drawforecast.common.predictor.TrendPredictor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines every ensemble member into one {@link EnsembleDecision}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Run each predictor over one snapshot of buffer, trained models and market state.
 *       A predictor that throws contributes a neutral {@code <model>_error} output.</li>
 *   <li>score(model) = confidence × weight (weight {@value #DEFAULT_WEIGHT} when missing);
 *       the side with the larger summed score wins (ties go to SMALL).</li>
 *   <li>raw confidence = winning score / total score (0.5 when total is 0);
 *       agreement = majority vote count / number of models.</li>
 *   <li>Shaping, in order: +0.08 if agreement ≥ 0.8, else +0.04 if ≥ 0.6; ×0.85 if the market is
 *       not exploitable; ×0.90 if volatility &gt; 0.6; +0.05 on ≥ 5 consecutive wins; −0.05 on
 *       any loss streak; clamp to [{@value #MIN_CONFIDENCE}, {@value #MAX_CONFIDENCE}].</li>
 *   <li>{@link RecoveryModeResolver} picks the recovery mode; only ANTI_TREND flips the label.</li>
 *   <li>{@link ConfidenceTier#classify(double, double)} assigns the tier.</li>
 * </ol>
 */
public class EnsembleAggregator {

    private static final Logger log = LoggerFactory.getLogger(EnsembleAggregator.class);

    static final double DEFAULT_WEIGHT = 0.15;
    static final double MIN_CONFIDENCE = 0.50;
    static final double MAX_CONFIDENCE = 0.92;

    private final ForecastContext context;
    private final List<Predictor> predictors;

    public EnsembleAggregator(ForecastContext context) {
        this(context, defaultPredictors(context));
    }

    public EnsembleAggregator(ForecastContext context, List<Predictor> predictors) {
        if (predictors.isEmpty()) {
            throw new IllegalArgumentException("ensemble needs at least one predictor");
        }
        this.context    = context;
        this.predictors = List.copyOf(predictors);
    }

    /** The six standard members, in weight-vector order. */
    public static List<Predictor> defaultPredictors(ForecastContext context) {
        return List.of(
            new PatternPredictor(context.settings().patternLengths()),
            new MarkovPredictor(context.settings().markovOrder()),
            new FrequencyPredictor(),
            new RecurrentCellPredictor(context),
            new TrendPredictor(),
            new QuantumPredictor());
    }

    /**
     * @throws IllegalStateException when the buffer is empty
     */
    public EnsembleDecision predict() {
        List<OutcomeRecord> records = context.buffer().records();
        if (records.isEmpty()) {
            throw new IllegalStateException("cannot predict from an empty buffer");
        }
        MarketState market = context.marketState();
        ModelInput input = new ModelInput(records, context.trainedModels(), market);
        Map<String, Double> weights = context.weightAdapter().weightsSnapshot();
        RunStreak.Snapshot streak = context.runStreak().snapshot();

        // ── run members ──────────────────────────────────────────────────
        Map<String, ModelOutput> outputs = new LinkedHashMap<>();
        for (Predictor predictor : predictors) {
            outputs.put(predictor.modelName(), safePredict(predictor, input));
        }

        // ── weighted vote ────────────────────────────────────────────────
        double bigScore = 0.0;
        double smallScore = 0.0;
        int bigVotes = 0;
        for (Map.Entry<String, ModelOutput> entry : outputs.entrySet()) {
            ModelOutput output = entry.getValue();
            double score = output.confidence() * weights.getOrDefault(entry.getKey(), DEFAULT_WEIGHT);
            if (output.prediction() == OutcomeLabel.BIG) {
                bigScore += score;
                bigVotes++;
            } else {
                smallScore += score;
            }
        }
        double total = bigScore + smallScore;
        OutcomeLabel rawLabel = bigScore > smallScore ? OutcomeLabel.BIG : OutcomeLabel.SMALL;
        double rawConfidence = total > 0.0 ? Math.max(bigScore, smallScore) / total : 0.5;
        double agreement = (double) Math.max(bigVotes, outputs.size() - bigVotes) / outputs.size();

        // ── shaping ──────────────────────────────────────────────────────
        double confidence = shapeConfidence(rawConfidence, agreement, market, streak);

        RecoveryMode recoveryMode = RecoveryModeResolver.resolve(streak, market);
        OutcomeLabel finalLabel = recoveryMode.apply(rawLabel);
        ConfidenceTier tier = ConfidenceTier.classify(confidence * 100.0, agreement);

        return new EnsembleDecision(
            null,
            finalLabel,
            rawLabel,
            confidence,
            (int) Math.round(confidence * 100.0),
            tier,
            tier.recommendation(),
            (int) Math.round(agreement * 100.0),
            market.recentTrend(),
            recoveryMode,
            outputs,
            weights,
            reasons(agreement, market, streak, recoveryMode));
    }

    static double shapeConfidence(double rawConfidence, double agreement,
                                  MarketState market, RunStreak.Snapshot streak) {
        double confidence = rawConfidence;
        if (agreement >= 0.8) confidence += 0.08;
        else if (agreement >= 0.6) confidence += 0.04;

        if (!market.exploitable()) confidence *= 0.85;
        if (market.volatility() > 0.6) confidence *= 0.90;
        if (streak.consecutiveWins() >= 5) confidence += 0.05;
        if (streak.consecutiveLosses() >= 1) confidence -= 0.05;

        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    static List<String> reasons(double agreement, MarketState market,
                                RunStreak.Snapshot streak, RecoveryMode recoveryMode) {
        List<String> reasons = new ArrayList<>();
        if (market.exploitable()) reasons.add("Exploitable randomness detected");
        if (agreement >= 0.7) reasons.add("Strong model consensus");
        if (streak.consecutiveWins() >= 5) reasons.add("High-win streak active");
        if (recoveryMode != RecoveryMode.NORMAL) reasons.add("Recovery mode: " + recoveryMode);
        if (reasons.isEmpty()) reasons.add("Default prediction based on ensemble");
        return reasons;
    }

    private ModelOutput safePredict(Predictor predictor, ModelInput input) {
        try {
            return predictor.predict(input);
        } catch (RuntimeException e) {
            log.error("Predictor failed, using neutral output. model={}", predictor.modelName(), e);
            return ModelOutput.neutral(predictor.modelName() + "_error");
        }
    }
}
