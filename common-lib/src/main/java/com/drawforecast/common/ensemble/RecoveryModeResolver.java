package com.drawforecast.common.ensemble;

import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.RecoveryMode;
import com.drawforecast.common.model.RunStreak;

/**
 * Maps the current loss streak and market state to a {@link RecoveryMode}.
 *
 * <p>Rules (evaluated in priority order):
 * <ol>
 *   <li>losses ≥ 3 and volatility &lt; 0.5        → {@link RecoveryMode#MARTINGALE_SAFE}</li>
 *   <li>losses ≥ 2 and market not exploitable   → {@link RecoveryMode#CAUTION}</li>
 *   <li>losses ≥ 2 and trend is STRONG_*        → {@link RecoveryMode#ANTI_TREND}</li>
 *   <li>otherwise                               → {@link RecoveryMode#NORMAL}</li>
 * </ol>
 */
public final class RecoveryModeResolver {

    private RecoveryModeResolver() {}

    public static RecoveryMode resolve(RunStreak.Snapshot streak, MarketState market) {
        int losses = streak.consecutiveLosses();
        if (losses >= 3 && market.volatility() < 0.5) {
            return RecoveryMode.MARTINGALE_SAFE;
        }
        if (losses >= 2 && !market.exploitable()) {
            return RecoveryMode.CAUTION;
        }
        if (losses >= 2 && market.recentTrend().isStrong()) {
            return RecoveryMode.ANTI_TREND;
        }
        return RecoveryMode.NORMAL;
    }
}
