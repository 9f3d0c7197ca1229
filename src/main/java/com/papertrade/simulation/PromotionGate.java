package com.papertrade.simulation;

import java.math.BigDecimal;
import java.util.Locale;

import com.papertrade.config.PaperTradingProperties;

public class PromotionGate {

	private final int minClosedTrades;
	private final BigDecimal minWinRate;
	private final BigDecimal minCumulativePnl;

	public PromotionGate(PaperTradingProperties.Promotion promotion) {
		this.minClosedTrades = promotion.minClosedTrades();
		this.minWinRate = promotion.minWinRate();
		this.minCumulativePnl = promotion.minCumulativePnl();
	}

	public boolean canPromote(PerformanceCounters counters) {
		return evaluate(counters).eligible();
	}

	public PromotionCheck evaluate(PerformanceCounters counters) {
		BigDecimal winRate = counters.winRate();
		boolean hasEnoughTrades = counters.totalClosed() >= minClosedTrades;
		boolean winRateOk = counters.totalClosed() > 0 && winRate.compareTo(minWinRate) >= 0;
		boolean profitOk = counters.cumulativePnl().compareTo(minCumulativePnl) > 0;
		return new PromotionCheck(
				counters.totalClosed(),
				winRate,
				counters.cumulativePnl(),
				hasEnoughTrades,
				winRateOk,
				profitOk,
				requirements());
	}

	public String requirements() {
		return String.format(Locale.ROOT, "Need: %d closed trades, >=%.0f%% win rate, >%s cumulative PnL",
				minClosedTrades, minWinRate.doubleValue() * 100, minCumulativePnl.toPlainString());
	}
}
