package com.papertrade.simulation;

import java.math.BigDecimal;
import java.math.MathContext;

public record PerformanceCounters(
		long totalOpened,
		long totalClosed,
		long winningClosed,
		BigDecimal cumulativePnl,
		BigDecimal confidenceLevel,
		double learningProgress) {

	public PerformanceCounters {
		if (winningClosed < 0 || winningClosed > totalClosed || totalClosed > totalOpened) {
			throw new IllegalArgumentException("Counters out of order: opened=" + totalOpened + " closed="
					+ totalClosed + " wins=" + winningClosed);
		}
	}

	public static PerformanceCounters initial(BigDecimal confidenceLevel) {
		return new PerformanceCounters(0, 0, 0, BigDecimal.ZERO, confidenceLevel, 0.0);
	}

	public BigDecimal winRate() {
		if (totalClosed == 0) {
			return BigDecimal.ZERO;
		}
		return BigDecimal.valueOf(winningClosed).divide(BigDecimal.valueOf(totalClosed), MathContext.DECIMAL64);
	}

	// mean of trade-count, win-rate and confidence progress, clamped to [0, 100]
	public static double learningProgress(long totalClosed, long winningClosed, BigDecimal confidenceLevel,
			int tradesForFullProgress, BigDecimal targetWinRate) {
		double tradesFactor = (double) totalClosed / tradesForFullProgress;
		double successFactor = totalClosed == 0
				? 0.0
				: ((double) winningClosed / totalClosed) / targetWinRate.doubleValue();
		double confidenceFactor = confidenceLevel.doubleValue();
		double progress = (tradesFactor + successFactor + confidenceFactor) / 3.0 * 100.0;
		return Math.max(0.0, Math.min(100.0, progress));
	}
}
