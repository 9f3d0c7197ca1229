package com.papertrade.simulation;

import java.math.BigDecimal;

public record PromotionCheck(
		long closedTrades,
		BigDecimal winRate,
		BigDecimal cumulativePnl,
		boolean hasEnoughTrades,
		boolean winRateOk,
		boolean profitOk,
		String requirements) {

	public boolean eligible() {
		return hasEnoughTrades && winRateOk && profitOk;
	}
}
