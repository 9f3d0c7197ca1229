package com.papertrade.api.dto;

import java.math.BigDecimal;

public record LearningStatusDto(
		boolean paperTradingEnabled,
		long totalPaperTrades,
		long closedPaperTrades,
		BigDecimal paperSuccessRate,
		BigDecimal aiConfidence,
		double learningProgress,
		boolean readyForLive,
		int openPositions,
		boolean hasEnoughTrades,
		boolean winRateOk,
		boolean profitOk,
		String requirements) {
}
