package com.papertrade.api.dto;

import java.math.BigDecimal;

import com.papertrade.domain.enums.RunMode;

public record StatusDto(
		boolean running,
		RunMode mode,
		boolean paperMode,
		BigDecimal virtualBalance,
		long totalTrades,
		long closedTrades,
		long openTrades,
		String successRate,
		BigDecimal totalProfit,
		String confidence,
		String learningProgress,
		boolean readyForLive) {
}
