package com.papertrade.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

import com.papertrade.domain.enums.PositionSide;
import com.papertrade.domain.enums.PositionState;

public record PositionDto(
		String id,
		String symbol,
		PositionSide side,
		BigDecimal amount,
		BigDecimal entryPrice,
		double confidence,
		PositionState state,
		BigDecimal exitPrice,
		BigDecimal realizedPnl,
		Instant openedAt,
		Instant closedAt) {
}
