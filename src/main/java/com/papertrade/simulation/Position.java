package com.papertrade.simulation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Objects;

import com.papertrade.domain.enums.PositionSide;
import com.papertrade.domain.enums.PositionState;

public record Position(
		String id,
		String symbol,
		PositionSide side,
		BigDecimal amount,
		BigDecimal entryPrice,
		double confidence,
		Instant openedAt,
		PositionState state,
		BigDecimal exitPrice,
		BigDecimal realizedPnl,
		Instant closedAt) {

	public Position {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(side, "side");
		Objects.requireNonNull(amount, "amount");
		Objects.requireNonNull(entryPrice, "entryPrice");
		Objects.requireNonNull(openedAt, "openedAt");
		Objects.requireNonNull(state, "state");
		boolean closed = state == PositionState.CLOSED;
		if (closed != (exitPrice != null) || closed != (realizedPnl != null) || closed != (closedAt != null)) {
			throw new IllegalArgumentException("Exit fields must be set exactly when position " + id + " is CLOSED");
		}
	}

	static Position open(String id, String symbol, PositionSide side, BigDecimal amount, BigDecimal entryPrice,
			double confidence, Instant openedAt) {
		return new Position(id, symbol, side, amount, entryPrice, confidence, openedAt, PositionState.OPEN,
				null, null, null);
	}

	Position close(BigDecimal exitPrice, Instant closedAt) {
		if (state != PositionState.OPEN) {
			throw new IllegalStateException("Position " + id + " is already closed");
		}
		return new Position(id, symbol, side, amount, entryPrice, confidence, openedAt, PositionState.CLOSED,
				exitPrice, realizedPnl(side, entryPrice, exitPrice, amount), closedAt);
	}

	public boolean isOpen() {
		return state == PositionState.OPEN;
	}

	public static BigDecimal realizedPnl(PositionSide side, BigDecimal entryPrice, BigDecimal exitPrice,
			BigDecimal amount) {
		BigDecimal units = amount.divide(entryPrice, MathContext.DECIMAL64);
		BigDecimal move = side == PositionSide.LONG
				? exitPrice.subtract(entryPrice)
				: entryPrice.subtract(exitPrice);
		return move.multiply(units, MathContext.DECIMAL64);
	}
}
