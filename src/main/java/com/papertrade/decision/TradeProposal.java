package com.papertrade.decision;

import java.math.BigDecimal;

import com.papertrade.domain.enums.PositionSide;

public record TradeProposal(
		String symbol,
		PositionSide side,
		BigDecimal amount,
		BigDecimal price,
		double confidence,
		boolean shouldTrade) {

	public boolean qualifies(double minConfidence) {
		return shouldTrade && confidence > minConfidence;
	}

	public TradeProposal withOrder(PositionSide side, BigDecimal amount) {
		return new TradeProposal(symbol, side, amount, price, confidence, true);
	}
}
