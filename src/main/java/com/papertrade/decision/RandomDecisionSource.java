package com.papertrade.decision;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Random;

import com.papertrade.config.PaperTradingProperties;
import com.papertrade.domain.enums.PositionSide;

import reactor.core.publisher.Mono;

// Placeholder analysis: jittered base prices and random confidence, used until a market-data feed exists.
public class RandomDecisionSource implements DecisionSource {

	private static final int PRICE_SCALE = 8;
	private static final int AMOUNT_SCALE = 2;

	private final PaperTradingProperties.MockMarket market;
	private final Random random;

	public RandomDecisionSource(PaperTradingProperties.MockMarket market, Random random) {
		this.market = market;
		this.random = random;
	}

	@Override
	public Mono<TradeProposal> propose(String symbol) {
		return Mono.fromSupplier(() -> analyze(symbol));
	}

	TradeProposal analyze(String symbol) {
		BigDecimal price = mockPrice(symbol);
		double sentiment = random.nextDouble();
		double technical = random.nextDouble();
		double confidence = (sentiment + technical) / 2.0;
		boolean shouldTrade = confidence > market.confidenceThreshold()
				&& random.nextDouble() > 1.0 - market.tradeProbability();
		PositionSide side = random.nextDouble() > 0.5 ? PositionSide.LONG : PositionSide.SHORT;
		BigDecimal amount = market.minAmount()
				.add(market.maxAmount().subtract(market.minAmount())
						.multiply(BigDecimal.valueOf(random.nextDouble())))
				.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
		return new TradeProposal(symbol, side, amount, price, confidence, shouldTrade);
	}

	BigDecimal mockPrice(String symbol) {
		double jitter = market.priceJitter();
		double factor = (1.0 - jitter) + random.nextDouble() * (2.0 * jitter);
		return market.basePrice(symbol)
				.multiply(BigDecimal.valueOf(factor), MathContext.DECIMAL64)
				.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
	}
}
