package com.papertrade.simulation;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.papertrade.config.PaperTradingProperties;

class PromotionGateTest {

	private final PromotionGate gate = new PromotionGate(PaperTradingProperties.Promotion.defaults());

	@Test
	void promotesWithEnoughProfitableTrades() {
		PromotionCheck check = gate.evaluate(counters(50, 40, "600"));

		assertThat(check.hasEnoughTrades()).isTrue();
		assertThat(check.winRateOk()).isTrue();
		assertThat(check.profitOk()).isTrue();
		assertThat(check.eligible()).isTrue();
		assertThat(gate.canPromote(counters(50, 40, "600"))).isTrue();
	}

	@Test
	void refusesWhenProfitTooLow() {
		PromotionCheck check = gate.evaluate(counters(50, 40, "400"));

		assertThat(check.profitOk()).isFalse();
		assertThat(check.eligible()).isFalse();
	}

	@Test
	void profitThresholdIsStrict() {
		assertThat(gate.canPromote(counters(60, 60, "500"))).isFalse();
		assertThat(gate.canPromote(counters(60, 60, "500.01"))).isTrue();
	}

	@Test
	void refusesWithTooFewClosedTrades() {
		PromotionCheck check = gate.evaluate(counters(49, 49, "5000"));

		assertThat(check.hasEnoughTrades()).isFalse();
		assertThat(check.eligible()).isFalse();
	}

	@Test
	void refusesWhenWinRateBelowMinimum() {
		PromotionCheck check = gate.evaluate(counters(100, 74, "900"));

		assertThat(check.winRateOk()).isFalse();
		assertThat(check.eligible()).isFalse();
		assertThat(gate.canPromote(counters(100, 75, "900"))).isTrue();
	}

	@Test
	void describesRequirements() {
		assertThat(gate.requirements()).isEqualTo("Need: 50 closed trades, >=75% win rate, >500 cumulative PnL");
	}

	private static PerformanceCounters counters(long closed, long wins, String pnl) {
		return new PerformanceCounters(closed, closed, wins, new BigDecimal(pnl), new BigDecimal("0.9"), 0.0);
	}
}
