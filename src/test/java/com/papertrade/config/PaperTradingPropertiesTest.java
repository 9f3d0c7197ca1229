package com.papertrade.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class PaperTradingPropertiesTest {

	@Test
	void defaultsMatchDocumentedValues() {
		PaperTradingProperties properties = PaperTradingProperties.defaults();

		assertThat(properties.symbols()).containsExactly("BTC/USDT", "ETH/USDT", "SOL/USDT");
		assertThat(properties.scanInterval()).isEqualTo(Duration.ofSeconds(5));
		assertThat(properties.closeDelayMin()).isEqualTo(Duration.ofSeconds(30));
		assertThat(properties.closeDelayMax()).isEqualTo(Duration.ofMinutes(5));
		assertThat(properties.exitPriceDeviation()).isEqualByComparingTo("0.02");
		assertThat(properties.minConfidence()).isEqualTo(0.7);
		assertThat(properties.limitOrderConfidence()).isEqualTo(0.8);
		assertThat(properties.initialBalance()).isEqualByComparingTo("10000");
		assertThat(properties.autoStart()).isFalse();
		assertThat(properties.graduationCheckInterval()).isEqualTo(Duration.ofMinutes(5));
		assertThat(properties.confidence().initial()).isEqualByComparingTo("0.5");
		assertThat(properties.confidence().increment()).isEqualByComparingTo("0.01");
		assertThat(properties.confidence().cap()).isEqualByComparingTo("0.95");
		assertThat(properties.promotion().minClosedTrades()).isEqualTo(50);
		assertThat(properties.promotion().minWinRate()).isEqualByComparingTo("0.75");
		assertThat(properties.promotion().minCumulativePnl()).isEqualByComparingTo("500");
		assertThat(properties.mockMarket().basePrice("ETH/USDT")).isEqualByComparingTo("2800");
		assertThat(properties.mockMarket().basePrice("XRP/USDT")).isEqualByComparingTo("100");
	}

	@Test
	void bindsOverridesAndKeepsDefaultsForTheRest() {
		Map<String, String> source = Map.of(
				"paper-trading.symbols[0]", "BTC/USDT",
				"paper-trading.close-delay-min", "10s",
				"paper-trading.close-delay-max", "20s",
				"paper-trading.auto-start", "true",
				"paper-trading.promotion.min-closed-trades", "20",
				"paper-trading.mock-market.min-amount", "50");

		PaperTradingProperties properties = new Binder(new MapConfigurationPropertySource(source))
				.bind("paper-trading", PaperTradingProperties.class)
				.get();

		assertThat(properties.symbols()).containsExactly("BTC/USDT");
		assertThat(properties.closeDelayMin()).isEqualTo(Duration.ofSeconds(10));
		assertThat(properties.closeDelayMax()).isEqualTo(Duration.ofSeconds(20));
		assertThat(properties.autoStart()).isTrue();
		assertThat(properties.promotion().minClosedTrades()).isEqualTo(20);
		assertThat(properties.promotion().minWinRate()).isEqualByComparingTo("0.75");
		assertThat(properties.mockMarket().minAmount()).isEqualByComparingTo("50");
		assertThat(properties.scanInterval()).isEqualTo(Duration.ofSeconds(5));
	}

	@Test
	void explicitZeroTunablesAreKept() {
		PaperTradingProperties properties = new PaperTradingProperties(null, null, null, null, null, 0.0, 0.0, null,
				false, null, null, new PaperTradingProperties.Promotion(0, null, null, null, null),
				new PaperTradingProperties.MockMarket(null, null, 0.0, 0.0, 0.0, null, null));

		assertThat(properties.minConfidence()).isEqualTo(0.0);
		assertThat(properties.limitOrderConfidence()).isEqualTo(0.0);
		assertThat(properties.promotion().minClosedTrades()).isZero();
		assertThat(properties.promotion().tradesForFullProgress()).isEqualTo(100);
		assertThat(properties.mockMarket().priceJitter()).isEqualTo(0.0);
		assertThat(properties.mockMarket().tradeProbability()).isEqualTo(0.0);
		assertThat(properties.mockMarket().confidenceThreshold()).isEqualTo(0.0);
	}

	@Test
	void bindsExplicitZeroMinConfidence() {
		Map<String, String> source = Map.of(
				"paper-trading.min-confidence", "0",
				"paper-trading.mock-market.price-jitter", "0");

		PaperTradingProperties properties = new Binder(new MapConfigurationPropertySource(source))
				.bind("paper-trading", PaperTradingProperties.class)
				.get();

		assertThat(properties.minConfidence()).isEqualTo(0.0);
		assertThat(properties.limitOrderConfidence()).isEqualTo(0.8);
		assertThat(properties.mockMarket().priceJitter()).isEqualTo(0.0);
		assertThat(properties.mockMarket().tradeProbability()).isEqualTo(0.1);
	}

	@Test
	void rejectsNonPositiveProgressDenominator() {
		assertThatThrownBy(() -> new PaperTradingProperties.Promotion(null, null, null, null, 0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void rejectsInvertedCloseWindow() {
		assertThatThrownBy(() -> PaperTradingProperties.defaults()
				.withCloseDelay(Duration.ofMinutes(5), Duration.ofSeconds(30)))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void rejectsInvertedMockAmounts() {
		assertThatThrownBy(() -> new PaperTradingProperties.MockMarket(null, null, null, null, null, new BigDecimal("600"),
				new BigDecimal("500")))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
