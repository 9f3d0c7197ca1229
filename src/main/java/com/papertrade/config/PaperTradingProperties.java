package com.papertrade.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "paper-trading")
public record PaperTradingProperties(
		List<String> symbols,
		Duration scanInterval,
		Duration closeDelayMin,
		Duration closeDelayMax,
		@DecimalMin("0.0") @DecimalMax("1.0") BigDecimal exitPriceDeviation,
		@DecimalMin("0.0") @DecimalMax("1.0") Double minConfidence,
		@DecimalMin("0.0") @DecimalMax("1.0") Double limitOrderConfidence,
		@Positive BigDecimal initialBalance,
		boolean autoStart,
		Duration graduationCheckInterval,
		@Valid Confidence confidence,
		@Valid Promotion promotion,
		@Valid MockMarket mockMarket) {

	public static final List<String> DEFAULT_SYMBOLS = List.of("BTC/USDT", "ETH/USDT", "SOL/USDT");

	public PaperTradingProperties {
		if (symbols == null || symbols.isEmpty()) symbols = DEFAULT_SYMBOLS;
		if (scanInterval == null || scanInterval.isZero() || scanInterval.isNegative()) scanInterval = Duration.ofSeconds(5);
		if (closeDelayMin == null || closeDelayMin.isNegative()) closeDelayMin = Duration.ofSeconds(30);
		if (closeDelayMax == null || closeDelayMax.isNegative()) closeDelayMax = Duration.ofMinutes(5);
		if (exitPriceDeviation == null) exitPriceDeviation = new BigDecimal("0.02");
		if (minConfidence == null) minConfidence = 0.7;
		if (limitOrderConfidence == null) limitOrderConfidence = 0.8;
		if (initialBalance == null) initialBalance = BigDecimal.valueOf(10_000);
		if (graduationCheckInterval == null || graduationCheckInterval.isZero() || graduationCheckInterval.isNegative()) {
			graduationCheckInterval = Duration.ofMinutes(5);
		}
		if (confidence == null) confidence = Confidence.defaults();
		if (promotion == null) promotion = Promotion.defaults();
		if (mockMarket == null) mockMarket = MockMarket.defaults();
		if (closeDelayMin.compareTo(closeDelayMax) > 0) {
			throw new IllegalArgumentException("closeDelayMin " + closeDelayMin + " exceeds closeDelayMax " + closeDelayMax);
		}
		symbols = List.copyOf(symbols);
	}

	public static PaperTradingProperties defaults() {
		return new PaperTradingProperties(null, null, null, null, null, null, null, null, false, null, null, null, null);
	}

	public PaperTradingProperties withCloseDelay(Duration min, Duration max) {
		return new PaperTradingProperties(symbols, scanInterval, min, max, exitPriceDeviation, minConfidence,
				limitOrderConfidence, initialBalance, autoStart, graduationCheckInterval, confidence, promotion,
				mockMarket);
	}

	public PaperTradingProperties withPromotion(Promotion promotion) {
		return new PaperTradingProperties(symbols, scanInterval, closeDelayMin, closeDelayMax, exitPriceDeviation,
				minConfidence, limitOrderConfidence, initialBalance, autoStart, graduationCheckInterval, confidence,
				promotion, mockMarket);
	}

	public record Confidence(
			@DecimalMin("0.0") @DecimalMax("1.0") BigDecimal initial,
			@DecimalMin("0.0") BigDecimal increment,
			@DecimalMin("0.0") @DecimalMax("1.0") BigDecimal cap) {

		public Confidence {
			if (initial == null) initial = new BigDecimal("0.5");
			if (increment == null) increment = new BigDecimal("0.01");
			if (cap == null) cap = new BigDecimal("0.95");
			if (initial.compareTo(cap) > 0) {
				throw new IllegalArgumentException("Initial confidence " + initial + " exceeds cap " + cap);
			}
		}

		public static Confidence defaults() {
			return new Confidence(null, null, null);
		}
	}

	public record Promotion(
			@PositiveOrZero Integer minClosedTrades,
			@DecimalMin("0.0") @DecimalMax("1.0") BigDecimal minWinRate,
			BigDecimal minCumulativePnl,
			@DecimalMin(value = "0.0", inclusive = false) BigDecimal targetWinRate,
			@Positive Integer tradesForFullProgress) {

		public Promotion {
			if (minClosedTrades == null) minClosedTrades = 50;
			if (minWinRate == null) minWinRate = new BigDecimal("0.75");
			if (minCumulativePnl == null) minCumulativePnl = BigDecimal.valueOf(500);
			if (targetWinRate == null) targetWinRate = new BigDecimal("0.75");
			if (tradesForFullProgress == null) tradesForFullProgress = 100;
			if (minClosedTrades < 0 || tradesForFullProgress <= 0) {
				throw new IllegalArgumentException("Promotion needs minClosedTrades >= 0 and tradesForFullProgress > 0, got "
						+ minClosedTrades + " and " + tradesForFullProgress);
			}
		}

		public static Promotion defaults() {
			return new Promotion(null, null, null, null, null);
		}
	}

	public record MockMarket(
			Map<String, BigDecimal> basePrices,
			BigDecimal defaultBasePrice,
			@DecimalMin("0.0") @DecimalMax("1.0") Double priceJitter,
			@DecimalMin("0.0") @DecimalMax("1.0") Double tradeProbability,
			@DecimalMin("0.0") @DecimalMax("1.0") Double confidenceThreshold,
			BigDecimal minAmount,
			BigDecimal maxAmount) {

		public MockMarket {
			if (basePrices == null || basePrices.isEmpty()) {
				basePrices = Map.of(
						"BTC/USDT", BigDecimal.valueOf(45_000),
						"ETH/USDT", BigDecimal.valueOf(2_800),
						"SOL/USDT", BigDecimal.valueOf(110));
			}
			if (defaultBasePrice == null) defaultBasePrice = BigDecimal.valueOf(100);
			if (priceJitter == null) priceJitter = 0.05;
			if (tradeProbability == null) tradeProbability = 0.1;
			if (confidenceThreshold == null) confidenceThreshold = 0.7;
			if (minAmount == null) minAmount = BigDecimal.valueOf(100);
			if (maxAmount == null) maxAmount = BigDecimal.valueOf(500);
			if (minAmount.compareTo(maxAmount) > 0) {
				throw new IllegalArgumentException("Mock minAmount " + minAmount + " exceeds maxAmount " + maxAmount);
			}
			basePrices = Map.copyOf(basePrices);
		}

		public static MockMarket defaults() {
			return new MockMarket(null, null, null, null, null, null, null);
		}

		public BigDecimal basePrice(String symbol) {
			return basePrices.getOrDefault(symbol, defaultBasePrice);
		}
	}
}
