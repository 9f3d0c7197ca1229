package com.papertrade.api;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.papertrade.api.dto.LearningStatusDto;
import com.papertrade.api.dto.PositionDto;
import com.papertrade.api.dto.StatusDto;
import com.papertrade.config.PaperTradingProperties;
import com.papertrade.domain.enums.PositionSide;
import com.papertrade.domain.enums.PositionState;
import com.papertrade.domain.enums.RunMode;
import com.papertrade.engine.ModeState;
import com.papertrade.simulation.LedgerSnapshot;
import com.papertrade.simulation.PerformanceCounters;
import com.papertrade.simulation.Position;
import com.papertrade.simulation.PromotionCheck;
import com.papertrade.simulation.PromotionGate;

class StatusReportFormatterTest {

	private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
	private final StatusReportFormatter formatter = new StatusReportFormatter(objectMapper, new BigDecimal("10000"));
	private final PromotionGate gate = new PromotionGate(PaperTradingProperties.Promotion.defaults());

	@Test
	void statusFormatsPercentages() {
		PerformanceCounters counters = new PerformanceCounters(64, 60, 47, new BigDecimal("612.5"),
				new BigDecimal("0.95"), 87.3456);

		StatusDto status = formatter.status(new ModeState(RunMode.SIMULATED, true), counters, gate.evaluate(counters));

		assertThat(status.running()).isTrue();
		assertThat(status.paperMode()).isTrue();
		assertThat(status.virtualBalance()).isEqualByComparingTo("10612.5");
		assertThat(status.totalTrades()).isEqualTo(64);
		assertThat(status.closedTrades()).isEqualTo(60);
		assertThat(status.openTrades()).isEqualTo(4);
		assertThat(status.successRate()).isEqualTo("78.3");
		assertThat(status.totalProfit()).isEqualByComparingTo("612.5");
		assertThat(status.confidence()).isEqualTo("95.0");
		assertThat(status.learningProgress()).isEqualTo("87.3");
		assertThat(status.readyForLive()).isTrue();
	}

	@Test
	void losingRunReducesVirtualBalance() {
		PerformanceCounters counters = new PerformanceCounters(10, 10, 2, new BigDecimal("-240"),
				new BigDecimal("0.6"), 25.0);

		StatusDto status = formatter.status(new ModeState(RunMode.LIVE, false), counters, gate.evaluate(counters));

		assertThat(status.virtualBalance()).isEqualByComparingTo("9760");
		assertThat(status.paperMode()).isFalse();
		assertThat(status.successRate()).isEqualTo("20.0");
		assertThat(status.readyForLive()).isFalse();
	}

	@Test
	void learningStatusCarriesGateBreakdown() {
		PerformanceCounters counters = new PerformanceCounters(12, 10, 9, new BigDecimal("80"),
				new BigDecimal("0.6"), 40.0);
		Position open = new Position("SIM-1-11", "BTC/USDT", PositionSide.LONG, new BigDecimal("100"),
				new BigDecimal("45000"), 0.8, Instant.parse("2024-03-01T10:00:00Z"), PositionState.OPEN, null, null,
				null);
		PromotionCheck check = gate.evaluate(counters);

		LearningStatusDto learning = formatter.learningStatus(new ModeState(RunMode.SIMULATED, false),
				new LedgerSnapshot(counters, List.of(open)), check);

		assertThat(learning.paperTradingEnabled()).isTrue();
		assertThat(learning.totalPaperTrades()).isEqualTo(12);
		assertThat(learning.closedPaperTrades()).isEqualTo(10);
		assertThat(learning.paperSuccessRate()).isEqualByComparingTo("0.9");
		assertThat(learning.aiConfidence()).isEqualByComparingTo("0.6");
		assertThat(learning.openPositions()).isEqualTo(1);
		assertThat(learning.hasEnoughTrades()).isFalse();
		assertThat(learning.winRateOk()).isTrue();
		assertThat(learning.profitOk()).isFalse();
		assertThat(learning.readyForLive()).isFalse();
		assertThat(learning.requirements()).isEqualTo(gate.requirements());
	}

	@Test
	void rendersPositionsAsJson() throws Exception {
		Position closed = new Position("SIM-1-7", "ETH/USDT", PositionSide.SHORT, new BigDecimal("280"),
				new BigDecimal("2800"), 0.9, Instant.parse("2024-03-01T10:00:00Z"), PositionState.CLOSED,
				new BigDecimal("2744"), new BigDecimal("5.6"), Instant.parse("2024-03-01T10:02:00Z"));

		List<PositionDto> positions = formatter.positions(List.of(closed));
		JsonNode json = objectMapper.readTree(formatter.toJson(positions));

		assertThat(json.isArray()).isTrue();
		assertThat(json.get(0).get("id").asText()).isEqualTo("SIM-1-7");
		assertThat(json.get(0).get("side").asText()).isEqualTo("SHORT");
		assertThat(json.get(0).get("state").asText()).isEqualTo("CLOSED");
		assertThat(json.get(0).get("realizedPnl").decimalValue()).isEqualByComparingTo("5.6");
	}
}
