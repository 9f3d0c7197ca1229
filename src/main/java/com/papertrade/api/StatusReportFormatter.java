package com.papertrade.api;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.papertrade.api.dto.LearningStatusDto;
import com.papertrade.api.dto.PositionDto;
import com.papertrade.api.dto.StatusDto;
import com.papertrade.domain.enums.RunMode;
import com.papertrade.engine.ModeState;
import com.papertrade.simulation.LedgerSnapshot;
import com.papertrade.simulation.PerformanceCounters;
import com.papertrade.simulation.Position;
import com.papertrade.simulation.PromotionCheck;

public class StatusReportFormatter {

	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	private final ObjectMapper objectMapper;
	private final BigDecimal initialBalance;

	public StatusReportFormatter(ObjectMapper objectMapper, BigDecimal initialBalance) {
		this.objectMapper = objectMapper;
		this.initialBalance = initialBalance;
	}

	public StatusDto status(ModeState modeState, PerformanceCounters counters, PromotionCheck check) {
		return new StatusDto(
				modeState.running(),
				modeState.mode(),
				modeState.mode() == RunMode.SIMULATED,
				initialBalance.add(counters.cumulativePnl()),
				counters.totalOpened(),
				counters.totalClosed(),
				counters.totalOpened() - counters.totalClosed(),
				percent(counters.winRate()),
				counters.cumulativePnl(),
				percent(counters.confidenceLevel()),
				oneDecimal(counters.learningProgress()),
				check.eligible());
	}

	public LearningStatusDto learningStatus(ModeState modeState, LedgerSnapshot snapshot, PromotionCheck check) {
		PerformanceCounters counters = snapshot.counters();
		return new LearningStatusDto(
				modeState.mode() == RunMode.SIMULATED,
				counters.totalOpened(),
				counters.totalClosed(),
				counters.winRate(),
				counters.confidenceLevel(),
				counters.learningProgress(),
				check.eligible(),
				snapshot.openPositions().size(),
				check.hasEnoughTrades(),
				check.winRateOk(),
				check.profitOk(),
				check.requirements());
	}

	public List<PositionDto> positions(List<Position> positions) {
		return positions.stream().map(StatusReportFormatter::toDto).toList();
	}

	public String toJson(Object report) {
		try {
			return objectMapper.writeValueAsString(report);
		} catch (JsonProcessingException ex) {
			throw new IllegalStateException("Failed to render status report " + report.getClass().getSimpleName(), ex);
		}
	}

	static PositionDto toDto(Position position) {
		return new PositionDto(
				position.id(),
				position.symbol(),
				position.side(),
				position.amount(),
				position.entryPrice(),
				position.confidence(),
				position.state(),
				position.exitPrice(),
				position.realizedPnl(),
				position.openedAt(),
				position.closedAt());
	}

	static String percent(BigDecimal fraction) {
		return oneDecimal(fraction.multiply(HUNDRED).doubleValue());
	}

	static String oneDecimal(double value) {
		return String.format(Locale.ROOT, "%.1f", value);
	}
}
