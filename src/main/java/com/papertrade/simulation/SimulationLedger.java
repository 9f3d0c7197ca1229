package com.papertrade.simulation;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.papertrade.config.PaperTradingProperties;
import com.papertrade.decision.TradeProposal;
import com.papertrade.event.PositionClosed;
import com.papertrade.event.PositionOpened;
import com.papertrade.event.ReadyForLive;
import com.papertrade.event.TradingEventHub;

public class SimulationLedger {

	private static final Logger LOGGER = LoggerFactory.getLogger(SimulationLedger.class);

	private final PaperTradingProperties properties;
	private final OutcomeScheduler outcomeScheduler;
	private final PromotionGate promotionGate;
	private final TradingEventHub eventHub;
	private final Clock clock;
	private final AtomicLong sequence = new AtomicLong(0L);

	private final Object lock = new Object();
	private final Map<String, Position> openPositions = new LinkedHashMap<>();
	private final List<Position> closedHistory = new ArrayList<>();
	private long totalOpened;
	private long totalClosed;
	private long winningClosed;
	private BigDecimal cumulativePnl = BigDecimal.ZERO;
	private BigDecimal confidenceLevel;
	private double learningProgress;

	public SimulationLedger(PaperTradingProperties properties,
			OutcomeScheduler outcomeScheduler,
			PromotionGate promotionGate,
			TradingEventHub eventHub,
			Clock clock) {
		this.properties = properties;
		this.outcomeScheduler = outcomeScheduler;
		this.promotionGate = promotionGate;
		this.eventHub = eventHub;
		this.clock = clock;
		this.confidenceLevel = properties.confidence().initial();
	}

	public Position open(TradeProposal proposal) {
		validate(proposal);
		Instant now = clock.instant();
		Position position = Position.open(nextPositionId(now), proposal.symbol(), proposal.side(),
				proposal.amount(), proposal.price(), proposal.confidence(), now);
		synchronized (lock) {
			openPositions.put(position.id(), position);
			totalOpened++;
		}
		LOGGER.info("EVENT=POSITION_OPENED positionId={} symbol={} side={} amount={} entryPrice={} confidence={}",
				position.id(), position.symbol(), position.side(), position.amount().toPlainString(),
				position.entryPrice().toPlainString(), String.format("%.4f", position.confidence()));
		eventHub.publish(new PositionOpened(position, now.toEpochMilli()));
		// armed after the open event so a zero-length window cannot report the close first
		outcomeScheduler.scheduleClose(position.id(), position.entryPrice(), position.side(), position.amount(),
				properties.closeDelayMin(), properties.closeDelayMax(), this::close);
		return position;
	}

	public Position close(String positionId, BigDecimal exitPrice) {
		if (exitPrice == null || exitPrice.signum() <= 0) {
			throw new InvalidProposalException(null, "Exit price must be positive for position " + positionId);
		}
		Position closed;
		PerformanceCounters counters;
		boolean gateOpened;
		synchronized (lock) {
			Position open = openPositions.get(positionId);
			if (open == null) {
				throw new UnknownPositionException(positionId);
			}
			boolean gateBefore = promotionGate.canPromote(countersLocked());
			closed = open.close(exitPrice, clock.instant());
			openPositions.remove(positionId);
			closedHistory.add(closed);
			totalClosed++;
			if (closed.realizedPnl().signum() > 0) {
				winningClosed++;
			}
			cumulativePnl = cumulativePnl.add(closed.realizedPnl());
			confidenceLevel = confidenceLevel.add(properties.confidence().increment())
					.min(properties.confidence().cap());
			learningProgress = PerformanceCounters.learningProgress(totalClosed, winningClosed, confidenceLevel,
					properties.promotion().tradesForFullProgress(), properties.promotion().targetWinRate());
			counters = countersLocked();
			gateOpened = !gateBefore && promotionGate.canPromote(counters);
		}
		LOGGER.info("EVENT=POSITION_CLOSED positionId={} symbol={} side={} entryPrice={} exitPrice={} pnl={} "
				+ "closed={} wins={} cumulativePnl={} confidence={} learningProgress={}",
				closed.id(), closed.symbol(), closed.side(), closed.entryPrice().toPlainString(),
				closed.exitPrice().toPlainString(), closed.realizedPnl().toPlainString(), counters.totalClosed(),
				counters.winningClosed(), counters.cumulativePnl().toPlainString(),
				counters.confidenceLevel().toPlainString(), String.format("%.2f", counters.learningProgress()));
		long eventTimeMs = closed.closedAt().toEpochMilli();
		eventHub.publish(new PositionClosed(closed, counters, eventTimeMs));
		if (gateOpened) {
			LOGGER.info("EVENT=READY_FOR_LIVE closed={} winRate={} cumulativePnl={}", counters.totalClosed(),
					counters.winRate().toPlainString(), counters.cumulativePnl().toPlainString());
			eventHub.publish(new ReadyForLive(counters, eventTimeMs));
		}
		return closed;
	}

	public LedgerSnapshot snapshot() {
		synchronized (lock) {
			return new LedgerSnapshot(countersLocked(), new ArrayList<>(openPositions.values()));
		}
	}

	public PerformanceCounters counters() {
		synchronized (lock) {
			return countersLocked();
		}
	}

	public List<Position> closedPositions() {
		synchronized (lock) {
			return List.copyOf(closedHistory);
		}
	}

	private PerformanceCounters countersLocked() {
		return new PerformanceCounters(totalOpened, totalClosed, winningClosed, cumulativePnl, confidenceLevel,
				learningProgress);
	}

	private String nextPositionId(Instant now) {
		return "SIM-" + now.toEpochMilli() + "-" + sequence.incrementAndGet();
	}

	private static void validate(TradeProposal proposal) {
		if (proposal == null) {
			throw new InvalidProposalException(null, "Proposal is required");
		}
		String symbol = proposal.symbol();
		if (symbol == null || symbol.isBlank()) {
			throw new InvalidProposalException(symbol, "Symbol is required");
		}
		if (proposal.side() == null) {
			throw new InvalidProposalException(symbol, "Side is required for " + symbol);
		}
		if (proposal.amount() == null || proposal.amount().signum() <= 0) {
			throw new InvalidProposalException(symbol, "Amount must be positive for " + symbol + ", got "
					+ proposal.amount());
		}
		if (proposal.price() == null || proposal.price().signum() <= 0) {
			throw new InvalidProposalException(symbol, "Entry price must be positive for " + symbol + ", got "
					+ proposal.price());
		}
		double confidence = proposal.confidence();
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new InvalidProposalException(symbol, "Confidence must be within [0, 1] for " + symbol + ", got "
					+ confidence);
		}
	}
}
