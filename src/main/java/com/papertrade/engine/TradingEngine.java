package com.papertrade.engine;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.papertrade.api.StatusReportFormatter;
import com.papertrade.api.dto.LearningStatusDto;
import com.papertrade.api.dto.StatusDto;
import com.papertrade.config.PaperTradingProperties;
import com.papertrade.decision.DecisionSource;
import com.papertrade.decision.TradeProposal;
import com.papertrade.domain.enums.PositionSide;
import com.papertrade.domain.enums.RunMode;
import com.papertrade.event.EngineInitialized;
import com.papertrade.event.TradingEvent;
import com.papertrade.event.TradingEventHub;
import com.papertrade.simulation.LedgerSnapshot;
import com.papertrade.simulation.OutcomeScheduler;
import com.papertrade.simulation.PerformanceCounters;
import com.papertrade.simulation.Position;
import com.papertrade.simulation.PromotionGate;
import com.papertrade.simulation.SimulationLedger;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

public class TradingEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingEngine.class);

	private final PaperTradingProperties properties;
	private final DecisionSource decisionSource;
	private final SimulationLedger ledger;
	private final OutcomeScheduler outcomeScheduler;
	private final PromotionGate promotionGate;
	private final ModeController modeController;
	private final OrderRouter orderRouter;
	private final MarketScanner marketScanner;
	private final GraduationWatcher graduationWatcher;
	private final TradingEventHub eventHub;
	private final StatusReportFormatter formatter;
	private final Clock clock;
	private boolean initialized;
	private boolean terminated;

	public TradingEngine(PaperTradingProperties properties,
			DecisionSource decisionSource,
			SimulationLedger ledger,
			OutcomeScheduler outcomeScheduler,
			PromotionGate promotionGate,
			ModeController modeController,
			OrderRouter orderRouter,
			MarketScanner marketScanner,
			GraduationWatcher graduationWatcher,
			TradingEventHub eventHub,
			StatusReportFormatter formatter,
			Clock clock) {
		this.properties = properties;
		this.decisionSource = decisionSource;
		this.ledger = ledger;
		this.outcomeScheduler = outcomeScheduler;
		this.promotionGate = promotionGate;
		this.modeController = modeController;
		this.orderRouter = orderRouter;
		this.marketScanner = marketScanner;
		this.graduationWatcher = graduationWatcher;
		this.eventHub = eventHub;
		this.formatter = formatter;
		this.clock = clock;
	}

	public static TradingEngine create(PaperTradingProperties properties,
			DecisionSource decisionSource,
			LiveOrderGateway liveOrderGateway,
			Scheduler scheduler,
			Random random,
			Clock clock,
			ObjectMapper objectMapper) {
		TradingEventHub eventHub = new TradingEventHub();
		OutcomeScheduler outcomeScheduler = new OutcomeScheduler(scheduler, random, properties.exitPriceDeviation());
		PromotionGate promotionGate = new PromotionGate(properties.promotion());
		SimulationLedger ledger = new SimulationLedger(properties, outcomeScheduler, promotionGate, eventHub, clock);
		ModeController modeController = new ModeController(ledger, promotionGate, eventHub, clock);
		OrderRouter orderRouter = new OrderRouter(ledger, modeController, liveOrderGateway);
		MarketScanner marketScanner = new MarketScanner(decisionSource, orderRouter, modeController,
				properties.symbols(), properties.scanInterval(), properties.minConfidence(), scheduler);
		GraduationWatcher graduationWatcher = new GraduationWatcher(ledger, promotionGate, modeController, eventHub,
				properties.graduationCheckInterval(), scheduler, clock);
		StatusReportFormatter formatter = new StatusReportFormatter(objectMapper, properties.initialBalance());
		return new TradingEngine(properties, decisionSource, ledger, outcomeScheduler, promotionGate, modeController,
				orderRouter, marketScanner, graduationWatcher, eventHub, formatter, clock);
	}

	public void initialize() {
		synchronized (this) {
			if (terminated) {
				throw new IllegalStateException("Trading engine has been shut down and cannot be initialized again");
			}
			if (initialized) {
				return;
			}
			initialized = true;
		}
		marketScanner.start();
		graduationWatcher.start();
		RunMode mode = modeController.currentMode();
		LOGGER.info("EVENT=ENGINE_INITIALIZED mode={} symbols={} autoStart={}", mode, properties.symbols(),
				properties.autoStart());
		eventHub.publish(new EngineInitialized(mode, properties.symbols(), clock.millis()));
		if (properties.autoStart()) {
			startTrading();
		}
	}

	public void shutdown() {
		synchronized (this) {
			if (terminated) {
				return;
			}
			terminated = true;
		}
		marketScanner.stop();
		graduationWatcher.stop();
		modeController.setRunning(false);
		outcomeScheduler.shutdown();
		LedgerSnapshot snapshot = ledger.snapshot();
		LOGGER.info("EVENT=ENGINE_SHUTDOWN openPositions={} closed={} cumulativePnl={}",
				snapshot.openPositions().size(), snapshot.counters().totalClosed(),
				snapshot.counters().cumulativePnl().toPlainString());
		eventHub.complete();
	}

	public Position open(TradeProposal proposal) {
		return ledger.open(proposal);
	}

	public Position close(String positionId, BigDecimal exitPrice) {
		Position closed = ledger.close(positionId, exitPrice);
		outcomeScheduler.cancel(positionId);
		return closed;
	}

	public LedgerSnapshot snapshot() {
		return ledger.snapshot();
	}

	public boolean canPromote() {
		return promotionGate.canPromote(ledger.counters());
	}

	public RunMode requestModeSwitch() {
		return modeController.requestModeSwitch();
	}

	public void setRunning(boolean running) {
		if (running) {
			startTrading();
		} else {
			stopTrading();
		}
	}

	public void startTrading() {
		synchronized (this) {
			if (terminated) {
				throw new IllegalStateException("Trading engine has been shut down and cannot start trading");
			}
		}
		modeController.setRunning(true);
	}

	public void stopTrading() {
		modeController.setRunning(false);
	}

	public Mono<TradeExecution> placeMarketOrder(String symbol, PositionSide side, BigDecimal amount) {
		return Mono.defer(() -> decisionSource.propose(symbol))
				.map(proposal -> proposal.withOrder(side, amount))
				.flatMap(orderRouter::route)
				.doOnNext(execution -> logManualOrder("MARKET", symbol, side, amount, execution));
	}

	public Mono<TradeExecution> placeLimitOrder(String symbol, PositionSide side, BigDecimal amount,
			BigDecimal price) {
		TradeProposal proposal = new TradeProposal(symbol, side, amount, price, properties.limitOrderConfidence(),
				true);
		return orderRouter.route(proposal)
				.doOnNext(execution -> logManualOrder("LIMIT", symbol, side, amount, execution));
	}

	public Mono<TradeExecution> placeFuturesOrder(String symbol, PositionSide side, BigDecimal amount,
			int leverage) {
		if (leverage < 1) {
			return Mono.error(new IllegalArgumentException("Leverage must be at least 1, got " + leverage));
		}
		if (amount == null) {
			return Mono.error(new IllegalArgumentException("Amount is required for " + symbol));
		}
		BigDecimal notional = amount.multiply(BigDecimal.valueOf(leverage));
		LOGGER.info("EVENT=FUTURES_ORDER symbol={} side={} margin={} leverage={} notional={}", symbol, side,
				amount.toPlainString(), leverage, notional.toPlainString());
		return placeMarketOrder(symbol, side, notional);
	}

	public Mono<TradeExecution> placeMarketOrder(String symbol, String orderSide, BigDecimal amount) {
		return Mono.fromCallable(() -> PositionSide.fromOrderSide(orderSide))
				.flatMap(side -> placeMarketOrder(symbol, side, amount));
	}

	public Mono<TradeExecution> placeLimitOrder(String symbol, String orderSide, BigDecimal amount,
			BigDecimal price) {
		return Mono.fromCallable(() -> PositionSide.fromOrderSide(orderSide))
				.flatMap(side -> placeLimitOrder(symbol, side, amount, price));
	}

	public Mono<TradeExecution> placeFuturesOrder(String symbol, String orderSide, BigDecimal amount,
			int leverage) {
		return Mono.fromCallable(() -> PositionSide.fromOrderSide(orderSide))
				.flatMap(side -> placeFuturesOrder(symbol, side, amount, leverage));
	}

	public StatusDto status() {
		PerformanceCounters counters = ledger.counters();
		return formatter.status(modeController.state(), counters, promotionGate.evaluate(counters));
	}

	public LearningStatusDto learningStatus() {
		LedgerSnapshot snapshot = ledger.snapshot();
		return formatter.learningStatus(modeController.state(), snapshot, promotionGate.evaluate(snapshot.counters()));
	}

	public String statusJson() {
		return formatter.toJson(status());
	}

	public String learningStatusJson() {
		return formatter.toJson(learningStatus());
	}

	public List<Position> openPositions() {
		return ledger.snapshot().openPositions();
	}

	public List<Position> closedPositions() {
		return ledger.closedPositions();
	}

	public Disposable addListener(Consumer<? super TradingEvent> listener) {
		return eventHub.subscribe(listener);
	}

	public Flux<TradingEvent> events() {
		return eventHub.flux();
	}

	public ModeState modeState() {
		return modeController.state();
	}

	private static void logManualOrder(String type, String symbol, PositionSide side, BigDecimal amount,
			TradeExecution execution) {
		LOGGER.info("EVENT=MANUAL_ORDER type={} symbol={} side={} amount={} mode={} positionId={}", type, symbol,
				side, amount, execution.mode(),
				execution.isSimulated() ? execution.position().id() : execution.liveReceipt().orderId());
	}
}
