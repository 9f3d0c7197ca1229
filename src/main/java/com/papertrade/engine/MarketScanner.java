package com.papertrade.engine;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.papertrade.decision.DecisionSource;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

public class MarketScanner {

	private static final Logger LOGGER = LoggerFactory.getLogger(MarketScanner.class);

	private final DecisionSource decisionSource;
	private final OrderRouter orderRouter;
	private final ModeController modeController;
	private final List<String> symbols;
	private final Duration scanInterval;
	private final double minConfidence;
	private final Scheduler scheduler;
	private Disposable subscription;

	public MarketScanner(DecisionSource decisionSource,
			OrderRouter orderRouter,
			ModeController modeController,
			List<String> symbols,
			Duration scanInterval,
			double minConfidence,
			Scheduler scheduler) {
		this.decisionSource = decisionSource;
		this.orderRouter = orderRouter;
		this.modeController = modeController;
		this.symbols = List.copyOf(symbols);
		this.scanInterval = scanInterval;
		this.minConfidence = minConfidence;
		this.scheduler = scheduler;
	}

	public synchronized void start() {
		if (subscription != null && !subscription.isDisposed()) {
			return;
		}
		LOGGER.info("EVENT=SCANNER_START symbols={} intervalMs={} minConfidence={}", symbols,
				scanInterval.toMillis(), minConfidence);
		subscription = Flux.interval(scanInterval, scanInterval, scheduler)
				.onBackpressureDrop(tick -> LOGGER.debug("EVENT=SCAN_TICK_DROPPED tick={}", tick))
				.concatMap(ignored -> scanOnce(), 1)
				.subscribe(null, ex -> LOGGER.error("EVENT=SCANNER_ERROR message={}", ex.getMessage(), ex));
	}

	public synchronized void stop() {
		if (subscription != null) {
			subscription.dispose();
			subscription = null;
			LOGGER.info("EVENT=SCANNER_STOP");
		}
	}

	public synchronized boolean isActive() {
		return subscription != null && !subscription.isDisposed();
	}

	public Flux<TradeExecution> scanOnce() {
		if (!modeController.isRunning()) {
			return Flux.empty();
		}
		return Flux.fromIterable(symbols)
				.concatMap(this::evaluate);
	}

	private Mono<TradeExecution> evaluate(String symbol) {
		return Mono.defer(() -> decisionSource.propose(symbol))
				.onErrorResume(error -> {
					LOGGER.warn("EVENT=SCAN_PROPOSAL_FAIL symbol={} reason={}", symbol, error.getMessage());
					return Mono.empty();
				})
				.filter(proposal -> proposal.qualifies(minConfidence))
				.flatMap(proposal -> orderRouter.route(proposal)
						.onErrorResume(error -> {
							LOGGER.warn("EVENT=SCAN_EXECUTION_FAIL symbol={} side={} amount={} price={} reason={}",
									symbol, proposal.side(), proposal.amount(), proposal.price(), error.getMessage());
							return Mono.empty();
						}));
	}
}
