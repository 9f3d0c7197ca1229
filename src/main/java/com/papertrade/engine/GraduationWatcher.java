package com.papertrade.engine;

import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.papertrade.domain.enums.RunMode;
import com.papertrade.event.ReadyForLive;
import com.papertrade.event.TradingEventHub;
import com.papertrade.simulation.PerformanceCounters;
import com.papertrade.simulation.PromotionGate;
import com.papertrade.simulation.SimulationLedger;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

public class GraduationWatcher {

	private static final Logger LOGGER = LoggerFactory.getLogger(GraduationWatcher.class);

	private final SimulationLedger ledger;
	private final PromotionGate promotionGate;
	private final ModeController modeController;
	private final TradingEventHub eventHub;
	private final Duration checkInterval;
	private final Scheduler scheduler;
	private final Clock clock;
	private Disposable subscription;

	public GraduationWatcher(SimulationLedger ledger,
			PromotionGate promotionGate,
			ModeController modeController,
			TradingEventHub eventHub,
			Duration checkInterval,
			Scheduler scheduler,
			Clock clock) {
		this.ledger = ledger;
		this.promotionGate = promotionGate;
		this.modeController = modeController;
		this.eventHub = eventHub;
		this.checkInterval = checkInterval;
		this.scheduler = scheduler;
		this.clock = clock;
	}

	public synchronized void start() {
		if (subscription != null && !subscription.isDisposed()) {
			return;
		}
		subscription = Flux.interval(checkInterval, checkInterval, scheduler)
				.onBackpressureDrop()
				.subscribe(ignored -> check(),
						ex -> LOGGER.error("EVENT=GRADUATION_WATCHER_ERROR message={}", ex.getMessage(), ex));
	}

	public synchronized void stop() {
		if (subscription != null) {
			subscription.dispose();
			subscription = null;
		}
	}

	public boolean check() {
		if (modeController.currentMode() != RunMode.SIMULATED) {
			return false;
		}
		PerformanceCounters counters = ledger.counters();
		if (!promotionGate.canPromote(counters)) {
			return false;
		}
		LOGGER.info("EVENT=READY_FOR_LIVE source=watcher closed={} winRate={} cumulativePnl={}",
				counters.totalClosed(), counters.winRate().toPlainString(), counters.cumulativePnl().toPlainString());
		eventHub.publish(new ReadyForLive(counters, clock.millis()));
		return true;
	}
}
