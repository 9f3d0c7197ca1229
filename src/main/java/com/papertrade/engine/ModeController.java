package com.papertrade.engine;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.papertrade.domain.enums.RunMode;
import com.papertrade.event.ModeChanged;
import com.papertrade.event.TradingEventHub;
import com.papertrade.event.TradingStarted;
import com.papertrade.event.TradingStopped;
import com.papertrade.simulation.NotReadyException;
import com.papertrade.simulation.PromotionCheck;
import com.papertrade.simulation.PromotionGate;
import com.papertrade.simulation.SimulationLedger;

public class ModeController {

	private static final Logger LOGGER = LoggerFactory.getLogger(ModeController.class);

	private final SimulationLedger ledger;
	private final PromotionGate promotionGate;
	private final TradingEventHub eventHub;
	private final Clock clock;

	private RunMode mode = RunMode.SIMULATED;
	private boolean running;

	public ModeController(SimulationLedger ledger, PromotionGate promotionGate, TradingEventHub eventHub, Clock clock) {
		this.ledger = ledger;
		this.promotionGate = promotionGate;
		this.eventHub = eventHub;
		this.clock = clock;
	}

	public void setRunning(boolean running) {
		RunMode current;
		synchronized (this) {
			if (this.running == running) {
				return;
			}
			this.running = running;
			current = mode;
		}
		long now = clock.millis();
		if (running) {
			LOGGER.info("EVENT=TRADING_STARTED mode={}", current);
			eventHub.publish(new TradingStarted(current, now));
		} else {
			LOGGER.info("EVENT=TRADING_STOPPED mode={}", current);
			eventHub.publish(new TradingStopped(current, now));
		}
	}

	public RunMode requestModeSwitch() {
		RunMode previous;
		RunMode next;
		synchronized (this) {
			previous = mode;
			if (previous == RunMode.SIMULATED) {
				PromotionCheck check = promotionGate.evaluate(ledger.counters());
				if (!check.eligible()) {
					LOGGER.info("EVENT=MODE_SWITCH_REFUSED closed={} winRate={} cumulativePnl={} requirements=\"{}\"",
							check.closedTrades(), check.winRate().toPlainString(),
							check.cumulativePnl().toPlainString(), check.requirements());
					throw new NotReadyException(check);
				}
				next = RunMode.LIVE;
			} else {
				next = RunMode.SIMULATED;
			}
			mode = next;
		}
		if (next == RunMode.LIVE) {
			LOGGER.warn("EVENT=MODE_SWITCH from={} to={} note=\"real capital at risk\"", previous, next);
		} else {
			LOGGER.info("EVENT=MODE_SWITCH from={} to={}", previous, next);
		}
		eventHub.publish(new ModeChanged(previous, next, clock.millis()));
		return next;
	}

	public synchronized ModeState state() {
		return new ModeState(mode, running);
	}

	public synchronized RunMode currentMode() {
		return mode;
	}

	public synchronized boolean isRunning() {
		return running;
	}
}
