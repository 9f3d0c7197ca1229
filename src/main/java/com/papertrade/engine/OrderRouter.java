package com.papertrade.engine;

import com.papertrade.decision.TradeProposal;
import com.papertrade.domain.enums.RunMode;
import com.papertrade.simulation.SimulationLedger;

import reactor.core.publisher.Mono;

public class OrderRouter {

	private final SimulationLedger ledger;
	private final ModeController modeController;
	private final LiveOrderGateway liveOrderGateway;

	public OrderRouter(SimulationLedger ledger, ModeController modeController, LiveOrderGateway liveOrderGateway) {
		this.ledger = ledger;
		this.modeController = modeController;
		this.liveOrderGateway = liveOrderGateway;
	}

	public Mono<TradeExecution> route(TradeProposal proposal) {
		if (modeController.currentMode() == RunMode.LIVE) {
			return liveOrderGateway.submit(proposal).map(TradeExecution::live);
		}
		return Mono.fromCallable(() -> TradeExecution.simulated(ledger.open(proposal)));
	}
}
