package com.papertrade.engine;

import com.papertrade.domain.enums.RunMode;
import com.papertrade.simulation.Position;

public record TradeExecution(RunMode mode, Position position, LiveOrderReceipt liveReceipt) {

	public static TradeExecution simulated(Position position) {
		return new TradeExecution(RunMode.SIMULATED, position, null);
	}

	public static TradeExecution live(LiveOrderReceipt receipt) {
		return new TradeExecution(RunMode.LIVE, null, receipt);
	}

	public boolean isSimulated() {
		return mode == RunMode.SIMULATED;
	}
}
