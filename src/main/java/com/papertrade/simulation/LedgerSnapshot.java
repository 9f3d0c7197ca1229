package com.papertrade.simulation;

import java.util.List;

public record LedgerSnapshot(PerformanceCounters counters, List<Position> openPositions) {

	public LedgerSnapshot {
		openPositions = List.copyOf(openPositions);
	}
}
