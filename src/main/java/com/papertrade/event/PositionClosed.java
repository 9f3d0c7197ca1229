package com.papertrade.event;

import com.papertrade.simulation.PerformanceCounters;
import com.papertrade.simulation.Position;

public record PositionClosed(Position position, PerformanceCounters counters, long eventTimeMs) implements TradingEvent {
}
