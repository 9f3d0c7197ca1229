package com.papertrade.event;

import com.papertrade.simulation.PerformanceCounters;

public record ReadyForLive(PerformanceCounters counters, long eventTimeMs) implements TradingEvent {
}
