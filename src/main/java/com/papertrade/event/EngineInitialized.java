package com.papertrade.event;

import java.util.List;

import com.papertrade.domain.enums.RunMode;

public record EngineInitialized(RunMode mode, List<String> symbols, long eventTimeMs) implements TradingEvent {
}
