package com.papertrade.event;

import com.papertrade.domain.enums.RunMode;

public record TradingStarted(RunMode mode, long eventTimeMs) implements TradingEvent {
}
