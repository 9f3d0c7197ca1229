package com.papertrade.event;

import com.papertrade.domain.enums.RunMode;

public record ModeChanged(RunMode previous, RunMode current, long eventTimeMs) implements TradingEvent {
}
