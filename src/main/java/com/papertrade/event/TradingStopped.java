package com.papertrade.event;

import com.papertrade.domain.enums.RunMode;

public record TradingStopped(RunMode mode, long eventTimeMs) implements TradingEvent {
}
