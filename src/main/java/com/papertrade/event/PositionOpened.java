package com.papertrade.event;

import com.papertrade.simulation.Position;

public record PositionOpened(Position position, long eventTimeMs) implements TradingEvent {
}
