package com.papertrade.event;

public interface TradingEvent {

	long eventTimeMs();
}
