package com.papertrade.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

import jakarta.annotation.PreDestroy;

public class TradingEngineStarter implements ApplicationListener<ApplicationReadyEvent> {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingEngineStarter.class);

	private final TradingEngine tradingEngine;

	public TradingEngineStarter(TradingEngine tradingEngine) {
		this.tradingEngine = tradingEngine;
	}

	@Override
	public void onApplicationEvent(ApplicationReadyEvent event) {
		try {
			tradingEngine.initialize();
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=ENGINE_START_FAILED message={}", ex.getMessage(), ex);
			throw ex;
		}
	}

	@PreDestroy
	public void stop() {
		tradingEngine.shutdown();
	}
}
