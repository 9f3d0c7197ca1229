package com.papertrade.config;

import java.time.Clock;
import java.util.Random;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.papertrade.api.StatusReportFormatter;
import com.papertrade.decision.DecisionSource;
import com.papertrade.decision.RandomDecisionSource;
import com.papertrade.engine.GraduationWatcher;
import com.papertrade.engine.LiveOrderGateway;
import com.papertrade.engine.MarketScanner;
import com.papertrade.engine.ModeController;
import com.papertrade.engine.OrderRouter;
import com.papertrade.engine.TradingEngine;
import com.papertrade.engine.TradingEngineStarter;
import com.papertrade.engine.UnroutedLiveOrderGateway;
import com.papertrade.event.TradingEventHub;
import com.papertrade.simulation.OutcomeScheduler;
import com.papertrade.simulation.PromotionGate;
import com.papertrade.simulation.SimulationLedger;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
@EnableConfigurationProperties(PaperTradingProperties.class)
public class EngineConfiguration {

	@Bean
	@ConditionalOnMissingBean
	public ObjectMapper objectMapper() {
		return new ObjectMapper().findAndRegisterModules();
	}

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public Random tradingRandom() {
		return new Random();
	}

	@Bean(destroyMethod = "dispose")
	public Scheduler tradingScheduler() {
		return Schedulers.newParallel("paper-trading", 2);
	}

	@Bean
	public TradingEventHub tradingEventHub() {
		return new TradingEventHub();
	}

	@Bean
	public OutcomeScheduler outcomeScheduler(Scheduler tradingScheduler, Random tradingRandom,
			PaperTradingProperties properties) {
		return new OutcomeScheduler(tradingScheduler, tradingRandom, properties.exitPriceDeviation());
	}

	@Bean
	public PromotionGate promotionGate(PaperTradingProperties properties) {
		return new PromotionGate(properties.promotion());
	}

	@Bean
	public SimulationLedger simulationLedger(PaperTradingProperties properties,
			OutcomeScheduler outcomeScheduler,
			PromotionGate promotionGate,
			TradingEventHub tradingEventHub,
			Clock clock) {
		return new SimulationLedger(properties, outcomeScheduler, promotionGate, tradingEventHub, clock);
	}

	@Bean
	public ModeController modeController(SimulationLedger simulationLedger, PromotionGate promotionGate,
			TradingEventHub tradingEventHub, Clock clock) {
		return new ModeController(simulationLedger, promotionGate, tradingEventHub, clock);
	}

	@Bean
	@ConditionalOnMissingBean
	public DecisionSource decisionSource(PaperTradingProperties properties, Random tradingRandom) {
		return new RandomDecisionSource(properties.mockMarket(), tradingRandom);
	}

	@Bean
	@ConditionalOnMissingBean
	public LiveOrderGateway liveOrderGateway(Clock clock) {
		return new UnroutedLiveOrderGateway(clock);
	}

	@Bean
	public OrderRouter orderRouter(SimulationLedger simulationLedger, ModeController modeController,
			LiveOrderGateway liveOrderGateway) {
		return new OrderRouter(simulationLedger, modeController, liveOrderGateway);
	}

	@Bean
	public MarketScanner marketScanner(DecisionSource decisionSource,
			OrderRouter orderRouter,
			ModeController modeController,
			PaperTradingProperties properties,
			Scheduler tradingScheduler) {
		return new MarketScanner(decisionSource, orderRouter, modeController, properties.symbols(),
				properties.scanInterval(), properties.minConfidence(), tradingScheduler);
	}

	@Bean
	public GraduationWatcher graduationWatcher(SimulationLedger simulationLedger,
			PromotionGate promotionGate,
			ModeController modeController,
			TradingEventHub tradingEventHub,
			PaperTradingProperties properties,
			Scheduler tradingScheduler,
			Clock clock) {
		return new GraduationWatcher(simulationLedger, promotionGate, modeController, tradingEventHub,
				properties.graduationCheckInterval(), tradingScheduler, clock);
	}

	@Bean
	public StatusReportFormatter statusReportFormatter(ObjectMapper objectMapper, PaperTradingProperties properties) {
		return new StatusReportFormatter(objectMapper, properties.initialBalance());
	}

	@Bean
	public TradingEngine tradingEngine(PaperTradingProperties properties,
			DecisionSource decisionSource,
			SimulationLedger simulationLedger,
			OutcomeScheduler outcomeScheduler,
			PromotionGate promotionGate,
			ModeController modeController,
			OrderRouter orderRouter,
			MarketScanner marketScanner,
			GraduationWatcher graduationWatcher,
			TradingEventHub tradingEventHub,
			StatusReportFormatter statusReportFormatter,
			Clock clock) {
		return new TradingEngine(properties, decisionSource, simulationLedger, outcomeScheduler, promotionGate,
				modeController, orderRouter, marketScanner, graduationWatcher, tradingEventHub, statusReportFormatter,
				clock);
	}

	@Bean
	public TradingEngineStarter tradingEngineStarter(TradingEngine tradingEngine) {
		return new TradingEngineStarter(tradingEngine);
	}
}
