package com.papertrade.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.papertrade.config.PaperTradingProperties;
import com.papertrade.domain.enums.RunMode;
import com.papertrade.event.ReadyForLive;
import com.papertrade.event.TradingEvent;
import com.papertrade.event.TradingEventHub;
import com.papertrade.simulation.PerformanceCounters;
import com.papertrade.simulation.PromotionGate;
import com.papertrade.simulation.SimulationLedger;

import reactor.test.scheduler.VirtualTimeScheduler;

class GraduationWatcherTest {

	private static final PerformanceCounters READY = new PerformanceCounters(60, 60, 50, new BigDecimal("750"),
			new BigDecimal("0.95"), 90.0);
	private static final PerformanceCounters NOT_READY = new PerformanceCounters(60, 20, 10, new BigDecimal("-50"),
			new BigDecimal("0.7"), 30.0);

	private final SimulationLedger ledger = mock(SimulationLedger.class);
	private final ModeController modeController = mock(ModeController.class);
	private final TradingEventHub eventHub = new TradingEventHub();
	private final List<TradingEvent> events = new CopyOnWriteArrayList<>();
	private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
	private GraduationWatcher watcher;

	@BeforeEach
	void setUp() {
		eventHub.subscribe(events::add);
		watcher = new GraduationWatcher(ledger, new PromotionGate(PaperTradingProperties.Promotion.defaults()),
				modeController, eventHub, Duration.ofMinutes(5), scheduler,
				Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
	}

	@Test
	void announcesReadinessWhileSimulated() {
		when(modeController.currentMode()).thenReturn(RunMode.SIMULATED);
		when(ledger.counters()).thenReturn(READY);

		assertThat(watcher.check()).isTrue();

		assertThat(events).singleElement()
				.isInstanceOfSatisfying(ReadyForLive.class, event -> assertThat(event.counters()).isEqualTo(READY));
	}

	@Test
	void staysQuietWhenGateFails() {
		when(modeController.currentMode()).thenReturn(RunMode.SIMULATED);
		when(ledger.counters()).thenReturn(NOT_READY);

		assertThat(watcher.check()).isFalse();
		assertThat(events).isEmpty();
	}

	@Test
	void staysQuietInLiveMode() {
		when(modeController.currentMode()).thenReturn(RunMode.LIVE);
		when(ledger.counters()).thenReturn(READY);

		assertThat(watcher.check()).isFalse();
		assertThat(events).isEmpty();
	}

	@Test
	void checksOnEveryInterval() {
		when(modeController.currentMode()).thenReturn(RunMode.SIMULATED);
		when(ledger.counters()).thenReturn(READY);

		watcher.start();
		scheduler.advanceTimeBy(Duration.ofMinutes(4));
		assertThat(events).isEmpty();

		scheduler.advanceTimeBy(Duration.ofMinutes(6));
		assertThat(events).hasSize(2);

		watcher.stop();
		scheduler.advanceTimeBy(Duration.ofMinutes(30));
		assertThat(events).hasSize(2);
	}
}
