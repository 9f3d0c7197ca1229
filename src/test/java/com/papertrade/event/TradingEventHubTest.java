package com.papertrade.event;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;

import com.papertrade.domain.enums.RunMode;

import reactor.core.Disposable;
import reactor.test.StepVerifier;

class TradingEventHubTest {

	private final TradingEventHub hub = new TradingEventHub();

	@Test
	void publishWithoutSubscribersIsDropped() {
		hub.publish(new TradingStarted(RunMode.SIMULATED, 1L));

		List<TradingEvent> received = new CopyOnWriteArrayList<>();
		hub.subscribe(received::add);
		hub.publish(new TradingStopped(RunMode.SIMULATED, 2L));

		assertThat(received).containsExactly(new TradingStopped(RunMode.SIMULATED, 2L));
	}

	@Test
	void failingListenerDoesNotStarveOthers() {
		List<TradingEvent> received = new CopyOnWriteArrayList<>();
		hub.subscribe(event -> {
			throw new IllegalStateException("boom");
		});
		hub.subscribe(received::add);

		hub.publish(new TradingStarted(RunMode.SIMULATED, 1L));
		hub.publish(new ModeChanged(RunMode.SIMULATED, RunMode.LIVE, 2L));

		assertThat(received).hasSize(2);
	}

	@Test
	void disposedListenerStopsReceiving() {
		List<TradingEvent> received = new CopyOnWriteArrayList<>();
		Disposable subscription = hub.subscribe(received::add);

		hub.publish(new TradingStarted(RunMode.SIMULATED, 1L));
		subscription.dispose();
		hub.publish(new TradingStopped(RunMode.SIMULATED, 2L));

		assertThat(received).hasSize(1);
	}

	@Test
	void completeEndsTheStream() {
		StepVerifier.create(hub.flux())
				.then(() -> hub.publish(new TradingStarted(RunMode.LIVE, 3L)))
				.expectNext(new TradingStarted(RunMode.LIVE, 3L))
				.then(hub::complete)
				.verifyComplete();
	}
}
