package com.papertrade.event;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

public class TradingEventHub {

	private static final Logger LOGGER = LoggerFactory.getLogger(TradingEventHub.class);

	private final Sinks.Many<TradingEvent> sink = Sinks.many().multicast().directBestEffort();

	public synchronized void publish(TradingEvent event) {
		Sinks.EmitResult result = sink.tryEmitNext(event);
		if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
			LOGGER.warn("EVENT=TRADING_EVENT_EMIT_FAIL type={} result={}", event.getClass().getSimpleName(), result);
		}
	}

	public Flux<TradingEvent> flux() {
		return sink.asFlux();
	}

	public Disposable subscribe(Consumer<? super TradingEvent> listener) {
		return flux().subscribe(event -> {
			try {
				listener.accept(event);
			} catch (RuntimeException ex) {
				LOGGER.error("EVENT=TRADING_LISTENER_ERROR type={} message={}", event.getClass().getSimpleName(),
						ex.getMessage(), ex);
			}
		});
	}

	public void complete() {
		sink.tryEmitComplete();
	}
}
