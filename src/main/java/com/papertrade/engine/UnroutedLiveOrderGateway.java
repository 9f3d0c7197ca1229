package com.papertrade.engine;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.papertrade.decision.TradeProposal;

import reactor.core.publisher.Mono;

public class UnroutedLiveOrderGateway implements LiveOrderGateway {

	private static final Logger LOGGER = LoggerFactory.getLogger(UnroutedLiveOrderGateway.class);
	static final String NOT_ROUTED_MESSAGE = "live order routing not configured";

	private final Clock clock;
	private final AtomicLong sequence = new AtomicLong(0L);

	public UnroutedLiveOrderGateway(Clock clock) {
		this.clock = clock;
	}

	@Override
	public Mono<LiveOrderReceipt> submit(TradeProposal proposal) {
		return Mono.fromSupplier(() -> {
			long now = clock.millis();
			String orderId = "LIVE-" + now + "-" + sequence.incrementAndGet();
			LOGGER.warn("EVENT=LIVE_ORDER_NOT_ROUTED orderId={} symbol={} side={} amount={} price={}", orderId,
					proposal.symbol(), proposal.side(), proposal.amount(), proposal.price());
			return new LiveOrderReceipt(orderId, proposal.symbol(), false, NOT_ROUTED_MESSAGE, now);
		});
	}
}
