package com.papertrade.engine;

import com.papertrade.decision.TradeProposal;

import reactor.core.publisher.Mono;

public interface LiveOrderGateway {

	Mono<LiveOrderReceipt> submit(TradeProposal proposal);
}
