package com.papertrade.decision;

import reactor.core.publisher.Mono;

public interface DecisionSource {

	Mono<TradeProposal> propose(String symbol);
}
