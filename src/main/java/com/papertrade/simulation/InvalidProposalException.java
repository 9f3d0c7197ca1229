package com.papertrade.simulation;

public class InvalidProposalException extends SimulationException {

	private final String symbol;

	public InvalidProposalException(String symbol, String message) {
		super(message);
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
