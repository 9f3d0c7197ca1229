package com.papertrade.simulation;

public class UnknownPositionException extends SimulationException {

	private final String positionId;

	public UnknownPositionException(String positionId) {
		super("No open position with id " + positionId);
		this.positionId = positionId;
	}

	public String positionId() {
		return positionId;
	}
}
