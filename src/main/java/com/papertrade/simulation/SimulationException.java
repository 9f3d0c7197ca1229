package com.papertrade.simulation;

public class SimulationException extends RuntimeException {

	public SimulationException(String message) {
		super(message);
	}
}
