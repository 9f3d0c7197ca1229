package com.papertrade.simulation;

public class NotReadyException extends SimulationException {

	private final PromotionCheck check;

	public NotReadyException(PromotionCheck check) {
		super("Promotion gate not passed: " + check.requirements());
		this.check = check;
	}

	public PromotionCheck check() {
		return check;
	}
}
