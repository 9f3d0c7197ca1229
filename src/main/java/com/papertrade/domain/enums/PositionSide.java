package com.papertrade.domain.enums;

import java.util.Locale;

public enum PositionSide {
	LONG,
	SHORT;

	public static PositionSide fromOrderSide(String side) {
		if (side == null) {
			throw new IllegalArgumentException("Order side is required");
		}
		return switch (side.trim().toUpperCase(Locale.ROOT)) {
			case "BUY", "LONG" -> LONG;
			case "SELL", "SHORT" -> SHORT;
			default -> throw new IllegalArgumentException("Unknown order side " + side);
		};
	}
}
