package com.papertrade.engine;

public record LiveOrderReceipt(
		String orderId,
		String symbol,
		boolean routed,
		String message,
		long submittedAtMs) {
}
