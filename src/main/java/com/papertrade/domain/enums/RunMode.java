package com.papertrade.domain.enums;

public enum RunMode {
	SIMULATED,
	LIVE
}
