package com.papertrade.domain.enums;

public enum PositionState {
	OPEN,
	CLOSED
}
