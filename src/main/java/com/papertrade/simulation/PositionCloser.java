package com.papertrade.simulation;

import java.math.BigDecimal;

@FunctionalInterface
public interface PositionCloser {

	Position close(String positionId, BigDecimal exitPrice);
}
