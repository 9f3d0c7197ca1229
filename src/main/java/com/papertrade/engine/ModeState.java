package com.papertrade.engine;

import com.papertrade.domain.enums.RunMode;

public record ModeState(RunMode mode, boolean running) {
}
