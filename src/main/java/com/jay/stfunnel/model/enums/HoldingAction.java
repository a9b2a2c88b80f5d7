package com.jay.stfunnel.model.enums;

public enum HoldingAction {
    HOLD,
    TRIM,
    SELL,
    ADD
}
