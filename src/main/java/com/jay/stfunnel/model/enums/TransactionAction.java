package com.jay.stfunnel.model.enums;

public enum TransactionAction {
    BUY,
    SELL
}
