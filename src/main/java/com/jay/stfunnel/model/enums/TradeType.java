package com.jay.stfunnel.model.enums;

/** Recommended rebalance trade; each maps onto a BUY or SELL ledger transaction. */
public enum TradeType {
    SELL(TransactionAction.SELL),
    TRIM(TransactionAction.SELL),
    ADD(TransactionAction.BUY),
    BUY(TransactionAction.BUY);

    private final TransactionAction side;

    TradeType(TransactionAction side) {
        this.side = side;
    }

    public TransactionAction side() {
        return side;
    }
}
