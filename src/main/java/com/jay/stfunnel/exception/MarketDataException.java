package com.jay.stfunnel.exception;

public class MarketDataException extends RuntimeException {
    private final String ticker;

    public MarketDataException(String ticker, String message) {
        super(message);
        this.ticker = ticker;
    }

    public MarketDataException(String ticker, String message, Throwable cause) {
        super(message, cause);
        this.ticker = ticker;
    }

    public String getTicker() {
        return ticker;
    }
}
