package com.jay.stfunnel.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time metric snapshot for one ticker, as returned by the market-data provider.
 * Every metric may be null; scoring substitutes neutral defaults.
 */
@Value
@Builder(toBuilder = true)
public class Candidate {
    String ticker;
    String companyName;
    String sector;

    // ── Quote ─────────────────────────────────────────────────────────────────
    Double price;
    Double marketCap;
    Double beta;
    Double fiftyTwoWeekChange;   // %

    // ── Valuation ─────────────────────────────────────────────────────────────
    Double peRatio;
    Double pbRatio;
    Double psRatio;
    Double dividendYield;        // %

    // ── Quality ───────────────────────────────────────────────────────────────
    Double profitMargin;         // %
    Double roe;                  // %
    Double currentRatio;
    Double debtToEquity;

    // ── Growth ────────────────────────────────────────────────────────────────
    Double revenueGrowth;        // % YoY
    Double earningsGrowth;       // % YoY

    public double priceOrZero() {
        return price != null ? price : 0;
    }

    public String sectorOrUnknown() {
        return sector == null || sector.isBlank() ? "Unknown" : sector;
    }
}
