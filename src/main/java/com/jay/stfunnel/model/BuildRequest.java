package com.jay.stfunnel.model;

import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.model.enums.Strategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Tunables for one portfolio construction run. Percentages are whole numbers (25 = 25%).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BuildRequest {
    private String name;
    private Strategy strategy;
    private double initialCapital;
    private int targetHoldings;
    private double cashReservePct;
    private double maxSectorPct;
    private double maxPositionPct;
    private double minPositionPct;

    private double tier1MinScore;
    private int tier1MaxCandidates;
    private int tier2MaxFinalists;
    private double tier3MinConviction;

    // Optional universe override; null means the configured universe
    private List<String> tickers;

    public static BuildRequest defaults(FunnelConfig config, Strategy strategy) {
        FunnelConfig.Portfolio p = config.portfolio();
        return BuildRequest.builder()
            .strategy(strategy)
            .initialCapital(p.getInitialCapital())
            .targetHoldings(p.getTargetHoldings())
            .cashReservePct(p.getCashReservePct())
            .maxSectorPct(p.getMaxSectorPct())
            .maxPositionPct(p.getMaxPositionPct())
            .minPositionPct(p.getMinPositionPct())
            .tier1MinScore(config.tier1().getMinScore())
            .tier1MaxCandidates(config.tier1().getMaxCandidates())
            .tier2MaxFinalists(config.tier2().getMaxFinalists())
            .tier3MinConviction(config.tier3().getMinConviction())
            .build();
    }

    /** Fills every unset (zero or null) field from the configured defaults. */
    public BuildRequest withDefaults(FunnelConfig config) {
        BuildRequest d = defaults(config, strategy);
        return toBuilder()
            .initialCapital(initialCapital > 0 ? initialCapital : d.initialCapital)
            .targetHoldings(targetHoldings > 0 ? targetHoldings : d.targetHoldings)
            .cashReservePct(cashReservePct > 0 ? cashReservePct : d.cashReservePct)
            .maxSectorPct(maxSectorPct > 0 ? maxSectorPct : d.maxSectorPct)
            .maxPositionPct(maxPositionPct > 0 ? maxPositionPct : d.maxPositionPct)
            .minPositionPct(minPositionPct > 0 ? minPositionPct : d.minPositionPct)
            .tier1MinScore(tier1MinScore > 0 ? tier1MinScore : d.tier1MinScore)
            .tier1MaxCandidates(tier1MaxCandidates > 0 ? tier1MaxCandidates : d.tier1MaxCandidates)
            .tier2MaxFinalists(tier2MaxFinalists > 0 ? tier2MaxFinalists : d.tier2MaxFinalists)
            .tier3MinConviction(tier3MinConviction > 0 ? tier3MinConviction : d.tier3MinConviction)
            .build();
    }
}
