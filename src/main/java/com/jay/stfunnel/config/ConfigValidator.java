package com.jay.stfunnel.config;

import com.jay.stfunnel.exception.PipelineValidationException;
import com.jay.stfunnel.model.BuildRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates run configuration before any stage starts.
 * Collects every violation and raises them together.
 */
@Component
public class ConfigValidator {

    public void validate(BuildRequest request) {
        List<String> violations = new ArrayList<>();
        if (request == null) {
            throw new PipelineValidationException(List.of("request is required"));
        }
        if (request.getStrategy() == null) violations.add("strategy is required (value, growth or balanced)");
        if (!(request.getInitialCapital() > 0)) violations.add("initial capital must be positive");
        if (request.getTargetHoldings() < 1 || request.getTargetHoldings() > 50) {
            violations.add("target holdings must be between 1 and 50");
        }
        if (request.getCashReservePct() < 0 || request.getCashReservePct() >= 100) {
            violations.add("cash reserve must be in [0, 100)");
        }
        checkPositionBounds(request.getMinPositionPct(), request.getMaxPositionPct(), violations);
        if (request.getMaxSectorPct() <= 0 || request.getMaxSectorPct() > 100) {
            violations.add("max sector % must be in (0, 100]");
        }
        checkScore("tier 1 min score", request.getTier1MinScore(), violations);
        checkScore("tier 3 min conviction", request.getTier3MinConviction(), violations);
        if (request.getTier1MaxCandidates() < 1) violations.add("tier 1 max candidates must be at least 1");
        if (request.getTier2MaxFinalists() < 1) violations.add("tier 2 max finalists must be at least 1");
        if (request.getTickers() != null && request.getTickers().isEmpty()) {
            violations.add("ticker override must not be empty");
        }
        if (!violations.isEmpty()) throw new PipelineValidationException(violations);
    }

    public void validate(FunnelConfig.Rebalance settings) {
        List<String> violations = new ArrayList<>();
        if (settings == null) {
            throw new PipelineValidationException(List.of("rebalance settings are required"));
        }
        checkScore("sell threshold", settings.getSellThreshold(), violations);
        checkScore("hold threshold", settings.getHoldThreshold(), violations);
        checkScore("buy threshold", settings.getBuyThreshold(), violations);
        if (settings.getSellThreshold() > settings.getHoldThreshold()) {
            violations.add("sell threshold must not exceed hold threshold");
        }
        if (settings.getMaxSellsPerReview() < 0) violations.add("max sells per review must not be negative");
        if (settings.getMaxBuysPerReview() < 0) violations.add("max buys per review must not be negative");
        if (settings.getMaxTurnoverPct() < 0) violations.add("max turnover must not be negative");
        if (settings.getTargetCashPct() < 0 || settings.getTargetCashPct() >= 100) {
            violations.add("target cash must be in [0, 100)");
        }
        if (settings.getNewCandidateLimit() < 0) violations.add("new candidate limit must not be negative");
        checkPositionBounds(settings.getMinPositionPct(), settings.getMaxPositionPct(), violations);
        if (!violations.isEmpty()) throw new PipelineValidationException(violations);
    }

    public void validate(FunnelConfig config) {
        List<String> violations = new ArrayList<>();
        if (config.tier1().getConcurrency() < 1) violations.add("tier1.concurrency must be at least 1");
        if (config.tier2().getBatchSize() < 1) violations.add("tier2.batch_size must be at least 1");
        if (config.tier3().getBatchSize() < 1) violations.add("tier3.batch_size must be at least 1");
        if (config.tier3().getAnalysisTimeoutSeconds() < 1) {
            violations.add("tier3.analysis_timeout_seconds must be at least 1");
        }
        if (!violations.isEmpty()) throw new PipelineValidationException(violations);
    }

    private void checkPositionBounds(double min, double max, List<String> violations) {
        if (min <= 0 || max > 100 || min > max) {
            violations.add("position bounds must satisfy 0 < min <= max <= 100");
        }
    }

    private void checkScore(String name, double value, List<String> violations) {
        if (value < 0 || value > 100) violations.add(name + " must be in [0, 100]");
    }
}
