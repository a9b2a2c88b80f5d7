package com.jay.stfunnel.layer3_triage;

import com.jay.stfunnel.model.TriageChecks;
import com.jay.stfunnel.model.TriageFlag;
import com.jay.stfunnel.model.TriageVerdict;
import com.jay.stfunnel.model.enums.TriageDecision;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 3: Tier 2 rule-based triage.
 * Turns the qualitative check bundle into red and green flags, then applies the
 * decision table. First matching rule wins:
 *   1. two or more major red flags                              → REJECT
 *   2. exactly one major red flag and no major green flag        → REJECT
 *   3. tier1 ≥ 70, two or more major green, no major red          → FAST_TRACK
 *   4. tier1 ≥ 55, no major red                                   → PASS
 *   5. red flags outnumber green flags by more than two           → REJECT
 *   6. anything else                                              → NEEDS_REVIEW
 */
@Component
public class TriageEngine {

    public record Decision(TriageDecision decision, String reasoning) {}

    /** Full evaluation of one ticker from its check bundle. */
    public TriageVerdict evaluate(String sector, int tier1Score, TriageChecks checks) {
        List<TriageFlag> red = new ArrayList<>();
        List<TriageFlag> green = new ArrayList<>();
        TriageVerdict.TriageVerdictBuilder verdict = TriageVerdict.builder()
            .ticker(checks.getTicker())
            .companyName(checks.getCompanyName())
            .sector(sector)
            .price(checks.getPrice())
            .tier1Score(tier1Score)
            .beta(checks.getBeta())
            .shortInterestPct(checks.getShortPercentOfFloat());

        verdict.analystConsensus(checkConsensus(checks, red, green));
        verdict.targetUpside(checkTargetUpside(checks, red, green));
        checkShortInterest(checks.getShortPercentOfFloat(), red);
        Double surprise = checkEarnings(checks.getEarningsHistory(), red, green);
        verdict.lastEarningsSurprise(surprise);
        verdict.earningsSentiment(surprise == null ? null : surprise > 5 ? "BEAT" : surprise < -5 ? "MISS" : "INLINE");
        checkBeta(checks.getBeta(), red, green);
        checkRatingTrend(checks.getRecentUpgrades(), checks.getRecentDowngrades(), red, green);

        Decision decision = decide(tier1Score, red, green);
        return verdict
            .decision(decision.decision())
            .reasoning(decision.reasoning())
            .redFlags(labels(red))
            .greenFlags(labels(green))
            .build();
    }

    /** Outcome when the check bundle could not be fetched: never a crash, never a silent pass. */
    public TriageVerdict providerFailure(String ticker, String companyName, String sector, int tier1Score, String message) {
        return TriageVerdict.builder()
            .ticker(ticker)
            .companyName(companyName)
            .sector(sector)
            .tier1Score(tier1Score)
            .decision(TriageDecision.NEEDS_REVIEW)
            .reasoning("Unable to complete triage checks: " + message)
            .redFlags(List.of("Data fetch error: " + message))
            .build();
    }

    /** Decision table over labelled flags; majors are recognised by keyword. */
    public Decision decideFromLabels(double tier1Score, List<String> redFlags, List<String> greenFlags) {
        return decide(tier1Score,
            redFlags.stream().map(TriageFlag::red).toList(),
            greenFlags.stream().map(TriageFlag::green).toList());
    }

    public Decision decide(double tier1Score, List<TriageFlag> red, List<TriageFlag> green) {
        List<String> majorRed = red.stream().filter(TriageFlag::major).map(TriageFlag::label).toList();
        List<String> majorGreen = green.stream().filter(TriageFlag::major).map(TriageFlag::label).toList();
        String score = formatScore(tier1Score);

        if (majorRed.size() >= 2) {
            return new Decision(TriageDecision.REJECT,
                "Rejected due to major red flags: " + String.join("; ", majorRed));
        }
        if (majorRed.size() == 1 && majorGreen.isEmpty()) {
            return new Decision(TriageDecision.REJECT, "Rejected due to: " + majorRed.get(0));
        }
        if (tier1Score >= 70 && majorGreen.size() >= 2 && majorRed.isEmpty()) {
            return new Decision(TriageDecision.FAST_TRACK,
                "Fast-tracked: High Tier 1 score (" + score + ") with positive signals: " + String.join("; ", majorGreen));
        }
        if (tier1Score >= 55 && majorRed.isEmpty()) {
            return new Decision(TriageDecision.PASS, String.format(
                "Passed: Score %s with %d positive signals and no major concerns", score, green.size()));
        }
        if (red.size() > green.size() + 2) {
            return new Decision(TriageDecision.REJECT, String.format(
                "Rejected: Too many concerns (%d red flags vs %d green flags)", red.size(), green.size()));
        }
        return new Decision(TriageDecision.NEEDS_REVIEW, String.format(
            "Mixed signals: %d concerns, %d positives. Manual review recommended.", red.size(), green.size()));
    }

    // ── Checks ─────────────────────────────────────────────────────────────────

    private String checkConsensus(TriageChecks checks, List<TriageFlag> red, List<TriageFlag> green) {
        int total = checks.analystCount();
        if (total == 0) return null;
        double bullishPct = (checks.getStrongBuy() + checks.getBuy()) * 100.0 / total;
        double bearishPct = (checks.getSell() + checks.getStrongSell()) * 100.0 / total;

        if (bullishPct >= 70) {
            green.add(TriageFlag.major("Strong analyst consensus (70%+ bullish)"));
            return "Strong Buy";
        }
        if (bullishPct >= 50) {
            green.add(TriageFlag.minor("Positive analyst consensus"));
            return "Buy";
        }
        if (bearishPct >= 40) {
            red.add(TriageFlag.major("Negative analyst consensus (40%+ bearish)"));
            return "Sell";
        }
        return "Hold";
    }

    private Double checkTargetUpside(TriageChecks checks, List<TriageFlag> red, List<TriageFlag> green) {
        Double target = checks.getTargetMeanPrice();
        Double price = checks.getPrice();
        if (target == null || target <= 0 || price == null || price <= 0) return null;

        double upside = (target - price) / price * 100;
        if (upside > 20) {
            green.add(TriageFlag.major(String.format("High target upside (%.0f%%)", upside)));
        } else if (upside < -10) {
            red.add(TriageFlag.minor(String.format("Negative target upside (%.0f%%)", upside)));
        }
        return upside;
    }

    private void checkShortInterest(Double shortPct, List<TriageFlag> red) {
        if (shortPct == null) return;
        if (shortPct > 25) {
            red.add(TriageFlag.major(String.format("Extreme short interest (%.1f%%)", shortPct)));
        } else if (shortPct > 15) {
            red.add(TriageFlag.minor(String.format("High short interest (%.1f%%)", shortPct)));
        }
    }

    private Double checkEarnings(List<TriageChecks.EarningsQuarter> history, List<TriageFlag> red, List<TriageFlag> green) {
        if (history == null || history.isEmpty()) return null;

        Double surprise = null;
        TriageChecks.EarningsQuarter latest = history.get(0);
        if (latest.epsActual() != null && latest.epsEstimate() != null && latest.epsEstimate() != 0) {
            surprise = (latest.epsActual() - latest.epsEstimate()) / Math.abs(latest.epsEstimate()) * 100;
            if (surprise > 5) {
                green.add(TriageFlag.major(String.format("Earnings beat (+%.1f%%)", surprise)));
            } else if (surprise < -5) {
                red.add(TriageFlag.minor(String.format("Earnings miss (%.1f%%)", surprise)));
            }
        }
        if (history.size() >= 2 && history.get(0).isMiss() && history.get(1).isMiss()) {
            red.add(TriageFlag.major("Two consecutive earnings misses"));
        }
        return surprise;
    }

    private void checkBeta(Double beta, List<TriageFlag> red, List<TriageFlag> green) {
        if (beta == null) return;
        if (beta > 2.0) {
            red.add(TriageFlag.major(String.format("Very high beta (%.2f)", beta)));
        } else if (beta > 1.5) {
            red.add(TriageFlag.minor(String.format("High beta (%.2f)", beta)));
        } else if (beta < 1.0) {
            green.add(TriageFlag.minor(String.format("Low beta (%.2f)", beta)));
        }
    }

    private void checkRatingTrend(int upgrades, int downgrades, List<TriageFlag> red, List<TriageFlag> green) {
        if (upgrades > downgrades + 2) {
            green.add(TriageFlag.minor(String.format("Recent upgrades (%d up vs %d down)", upgrades, downgrades)));
        } else if (downgrades > upgrades + 2) {
            red.add(TriageFlag.minor(String.format("Recent downgrades (%d down vs %d up)", downgrades, upgrades)));
        }
    }

    private static List<String> labels(List<TriageFlag> flags) {
        return flags.stream().map(TriageFlag::label).toList();
    }

    private static String formatScore(double score) {
        return score == Math.rint(score) ? String.valueOf((long) score) : String.format("%.1f", score);
    }
}
