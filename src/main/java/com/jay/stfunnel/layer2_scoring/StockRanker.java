package com.jay.stfunnel.layer2_scoring;

import com.jay.stfunnel.model.ScoreResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sector-capped ranking of Tier 1 scores with a pre-conviction weight suggestion.
 */
@Slf4j
@Component
public class StockRanker {

    public record RankedStock(ScoreResult score, double weight) {}

    public record RankingResult(List<RankedStock> selected,
                                Map<String, Integer> sectorBreakdown,
                                Map<String, Integer> excludedReasons) {
        public List<String> tickers() {
            return selected.stream().map(r -> r.score().ticker()).toList();
        }
    }

    /**
     * @param targetCount  number of names to admit
     * @param maxSectorPct sector cap as a fraction (0.25 = 25%)
     * @param minScore     scores below this are excluded as lowScore
     */
    public RankingResult rank(List<ScoreResult> scores, int targetCount, double maxSectorPct, double minScore) {
        Map<String, Integer> excluded = new LinkedHashMap<>();
        excluded.put("lowScore", 0);
        excluded.put("sectorLimit", 0);

        List<ScoreResult> eligible = new ArrayList<>();
        for (ScoreResult s : scores) {
            if (s.totalScore() < minScore) excluded.merge("lowScore", 1, Integer::sum);
            else eligible.add(s);
        }
        // Stable sort: equal scores keep input order
        eligible.sort(Comparator.comparingInt(ScoreResult::totalScore).reversed());

        int maxPerSector = (int) Math.ceil(targetCount * maxSectorPct);
        Map<String, Integer> sectorCounts = new TreeMap<>();
        List<ScoreResult> admitted = new ArrayList<>();
        for (ScoreResult s : eligible) {
            if (admitted.size() >= targetCount) break;
            String sector = s.candidate().sectorOrUnknown();
            int count = sectorCounts.getOrDefault(sector, 0);
            if (count >= maxPerSector) {
                excluded.merge("sectorLimit", 1, Integer::sum);
                continue;
            }
            sectorCounts.put(sector, count + 1);
            admitted.add(s);
        }

        List<Double> weights = suggestWeights(admitted);
        List<RankedStock> ranked = new ArrayList<>();
        for (int i = 0; i < admitted.size(); i++) {
            ranked.add(new RankedStock(admitted.get(i), weights.get(i)));
        }
        log.info("Ranking: {} admitted of {} scored (max {}/sector), excluded {}",
            ranked.size(), scores.size(), maxPerSector, excluded);
        return new RankingResult(ranked, sectorCounts, excluded);
    }

    /**
     * Equal weight plus a score-proportional tilt of at most 20%, renormalized to sum to 1.
     */
    List<Double> suggestWeights(List<ScoreResult> admitted) {
        if (admitted.isEmpty()) return List.of();
        int n = admitted.size();
        double scoreSum = admitted.stream().mapToDouble(ScoreResult::totalScore).sum();

        List<Double> raw = new ArrayList<>();
        for (ScoreResult s : admitted) {
            double tilt = scoreSum > 0 ? (s.totalScore() / scoreSum) * 0.2 : 0;
            raw.add(round3(1.0 / n + tilt));
        }
        double rawSum = raw.stream().mapToDouble(Double::doubleValue).sum();
        return raw.stream().map(w -> round3(w / rawSum)).toList();
    }

    private static double round3(double v) {
        return Math.round(v * 1000) / 1000.0;
    }
}
