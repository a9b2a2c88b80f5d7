package com.jay.stfunnel.layer2_scoring;

import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.ScoreResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StockRankerTest {

    private final StockRanker ranker = new StockRanker();

    private static ScoreResult score(String ticker, String sector, int total) {
        Candidate c = Candidate.builder().ticker(ticker).sector(sector).build();
        return new ScoreResult(c, 50, 50, 50, 50, 50, total);
    }

    @Test
    void sectorCapSkipsExcessNamesFromOneSector() {
        List<ScoreResult> scores = List.of(
            score("T1", "Technology", 90),
            score("T2", "Technology", 88),
            score("T3", "Technology", 86),
            score("E1", "Energy", 70),
            score("H1", "Healthcare", 65));

        // 4 targets at 25% -> at most 1 per sector
        StockRanker.RankingResult result = ranker.rank(scores, 4, 0.25, 50);

        assertThat(result.tickers()).containsExactly("T1", "E1", "H1");
        assertThat(result.excludedReasons()).containsEntry("sectorLimit", 2);
        assertThat(result.sectorBreakdown()).containsEntry("Technology", 1);
    }

    @Test
    void lowScoresAreExcluded() {
        StockRanker.RankingResult result = ranker.rank(
            List.of(score("A", "X", 40), score("B", "Y", 60)), 10, 1.0, 50);

        assertThat(result.tickers()).containsExactly("B");
        assertThat(result.excludedReasons()).containsEntry("lowScore", 1);
    }

    @Test
    void equalScoresKeepInputOrder() {
        StockRanker.RankingResult result = ranker.rank(
            List.of(score("A", "X", 60), score("B", "Y", 60), score("C", "Z", 60)), 10, 1.0, 0);

        assertThat(result.tickers()).containsExactly("A", "B", "C");
    }

    @Test
    void missingSectorCountsAsUnknown() {
        StockRanker.RankingResult result = ranker.rank(List.of(score("A", null, 60)), 4, 0.25, 0);

        assertThat(result.sectorBreakdown()).containsKey("Unknown");
    }

    @Test
    void suggestedWeightsSumToOneAndFavourHigherScores() {
        List<Double> weights = ranker.suggestWeights(List.of(score("A", "X", 90), score("B", "Y", 60)));

        assertThat(weights.get(0)).isGreaterThan(weights.get(1));
        assertThat(weights.stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(0.002));
        assertThat(ranker.suggestWeights(List.of())).isEmpty();
    }
}
