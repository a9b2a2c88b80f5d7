package com.jay.stfunnel.layer7_ledger;

import com.jay.stfunnel.entity.StockAnalysisRecord;
import com.jay.stfunnel.entity.StockScoreRecord;
import com.jay.stfunnel.entity.TriageDecisionRecord;
import com.jay.stfunnel.layer3_triage.TriageWorkflow;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.ScoreResult;
import com.jay.stfunnel.model.TriageVerdict;
import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.model.enums.TriageDecision;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(AnalysisLedger.class)
class AnalysisLedgerTest {

    private static final String RUN = "IPB-BALANCED-1";

    @Autowired
    private AnalysisLedger ledger;

    private static ScoreResult score(String ticker, int total) {
        Candidate c = Candidate.builder().ticker(ticker).companyName(ticker + " Inc").sector("Technology")
            .price(50.0).peRatio(18.0).build();
        return new ScoreResult(c, 60, 60, 60, 60, 60, total);
    }

    private static TriageVerdict verdict(String ticker, TriageDecision decision) {
        return TriageVerdict.builder().ticker(ticker).tier1Score(70).decision(decision)
            .reasoning("Passed triage").greenFlags(List.of("Strong analyst consensus")).build();
    }

    private static ConvictionResult conviction(String ticker, int score) {
        return ConvictionResult.builder()
            .ticker(ticker).companyName(ticker + " Inc").sector("Technology").price(50.0)
            .tier1Score(70).tier2Decision(TriageDecision.PASS)
            .valuationScore(60).sentimentScore(60).riskScore(60).earningsScore(70).qualityScore(60)
            .compositeUpside(12.5)
            .convictionScore(score).convictionLevel(ConvictionLevel.HIGH)
            .bullFactors(List.of("Analysts bullish")).bearFactors(List.of())
            .reasoning("Composite view")
            .build();
    }

    @Test
    void scoresAreReadBackHighestFirst() {
        assertThat(ledger.saveScores(RUN, Strategy.BALANCED, List.of(score("LOW", 40), score("HIGH", 80)))).isEqualTo(2);

        assertThat(ledger.scores(RUN)).extracting(StockScoreRecord::getTicker).containsExactly("HIGH", "LOW");
        assertThat(ledger.scores("OTHER")).isEmpty();
    }

    @Test
    void overflowFinalistIsLoggedAsRejected() {
        TriageVerdict kept = verdict("KEEP", TriageDecision.FAST_TRACK);
        TriageVerdict cut = verdict("CUT", TriageDecision.PASS);
        TriageWorkflow.Tier2Result result = new TriageWorkflow.Tier2Result(
            List.of(kept), List.of(cut), List.of(), List.of(kept, cut), Set.of("CUT"));

        assertThat(ledger.saveTriageDecisions(RUN, result)).isEqualTo(2);

        List<TriageDecisionRecord> rows = ledger.triageDecisions(RUN);
        assertThat(rows).filteredOn(r -> r.getTicker().equals("CUT")).singleElement().satisfies(r -> {
            assertThat(r.getDecision()).isEqualTo(TriageDecision.PASS);
            assertThat(r.getFinalDecision()).isEqualTo(TriageDecision.REJECT);
            assertThat(r.getReasoning()).isEqualTo("Passed triage | Exceeded max finalists limit");
        });
        assertThat(rows).filteredOn(r -> r.getTicker().equals("KEEP")).singleElement().satisfies(r -> {
            assertThat(r.getFinalDecision()).isEqualTo(TriageDecision.FAST_TRACK);
            assertThat(r.getGreenFlags()).contains("Strong analyst consensus");
        });
    }

    @Test
    void analysisIsUpsertedPerRunAndTicker() {
        ledger.saveAnalysis(RUN, conviction("ACME", 70), false, null, "first pass");
        ledger.saveAnalysis(RUN, conviction("ACME", 75), true, null, "second pass");
        ledger.saveAnalysis(RUN, conviction("BETA", 58), false, "Below minimum conviction", null);

        List<StockAnalysisRecord> rows = ledger.analyses(RUN);

        assertThat(rows).extracting(StockAnalysisRecord::getTicker).containsExactly("ACME", "BETA");
        StockAnalysisRecord acme = rows.get(0);
        assertThat(acme.getConvictionScore()).isEqualTo(75);
        assertThat(acme.isSelected()).isTrue();
        assertThat(acme.getResearchSummary()).isEqualTo("second pass");
        assertThat(acme.getEarningsSentiment()).isEqualTo("beat");
        assertThat(acme.getInvestmentThesis())
            .isEqualTo("ACME: HIGH conviction (75/100), composite upside 12.5%. Bull case: Analysts bullish.");
        assertThat(rows.get(1).getRejectionReason()).isEqualTo("Below minimum conviction");
    }

    @Test
    void earningsSentimentBands() {
        assertThat(AnalysisLedger.earningsSentiment(65)).isEqualTo("beat");
        assertThat(AnalysisLedger.earningsSentiment(64)).isEqualTo("inline");
        assertThat(AnalysisLedger.earningsSentiment(45)).isEqualTo("inline");
        assertThat(AnalysisLedger.earningsSentiment(44)).isEqualTo("miss");
    }
}
