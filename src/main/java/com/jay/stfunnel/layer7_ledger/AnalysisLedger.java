package com.jay.stfunnel.layer7_ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.stfunnel.entity.StockAnalysisRecord;
import com.jay.stfunnel.entity.StockScoreRecord;
import com.jay.stfunnel.entity.TriageDecisionRecord;
import com.jay.stfunnel.layer3_triage.TriageWorkflow;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.ConvictionResult;
import com.jay.stfunnel.model.ScoreResult;
import com.jay.stfunnel.model.TriageVerdict;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.repository.StockAnalysisRecordRepository;
import com.jay.stfunnel.repository.StockScoreRecordRepository;
import com.jay.stfunnel.repository.TriageDecisionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Layer 7: per-run research audit trail.
 * Tier 1 scores, the Tier 2 triage log and every Tier 3 analysis (selected or not) are kept
 * against the run id. A failed row is logged and skipped; the rest of the batch is still written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisLedger {

    private final StockScoreRecordRepository scoreRepo;
    private final TriageDecisionRecordRepository triageRepo;
    private final StockAnalysisRecordRepository analysisRepo;
    private final ObjectMapper mapper = new ObjectMapper();

    // ── Tier 1 ─────────────────────────────────────────────────────────────────

    public int saveScores(String runId, Strategy strategy, List<ScoreResult> scores) {
        LocalDateTime now = LocalDateTime.now();
        int saved = 0;
        for (ScoreResult s : scores) {
            Candidate c = s.candidate();
            try {
                scoreRepo.save(StockScoreRecord.builder()
                    .runId(runId)
                    .ticker(s.ticker())
                    .companyName(s.companyName())
                    .sector(s.sector())
                    .strategy(strategy)
                    .price(c.getPrice())
                    .marketCap(c.getMarketCap())
                    .valueScore(s.valueScore())
                    .qualityScore(s.qualityScore())
                    .riskScore(s.riskScore())
                    .growthScore(s.growthScore())
                    .momentumScore(s.momentumScore())
                    .totalScore(s.totalScore())
                    .peRatio(c.getPeRatio())
                    .pbRatio(c.getPbRatio())
                    .dividendYield(c.getDividendYield())
                    .profitMargin(c.getProfitMargin())
                    .roe(c.getRoe())
                    .revenueGrowth(c.getRevenueGrowth())
                    .earningsGrowth(c.getEarningsGrowth())
                    .beta(c.getBeta())
                    .fiftyTwoWeekChange(c.getFiftyTwoWeekChange())
                    .scoredAt(now)
                    .build());
                saved++;
            } catch (DataAccessException e) {
                log.warn("Could not save score for {} in run {}: {}", s.ticker(), runId, e.getMessage());
            }
        }
        log.debug("Saved {}/{} Tier 1 scores for run {}", saved, scores.size(), runId);
        return saved;
    }

    public List<StockScoreRecord> scores(String runId) {
        return scoreRepo.findByRunIdOrderByTotalScoreDesc(runId);
    }

    // ── Tier 2 ─────────────────────────────────────────────────────────────────

    public int saveTriageDecisions(String runId, TriageWorkflow.Tier2Result result) {
        LocalDateTime now = LocalDateTime.now();
        int saved = 0;
        for (TriageVerdict v : result.allVerdicts()) {
            boolean overflow = result.overflow().contains(v.getTicker());
            try {
                triageRepo.save(TriageDecisionRecord.builder()
                    .runId(runId)
                    .ticker(v.getTicker())
                    .tier(2)
                    .decision(v.getDecision())
                    .finalDecision(result.finalDecision(v))
                    .tier1Score(v.getTier1Score())
                    .redFlags(toJson(v.getRedFlags()))
                    .greenFlags(toJson(v.getGreenFlags()))
                    .additionalChecks(checksJson(v))
                    .reasoning(overflow ? v.getReasoning() + " | Exceeded max finalists limit" : v.getReasoning())
                    .decidedAt(now)
                    .build());
                saved++;
            } catch (DataAccessException e) {
                log.warn("Could not save triage decision for {} in run {}: {}", v.getTicker(), runId, e.getMessage());
            }
        }
        return saved;
    }

    public List<TriageDecisionRecord> triageDecisions(String runId) {
        return triageRepo.findByRunId(runId);
    }

    // ── Tier 3 ─────────────────────────────────────────────────────────────────

    /** Upserts on (run, ticker). */
    public boolean saveAnalysis(String runId, ConvictionResult c, boolean selected,
                                String rejectionReason, String researchSummary) {
        try {
            StockAnalysisRecord record = analysisRepo.findByRunIdAndTicker(runId, c.getTicker())
                .orElseGet(() -> StockAnalysisRecord.builder().runId(runId).ticker(c.getTicker()).build());
            record.setCompanyName(c.getCompanyName());
            record.setSector(c.getSector());
            record.setPrice(c.getPrice());
            record.setTier1Score(c.getTier1Score());
            record.setTier2Decision(c.getTier2Decision());
            record.setValuationScore(c.getValuationScore());
            record.setSentimentScore(c.getSentimentScore());
            record.setRiskScore(c.getRiskScore());
            record.setEarningsScore(c.getEarningsScore());
            record.setQualityScore(c.getQualityScore());
            record.setConvictionScore(c.getConvictionScore());
            record.setConvictionLevel(c.getConvictionLevel());
            record.setDcfUpside(c.getDcfUpside());
            record.setPeerUpside(c.getPeerUpside());
            record.setCompositeUpside(c.getCompositeUpside());
            record.setIntrinsicValue(c.getIntrinsicValue());
            record.setImpliedValue(c.getImpliedValue());
            record.setEarningsSentiment(earningsSentiment(c.getEarningsScore()));
            record.setSuggestedWeight(c.getSuggestedWeight());
            record.setMaxWeight(c.getMaxWeight());
            record.setSelected(selected);
            record.setRejectionReason(rejectionReason);
            record.setBullFactors(toJson(c.getBullFactors()));
            record.setBearFactors(toJson(c.getBearFactors()));
            record.setKeyRisks(toJson(c.getKeyRisks()));
            record.setWorkflowsRun(toJson(c.getAnalysesRun()));
            record.setReasoning(c.getReasoning());
            record.setResearchSummary(researchSummary);
            record.setInvestmentThesis(investmentThesis(c));
            record.setAnalyzedAt(LocalDateTime.now());
            analysisRepo.save(record);
            return true;
        } catch (DataAccessException e) {
            log.warn("Could not save analysis for {} in run {}: {}", c.getTicker(), runId, e.getMessage());
            return false;
        }
    }

    public List<StockAnalysisRecord> analyses(String runId) {
        return analysisRepo.findByRunIdOrderByConvictionScoreDesc(runId);
    }

    static String earningsSentiment(int earningsScore) {
        if (earningsScore >= 65) return "beat";
        if (earningsScore >= 45) return "inline";
        return "miss";
    }

    static String investmentThesis(ConvictionResult c) {
        StringBuilder thesis = new StringBuilder()
            .append(c.getTicker()).append(": ")
            .append(c.getConvictionLevel()).append(" conviction (").append(c.getConvictionScore()).append("/100)");
        if (c.getCompositeUpside() != null) {
            thesis.append(", composite upside ").append(c.upsideString());
        }
        if (!c.getBullFactors().isEmpty()) {
            thesis.append(". Bull case: ").append(String.join("; ", c.getBullFactors()));
        }
        if (!c.getBearFactors().isEmpty()) {
            thesis.append(". Bear case: ").append(String.join("; ", c.getBearFactors()));
        }
        return thesis.append('.').toString();
    }

    // ── JSON helpers ───────────────────────────────────────────────────────────

    private String checksJson(TriageVerdict v) {
        ObjectNode checks = mapper.createObjectNode();
        checks.put("analystConsensus", v.getAnalystConsensus());
        checks.put("targetUpside", v.getTargetUpside());
        checks.put("shortInterestPct", v.getShortInterestPct());
        checks.put("lastEarningsSurprise", v.getLastEarningsSurprise());
        checks.put("earningsSentiment", v.getEarningsSentiment());
        checks.put("beta", v.getBeta());
        return checks.toString();
    }

    private String toJson(List<String> values) {
        try {
            return mapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise list: {}", e.getMessage());
            return "[]";
        }
    }
}
