package com.jay.stfunnel.entity;

import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.TriageDecision;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Tier 3 payload for one ticker within one run, stored whether or not it was selected.
 */
@Entity
@Table(name = "stock_analyses",
    uniqueConstraints = @UniqueConstraint(name = "uk_analysis_run_ticker",
        columnNames = {"run_id", "ticker"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockAnalysisRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, length = 64)
    private String runId;

    @Column(name = "ticker", nullable = false, length = 16)
    private String ticker;

    private String companyName;
    private String sector;
    private Double price;
    private double tier1Score;

    @Enumerated(EnumType.STRING)
    private TriageDecision tier2Decision;

    // Component scores
    private int valuationScore;
    private int sentimentScore;
    private int riskScore;
    private int earningsScore;
    private int qualityScore;

    private int convictionScore;
    @Enumerated(EnumType.STRING)
    private ConvictionLevel convictionLevel;

    private Double dcfUpside;
    private Double peerUpside;
    private Double compositeUpside;
    private Double intrinsicValue;
    private Double impliedValue;
    private String earningsSentiment;   // beat / inline / miss

    private double suggestedWeight;
    private double maxWeight;
    private boolean selected;
    @Column(length = 500)
    private String rejectionReason;

    // JSON arrays
    @Column(length = 4000)
    private String bullFactors;
    @Column(length = 4000)
    private String bearFactors;
    @Column(length = 4000)
    private String keyRisks;
    @Column(length = 500)
    private String workflowsRun;

    @Column(length = 4000)
    private String reasoning;
    @Column(length = 8000)
    private String researchSummary;
    @Column(length = 4000)
    private String investmentThesis;

    private LocalDateTime analyzedAt;
}
