package com.jay.stfunnel.entity;

import com.jay.stfunnel.model.enums.Strategy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "stock_scores")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockScoreRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String runId;
    private String ticker;
    private String companyName;
    private String sector;

    @Enumerated(EnumType.STRING)
    private Strategy strategy;

    private Double price;
    private Double marketCap;

    // Sub-scores
    private int valueScore;
    private int qualityScore;
    private int riskScore;
    private int growthScore;
    private int momentumScore;
    private int totalScore;

    // Raw metrics
    private Double peRatio;
    private Double pbRatio;
    private Double dividendYield;
    private Double profitMargin;
    private Double roe;
    private Double revenueGrowth;
    private Double earningsGrowth;
    private Double beta;
    private Double fiftyTwoWeekChange;

    private LocalDateTime scoredAt;
}
