package com.jay.stfunnel.entity;

import com.jay.stfunnel.model.enums.ConvictionLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One position in a portfolio. Rows exist only while shares > 0.
 */
@Entity
@Table(name = "holdings",
    uniqueConstraints = @UniqueConstraint(name = "uk_holding_portfolio_ticker",
        columnNames = {"portfolio_id", "ticker"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Holding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "portfolio_id", nullable = false)
    private Long portfolioId;

    @Column(name = "ticker", nullable = false, length = 16)
    private String ticker;

    private String companyName;
    private String sector;

    private long shares;
    private double avgCost;        // running weighted average
    private Double currentPrice;

    private Integer convictionScore;
    @Enumerated(EnumType.STRING)
    private ConvictionLevel convictionLevel;

    private LocalDateTime lastAnalyzedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /** Market value at the current price, or at cost when no price is known. */
    public double marketValue() {
        double price = currentPrice != null && currentPrice > 0 ? currentPrice : avgCost;
        return shares * price;
    }
}
