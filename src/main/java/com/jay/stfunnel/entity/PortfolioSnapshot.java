package com.jay.stfunnel.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "portfolio_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long portfolioId;
    private LocalDate snapshotDate;
    private double totalValue;
    private double cashValue;
    private double holdingsValue;
    private int holdingsCount;

    // JSON array of {ticker, shares, price, value, weight, sector}
    @Column(length = 20000)
    private String holdingsData;

    private LocalDateTime createdAt;
}
