package com.jay.stfunnel.entity;

import com.jay.stfunnel.model.enums.Strategy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "portfolios")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Portfolio {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name;

    @Enumerated(EnumType.STRING)
    private Strategy strategy;

    private double initialCapital;
    private double currentCash;
    private int targetHoldings;
    private double maxPositionPct;
    private double minPositionPct;
    private double maxSectorPct;
    private double maxMonthlyTurnoverPct;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
