package com.jay.stfunnel.entity;

import com.jay.stfunnel.model.enums.TransactionAction;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "transactions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long portfolioId;
    private String ticker;

    @Enumerated(EnumType.STRING)
    private TransactionAction action;

    private long shares;
    private double price;
    private double totalValue;

    @Column(length = 1000)
    private String reason;
    private String runId;

    private LocalDateTime executedAt;
}
