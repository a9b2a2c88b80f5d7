package com.jay.stfunnel.entity;

import com.jay.stfunnel.model.enums.RunStatus;
import com.jay.stfunnel.model.enums.RunType;
import com.jay.stfunnel.model.enums.Strategy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Audit record of one pipeline invocation. Append-only until it reaches a terminal status.
 */
@Entity
@Table(name = "screening_runs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreeningRun {

    @Id
    @Column(name = "run_id", length = 64)
    private String runId;

    @Enumerated(EnumType.STRING)
    private RunType runType;

    @Enumerated(EnumType.STRING)
    private Strategy strategy;

    @Enumerated(EnumType.STRING)
    private RunStatus status;

    private Long portfolioId;

    private Integer tier1Input;
    private Integer tier1Output;
    private LocalDateTime tier1CompletedAt;
    private Integer tier2Input;
    private Integer tier2Output;
    private LocalDateTime tier2CompletedAt;
    private Integer tier3Input;
    private Integer tier3Output;
    private LocalDateTime tier3CompletedAt;
    private Integer finalPortfolioCount;

    @Lob
    private String configJson;
    @Column(length = 2000)
    private String errorMessage;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
