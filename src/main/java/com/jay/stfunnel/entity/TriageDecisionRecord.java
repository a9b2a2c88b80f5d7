package com.jay.stfunnel.entity;

import com.jay.stfunnel.model.enums.TriageDecision;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "triage_decisions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriageDecisionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String runId;
    private String ticker;
    private int tier;                     // 2 = triage, 3 = deep research

    @Enumerated(EnumType.STRING)
    private TriageDecision decision;       // rule-table outcome
    @Enumerated(EnumType.STRING)
    private TriageDecision finalDecision;  // after finalist truncation

    private double tier1Score;

    // JSON arrays / object
    @Column(length = 4000)
    private String redFlags;
    @Column(length = 4000)
    private String greenFlags;
    @Column(length = 4000)
    private String additionalChecks;

    @Column(length = 2000)
    private String reasoning;

    private LocalDateTime decidedAt;
}
