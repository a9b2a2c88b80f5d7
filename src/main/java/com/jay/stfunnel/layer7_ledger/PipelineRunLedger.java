package com.jay.stfunnel.layer7_ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.stfunnel.entity.ScreeningRun;
import com.jay.stfunnel.model.enums.RunStatus;
import com.jay.stfunnel.model.enums.RunType;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.repository.ScreeningRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Layer 7: audit record of every pipeline run.
 * A run starts RUNNING, collects per-tier counts as stages finish, and ends COMPLETED or
 * FAILED. Once terminal it is never written again.
 *
 * Write failures are logged and swallowed so that auditing never aborts a stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineRunLedger {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final ScreeningRunRepository runRepo;
    private final ObjectMapper mapper = new ObjectMapper();
    private Clock clock = Clock.systemDefaultZone();

    /** Test hook for deterministic run ids and timestamps. */
    void setClock(Clock clock) {
        this.clock = clock;
    }

    public String start(RunType runType, Strategy strategy, Long portfolioId, Object configSnapshot) {
        String runId = runId(runType, strategy, portfolioId, clock.millis());
        ScreeningRun run = ScreeningRun.builder()
            .runId(runId)
            .runType(runType)
            .strategy(strategy)
            .portfolioId(portfolioId)
            .status(RunStatus.RUNNING)
            .configJson(toJson(configSnapshot))
            .startedAt(now())
            .build();
        try {
            runRepo.save(run);
            log.info("Run {} started ({}, {})", runId, runType, strategy == null ? "-" : strategy.label());
        } catch (DataAccessException e) {
            log.error("Could not persist start of run {}: {}", runId, e.getMessage());
        }
        return runId;
    }

    static String runId(RunType runType, Strategy strategy, Long portfolioId, long millis) {
        return runType == RunType.MONTHLY_REVIEW
            ? "REB-" + portfolioId + "-" + millis
            : "IPB-" + (strategy == null ? "UNKNOWN" : strategy.name()) + "-" + millis;
    }

    // ── Stage boundaries ───────────────────────────────────────────────────────

    public void recordTier1(String runId, int input, int output) {
        update(runId, run -> {
            run.setTier1Input(input);
            run.setTier1Output(output);
            run.setTier1CompletedAt(now());
        });
    }

    public void recordTier2(String runId, int input, int output) {
        update(runId, run -> {
            run.setTier2Input(input);
            run.setTier2Output(output);
            run.setTier2CompletedAt(now());
        });
    }

    public void recordTier3(String runId, int input, int output) {
        update(runId, run -> {
            run.setTier3Input(input);
            run.setTier3Output(output);
            run.setTier3CompletedAt(now());
        });
    }

    public void complete(String runId, int finalCount) {
        update(runId, run -> {
            run.setFinalPortfolioCount(finalCount);
            run.setStatus(RunStatus.COMPLETED);
            run.setCompletedAt(now());
        });
        log.info("Run {} completed with {} positions", runId, finalCount);
    }

    public void fail(String runId, String message) {
        update(runId, run -> {
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(truncate(message));
            run.setCompletedAt(now());
        });
        log.error("Run {} failed: {}", runId, message);
    }

    // ── Queries ────────────────────────────────────────────────────────────────

    public Optional<ScreeningRun> find(String runId) {
        return runRepo.findById(runId);
    }

    public List<ScreeningRun> recent(int limit) {
        return runRepo.findAll(PageRequest.of(0, Math.max(1, limit), Sort.by(Sort.Direction.DESC, "startedAt")))
            .getContent();
    }

    public List<ScreeningRun> forPortfolio(Long portfolioId) {
        return runRepo.findByPortfolioIdOrderByStartedAtDesc(portfolioId);
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private void update(String runId, Consumer<ScreeningRun> change) {
        try {
            Optional<ScreeningRun> found = runRepo.findById(runId);
            if (found.isEmpty()) {
                log.warn("Run {} not found in ledger, update skipped", runId);
                return;
            }
            ScreeningRun run = found.get();
            if (run.getStatus() != null && run.getStatus().isTerminal()) {
                log.warn("Run {} is already {}, update skipped", runId, run.getStatus());
                return;
            }
            change.accept(run);
            runRepo.save(run);
        } catch (DataAccessException e) {
            log.error("Could not update run {}: {}", runId, e.getMessage());
        }
    }

    private String toJson(Object snapshot) {
        if (snapshot == null) return null;
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise config snapshot: {}", e.getMessage());
            return null;
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
