package com.jay.stfunnel.layer7_ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.jay.stfunnel.entity.Holding;
import com.jay.stfunnel.entity.Portfolio;
import com.jay.stfunnel.entity.PortfolioSnapshot;
import com.jay.stfunnel.entity.TransactionRecord;
import com.jay.stfunnel.exception.LedgerException;
import com.jay.stfunnel.model.BuildRequest;
import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.TransactionAction;
import com.jay.stfunnel.repository.HoldingRepository;
import com.jay.stfunnel.repository.PortfolioRepository;
import com.jay.stfunnel.repository.PortfolioSnapshotRepository;
import com.jay.stfunnel.repository.TransactionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Layer 7: portfolio book of record.
 * Holdings are unique per (portfolio, ticker) and exist only while shares are positive;
 * the cost basis is a running weighted average. Transactions are append-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioLedger {

    private final PortfolioRepository portfolioRepo;
    private final HoldingRepository holdingRepo;
    private final TransactionRecordRepository transactionRepo;
    private final PortfolioSnapshotRepository snapshotRepo;
    private final ObjectMapper mapper = new ObjectMapper();

    public record PortfolioSummary(Portfolio portfolio,
                                   List<Holding> holdings,
                                   double holdingsValue,
                                   double cashValue,
                                   double totalValue,
                                   int holdingsCount,
                                   int averageConviction,
                                   Map<String, Double> sectorWeights,
                                   double returnPct) {}

    // ── Portfolios ─────────────────────────────────────────────────────────────

    @Transactional
    public Portfolio createPortfolio(BuildRequest request, double cash) {
        LocalDateTime now = LocalDateTime.now();
        Portfolio portfolio = Portfolio.builder()
            .name(request.getName() != null ? request.getName()
                : request.getStrategy().label() + " portfolio " + LocalDate.now())
            .strategy(request.getStrategy())
            .initialCapital(request.getInitialCapital())
            .currentCash(cash)
            .targetHoldings(request.getTargetHoldings())
            .maxPositionPct(request.getMaxPositionPct())
            .minPositionPct(request.getMinPositionPct())
            .maxSectorPct(request.getMaxSectorPct())
            .createdAt(now)
            .updatedAt(now)
            .build();
        Portfolio saved = portfolioRepo.save(portfolio);
        log.info("Portfolio {} '{}' created with ${} cash", saved.getId(), saved.getName(), String.format("%.2f", cash));
        return saved;
    }

    public Portfolio getPortfolio(Long portfolioId) {
        return portfolioRepo.findById(portfolioId)
            .orElseThrow(() -> new LedgerException("Portfolio " + portfolioId + " not found"));
    }

    public List<Portfolio> allPortfolios() {
        return portfolioRepo.findAllByOrderByCreatedAtDesc();
    }

    @Transactional
    public void updateCash(Long portfolioId, double cash) {
        Portfolio portfolio = getPortfolio(portfolioId);
        portfolio.setCurrentCash(cash);
        portfolio.setUpdatedAt(LocalDateTime.now());
        portfolioRepo.save(portfolio);
    }

    // ── Holdings ───────────────────────────────────────────────────────────────

    public List<Holding> holdings(Long portfolioId) {
        return holdingRepo.findByPortfolioIdOrderByTickerAsc(portfolioId);
    }

    /** Inserts the position, or adds to it with a weighted-average cost update. */
    @Transactional
    public Holding addHolding(Long portfolioId, String ticker, String companyName, String sector,
                              long shares, double price, Integer convictionScore, ConvictionLevel convictionLevel) {
        if (shares <= 0) {
            throw new LedgerException("Cannot add " + shares + " shares of " + ticker);
        }
        LocalDateTime now = LocalDateTime.now();
        Holding holding = holdingRepo.findByPortfolioIdAndTicker(portfolioId, ticker)
            .map(existing -> {
                long total = existing.getShares() + shares;
                existing.setAvgCost((existing.getShares() * existing.getAvgCost() + shares * price) / total);
                existing.setShares(total);
                return existing;
            })
            .orElseGet(() -> Holding.builder()
                .portfolioId(portfolioId)
                .ticker(ticker)
                .companyName(companyName)
                .sector(sector)
                .shares(shares)
                .avgCost(price)
                .createdAt(now)
                .build());
        if (sector != null) holding.setSector(sector);
        holding.setCurrentPrice(price);
        holding.setConvictionScore(convictionScore);
        holding.setConvictionLevel(convictionLevel);
        holding.setLastAnalyzedAt(now);
        holding.setUpdatedAt(now);
        return holdingRepo.save(holding);
    }

    /**
     * Removes shares from a position; the row is deleted when nothing is left.
     * @return shares remaining after the reduction
     */
    @Transactional
    public long reduceHolding(Long portfolioId, String ticker, long shares) {
        Holding holding = holdingRepo.findByPortfolioIdAndTicker(portfolioId, ticker)
            .orElseThrow(() -> new LedgerException("No holding of " + ticker + " in portfolio " + portfolioId));
        long remaining = holding.getShares() - shares;
        if (remaining <= 0) {
            holdingRepo.delete(holding);
            log.info("Holding {} removed from portfolio {}", ticker, portfolioId);
            return 0;
        }
        holding.setShares(remaining);
        holding.setUpdatedAt(LocalDateTime.now());
        holdingRepo.save(holding);
        return remaining;
    }

    /** Stores the price and conviction found by a review. */
    @Transactional
    public void updateReview(Long portfolioId, String ticker, double price, int convictionScore, ConvictionLevel level) {
        holdingRepo.findByPortfolioIdAndTicker(portfolioId, ticker).ifPresent(holding -> {
            LocalDateTime now = LocalDateTime.now();
            holding.setCurrentPrice(price);
            holding.setConvictionScore(convictionScore);
            holding.setConvictionLevel(level);
            holding.setLastAnalyzedAt(now);
            holding.setUpdatedAt(now);
            holdingRepo.save(holding);
        });
    }

    // ── Transactions ───────────────────────────────────────────────────────────

    @Transactional
    public TransactionRecord recordTransaction(Long portfolioId, String ticker, TransactionAction action,
                                               long shares, double price, String reason, String runId) {
        TransactionRecord record = TransactionRecord.builder()
            .portfolioId(portfolioId)
            .ticker(ticker)
            .action(action)
            .shares(shares)
            .price(price)
            .totalValue(shares * price)
            .reason(reason != null && reason.length() > 1000 ? reason.substring(0, 1000) : reason)
            .runId(runId)
            .executedAt(LocalDateTime.now())
            .build();
        return transactionRepo.save(record);
    }

    public List<TransactionRecord> transactions(Long portfolioId) {
        return transactionRepo.findByPortfolioIdOrderByExecutedAtDesc(portfolioId);
    }

    // ── Summary & snapshots ────────────────────────────────────────────────────

    public PortfolioSummary summary(Long portfolioId) {
        Portfolio portfolio = getPortfolio(portfolioId);
        List<Holding> holdings = holdings(portfolioId);
        double holdingsValue = holdings.stream().mapToDouble(Holding::marketValue).sum();
        double cash = portfolio.getCurrentCash();
        double total = holdingsValue + cash;

        Map<String, Double> sectors = new TreeMap<>();
        for (Holding h : holdings) {
            String sector = h.getSector() == null ? "Unknown" : h.getSector();
            sectors.merge(sector, total > 0 ? h.marketValue() / total * 100 : 0, Double::sum);
        }
        int avgConviction = (int) Math.round(holdings.stream()
            .mapToInt(h -> h.getConvictionScore() == null ? 0 : h.getConvictionScore())
            .average().orElse(0));
        double returnPct = portfolio.getInitialCapital() > 0
            ? (total - portfolio.getInitialCapital()) / portfolio.getInitialCapital() * 100
            : 0;
        return new PortfolioSummary(portfolio, holdings, holdingsValue, cash, total, holdings.size(),
            avgConviction, new LinkedHashMap<>(sectors), returnPct);
    }

    @Transactional
    public PortfolioSnapshot takeSnapshot(Long portfolioId) {
        PortfolioSummary summary = summary(portfolioId);
        PortfolioSnapshot snapshot = PortfolioSnapshot.builder()
            .portfolioId(portfolioId)
            .snapshotDate(LocalDate.now())
            .totalValue(summary.totalValue())
            .cashValue(summary.cashValue())
            .holdingsValue(summary.holdingsValue())
            .holdingsCount(summary.holdingsCount())
            .holdingsData(holdingsJson(summary))
            .createdAt(LocalDateTime.now())
            .build();
        PortfolioSnapshot saved = snapshotRepo.save(snapshot);
        log.info("Snapshot for portfolio {}: value ${}, {} holdings",
            portfolioId, String.format("%.2f", summary.totalValue()), summary.holdingsCount());
        return saved;
    }

    public List<PortfolioSnapshot> snapshots(Long portfolioId) {
        return snapshotRepo.findByPortfolioIdOrderBySnapshotDateAsc(portfolioId);
    }

    private String holdingsJson(PortfolioSummary summary) {
        ArrayNode array = mapper.createArrayNode();
        for (Holding h : summary.holdings()) {
            double price = h.getCurrentPrice() != null ? h.getCurrentPrice() : h.getAvgCost();
            array.addObject()
                .put("ticker", h.getTicker())
                .put("shares", h.getShares())
                .put("price", price)
                .put("value", h.marketValue())
                .put("weight", summary.totalValue() > 0 ? h.marketValue() / summary.totalValue() * 100 : 0)
                .put("sector", h.getSector());
        }
        try {
            return mapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise holdings for snapshot: {}", e.getMessage());
            return "[]";
        }
    }
}
