package com.jay.stfunnel.layer7_ledger;

import com.jay.stfunnel.entity.Holding;
import com.jay.stfunnel.entity.Portfolio;
import com.jay.stfunnel.entity.PortfolioSnapshot;
import com.jay.stfunnel.exception.LedgerException;
import com.jay.stfunnel.model.BuildRequest;
import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.Strategy;
import com.jay.stfunnel.model.enums.TransactionAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@Import(PortfolioLedger.class)
class PortfolioLedgerTest {

    @Autowired
    private PortfolioLedger ledger;

    private Long portfolioId;

    @BeforeEach
    void setUp() {
        BuildRequest request = BuildRequest.builder()
            .strategy(Strategy.VALUE).initialCapital(5_000).targetHoldings(5)
            .maxPositionPct(10).minPositionPct(2).maxSectorPct(25)
            .build();
        portfolioId = ledger.createPortfolio(request, 1_000).getId();
    }

    @Test
    void createdPortfolioCarriesRequestSettings() {
        Portfolio p = ledger.getPortfolio(portfolioId);

        assertThat(p.getStrategy()).isEqualTo(Strategy.VALUE);
        assertThat(p.getCurrentCash()).isEqualTo(1_000);
        assertThat(p.getName()).startsWith("value portfolio");
        assertThat(ledger.allPortfolios()).extracting(Portfolio::getId).contains(portfolioId);
    }

    @Test
    void addingToAPositionAveragesTheCost() {
        ledger.addHolding(portfolioId, "ACME", "Acme", "Industrials", 10, 100, 70, ConvictionLevel.HIGH);
        Holding h = ledger.addHolding(portfolioId, "ACME", "Acme", "Industrials", 10, 120, 75, ConvictionLevel.HIGH);

        assertThat(h.getShares()).isEqualTo(20);
        assertThat(h.getAvgCost()).isCloseTo(110, within(1e-9));
        assertThat(h.getCurrentPrice()).isEqualTo(120);
        assertThat(h.getConvictionScore()).isEqualTo(75);
        assertThat(ledger.holdings(portfolioId)).hasSize(1);
    }

    @Test
    void reducingToZeroDeletesTheRow() {
        ledger.addHolding(portfolioId, "ACME", "Acme", "Industrials", 20, 100, 70, ConvictionLevel.HIGH);

        assertThat(ledger.reduceHolding(portfolioId, "ACME", 5)).isEqualTo(15);
        assertThat(ledger.reduceHolding(portfolioId, "ACME", 15)).isZero();
        assertThat(ledger.holdings(portfolioId)).isEmpty();
    }

    @Test
    void invalidOperationsRaiseLedgerException() {
        assertThatThrownBy(() -> ledger.reduceHolding(portfolioId, "NONE", 1))
            .isInstanceOf(LedgerException.class)
            .hasMessageContaining("No holding of NONE");
        assertThatThrownBy(() -> ledger.addHolding(portfolioId, "ZERO", null, null, 0, 10, null, null))
            .isInstanceOf(LedgerException.class);
        assertThatThrownBy(() -> ledger.getPortfolio(-1L))
            .isInstanceOf(LedgerException.class)
            .hasMessage("Portfolio -1 not found");
    }

    @Test
    void summaryValuesHoldingsAtCurrentPrice() {
        ledger.addHolding(portfolioId, "ACME", "Acme", "Industrials", 20, 100, 70, ConvictionLevel.HIGH);
        ledger.addHolding(portfolioId, "OIL", "Oil Co", "Energy", 10, 60, 50, ConvictionLevel.MODERATE);
        ledger.updateReview(portfolioId, "ACME", 120, 64, ConvictionLevel.MODERATE);

        PortfolioLedger.PortfolioSummary s = ledger.summary(portfolioId);

        assertThat(s.holdingsValue()).isEqualTo(3_000);
        assertThat(s.totalValue()).isEqualTo(4_000);
        assertThat(s.holdingsCount()).isEqualTo(2);
        assertThat(s.averageConviction()).isEqualTo(57);
        assertThat(s.sectorWeights()).containsOnlyKeys("Energy", "Industrials");
        assertThat(s.sectorWeights().get("Industrials")).isCloseTo(60, within(1e-9));
        assertThat(s.returnPct()).isCloseTo(-20, within(1e-9));
    }

    @Test
    void transactionsAndSnapshotsAreRecorded() {
        ledger.addHolding(portfolioId, "ACME", "Acme", "Industrials", 10, 100, 70, ConvictionLevel.HIGH);
        ledger.recordTransaction(portfolioId, "ACME", TransactionAction.BUY, 10, 100, "Initial build", "IPB-VALUE-1");
        ledger.updateCash(portfolioId, 0);

        PortfolioSnapshot snapshot = ledger.takeSnapshot(portfolioId);

        assertThat(ledger.transactions(portfolioId)).singleElement().satisfies(t -> {
            assertThat(t.getTotalValue()).isEqualTo(1_000);
            assertThat(t.getRunId()).isEqualTo("IPB-VALUE-1");
        });
        assertThat(snapshot.getTotalValue()).isEqualTo(1_000);
        assertThat(snapshot.getHoldingsCount()).isEqualTo(1);
        assertThat(snapshot.getHoldingsData()).contains("\"ticker\":\"ACME\"");
        assertThat(ledger.snapshots(portfolioId)).hasSize(1);
    }
}
