package com.jay.stfunnel.layer6_rebalance;

import com.jay.stfunnel.exception.LedgerException;
import com.jay.stfunnel.layer6_rebalance.RebalanceEngine.RecommendedTrade;
import com.jay.stfunnel.layer7_ledger.PortfolioLedger;
import com.jay.stfunnel.model.enums.ConvictionLevel;
import com.jay.stfunnel.model.enums.TradeType;
import com.jay.stfunnel.model.enums.TransactionAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RebalanceExecutorTest {

    @Mock
    private PortfolioLedger ledger;

    private RebalanceExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new RebalanceExecutor(ledger);
    }

    private static RecommendedTrade trade(int priority, TradeType type, String ticker, long shares, double price) {
        return new RecommendedTrade(priority, type, ticker, ticker + " Inc", "Technology", shares, price,
            shares * price, "test", 70, ConvictionLevel.HIGH);
    }

    @Test
    void sellsFundBuysAndCashIsUpdated() {
        List<RecommendedTrade> trades = List.of(
            trade(1, TradeType.SELL, "OLD", 10, 100),
            trade(2, TradeType.BUY, "NEW", 20, 50));

        RebalanceExecutor.ExecutionResult result = executor.execute(7L, "REB-7-1", trades, 0);

        assertThat(result.executed()).extracting(RebalanceExecutor.ExecutedTrade::ticker).containsExactly("OLD", "NEW");
        assertThat(result.skipped()).isEmpty();
        assertThat(result.cashAfter()).isZero();

        InOrder order = inOrder(ledger);
        order.verify(ledger).reduceHolding(7L, "OLD", 10);
        order.verify(ledger).recordTransaction(7L, "OLD", TransactionAction.SELL, 10, 100.0, "Rebalance SELL: test", "REB-7-1");
        order.verify(ledger).addHolding(7L, "NEW", "NEW Inc", "Technology", 20, 50.0, 70, ConvictionLevel.HIGH);
        order.verify(ledger).recordTransaction(7L, "NEW", TransactionAction.BUY, 20, 50.0, "Rebalance BUY: test", "REB-7-1");
        order.verify(ledger).updateCash(7L, 0.0);
    }

    @Test
    void buyWithoutEnoughCashIsSkipped() {
        RebalanceExecutor.ExecutionResult result = executor.execute(7L, "REB-7-2",
            List.of(trade(1, TradeType.ADD, "PRICY", 10, 500)), 1_000);

        assertThat(result.executed()).isEmpty();
        assertThat(result.skipped()).singleElement()
            .satisfies(s -> assertThat(s.reason()).isEqualTo("Insufficient cash"));
        verify(ledger, never()).addHolding(anyLong(), anyString(), anyString(), anyString(), anyLong(),
            anyDouble(), anyInt(), any());
        verify(ledger).updateCash(7L, 1_000.0);
    }

    @Test
    void ledgerFailureSkipsOnlyThatTrade() {
        when(ledger.reduceHolding(eq(7L), eq("GONE"), anyLong()))
            .thenThrow(new LedgerException("No holding GONE in portfolio 7"));

        RebalanceExecutor.ExecutionResult result = executor.execute(7L, "REB-7-3", List.of(
            trade(1, TradeType.SELL, "GONE", 5, 10),
            trade(2, TradeType.TRIM, "KEEP", 5, 10)), 0);

        assertThat(result.executed()).extracting(RebalanceExecutor.ExecutedTrade::ticker).containsExactly("KEEP");
        assertThat(result.skipped()).singleElement()
            .satisfies(s -> assertThat(s.reason()).contains("No holding GONE"));
        assertThat(result.cashAfter()).isEqualTo(50.0);
    }

    @Test
    void transactionRowFailureStillCountsTheAppliedTrade() {
        when(ledger.recordTransaction(eq(7L), eq("OLD"), eq(TransactionAction.SELL), anyLong(), anyDouble(),
            anyString(), anyString())).thenThrow(new LedgerException("transactions table unavailable"));

        RebalanceExecutor.ExecutionResult result = executor.execute(7L, "REB-7-4", List.of(
            trade(1, TradeType.SELL, "OLD", 10, 100),
            trade(2, TradeType.BUY, "NEW", 4, 50)), 0);

        verify(ledger).reduceHolding(7L, "OLD", 10);
        assertThat(result.skipped()).isEmpty();
        assertThat(result.executed()).extracting(RebalanceExecutor.ExecutedTrade::ticker,
                RebalanceExecutor.ExecutedTrade::recorded)
            .containsExactly(tuple("OLD", false),
                tuple("NEW", true));
        assertThat(result.cashAfter()).isEqualTo(800.0);
        verify(ledger).updateCash(7L, 800.0);
    }
}
