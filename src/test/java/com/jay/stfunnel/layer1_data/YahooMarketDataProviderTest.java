package com.jay.stfunnel.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.exception.MarketDataException;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.TriageChecks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class YahooMarketDataProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private YahooMarketDataProvider provider;

    @BeforeEach
    void setUp() {
        FunnelConfig config = new FunnelConfig();
        config.loadFrom(new ByteArrayInputStream("""
            universe:
              - ticker: ACME
                name: Acme Corp
                sector: Industrials
            """.getBytes(StandardCharsets.UTF_8)));
        provider = new YahooMarketDataProvider(config, new RateLimiter(1, 0), new UniverseService(config));
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void candidateConvertsFractionsToPercent() throws Exception {
        JsonNode quote = json("""
            {"price": {"regularMarketPrice": {"raw": 120.5, "fmt": "120.50"},
                       "marketCap": {"raw": 5.0E10}, "longName": "Acme Corporation"},
             "summaryDetail": {"trailingPE": {"raw": 18.2}, "dividendYield": {"raw": 0.021}},
             "assetProfile": {"sector": "Technology"}}
            """);
        JsonNode fundamentals = json("""
            {"financialData": {"profitMargins": {"raw": 0.15}, "returnOnEquity": {"raw": 0.22},
                               "currentRatio": {"raw": 1.8}, "revenueGrowth": {"raw": 0.12}},
             "defaultKeyStatistics": {"priceToBook": {"raw": 3.1}, "beta": {"raw": 1.1},
                                      "52WeekChange": {"raw": -0.05}}}
            """);

        Candidate c = provider.parseCandidate("ACME", quote, fundamentals);

        assertThat(c.getCompanyName()).isEqualTo("Acme Corporation");
        assertThat(c.getSector()).isEqualTo("Industrials");
        assertThat(c.getPrice()).isEqualTo(120.5);
        assertThat(c.getPeRatio()).isEqualTo(18.2);
        assertThat(c.getDividendYield()).isCloseTo(2.1, within(1e-9));
        assertThat(c.getProfitMargin()).isCloseTo(15, within(1e-9));
        assertThat(c.getRoe()).isCloseTo(22, within(1e-9));
        assertThat(c.getRevenueGrowth()).isCloseTo(12, within(1e-9));
        assertThat(c.getFiftyTwoWeekChange()).isCloseTo(-5, within(1e-9));
        assertThat(c.getBeta()).isEqualTo(1.1);
        assertThat(c.getEarningsGrowth()).isNull();
        assertThat(c.getDebtToEquity()).isNull();
    }

    @Test
    void profileSectorUsedOutsideTheUniverse() throws Exception {
        JsonNode quote = json("""
            {"price": {"regularMarketPrice": 10, "shortName": "Other"},
             "assetProfile": {"sector": "Utilities"}}
            """);

        Candidate c = provider.parseCandidate("OTHR", quote, json("{}"));

        assertThat(c.getSector()).isEqualTo("Utilities");
        assertThat(c.getCompanyName()).isEqualTo("Other");
    }

    @Test
    void missingPriceIsAProviderFailure() throws Exception {
        assertThatThrownBy(() -> provider.parseCandidate("ACME", json("{\"price\": {}}"), json("{}")))
            .isInstanceOf(MarketDataException.class)
            .hasMessageContaining("No market price");
    }

    @Test
    void triageChecksReadTrendEarningsAndRecentGrades() throws Exception {
        Instant now = Instant.parse("2024-06-01T00:00:00Z");
        long recent = now.minus(10, ChronoUnit.DAYS).getEpochSecond();
        long old = now.minus(200, ChronoUnit.DAYS).getEpochSecond();
        JsonNode node = json("""
            {"price": {"regularMarketPrice": {"raw": 50.0}, "longName": "Acme Corp"},
             "financialData": {"targetMeanPrice": {"raw": 65.0}},
             "defaultKeyStatistics": {"shortPercentOfFloat": {"raw": 0.04}},
             "recommendationTrend": {"trend": [
                 {"strongBuy": 5, "buy": 10, "hold": 3, "sell": 1, "strongSell": 0},
                 {"strongBuy": 1, "buy": 1, "hold": 1, "sell": 1, "strongSell": 1}]},
             "earningsHistory": {"history": [
                 {"epsActual": {"raw": 0.9}, "epsEstimate": {"raw": 1.0}},
                 {"epsActual": {"raw": 1.2}, "epsEstimate": {"raw": 1.1}}]},
             "upgradeDowngradeHistory": {"history": [
                 {"epochGradeDate": %d, "action": "up"},
                 {"epochGradeDate": %d, "action": "init"},
                 {"epochGradeDate": %d, "action": "down"},
                 {"epochGradeDate": %d, "action": "down"}]}}
            """.formatted(recent, recent, recent, old));

        TriageChecks checks = provider.parseTriageChecks("ACME", node, now);

        assertThat(checks.analystCount()).isEqualTo(19);
        assertThat(checks.getStrongBuy()).isEqualTo(5);
        assertThat(checks.getTargetMeanPrice()).isEqualTo(65.0);
        assertThat(checks.getShortPercentOfFloat()).isCloseTo(4, within(1e-9));
        assertThat(checks.getEarningsHistory()).hasSize(2);
        assertThat(checks.getEarningsHistory().get(0).isMiss()).isFalse();
        assertThat(checks.getEarningsHistory().get(1).isMiss()).isTrue();
        assertThat(checks.getRecentUpgrades()).isEqualTo(2);
        assertThat(checks.getRecentDowngrades()).isEqualTo(1);
    }

    @Test
    void emptyTriagePayloadHasNoSignals() throws Exception {
        TriageChecks checks = provider.parseTriageChecks("ACME", json("{}"), Instant.now());

        assertThat(checks.analystCount()).isZero();
        assertThat(checks.getTargetMeanPrice()).isNull();
        assertThat(checks.getEarningsHistory()).isEmpty();
        assertThat(checks.getCompanyName()).isEqualTo("ACME");
    }
}
