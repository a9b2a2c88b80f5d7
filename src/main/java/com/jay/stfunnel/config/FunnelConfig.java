package com.jay.stfunnel.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.List;

/**
 * Loads and exposes the funnel configuration from config.yaml.
 * Values are read once at startup; every section falls back to its defaults when absent.
 * A bare {@code new FunnelConfig()} carries the defaults only.
 */
@Slf4j
@Component
public class FunnelConfig {

    @Value("${funnel.config-file:config.yaml}")
    private String configFile = "config.yaml";

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, key ->
            env != null ? env.getProperty(key) : System.getenv(key));
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Portfolio portfolio = new Portfolio();
    private Tier1 tier1 = new Tier1();
    private Tier2 tier2 = new Tier2();
    private Tier3 tier3 = new Tier3();
    private Rebalance rebalance = new Rebalance();
    private MarketData marketData = new MarketData();
    private Llm llm = new Llm();
    private Scheduler scheduler = new Scheduler();
    private List<UniverseEntry> universe = List.of();

    @PostConstruct
    public void load() {
        InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
        if (is == null) {
            log.warn("Config file '{}' not found on classpath, using defaults", configFile);
            return;
        }
        loadFrom(is);
    }

    public void loadFrom(InputStream is) {
        try (is) {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            this.portfolio  = root.getPortfolio();
            this.tier1      = root.getTier1();
            this.tier2      = root.getTier2();
            this.tier3      = root.getTier3();
            this.rebalance  = root.getRebalance();
            this.marketData = root.getMarketData();
            this.llm        = root.getLlm();
            this.scheduler  = root.getScheduler();

            // Jackson reads ${VAR:default} as a literal string
            this.llm.setBaseUrl(resolve(this.llm.getBaseUrl()));
            this.llm.setApiKey(resolve(this.llm.getApiKey()));
            this.llm.setModel(resolve(this.llm.getModel()));
            this.marketData.setBaseUrl(resolve(this.marketData.getBaseUrl()));
            this.universe   = root.getUniverse() != null ? root.getUniverse() : List.of();
            log.info("FunnelConfig loaded from '{}': {} tickers in universe, LLM configured: {}",
                configFile, universe.size(), llm.isConfigured());
        } catch (Exception e) {
            log.error("Failed to load {}, funnel will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Portfolio portfolio()           { return portfolio; }
    public Tier1 tier1()                   { return tier1; }
    public Tier2 tier2()                   { return tier2; }
    public Tier3 tier3()                   { return tier3; }
    public Rebalance rebalance()           { return rebalance; }
    public MarketData marketData()         { return marketData; }
    public Llm llm()                       { return llm; }
    public Scheduler scheduler()           { return scheduler; }
    public List<UniverseEntry> universe()  { return universe; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Portfolio portfolio = new Portfolio();
        private Tier1 tier1 = new Tier1();
        private Tier2 tier2 = new Tier2();
        private Tier3 tier3 = new Tier3();
        private Rebalance rebalance = new Rebalance();
        private MarketData marketData = new MarketData();
        private Llm llm = new Llm();
        private Scheduler scheduler = new Scheduler();
        private List<UniverseEntry> universe;
    }

    /** Construction defaults; a build request may override any of them. */
    @Data public static class Portfolio {
        private double initialCapital = 100000;
        private int targetHoldings = 12;
        private double cashReservePct = 5;
        private double maxSectorPct = 25;
        private double maxPositionPct = 10;
        private double minPositionPct = 2;
        private double maxMonthlyTurnoverPct = 20;
    }

    @Data public static class Tier1 {
        private double minScore = 50;
        private int maxCandidates = 80;
        private double maxPe = 100;
        private double minMarketCap = 1_000_000_000d;
        private boolean requirePositiveFcf = true;
        private int concurrency = 5;
        private long minRequestSpacingMs = 100;
    }

    @Data public static class Tier2 {
        private int maxFinalists = 25;
        private int batchSize = 5;
    }

    @Data public static class Tier3 {
        private double minConviction = 50;
        private int batchSize = 3;
        private int analysisTimeoutSeconds = 90;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Rebalance {
        private double sellThreshold = 40;
        private double holdThreshold = 50;
        private double buyThreshold = 60;
        private int maxSellsPerReview = 3;
        private int maxBuysPerReview = 3;
        private double maxTurnoverPct = 20;
        private double minPositionPct = 2;
        private double maxPositionPct = 10;
        private double targetCashPct = 5;
        private boolean runFullAnalysis = true;
        private boolean screenNewCandidates = true;
        private int newCandidateLimit = 10;
        private boolean executeRecommendations = false;

        public Rebalance copy() {
            return new Rebalance(sellThreshold, holdThreshold, buyThreshold, maxSellsPerReview,
                maxBuysPerReview, maxTurnoverPct, minPositionPct, maxPositionPct, targetCashPct,
                runFullAnalysis, screenNewCandidates, newCandidateLimit, executeRecommendations);
        }
    }

    @Data public static class MarketData {
        private String baseUrl = "https://query2.finance.yahoo.com";
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 15;
    }

    @Data public static class Llm {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private int timeoutSeconds = 60;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data public static class Scheduler {
        private boolean monthlyReviewEnabled = false;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UniverseEntry {
        private String ticker;
        private String name;
        private String sector;
    }
}
