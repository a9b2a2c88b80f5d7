package com.jay.stfunnel.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.exception.MarketDataException;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.TriageChecks;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Yahoo Finance quoteSummary client.
 * Uses the cookie + crumb handshake (fc.yahoo.com, then /v1/test/getcrumb) and refreshes
 * the crumb once on failure. Every request goes through the shared {@link RateLimiter}.
 */
@Slf4j
@Component
public class YahooMarketDataProvider implements MarketDataProvider {

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
        + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String QUOTE_MODULES = "price,summaryDetail,assetProfile";
    private static final String FUNDAMENTAL_MODULES = "financialData,defaultKeyStatistics";
    private static final String TRIAGE_MODULES =
        "price,recommendationTrend,financialData,upgradeDowngradeHistory,earningsHistory,defaultKeyStatistics";

    private final String baseUrl;
    private final RateLimiter rateLimiter;
    private final UniverseService universe;
    private final ObjectMapper mapper = new ObjectMapper();

    // In-memory CookieJar matching cookies by URL, equivalent to curl -c/-b
    private final List<Cookie> cookieStore = new CopyOnWriteArrayList<>();
    private final OkHttpClient httpClient;

    private volatile String crumb = null;

    public YahooMarketDataProvider(FunnelConfig config, RateLimiter rateLimiter, UniverseService universe) {
        this.baseUrl = config.marketData().getBaseUrl();
        this.rateLimiter = rateLimiter;
        this.universe = universe;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(config.marketData().getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(config.marketData().getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .cookieJar(new CookieJar() {
                @Override public void saveFromResponse(HttpUrl url, List<Cookie> cookies) {
                    cookieStore.addAll(cookies);
                }
                @Override public List<Cookie> loadForRequest(HttpUrl url) {
                    List<Cookie> matched = new ArrayList<>();
                    for (Cookie c : cookieStore) { if (c.matches(url)) matched.add(c); }
                    return matched;
                }
            })
            .build();
    }

    // ── MarketDataProvider ─────────────────────────────────────────────────────

    @Override
    public Candidate fetchCandidate(String ticker) {
        String symbol = UniverseService.normalize(ticker);
        // Two 2-3 module calls: a single large request makes Yahoo drop key statistics fields
        JsonNode quoteNode = quoteSummary(symbol, QUOTE_MODULES);
        JsonNode fundamentalNode = quoteSummary(symbol, FUNDAMENTAL_MODULES);
        return parseCandidate(symbol, quoteNode, fundamentalNode);
    }

    @Override
    public TriageChecks fetchTriageChecks(String ticker) {
        String symbol = UniverseService.normalize(ticker);
        return parseTriageChecks(symbol, quoteSummary(symbol, TRIAGE_MODULES), Instant.now());
    }

    @Override
    public Double fetchPrice(String ticker) {
        String symbol = UniverseService.normalize(ticker);
        JsonNode node = quoteSummary(symbol, "price");
        return raw(node.path("price"), "regularMarketPrice");
    }

    // ── Parsing ────────────────────────────────────────────────────────────────

    Candidate parseCandidate(String symbol, JsonNode quoteNode, JsonNode fundamentalNode) {
        JsonNode price     = quoteNode.path("price");
        JsonNode summary   = quoteNode.path("summaryDetail");
        JsonNode profile   = quoteNode.path("assetProfile");
        JsonNode financial = fundamentalNode.path("financialData");
        JsonNode keyStats  = fundamentalNode.path("defaultKeyStatistics");

        Double regularPrice = raw(price, "regularMarketPrice");
        if (regularPrice == null || regularPrice <= 0) {
            throw new MarketDataException(symbol, "No market price in quote for " + symbol);
        }

        String sector = universe.sectorFor(symbol);
        if (sector == null && profile.hasNonNull("sector")) sector = profile.path("sector").asText();
        String name = price.path("longName").asText(null);
        if (name == null) name = price.path("shortName").asText(universe.nameFor(symbol));

        Double beta = raw(keyStats, "beta");
        if (beta == null) beta = raw(summary, "beta");

        return Candidate.builder()
            .ticker(symbol)
            .companyName(name != null ? name : symbol)
            .sector(sector)
            .price(regularPrice)
            .marketCap(raw(price, "marketCap"))
            .peRatio(raw(summary, "trailingPE"))
            .pbRatio(raw(keyStats, "priceToBook"))
            .psRatio(raw(summary, "priceToSalesTrailing12Months"))
            .dividendYield(percent(raw(summary, "dividendYield")))
            .profitMargin(percent(raw(financial, "profitMargins")))
            .roe(percent(raw(financial, "returnOnEquity")))
            .currentRatio(raw(financial, "currentRatio"))
            .debtToEquity(raw(financial, "debtToEquity"))
            .revenueGrowth(percent(raw(financial, "revenueGrowth")))
            .earningsGrowth(percent(raw(financial, "earningsGrowth")))
            .beta(beta)
            .fiftyTwoWeekChange(percent(raw(keyStats, "52WeekChange")))
            .build();
    }

    TriageChecks parseTriageChecks(String symbol, JsonNode node, Instant now) {
        JsonNode price = node.path("price");
        JsonNode financial = node.path("financialData");
        JsonNode keyStats = node.path("defaultKeyStatistics");

        TriageChecks.TriageChecksBuilder checks = TriageChecks.builder()
            .ticker(symbol)
            .companyName(price.path("longName").asText(symbol))
            .price(raw(price, "regularMarketPrice"))
            .targetMeanPrice(raw(financial, "targetMeanPrice"))
            .shortPercentOfFloat(percent(raw(keyStats, "shortPercentOfFloat")))
            .beta(raw(keyStats, "beta"));

        JsonNode trend = node.path("recommendationTrend").path("trend");
        if (trend.isArray() && !trend.isEmpty()) {
            JsonNode latest = trend.get(0);
            checks.strongBuy(latest.path("strongBuy").asInt(0))
                .buy(latest.path("buy").asInt(0))
                .hold(latest.path("hold").asInt(0))
                .sell(latest.path("sell").asInt(0))
                .strongSell(latest.path("strongSell").asInt(0));
        }

        List<TriageChecks.EarningsQuarter> quarters = new ArrayList<>();
        JsonNode history = node.path("earningsHistory").path("history");
        if (history.isArray()) {
            // Yahoo lists oldest first
            for (int i = history.size() - 1; i >= 0; i--) {
                JsonNode q = history.get(i);
                quarters.add(new TriageChecks.EarningsQuarter(raw(q, "epsActual"), raw(q, "epsEstimate")));
            }
        }
        checks.earningsHistory(quarters);

        int upgrades = 0;
        int downgrades = 0;
        long cutoff = now.minus(90, ChronoUnit.DAYS).getEpochSecond();
        JsonNode grades = node.path("upgradeDowngradeHistory").path("history");
        if (grades.isArray()) {
            int seen = 0;
            for (JsonNode event : grades) {
                if (seen++ >= 20) break;
                if (event.path("epochGradeDate").asLong(0) <= cutoff) continue;
                String action = event.path("action").asText("").toLowerCase(Locale.ROOT);
                if (action.contains("up") || action.contains("init")) upgrades++;
                else if (action.contains("down")) downgrades++;
            }
        }
        return checks.recentUpgrades(upgrades).recentDowngrades(downgrades).build();
    }

    /** Yahoo wraps numbers as {raw, fmt}; returns null when absent. */
    private static Double raw(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (node.isNumber()) return node.asDouble();
        JsonNode raw = node.path("raw");
        return raw.isNumber() ? raw.asDouble() : null;
    }

    private static Double percent(Double fraction) {
        return fraction == null ? null : fraction * 100;
    }

    // ── HTTP ───────────────────────────────────────────────────────────────────

    private JsonNode quoteSummary(String symbol, String modules) {
        return rateLimiter.execute(symbol, () -> {
            if (crumb == null) initCredentials();
            JsonNode result = callQuoteSummary(symbol, modules);
            if (result == null) {
                log.warn("Yahoo Finance error for {}, refreshing crumb and retrying", symbol);
                crumb = null;
                cookieStore.clear();
                initCredentials();
                result = callQuoteSummary(symbol, modules);
            }
            if (result == null) {
                throw new MarketDataException(symbol, "quoteSummary [" + modules + "] unavailable for " + symbol);
            }
            return result;
        });
    }

    /** Makes one quoteSummary call and returns the first result node, or null on failure. */
    private JsonNode callQuoteSummary(String symbol, String modules) {
        if (crumb == null) return null;
        String url = baseUrl + "/v10/finance/quoteSummary/" + symbol
            + "?modules=" + modules + "&crumb=" + URLEncoder.encode(crumb, StandardCharsets.UTF_8);
        Request request = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", USER_AGENT)
            .addHeader("Accept", "application/json")
            .get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("Yahoo Finance [{}] returned {} for {}", modules, response.code(), symbol);
                return null;
            }
            JsonNode root = mapper.readTree(response.body().string());
            JsonNode result = root.path("quoteSummary").path("result");
            return (result.isArray() && !result.isEmpty()) ? result.get(0) : null;
        } catch (Exception e) {
            log.warn("Yahoo Finance [{}] call failed for {}: {}", modules, symbol, e.getMessage());
            return null;
        }
    }

    private synchronized void initCredentials() {
        if (crumb != null) return; // another thread already refreshed
        try {
            Request fcReq = new Request.Builder()
                .url("https://fc.yahoo.com")
                .addHeader("User-Agent", USER_AGENT)
                .get().build();
            try (Response fcResp = httpClient.newCall(fcReq).execute()) {
                log.debug("fc.yahoo.com responded with HTTP {}", fcResp.code());
            }

            Request crumbReq = new Request.Builder()
                .url(baseUrl + "/v1/test/getcrumb")
                .addHeader("User-Agent", USER_AGENT)
                .addHeader("Accept", "text/plain")
                .get().build();
            try (Response crumbResp = httpClient.newCall(crumbReq).execute()) {
                if (!crumbResp.isSuccessful() || crumbResp.body() == null) {
                    log.warn("Yahoo Finance: crumb request returned {}", crumbResp.code());
                    return;
                }
                String value = crumbResp.body().string().trim();
                if (value.isEmpty() || value.startsWith("{")) {
                    log.warn("Yahoo Finance: invalid crumb received: {}", value);
                    return;
                }
                crumb = value;
                log.info("Yahoo Finance credentials initialised (crumb length={})", value.length());
            }
        } catch (Exception e) {
            log.error("Yahoo Finance credential init failed: {}", e.getMessage());
        }
    }
}
