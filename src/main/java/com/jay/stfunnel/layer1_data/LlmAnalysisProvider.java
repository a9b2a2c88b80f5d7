package com.jay.stfunnel.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.stfunnel.config.FunnelConfig;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.enums.AnalysisKind;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Qualitative analyst backed by an OpenAI-compatible chat-completions endpoint.
 * Returns empty when no API key is configured or the call fails; callers fall back to neutral scores.
 */
@Slf4j
@Service
public class LlmAnalysisProvider implements QualitativeAnalysisProvider {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String SYSTEM_PROMPT = "You are an equity research analyst. Answer in plain prose. "
        + "Always state figures explicitly, e.g. '18% upside', 'Risk score: 6/10', 'sentiment: bullish'.";

    private final FunnelConfig.Llm settings;
    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient httpClient;

    public LlmAnalysisProvider(FunnelConfig config) {
        this.settings = config.llm();
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(settings.getTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
        log.info("LlmAnalysisProvider initialized. Endpoint configured: {}", settings.isConfigured());
    }

    @Override
    public Optional<String> analyse(Candidate candidate, AnalysisKind kind) {
        if (!settings.isConfigured()) {
            log.debug("LLM API key not configured, skipping {} analysis for {}", kind, candidate.getTicker());
            return Optional.empty();
        }
        try {
            ObjectNode payload = mapper.createObjectNode().put("model", settings.getModel());
            ArrayNode messages = payload.putArray("messages");
            messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
            messages.addObject().put("role", "user").put("content", prompt(candidate, kind));

            Request request = new Request.Builder()
                .url(settings.getBaseUrl() + "/chat/completions")
                .addHeader("Authorization", "Bearer " + settings.getApiKey())
                .post(RequestBody.create(payload.toString(), JSON))
                .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    log.warn("LLM {} analysis for {} failed: HTTP {}", kind, candidate.getTicker(), response.code());
                    return Optional.empty();
                }
                return extractContent(mapper.readTree(response.body().string()));
            }
        } catch (IOException e) {
            log.warn("LLM {} analysis for {} failed: {}", kind, candidate.getTicker(), e.getMessage());
            return Optional.empty();
        }
    }

    Optional<String> extractContent(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) return Optional.empty();
        String content = choices.get(0).path("message").path("content").asText("");
        return content.isBlank() ? Optional.empty() : Optional.of(content);
    }

    String prompt(Candidate c, AnalysisKind kind) {
        String header = String.format("%s (%s), sector %s, price %s, P/E %s, P/B %s, ROE %s%%, revenue growth %s%%, beta %s.",
            c.getCompanyName(), c.getTicker(), c.sectorOrUnknown(), fmt(c.getPrice()), fmt(c.getPeRatio()),
            fmt(c.getPbRatio()), fmt(c.getRoe()), fmt(c.getRevenueGrowth()), fmt(c.getBeta()));
        return switch (kind) {
            case DCF -> header + " Run a discounted cash flow valuation. State the intrinsic value per share "
                + "as '$N' and the upside or downside to the current price as a percentage.";
            case COMPARABLE -> header + " Compare valuation multiples against sector peers. State the implied "
                + "value per share as 'implied value $N' and the upside or downside as a percentage.";
            case SENTIMENT -> header + " Summarise analyst ratings, news flow and insider activity. Conclude with "
                + "an overall sentiment of very bullish, bullish, neutral, bearish or very bearish.";
            case RISK -> header + " Assess volatility, drawdown, leverage and short interest. Conclude with "
                + "'Overall risk score: N/10' where 10 is highest risk.";
            case EARNINGS -> header + " Review the last four quarters: beats or misses versus estimates, "
                + "guidance changes and growth rates.";
        };
    }

    private static String fmt(Double value) {
        return value == null ? "n/a" : String.format("%.2f", value);
    }
}
