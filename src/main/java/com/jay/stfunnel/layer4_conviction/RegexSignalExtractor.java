package com.jay.stfunnel.layer4_conviction;

import com.jay.stfunnel.model.AnalysisSignals;
import com.jay.stfunnel.model.AnalysisTexts;
import com.jay.stfunnel.model.enums.GuidanceChange;
import com.jay.stfunnel.model.enums.SentimentLabel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based signal extraction from analyst prose.
 */
@Component
public class RegexSignalExtractor implements AnalysisSignalExtractor {

    private static final String NUMBER = "[+-]?\\d+(?:\\.\\d+)?";
    private static final String DOLLARS = "\\$?([\\d,]+\\.?\\d*)";
    private static final Pattern PERCENTAGE = Pattern.compile("([+-]?)(\\d+(?:\\.\\d+)?)\\s*%");
    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d*)?");
    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    // First match wins
    private static final List<Pattern> UPSIDE_PATTERNS = List.of(
        Pattern.compile(NUMBER + "%\\s*(?:upside|downside|potential)", FLAGS),
        Pattern.compile("(?:upside|downside|potential)[:\\s]+" + NUMBER + "%", FLAGS),
        Pattern.compile("fair value[^.]*?" + NUMBER + "%", FLAGS),
        Pattern.compile("intrinsic value[^.]*?" + NUMBER + "%", FLAGS));

    private static final List<Pattern> RISK_PATTERNS = List.of(
        Pattern.compile("(?:overall\\s+)?risk\\s+score[:\\s]+(\\d+(?:\\.\\d+)?)\\s*/\\s*10", FLAGS),
        Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*/\\s*10\\s*(?:risk|score)", FLAGS));

    private static final List<Pattern> INTRINSIC_VALUE_PATTERNS = List.of(
        Pattern.compile("INTRINSIC VALUE PER SHARE:\\s*" + DOLLARS),
        Pattern.compile("intrinsic value[:\\s]+" + DOLLARS, FLAGS),
        Pattern.compile("fair value[:\\s]+" + DOLLARS, FLAGS),
        Pattern.compile("intrinsic value per share[:\\s]+" + DOLLARS, FLAGS));

    private static final List<Pattern> IMPLIED_VALUE_PATTERNS = List.of(
        Pattern.compile("implied\\s+(?:fair\\s+)?value[:\\s]+" + DOLLARS, FLAGS),
        Pattern.compile("peer[- ]implied\\s+(?:price|value)[:\\s]+" + DOLLARS, FLAGS),
        Pattern.compile("comparable\\s+value[:\\s]+" + DOLLARS, FLAGS),
        Pattern.compile("target\\s+price[:\\s]+" + DOLLARS, FLAGS));

    private static final Pattern VERY_BULLISH = Pattern.compile("very\\s+bullish", FLAGS);
    private static final Pattern VERY_BEARISH = Pattern.compile("very\\s+bearish", FLAGS);
    private static final Pattern INSIDER_BUYING = Pattern.compile("insider.*buy", FLAGS);
    private static final Pattern DEEP_DRAWDOWN = Pattern.compile("max drawdown.*-?[3-9]\\d%", FLAGS);
    private static final Pattern HIGH_SHORT_INTEREST = Pattern.compile("short interest.*high", FLAGS);

    private static final Pattern BEAT = Pattern.compile("beat.*(\\d+)", FLAGS);
    private static final Pattern MISS = Pattern.compile("miss.*(\\d+)", FLAGS);
    private static final Pattern RAISED_GUIDANCE = Pattern.compile("raised.*guidance", FLAGS);
    private static final Pattern LOWERED_GUIDANCE = Pattern.compile("lowered.*guidance", FLAGS);
    private static final Pattern GROWTH = Pattern.compile("\\+\\d+%.*growth|growth.*\\+\\d+%", FLAGS);

    @Override
    public AnalysisSignals extract(AnalysisTexts texts) {
        if (texts == null) return AnalysisSignals.none();

        AnalysisSignals.AnalysisSignalsBuilder signals = AnalysisSignals.builder()
            .dcfUpside(parseUpside(texts.dcf()))
            .peerUpside(parseUpside(texts.comparable()))
            .intrinsicValue(parseDollarValue(texts.dcf(), INTRINSIC_VALUE_PATTERNS))
            .impliedValue(parseDollarValue(texts.comparable(), IMPLIED_VALUE_PATTERNS));

        String sentiment = texts.sentiment();
        if (sentiment != null) {
            String lowerText = sentiment.toLowerCase(Locale.ROOT);
            boolean strongBuy = lowerText.contains("strong buy");
            signals.sentimentLabel(parseSentimentLabel(sentiment))
                .strongBuyMentioned(strongBuy)
                .sellMentioned(lowerText.contains("sell") && !strongBuy)
                .insiderBuyingMentioned(INSIDER_BUYING.matcher(sentiment).find());
        }

        String risk = texts.risk();
        if (risk != null) {
            signals.rawRiskScore(parseRiskScore(risk)).riskMentions(parseRiskMentions(risk));
        }

        String earnings = texts.earnings();
        if (earnings != null) {
            GuidanceChange guidance = GuidanceChange.NONE;
            if (RAISED_GUIDANCE.matcher(earnings).find()) guidance = GuidanceChange.RAISED;
            else if (LOWERED_GUIDANCE.matcher(earnings).find()) guidance = GuidanceChange.LOWERED;
            signals.earningsBeat(BEAT.matcher(earnings).find())
                .earningsMiss(MISS.matcher(earnings).find())
                .guidance(guidance)
                .growthMentioned(GROWTH.matcher(earnings).find());
        }
        return signals.build();
    }

    /**
     * Signed percentage from the first matching pattern. The sign comes from the last
     * percentage in the match, and "downside" always makes it negative.
     */
    Double parseUpside(String text) {
        if (text == null || text.isBlank()) return null;
        for (Pattern pattern : UPSIDE_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) continue;
            String match = m.group();

            Matcher number = PERCENTAGE.matcher(match);
            String sign = null;
            String digits = null;
            while (number.find()) {
                sign = number.group(1);
                digits = number.group(2);
            }
            if (digits == null) continue;

            double value = Double.parseDouble(digits);
            boolean negative = "-".equals(sign) || match.toLowerCase(Locale.ROOT).contains("downside");
            return negative ? -value : value;
        }
        return null;
    }

    Double parseRiskScore(String text) {
        if (text == null) return null;
        for (Pattern pattern : RISK_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) return Double.parseDouble(m.group(1));
        }
        return null;
    }

    /** "bullish" is tested before the bearish labels, so mixed prose reads bullish. */
    SentimentLabel parseSentimentLabel(String text) {
        String lowerText = text.toLowerCase(Locale.ROOT);
        if (VERY_BULLISH.matcher(text).find()) return SentimentLabel.VERY_BULLISH;
        if (lowerText.contains("bullish")) return SentimentLabel.BULLISH;
        if (VERY_BEARISH.matcher(text).find()) return SentimentLabel.VERY_BEARISH;
        if (lowerText.contains("bearish")) return SentimentLabel.BEARISH;
        if (lowerText.contains("neutral")) return SentimentLabel.NEUTRAL;
        return null;
    }

    List<String> parseRiskMentions(String text) {
        List<String> mentions = new ArrayList<>();
        if (text.toLowerCase(Locale.ROOT).contains("high beta")) mentions.add("High beta (market sensitivity)");
        if (DEEP_DRAWDOWN.matcher(text).find()) mentions.add("History of large drawdowns");
        if (HIGH_SHORT_INTEREST.matcher(text).find()) mentions.add("Elevated short interest");
        return mentions;
    }

    /** First positive dollar figure found by the patterns, in order. */
    Double parseDollarValue(String text, List<Pattern> patterns) {
        if (text == null) return null;
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) continue;
            String digits = m.group(1).replace(",", "");
            if (!DECIMAL.matcher(digits).matches()) continue;
            double value = Double.parseDouble(digits);
            if (value > 0) return value;
        }
        return null;
    }
}
