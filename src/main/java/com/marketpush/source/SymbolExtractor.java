package com.marketpush.source;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Guesses the token symbol an item is about when upstream did not supply one.
 *
 * <p>Candidates are tried in order: a bare uppercase word, a {@code $TICKER}, then
 * a list of well-known tokens matched case-insensitively. A candidate must be 3 to
 * 10 uppercase letters and must not be a common English word or currency code.
 */
@Component
public class SymbolExtractor {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b([A-Z]{3,10})\\b"),
            Pattern.compile("\\$([A-Z]{3,10})\\b"),
            Pattern.compile(
                    "\\b(BTC|ETH|USDT|USDC|BNB|ADA|SOL|DOGE|SHIB|PEPE|WIF|BONK)\\b", Pattern.CASE_INSENSITIVE));

    private static final Pattern VALID_SYMBOL = Pattern.compile("^[A-Z]{3,10}$");

    private static final Set<String> EXCLUDED = Set.of(
            "THE", "AND", "FOR", "ALL", "NEW", "NOW", "GET", "SET",
            "USD", "CNY", "EUR", "GBP", "JPY",
            "API", "URL", "HTTP", "JSON", "XML",
            "CEO", "CTO", "CFO", "COO",
            "MIN", "MAX", "AVG", "SUM", "TOP", "HOT", "BIG", "LOW", "HIGH");

    /** Returns the first valid symbol found across the given texts, or null. */
    public String extract(String... texts) {
        for (String text : texts) {
            String symbol = extractFrom(text);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    String extractFrom(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String candidate = matcher.group(1).toUpperCase(Locale.ROOT);
                if (isValid(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    public boolean isValid(String symbol) {
        return symbol != null && VALID_SYMBOL.matcher(symbol).matches() && !EXCLUDED.contains(symbol);
    }
}
