package com.marketpush.filter;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses the notional value out of upstream amount strings.
 *
 * <p>Handles plain numbers ("2500000"), comma grouping ("2,500,000"), currency
 * decoration ("$2.5M", "2,500,000 USDT") and scale suffixes K/M/B (also "mn",
 * "bn", "thousand", "million", "billion"). The first number in the string wins;
 * the sign is ignored because outflows are reported as negative amounts.
 *
 * <p>Dollar and USD/USDT markers are stripped first, so "2,000,000USDT" and
 * "1.5MUSDT" read as the full amount. Returns empty when no number is present or
 * when letters other than a scale suffix are glued to it ("2000000ETH"). Callers
 * treat empty as "unknown" and must not drop the item because of it.
 */
@Component
public class AmountParser {

    private static final Pattern CURRENCY = Pattern.compile("\\$|usdt?", Pattern.CASE_INSENSITIVE);

    // Possessive digit and suffix groups: a failed lookahead must not shorten the number.
    private static final Pattern AMOUNT = Pattern.compile(
            "(\\d[\\d,]*+(?:\\.\\d++)?+|\\.\\d++)\\s*(thousand|million|billion|mn|bn|k|m|b)?+(?![a-z])",
            Pattern.CASE_INSENSITIVE);

    private static final BigDecimal THOUSAND = new BigDecimal("1000");
    private static final BigDecimal MILLION = new BigDecimal("1000000");
    private static final BigDecimal BILLION = new BigDecimal("1000000000");

    public Optional<BigDecimal> parse(String amount) {
        if (amount == null || amount.isBlank()) {
            return Optional.empty();
        }

        Matcher matcher = AMOUNT.matcher(CURRENCY.matcher(amount).replaceAll(" "));
        if (!matcher.find()) {
            return Optional.empty();
        }

        String digits = matcher.group(1).replace(",", "");
        BigDecimal value;
        try {
            value = new BigDecimal(digits);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        String suffix = matcher.group(2);
        if (suffix != null) {
            value = value.multiply(multiplierFor(suffix.toLowerCase(Locale.ROOT)));
        }
        return Optional.of(value);
    }

    private BigDecimal multiplierFor(String suffix) {
        return switch (suffix) {
            case "k", "thousand" -> THOUSAND;
            case "m", "mn", "million" -> MILLION;
            case "b", "bn", "billion" -> BILLION;
            default -> BigDecimal.ONE;
        };
    }
}
