package com.marketpush.format;

import com.marketpush.domain.model.ContentItem;
import com.marketpush.domain.model.ContentPayload;
import com.marketpush.domain.model.FundFlowPayload;
import com.marketpush.domain.model.NewsPayload;
import com.marketpush.domain.model.RenderedMessage;
import com.marketpush.domain.model.TransferPayload;
import com.marketpush.domain.enums.FundFlowFormat;
import com.marketpush.exception.MalformedContentException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Renders content items as Telegram HTML.
 *
 * <p>Templates:
 * <pre>
 * 🚨 &lt;b&gt;News&lt;/b&gt;            title, first paragraph of body, related token
 * 🐋 Whale 0x7c33…502a just closed 1.56M FARTCOIN long position (10x cross), loss 2,484.66 USDT.
 * 💰 &lt;b&gt;Fund Flow&lt;/b&gt;       From / To / Amount, or headline / Token / Price / 1h / 4h
 * </pre>
 * All upstream text is HTML-escaped.
 */
@Component
public class HtmlMessageFormatter implements MessageFormatter {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern LEADING_NUMBER = Pattern.compile("[\\d,]+\\.?\\d*");

    private static final Map<String, String> PAST_TENSE = Map.ofEntries(
            Map.entry("open", "opened"),
            Map.entry("opened", "opened"),
            Map.entry("opening", "opened"),
            Map.entry("close", "closed"),
            Map.entry("closed", "closed"),
            Map.entry("closing", "closed"),
            Map.entry("buy", "bought"),
            Map.entry("bought", "bought"),
            Map.entry("buying", "bought"),
            Map.entry("sell", "sold"),
            Map.entry("sold", "sold"),
            Map.entry("selling", "sold"),
            Map.entry("transfer", "transferred"),
            Map.entry("transferred", "transferred"),
            Map.entry("transferring", "transferred"),
            Map.entry("trade", "traded"),
            Map.entry("traded", "traded"),
            Map.entry("trading", "traded"),
            Map.entry("liquidate", "liquidated"),
            Map.entry("liquidated", "liquidated"),
            Map.entry("liquidating", "liquidated"));

    @Override
    public RenderedMessage format(ContentItem item) {
        if (item == null || item.getPayload() == null) {
            throw new MalformedContentException("Item has no payload");
        }
        ContentPayload payload = item.getPayload();
        String text;
        if (payload instanceof NewsPayload news) {
            text = formatNews(news);
        } else if (payload instanceof TransferPayload transfer) {
            text = formatTransfer(transfer);
        } else if (payload instanceof FundFlowPayload flow) {
            text = formatFundFlow(flow);
        } else {
            throw new MalformedContentException("Unsupported payload " + payload.getClass().getSimpleName());
        }
        return RenderedMessage.builder().text(text).symbol(payload.getSymbol()).build();
    }

    String formatNews(NewsPayload news) {
        if (isBlank(news.getTitle())) {
            throw new MalformedContentException("News item has no title");
        }
        StringBuilder sb = new StringBuilder("🚨 <b>News</b>\n\n");
        sb.append(escapeHtml(news.getTitle()));

        String paragraph = firstParagraph(news.getBody());
        if (!paragraph.isEmpty()) {
            sb.append("\n\n").append(escapeHtml(paragraph));
        }
        appendRelatedToken(sb, news.getSymbol());
        return sb.toString();
    }

    String formatTransfer(TransferPayload transfer) {
        if (isBlank(transfer.getAddress()) || isBlank(transfer.getAction())) {
            throw new MalformedContentException("Transfer item has no address or action");
        }
        StringBuilder sb = new StringBuilder("🐋 Whale ")
                .append(escapeHtml(truncateAddress(transfer.getAddress())))
                .append(" just ")
                .append(verb(transfer));

        String amount = compactAmount(transfer.getAmount());
        if (!amount.isEmpty()) {
            sb.append(' ').append(escapeHtml(amount));
        }
        sb.append(' ').append(escapeHtml(transfer.getSymbol() != null ? transfer.getSymbol() : "TOKEN"));

        if (!isBlank(transfer.getPositionType())) {
            sb.append(' ').append(escapeHtml(transfer.getPositionType())).append(" position");
        }

        List<String> leverageInfo = new ArrayList<>();
        if (!isBlank(transfer.getLeverage())) {
            leverageInfo.add(transfer.getLeverage());
        }
        if (!isBlank(transfer.getMarginType())) {
            leverageInfo.add(transfer.getMarginType());
        }
        if (!leverageInfo.isEmpty()) {
            sb.append(" (").append(escapeHtml(String.join(" ", leverageInfo))).append(')');
        }

        if (!isBlank(transfer.getPnlType()) && !isBlank(transfer.getPnlAmount())) {
            sb.append(", ")
                    .append(escapeHtml(transfer.getPnlType()))
                    .append(' ')
                    .append(formatPnl(transfer.getPnlAmount()))
                    .append(' ')
                    .append(escapeHtml(transfer.getPnlCurrency() != null ? transfer.getPnlCurrency() : "USDT"));
        }

        if (sb.charAt(sb.length() - 1) != '.') {
            sb.append('.');
        }
        return sb.toString();
    }

    String formatFundFlow(FundFlowPayload flow) {
        StringBuilder sb = new StringBuilder("💰 <b>Fund Flow</b>\n\n");
        if (flow.getFormat() == FundFlowFormat.MARKET_SUMMARY) {
            if (isBlank(flow.getHeadline())) {
                throw new MalformedContentException("Fund flow summary has no headline");
            }
            sb.append(escapeHtml(flow.getHeadline())).append("\n\n");
            sb.append("Token: ").append(escapeHtml(nullToEmpty(flow.getSymbol()))).append('\n');
            sb.append("Price: $").append(escapeHtml(nullToEmpty(flow.getPrice()))).append('\n');
            sb.append("1h Flow: ").append(escapeHtml(nullToEmpty(flow.getFlow1h()))).append('\n');
            sb.append("4h Flow: ").append(escapeHtml(nullToEmpty(flow.getFlow4h())));
        } else {
            if (isBlank(flow.getFrom()) || isBlank(flow.getTo())) {
                throw new MalformedContentException("Fund flow transfer has no source or destination");
            }
            sb.append("From: ").append(escapeHtml(flow.getFrom())).append('\n');
            sb.append("To: ").append(escapeHtml(flow.getTo()));
            if (!isBlank(flow.getAmount())) {
                sb.append("\nAmount: ").append(escapeHtml(flow.getAmount().trim()));
            }
        }
        appendRelatedToken(sb, flow.getSymbol());
        return sb.toString();
    }

    private String verb(TransferPayload transfer) {
        if ("close".equalsIgnoreCase(transfer.getTradeType())) {
            return "closed";
        }
        if ("open".equalsIgnoreCase(transfer.getTradeType())) {
            return "opened";
        }
        return PAST_TENSE.getOrDefault(transfer.getAction().trim().toLowerCase(Locale.ROOT), "traded");
    }

    private static void appendRelatedToken(StringBuilder sb, String symbol) {
        if (!isBlank(symbol)) {
            sb.append("\n\n💡 <i>Related token: ").append(escapeHtml(symbol)).append("</i>");
        }
    }

    /** 0x7c33a1…502a style: first 6 and last 4 characters. */
    static String truncateAddress(String address) {
        if (address == null || address.length() < 10) {
            return address;
        }
        return address.substring(0, 6) + "…" + address.substring(address.length() - 4);
    }

    /** 1560000 → 1.56M, 156000 → 156K, 1500 → 1.5K. Unparsable input is returned unchanged. */
    static String compactAmount(String amount) {
        if (isBlank(amount)) {
            return "";
        }
        Matcher matcher = LEADING_NUMBER.matcher(amount);
        if (!matcher.find()) {
            return amount.trim();
        }
        BigDecimal value;
        try {
            value = new BigDecimal(matcher.group().replace(",", ""));
        } catch (NumberFormatException e) {
            return amount.trim();
        }
        if (value.compareTo(BigDecimal.valueOf(1_000_000)) >= 0) {
            return strip(value.divide(BigDecimal.valueOf(1_000_000), 2, RoundingMode.HALF_UP)) + "M";
        }
        if (value.compareTo(BigDecimal.valueOf(1_000)) >= 0) {
            return strip(value.divide(BigDecimal.valueOf(1_000), 1, RoundingMode.HALF_UP)) + "K";
        }
        return strip(value);
    }

    static String formatPnl(String amount) {
        String cleaned = amount.replaceAll("[^0-9.-]", "");
        try {
            BigDecimal value = new BigDecimal(cleaned).abs();
            DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
            return format.format(value);
        } catch (NumberFormatException e) {
            return escapeHtml(amount);
        }
    }

    static String firstParagraph(String body) {
        if (isBlank(body)) {
            return "";
        }
        String text = TAG.matcher(body.replace("<br>", "\n").replace("<br/>", "\n").replace("</p>", "\n\n"))
                .replaceAll("")
                .replace("&nbsp;", " ")
                .trim();
        String[] paragraphs = PARAGRAPH_BREAK.split(text, 2);
        return paragraphs.length > 0 ? paragraphs[0].trim() : "";
    }

    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String strip(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
