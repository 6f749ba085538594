package com.marketpush.source;

import com.marketpush.domain.enums.ContentCategory;
import com.marketpush.domain.enums.FundFlowFormat;
import com.marketpush.domain.model.BoundGroup;
import com.marketpush.domain.model.ContentBatch;
import com.marketpush.domain.model.ContentItem;
import com.marketpush.domain.model.FundFlowPayload;
import com.marketpush.domain.model.NewsPayload;
import com.marketpush.domain.model.PushSettings;
import com.marketpush.domain.model.TransferPayload;
import com.marketpush.exception.MalformedContentException;
import com.marketpush.source.dto.FlashNewsDto;
import com.marketpush.source.dto.FundFlowDto;
import com.marketpush.source.dto.PushSettingsEnvelope;
import com.marketpush.source.dto.WhaleActionDto;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps the upstream wire shapes to domain items.
 *
 * <p>Items missing their identifying fields are dropped with a WARN; the rest of the
 * batch survives. Symbols are filled in before the fingerprint is computed so the
 * fingerprint is the same on every fetch.
 */
@Component
public class ContentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ContentNormalizer.class);

    private final SymbolExtractor symbolExtractor;

    public ContentNormalizer(SymbolExtractor symbolExtractor) {
        this.symbolExtractor = symbolExtractor;
    }

    public PushSettings toSettings(PushSettingsEnvelope.UserSettingsDto dto) {
        if (dto == null) {
            return PushSettings.allDisabled();
        }
        List<BoundGroup> groups = new ArrayList<>();
        if (dto.getManagedGroups() != null) {
            for (PushSettingsEnvelope.ManagedGroupDto group : dto.getManagedGroups()) {
                if (group == null || isBlank(group.getGroupId())) {
                    log.warn("Skipping bound group without id");
                    continue;
                }
                groups.add(new BoundGroup(group.getGroupId(), group.getGroupName(), group.getBoundAt()));
            }
        }
        return PushSettings.builder()
                .news(dto.isFlashEnabled())
                .largeTransfer(dto.isWhaleEnabled())
                .fundFlow(dto.isFundEnabled())
                .boundGroups(groups)
                .build();
    }

    public ContentBatch toBatch(PushSettingsEnvelope.PushDataDto dto) {
        if (dto == null) {
            return ContentBatch.empty();
        }
        return ContentBatch.builder()
                .news(convertAll(dto.getFlashNews(), ContentCategory.NEWS, this::toNewsItem))
                .largeTransfers(convertAll(dto.getWhaleActions(), ContentCategory.LARGE_TRANSFER, this::toTransferItem))
                .fundFlows(convertAll(dto.getFundFlows(), ContentCategory.FUND_FLOW, this::toFundFlowItem))
                .build();
    }

    ContentItem toNewsItem(FlashNewsDto dto) {
        require(dto.getTitle(), "news title");
        require(dto.getTimestamp(), "news timestamp");
        String symbol = resolveSymbol(dto.getSymbol(), dto.getTitle(), dto.getContent());
        NewsPayload payload = NewsPayload.builder()
                .title(dto.getTitle())
                .body(dto.getContent())
                .source(dto.getSource())
                .url(dto.getUrl())
                .symbol(symbol)
                .build();
        return ContentItem.of(ContentCategory.NEWS, payload, dto.getTimestamp());
    }

    ContentItem toTransferItem(WhaleActionDto dto) {
        require(dto.getAddress(), "transfer address");
        require(dto.getAction(), "transfer action");
        require(dto.getTimestamp(), "transfer timestamp");
        String symbol = resolveSymbol(dto.getSymbol(), dto.getAction(), dto.getAmount());
        TransferPayload payload = TransferPayload.builder()
                .address(dto.getAddress())
                .action(dto.getAction())
                .amount(dto.getAmount())
                .symbol(symbol)
                .transactionHash(dto.getTransactionHash())
                .exchange(dto.getExchange())
                .leverage(dto.getLeverage())
                .positionType(dto.getPositionType())
                .tradeType(dto.getTradeType())
                .pnlAmount(dto.getPnlAmount())
                .pnlCurrency(dto.getPnlCurrency())
                .pnlType(dto.getPnlType())
                .marginType(dto.getMarginType())
                .build();
        return ContentItem.of(ContentCategory.LARGE_TRANSFER, payload, dto.getTimestamp());
    }

    ContentItem toFundFlowItem(FundFlowDto dto) {
        require(dto.getTimestamp(), "fund flow timestamp");
        FundFlowPayload payload;
        if (isMarketSummary(dto)) {
            payload = FundFlowPayload.builder()
                    .format(FundFlowFormat.MARKET_SUMMARY)
                    .headline(dto.getMessage())
                    .price(dto.getPrice())
                    .flow1h(dto.getFlow1h())
                    .flow4h(dto.getFlow4h())
                    .symbol(resolveSymbol(dto.getSymbol(), dto.getMessage()))
                    .build();
        } else {
            require(dto.getFrom(), "fund flow source");
            require(dto.getTo(), "fund flow destination");
            String combined = dto.getFrom() + " " + dto.getTo() + " " + nullToEmpty(dto.getAmount());
            payload = FundFlowPayload.builder()
                    .format(FundFlowFormat.TRANSFER)
                    .from(dto.getFrom())
                    .to(dto.getTo())
                    .amount(dto.getAmount())
                    .symbol(resolveSymbol(dto.getSymbol(), dto.getAmount(), combined))
                    .build();
        }
        return ContentItem.of(ContentCategory.FUND_FLOW, payload, dto.getTimestamp());
    }

    static boolean isMarketSummary(FundFlowDto dto) {
        return !isBlank(dto.getMessage()) && (!isBlank(dto.getFlow1h()) || !isBlank(dto.getFlow4h()));
    }

    private String resolveSymbol(String provided, String... texts) {
        if (!isBlank(provided)) {
            return provided.trim();
        }
        return symbolExtractor.extract(texts);
    }

    private <T> List<ContentItem> convertAll(List<T> dtos, ContentCategory category, Function<T, ContentItem> mapper) {
        if (dtos == null || dtos.isEmpty()) {
            return List.of();
        }
        List<ContentItem> items = new ArrayList<>(dtos.size());
        for (T dto : dtos) {
            if (dto == null) {
                log.warn("Dropping null {} item", category.getKey());
                continue;
            }
            try {
                items.add(mapper.apply(dto));
            } catch (MalformedContentException e) {
                log.warn("Dropping malformed {} item: {}", category.getKey(), e.getMessage());
            }
        }
        return List.copyOf(items);
    }

    private static void require(String value, String field) {
        if (isBlank(value)) {
            throw new MalformedContentException("Missing " + field);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
