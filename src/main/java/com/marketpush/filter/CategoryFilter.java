package com.marketpush.filter;

import com.marketpush.config.PushProperties;
import com.marketpush.domain.enums.ContentCategory;
import com.marketpush.domain.model.ContentBatch;
import com.marketpush.domain.model.ContentItem;
import com.marketpush.domain.model.ContentPayload;
import com.marketpush.domain.model.PushSettings;
import com.marketpush.domain.model.TransferPayload;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Narrows a fetched batch to what a recipient asked for.
 *
 * <p>Disabled categories yield an empty list. Large transfers below the configured
 * minimum notional are excluded whatever the settings say; transfers whose amount
 * cannot be parsed are kept.
 */
@Component
public class CategoryFilter {

    private static final Logger log = LoggerFactory.getLogger(CategoryFilter.class);

    private final AmountParser amountParser;
    private final PushProperties pushProperties;

    public CategoryFilter(AmountParser amountParser, PushProperties pushProperties) {
        this.amountParser = amountParser;
        this.pushProperties = pushProperties;
    }

    /**
     * @return candidates for every category, in upstream order; never null, every key present
     */
    public Map<ContentCategory, List<ContentItem>> filter(ContentBatch batch, PushSettings settings) {
        Map<ContentCategory, List<ContentItem>> candidates = new EnumMap<>(ContentCategory.class);
        for (ContentCategory category : ContentCategory.values()) {
            if (batch == null || settings == null || !settings.isEnabled(category)) {
                candidates.put(category, List.of());
                continue;
            }
            List<ContentItem> items = batch.get(category);
            if (category == ContentCategory.LARGE_TRANSFER) {
                items = applyTransferThreshold(items);
            }
            candidates.put(category, List.copyOf(items));
        }
        return candidates;
    }

    private List<ContentItem> applyTransferThreshold(List<ContentItem> items) {
        BigDecimal minimum = pushProperties.getFilter().getMinTransferNotional();
        List<ContentItem> kept = new ArrayList<>(items.size());
        for (ContentItem item : items) {
            if (meetsThreshold(item, minimum)) {
                kept.add(item);
            }
        }
        if (kept.size() < items.size()) {
            log.debug("Transfer threshold {} excluded {} of {} items", minimum, items.size() - kept.size(), items.size());
        }
        return kept;
    }

    boolean meetsThreshold(ContentItem item, BigDecimal minimum) {
        ContentPayload payload = item.getPayload();
        if (!(payload instanceof TransferPayload transfer)) {
            return true;
        }
        Optional<BigDecimal> notional = amountParser.parse(transfer.getAmount());
        if (notional.isEmpty()) {
            log.debug("Unparsable transfer amount '{}', keeping item {}", transfer.getAmount(), item.getFingerprint());
            return true;
        }
        return notional.get().abs().compareTo(minimum) >= 0;
    }
}
