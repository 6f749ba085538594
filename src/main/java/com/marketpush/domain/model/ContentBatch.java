package com.marketpush.domain.model;

import com.marketpush.domain.enums.ContentCategory;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Content returned by one upstream fetch, grouped by category. */
@Value
@Builder
public class ContentBatch {

    @Builder.Default
    List<ContentItem> news = List.of();

    @Builder.Default
    List<ContentItem> largeTransfers = List.of();

    @Builder.Default
    List<ContentItem> fundFlows = List.of();

    public List<ContentItem> get(ContentCategory category) {
        return switch (category) {
            case NEWS -> news;
            case LARGE_TRANSFER -> largeTransfers;
            case FUND_FLOW -> fundFlows;
        };
    }

    public boolean isEmpty() {
        return news.isEmpty() && largeTransfers.isEmpty() && fundFlows.isEmpty();
    }

    public int size() {
        return news.size() + largeTransfers.size() + fundFlows.size();
    }

    public Map<ContentCategory, Integer> counts() {
        Map<ContentCategory, Integer> counts = new EnumMap<>(ContentCategory.class);
        for (ContentCategory category : ContentCategory.values()) {
            counts.put(category, get(category).size());
        }
        return counts;
    }

    public static ContentBatch empty() {
        return ContentBatch.builder().build();
    }
}
