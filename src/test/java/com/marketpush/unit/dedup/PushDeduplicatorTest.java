package com.marketpush.unit.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.marketpush.config.PushProperties;
import com.marketpush.dedup.DedupKey;
import com.marketpush.dedup.DeliveryLedger;
import com.marketpush.dedup.InMemoryDeliveryLedger;
import com.marketpush.dedup.PushDeduplicator;
import com.marketpush.domain.enums.ContentCategory;
import com.marketpush.domain.model.ContentItem;
import com.marketpush.domain.model.NewsPayload;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PushDeduplicatorTest {

    private static final Instant T0 = Instant.parse("2025-03-01T08:00:00Z");
    private static final String USER_SCOPE = "user:1001";
    private static final String GROUP_SCOPE = "group:-100200";

    private final AtomicLong ticker = new AtomicLong();
    private InMemoryDeliveryLedger ledger;
    private PushProperties pushProperties;
    private PushDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryDeliveryLedger(Duration.ofHours(1), ticker::get);
        pushProperties = new PushProperties();
        pushProperties.getDedup().setRetention(Duration.ofHours(1));
        deduplicator = new PushDeduplicator(ledger, pushProperties);
    }

    private static ContentItem news(String title) {
        return ContentItem.of(ContentCategory.NEWS, NewsPayload.builder().title(title).build(), "2025-03-01T07:55:00Z");
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        @Test
        @DisplayName("a delivered item is filtered out on the next lookup")
        void deliveredItemSuppressed() {
            ContentItem item = news("BTC breaks 100k");
            deduplicator.markDelivered(USER_SCOPE, List.of(item), ContentCategory.NEWS, T0);

            List<ContentItem> fresh = deduplicator.filterDuplicates(
                    USER_SCOPE, List.of(item), ContentCategory.NEWS, T0.plusSeconds(60));

            assertThat(fresh).isEmpty();
        }

        @Test
        @DisplayName("undelivered items pass through in input order")
        void freshItemsInOrder() {
            ContentItem a = news("A");
            ContentItem b = news("B");
            ContentItem c = news("C");
            deduplicator.markDelivered(USER_SCOPE, List.of(b), ContentCategory.NEWS, T0);

            assertThat(deduplicator.filterDuplicates(USER_SCOPE, List.of(a, b, c), ContentCategory.NEWS, T0))
                    .containsExactly(a, c);
        }

        @Test
        @DisplayName("repeats within one batch collapse to the first occurrence")
        void repeatsInBatchCollapse() {
            ContentItem item = news("Same headline");
            ContentItem copy = news("Same headline");

            assertThat(deduplicator.filterDuplicates(USER_SCOPE, List.of(item, copy), ContentCategory.NEWS, T0))
                    .containsExactly(item);
        }

        @Test
        @DisplayName("filtering alone never records anything")
        void filterDoesNotRecord() {
            deduplicator.filterDuplicates(USER_SCOPE, List.of(news("X")), ContentCategory.NEWS, T0);

            assertThat(ledger.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("a record older than the retention window no longer suppresses and is evicted")
        void expiredRecordIgnored() {
            ContentItem item = news("Old news");
            deduplicator.markDelivered(USER_SCOPE, List.of(item), ContentCategory.NEWS, T0);

            List<ContentItem> fresh = deduplicator.filterDuplicates(
                    USER_SCOPE, List.of(item), ContentCategory.NEWS, T0.plus(Duration.ofHours(1)));

            assertThat(fresh).containsExactly(item);
            assertThat(ledger.size()).isZero();
        }

        @Test
        @DisplayName("expired records that are never looked up again do not accumulate")
        void expiredRecordsDropWithoutLookup() {
            deduplicator.markDelivered(
                    USER_SCOPE, List.of(news("gone 1"), news("gone 2"), news("gone 3")), ContentCategory.NEWS, T0);
            assertThat(ledger.size()).isEqualTo(3);

            ticker.addAndGet(TimeUnit.MINUTES.toNanos(61));

            assertThat(ledger.size()).isZero();
        }

        @Test
        @DisplayName("a record just inside the window still suppresses")
        void justInsideWindow() {
            ContentItem item = news("Recent news");
            deduplicator.markDelivered(USER_SCOPE, List.of(item), ContentCategory.NEWS, T0);

            assertThat(deduplicator.isDelivered(
                            USER_SCOPE, ContentCategory.NEWS, item.getFingerprint(), T0.plus(Duration.ofMinutes(59))))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("Scopes")
    class Scopes {

        @Test
        @DisplayName("user and group scopes are independent")
        void scopesIndependent() {
            ContentItem item = news("ETH ETF approved");
            deduplicator.markDelivered(USER_SCOPE, List.of(item), ContentCategory.NEWS, T0);

            assertThat(deduplicator.filterDuplicates(GROUP_SCOPE, List.of(item), ContentCategory.NEWS, T0))
                    .containsExactly(item);
        }

        @Test
        @DisplayName("categories are independent within a scope")
        void categoriesIndependent() {
            ContentItem item = news("Same fingerprint");
            deduplicator.markDelivered(USER_SCOPE, List.of(item), ContentCategory.NEWS, T0);

            assertThat(deduplicator.isDelivered(USER_SCOPE, ContentCategory.FUND_FLOW, item.getFingerprint(), T0))
                    .isFalse();
        }

        @Test
        @DisplayName("clearScope removes only that scope's records")
        void clearScope() {
            ContentItem item = news("Clear me");
            deduplicator.markDelivered(USER_SCOPE, List.of(item), ContentCategory.NEWS, T0);
            deduplicator.markDelivered(GROUP_SCOPE, List.of(item), ContentCategory.NEWS, T0);

            int cleared = deduplicator.clearScope(USER_SCOPE, null);

            assertThat(cleared).isEqualTo(1);
            assertThat(deduplicator.isDelivered(USER_SCOPE, ContentCategory.NEWS, item.getFingerprint(), T0))
                    .isFalse();
            assertThat(deduplicator.isDelivered(GROUP_SCOPE, ContentCategory.NEWS, item.getFingerprint(), T0))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("Ledger failures")
    class LedgerFailures {

        @Test
        @DisplayName("lookup failure treats the item as new")
        void lookupFailureFailsOpen() {
            DeliveryLedger failing = mock(DeliveryLedger.class);
            when(failing.deliveredAt(any(DedupKey.class))).thenThrow(new IllegalStateException("redis down"));
            PushDeduplicator dedup = new PushDeduplicator(failing, pushProperties);
            ContentItem item = news("Outage");

            assertThat(dedup.filterDuplicates(USER_SCOPE, List.of(item), ContentCategory.NEWS, T0))
                    .containsExactly(item);
        }

        @Test
        @DisplayName("write failure is logged, not thrown")
        void writeFailureContained() {
            DeliveryLedger failing = mock(DeliveryLedger.class);
            doThrow(new IllegalStateException("redis down"))
                    .when(failing)
                    .record(any(DedupKey.class), any(Instant.class), any(Duration.class));
            PushDeduplicator dedup = new PushDeduplicator(failing, pushProperties);

            dedup.markDelivered(USER_SCOPE, List.of(news("Outage")), ContentCategory.NEWS, T0);
        }
    }
}
