package com.marketpush.domain.enums;

/**
 * Alert categories a recipient can toggle independently.
 *
 * <p>Declaration order is the delivery order used by the fan-out dispatcher:
 * news first, then large transfers, then fund flows.
 */
public enum ContentCategory {

    /** Breaking market news ("flash news" upstream). */
    NEWS("news"),

    /** Large-holder transfers and whale trades ("whale actions" upstream). */
    LARGE_TRANSFER("largeTransfer"),

    /** Exchange fund flows, in either of the two upstream formats. */
    FUND_FLOW("fundFlow");

    private final String key;

    ContentCategory(String key) {
        this.key = key;
    }

    /** Short stable key used in dedup storage keys and log output. */
    public String getKey() {
        return key;
    }

    /** Accepts either the key ("largeTransfer") or the constant name ("LARGE_TRANSFER"). */
    public static ContentCategory fromKey(String value) {
        for (ContentCategory category : values()) {
            if (category.key.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown content category: " + value);
    }
}
