package com.marketpush.domain.model;

final class PayloadKeys {

    private PayloadKeys() {}

    static String prefix(String value, int length) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        return trimmed.length() <= length ? trimmed : trimmed.substring(0, length);
    }

    static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('|');
            }
            sb.append(parts[i] != null ? parts[i] : "");
        }
        return sb.toString();
    }
}
