package com.marketpush.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A message ready for the gateway. The engine only cares whether sending it
 * succeeded; {@code html} and {@code symbol} are passed through untouched.
 */
@Value
@Builder
public class RenderedMessage {

    String text;

    @Builder.Default
    boolean html = true;

    String symbol;
}
