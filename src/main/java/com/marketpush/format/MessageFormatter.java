package com.marketpush.format;

import com.marketpush.domain.model.ContentItem;
import com.marketpush.domain.model.RenderedMessage;

/**
 * Turns one content item into a gateway message.
 *
 * <p>Implementations throw {@link com.marketpush.exception.MalformedContentException}
 * when an item cannot be rendered; the dispatcher drops that item and carries on.
 */
public interface MessageFormatter {

    RenderedMessage format(ContentItem item);
}
