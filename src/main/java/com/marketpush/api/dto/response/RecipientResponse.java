package com.marketpush.api.dto.response;

import com.marketpush.domain.model.BoundGroup;
import com.marketpush.domain.model.PushSettings;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecipientResponse {

    String recipientId;
    boolean news;
    boolean largeTransfer;
    boolean fundFlow;
    List<BoundGroup> boundGroups;

    public static RecipientResponse of(String recipientId, PushSettings settings) {
        return RecipientResponse.builder()
                .recipientId(recipientId)
                .news(settings.isNews())
                .largeTransfer(settings.isLargeTransfer())
                .fundFlow(settings.isFundFlow())
                .boundGroups(List.copyOf(settings.getBoundGroups()))
                .build();
    }
}
