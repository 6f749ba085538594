package com.marketpush.domain.model;

import com.marketpush.domain.enums.ContentCategory;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-recipient category toggles plus the groups bound to the recipient.
 *
 * <p>Upstream calls these flash / whale / fund; internally they map to
 * {@link ContentCategory#NEWS}, {@link ContentCategory#LARGE_TRANSFER} and
 * {@link ContentCategory#FUND_FLOW}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PushSettings {

    private boolean news;
    private boolean largeTransfer;
    private boolean fundFlow;

    @Builder.Default
    private List<BoundGroup> boundGroups = new ArrayList<>();

    public boolean isEnabled(ContentCategory category) {
        return switch (category) {
            case NEWS -> news;
            case LARGE_TRANSFER -> largeTransfer;
            case FUND_FLOW -> fundFlow;
        };
    }

    public boolean isAnyEnabled() {
        return news || largeTransfer || fundFlow;
    }

    /** Defensive copy so registry snapshots cannot be mutated by callers. */
    public PushSettings copy() {
        List<BoundGroup> groups = new ArrayList<>();
        if (boundGroups != null) {
            for (BoundGroup group : boundGroups) {
                groups.add(new BoundGroup(group.getGroupId(), group.getGroupName(), group.getBoundAt()));
            }
        }
        return toBuilder().boundGroups(groups).build();
    }

    public static PushSettings allDisabled() {
        return PushSettings.builder().build();
    }
}
