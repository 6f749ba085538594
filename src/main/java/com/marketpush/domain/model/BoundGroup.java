package com.marketpush.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A group channel bound to a user. The group receives the owning user's
 * categories, with its own dedup scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoundGroup {

    private String groupId;
    private String groupName;
    private String boundAt;
}
