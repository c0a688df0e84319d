package com.reactivechat.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Set;

/**
 * Authenticated user identity.
 * <p>
 * Loaded from the principal directory when an access token is validated and cached for the
 * lifetime of a connection. Group memberships are informational; routing always resolves the
 * member set of a conversation at send time.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class Principal {
    String userId;
    String displayName;
    Set<String> groupIds;

    public Principal(String userId, String displayName, Set<String> groupIds) {
        this.userId = userId;
        this.displayName = displayName;
        this.groupIds = groupIds == null ? Set.of() : Set.copyOf(groupIds);
    }

    public boolean isMemberOf(String groupId) {
        return groupIds.contains(groupId);
    }
}
