package com.reactivechat.socket.auth;

import com.reactivechat.core.model.Principal;
import reactor.core.publisher.Mono;

/**
 * Read-only view of user records owned by the storage collaborator.
 */
public interface IPrincipalDirectory {
    /**
     * @param principalId user identifier
     * @return the principal with its group memberships, or empty if unknown
     */
    Mono<Principal> findPrincipal(String principalId);
}
