package com.reactivechat.socket.auth;

import com.reactivechat.core.model.Principal;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPrincipalDirectory implements IPrincipalDirectory {

    private final Map<String, Principal> principals = new ConcurrentHashMap<>();

    public InMemoryPrincipalDirectory register(Principal principal) {
        principals.put(principal.getUserId(), principal);
        return this;
    }

    @Override
    public Mono<Principal> findPrincipal(String principalId) {
        return Mono.justOrEmpty(principals.get(principalId));
    }
}
