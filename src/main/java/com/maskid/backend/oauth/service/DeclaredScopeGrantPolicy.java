package com.maskid.backend.oauth.service;

import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.model.Scope;
import com.maskid.backend.users.entity.User;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/** 沒指定 scope → client 宣告的全部；有指定 → 與宣告集合取交集 */
@Component
public class DeclaredScopeGrantPolicy implements ScopeGrantPolicy {

    @Override
    public Set<Scope> grant(Client client, User user, Set<Scope> requested) {
        Set<Scope> declared = client.getScopes();
        if (requested == null || requested.isEmpty()) return EnumSet.copyOf(declared);
        EnumSet<Scope> granted = EnumSet.copyOf(requested);
        granted.retainAll(declared);
        return granted;
    }
}
