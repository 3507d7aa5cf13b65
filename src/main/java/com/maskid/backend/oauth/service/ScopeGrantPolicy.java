package com.maskid.backend.oauth.service;

import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.model.Scope;
import com.maskid.backend.users.entity.User;

import java.util.Set;

/**
 * 決定這次授權實際給 client 哪些 scope。
 * 目前沒有同意畫面；要做「使用者逐項勾選」時換掉這個實作即可。
 */
public interface ScopeGrantPolicy {

    Set<Scope> grant(Client client, User user, Set<Scope> requested);
}
