package com.maskid.backend.oauth.service;

import com.maskid.backend.alias.repo.AliasRepo;
import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.entity.ClientUser;
import com.maskid.backend.oauth.model.DisclosureChannel;
import com.maskid.backend.oauth.model.Scope;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 依 granted scope 把 binding 投影成 client 看得到的 user info：
 * <pre>
 * {
 *   "id": 1,                       // binding id
 *   "client": "Demo",
 *   "email_verified": true,
 *   "email": "brave_otter123@maskid.io",
 *   "name": "Son",
 *   "avatar_url": null             // 有 avatar_url scope 一定有 key
 * }
 * </pre>
 * 同樣的 (binding, scope, user 屬性) 一定得到同樣的結果。
 */
@Component
@RequiredArgsConstructor
public class ScopeProjector {

    public static final String KEY_ID = "id";
    public static final String KEY_CLIENT = "client";
    public static final String KEY_EMAIL_VERIFIED = "email_verified";

    /** 投影所需的全部輸入，先讀好再交給純函式 */
    public record Source(String name, String disclosedEmail, String avatarUrl) {}

    private static final Map<Scope, Function<Source, Object>> PROJECTIONS;

    static {
        Map<Scope, Function<Source, Object>> m = new EnumMap<>(Scope.class);
        m.put(Scope.NAME, Source::name);
        m.put(Scope.EMAIL, Source::disclosedEmail);
        m.put(Scope.AVATAR_URL, Source::avatarUrl);
        PROJECTIONS = Collections.unmodifiableMap(m);
    }

    private final AliasRepo aliases;
    private final UserService userService;

    public Map<String, Object> project(ClientUser binding, Client client, User user, Set<Scope> granted) {
        return project(binding.getId(), client.getName(), source(binding, user, granted), granted);
    }

    public Source source(ClientUser binding, User user, Set<Scope> granted) {
        String email = granted.contains(Scope.EMAIL) ? disclosedEmail(binding, user) : null;
        String avatar = granted.contains(Scope.AVATAR_URL) ? userService.uploadedPictureUrl(user) : null;
        return new Source(user.getName(), email, avatar);
    }

    public static Map<String, Object> project(Long bindingId, String clientName, Source source, Set<Scope> granted) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put(KEY_ID, bindingId);
        res.put(KEY_CLIENT, clientName);
        res.put(KEY_EMAIL_VERIFIED, true);
        for (Scope scope : Scope.values()) {
            if (granted.contains(scope)) {
                // value 可能是 null（例如沒有頭像），key 照放
                res.put(scope.value(), PROJECTIONS.get(scope).apply(source));
            }
        }
        return res;
    }

    private String disclosedEmail(ClientUser binding, User user) {
        DisclosureChannel channel = binding.getChannel();
        if (channel instanceof DisclosureChannel.Alias a) {
            return aliases.findById(a.aliasId())
                    .orElseThrow(() -> new IllegalStateException("ALIAS_MISSING_FOR_BINDING"))
                    .getEmail();
        }
        return user.getEmail();
    }
}
