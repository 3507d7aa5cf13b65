package com.maskid.backend.idgen;

import com.maskid.backend.alias.repo.AliasRepo;
import com.maskid.backend.auth.repo.AccountCodeRepo;
import com.maskid.backend.auth.repo.SessionTokenRepo;
import com.maskid.backend.common.crypto.Digests;
import com.maskid.backend.oauth.repo.AuthorizationCodeRepo;
import com.maskid.backend.oauth.repo.ClientRepo;
import com.maskid.backend.oauth.repo.OauthTokenRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** 每個種類對應一張表的 unique 欄位 */
@Component
@RequiredArgsConstructor
public class JpaUniquenessAuthority implements UniquenessAuthority {

    private final AliasRepo aliases;
    private final ClientRepo clients;
    private final AuthorizationCodeRepo codes;
    private final OauthTokenRepo tokens;
    private final SessionTokenRepo sessions;
    private final AccountCodeRepo accountCodes;

    @Override
    @Transactional(readOnly = true)
    public boolean isTaken(IdentifierKind kind, String candidate) {
        return switch (kind) {
            case ALIAS -> aliases.existsByEmail(candidate);
            case CLIENT_ID -> clients.existsByOauthClientId(candidate);
            case CLIENT_SECRET -> clients.existsByOauthClientSecret(candidate);
            case AUTH_CODE -> codes.existsByCode(candidate);
            case ACCESS_TOKEN -> tokens.existsByAccessToken(candidate);
            case SESSION_TOKEN -> sessions.existsByToken(candidate);
            // 只存 hash
            case ACTIVATION_CODE, RESET_PASSWORD_CODE -> accountCodes.existsByCodeHash(Digests.sha256Hex(candidate));
        };
    }
}
