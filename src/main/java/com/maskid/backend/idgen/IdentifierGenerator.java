package com.maskid.backend.idgen;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 產生對外可見的識別碼，並向 UniquenessAuthority 確認尚未被使用。
 * <p>
 * 只做「查詢」不做「保留」：寫入由呼叫端負責（見 IdentifierAllocator），
 * 兩個並行的 allocator 拿到同一個候選值時由 DB unique constraint 裁決。
 * 撞值時以有上限的迴圈重試，超過上限丟 {@link GenerationExhaustedException}。
 */
@Slf4j
@Component
public class IdentifierGenerator {

    private final UniquenessAuthority authority;
    private final WordList words;
    private final String aliasDomain;
    private final int maxAttempts;

    public IdentifierGenerator(
            UniquenessAuthority authority,
            WordList words,
            @Value("${app.alias.domain:maskid.io}") String aliasDomain,
            @Value("${app.idgen.max-attempts:10}") int maxAttempts
    ) {
        if (maxAttempts < 1) throw new IllegalArgumentException("max-attempts must be >= 1");
        this.authority = authority;
        this.words = words;
        this.aliasDomain = aliasDomain.trim().toLowerCase(Locale.ROOT);
        this.maxAttempts = maxAttempts;
    }

    public String generate(IdentifierKind kind) {
        return generate(kind, null);
    }

    /**
     * @param seed ALIAS：可選的前綴（null 則用隨機單字組）；CLIENT_ID：client 名稱；其他種類忽略
     */
    public String generate(IdentifierKind kind, String seed) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = candidate(kind, seed);
            if (!authority.isTaken(kind, candidate)) {
                if (kind.secret()) {
                    log.debug("generate {} on attempt {}", kind, attempt);
                } else {
                    log.debug("generate {} {} on attempt {}", kind, candidate, attempt);
                }
                return candidate;
            }
            if (kind.secret()) {
                log.warn("{} already exists, generate a new one (attempt {}/{})", kind, attempt, maxAttempts);
            } else {
                log.warn("{} {} already exists, generate a new one (attempt {}/{})",
                        kind, candidate, attempt, maxAttempts);
            }
        }
        log.error("{} generation exhausted after {} attempts", kind, maxAttempts);
        throw new GenerationExhaustedException(kind, maxAttempts);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    String candidate(IdentifierKind kind, String seed) {
        return switch (kind) {
            case ALIAS -> aliasLocalPart(seed) + RandomStrings.digits(kind.randomLength()) + "@" + aliasDomain;
            case CLIENT_ID -> Slugs.toId(seed) + "-" + RandomStrings.lowercase(kind.randomLength());
            case CLIENT_SECRET -> RandomStrings.lowercase(kind.randomLength());
            case AUTH_CODE, ACCESS_TOKEN, ACTIVATION_CODE, RESET_PASSWORD_CODE ->
                    RandomStrings.alphanumeric(kind.randomLength());
            case SESSION_TOKEN -> RandomStrings.hex(kind.randomLength());
        };
    }

    private String aliasLocalPart(String seed) {
        if (seed == null || seed.isBlank()) return words.randomPair();
        return Slugs.toId(seed).replace('-', '_') + "_";
    }
}
