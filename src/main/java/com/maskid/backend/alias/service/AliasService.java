package com.maskid.backend.alias.service;

import com.maskid.backend.alias.entity.Alias;
import com.maskid.backend.alias.repo.AliasRepo;
import com.maskid.backend.alias.web.QuotaExceededException;
import com.maskid.backend.idgen.IdentifierAllocator;
import com.maskid.backend.idgen.IdentifierKind;
import com.maskid.backend.plan.PlanEvaluator;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AliasService {

    private final AliasRepo aliases;
    private final UserRepo users;
    private final PlanEvaluator planEvaluator;
    private final IdentifierAllocator allocator;

    /**
     * 使用者主動建立 alias：額度不足丟 QuotaExceededException（提示升級）。
     * 額度檢查是軟上限：兩個並行請求可能同時通過檢查。
     */
    public Alias create(Long userId, String prefix, Instant now) {
        User user = users.findById(userId).orElseThrow(() -> new IllegalArgumentException("USER_NOT_FOUND"));
        long count = aliases.countByUserId(userId);
        if (!planEvaluator.canCreateAlias(user, count, now)) {
            log.info("user {} reached alias quota ({}), plan={}", userId, count, user.getPlan());
            throw new QuotaExceededException("QUOTA_EXCEEDED", planEvaluator.maxAliasesFreePlan(), "UPGRADE");
        }
        Alias a = allocator.allocate(IdentifierKind.ALIAS, prefix,
                email -> aliases.saveAndFlush(Alias.of(userId, email)));
        log.info("user {} created alias {}", userId, a.getEmail());
        return a;
    }

    @Transactional(readOnly = true)
    public List<Alias> list(Long userId) {
        return aliases.findByUserIdOrderByIdDesc(userId);
    }

    @Transactional
    public Alias setEnabled(Long userId, Long aliasId, boolean enabled) {
        Alias a = aliases.findByIdAndUserId(aliasId, userId)
                .orElseThrow(() -> new IllegalArgumentException("ALIAS_NOT_FOUND"));
        a.setEnabled(enabled);
        return aliases.save(a);
    }
}
