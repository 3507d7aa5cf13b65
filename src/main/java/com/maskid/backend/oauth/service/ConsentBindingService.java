package com.maskid.backend.oauth.service;

import com.maskid.backend.alias.entity.Alias;
import com.maskid.backend.alias.repo.AliasRepo;
import com.maskid.backend.idgen.IdentifierAllocator;
import com.maskid.backend.idgen.IdentifierKind;
import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.entity.ClientUser;
import com.maskid.backend.oauth.model.DisclosureChannel;
import com.maskid.backend.oauth.model.Scope;
import com.maskid.backend.oauth.repo.ClientUserRepo;
import com.maskid.backend.plan.PlanEvaluator;
import com.maskid.backend.users.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;

/**
 * (client, user) → 要揭露哪個 email。第一次授權時建立，之後一律沿用。
 * <p>
 * 併發：兩個第一次授權同時進來時，client_users 的 unique (client_id, user_id) 是唯一裁判；
 * 輸的那一方整個 transaction rollback（連同它順便建的 alias），重新讀到贏家的 binding。
 * 有些資料庫（例如 H2）在贏家還沒 commit 時就直接拒絕輸家，所以輸家會短暫等一下贏家的資料出現。
 * 授權本身不會因為 alias 額度不足而失敗，只會退回真實 email。
 * <p>
 * 揭露管道只看 client 宣告的 scope，不看這次請求要了哪些：
 * 第一次只要 name、之後才要 email 的 client，一樣拿到 alias。
 */
@Slf4j
@Service
public class ConsentBindingService {

    private final ClientUserRepo bindings;
    private final AliasRepo aliases;
    private final PlanEvaluator planEvaluator;
    private final IdentifierAllocator allocator;
    private final TransactionTemplate tx;
    private final AliasMode aliasMode;

    static final int WINNER_FETCH_ATTEMPTS = 5;
    static final long WINNER_FETCH_BACKOFF_MS = 50;

    public ConsentBindingService(ClientUserRepo bindings,
                                 AliasRepo aliases,
                                 PlanEvaluator planEvaluator,
                                 IdentifierAllocator allocator,
                                 PlatformTransactionManager txManager,
                                 @Value("${app.consent.alias-mode:ALWAYS}") AliasMode aliasMode) {
        this.bindings = bindings;
        this.aliases = aliases;
        this.planEvaluator = planEvaluator;
        this.allocator = allocator;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.aliasMode = aliasMode;
    }

    public Optional<ClientUser> find(Long clientId, Long userId) {
        return bindings.findByClientIdAndUserId(clientId, userId);
    }

    public ClientUser getOrCreateBinding(Client client, User user, Instant now) {
        Optional<ClientUser> existing = bindings.findByClientIdAndUserId(client.getId(), user.getId());
        if (existing.isPresent()) return existing.get();

        try {
            if (wantsAlias(client, user, now)) {
                long count = aliases.countByUserId(user.getId());
                if (planEvaluator.canCreateAlias(user, count, now)) {
                    return allocator.allocate(IdentifierKind.ALIAS,
                            email -> insertWithNewAlias(client, user, email));
                }
                log.info("user {} has no alias quota left ({}), client {} gets the real email",
                        user.getId(), count, client.getOauthClientId());
            }
            return insertRealEmail(client, user);
        } catch (BindingConflictException e) {
            log.debug("binding conflict for client {} user {}, re-fetch", client.getId(), user.getId());
            return awaitWinner(client, user, e);
        }
    }

    private boolean wantsAlias(Client client, User user, Instant now) {
        if (!client.getScopes().contains(Scope.EMAIL)) return false;
        return switch (aliasMode) {
            case ALWAYS -> true;
            case PREMIUM_ONLY -> planEvaluator.hasPremiumAccess(user, now);
            case NEVER -> false;
        };
    }

    /**
     * 在 allocator 的新 transaction 內執行。重試時先讀一次：
     * 若別人已經建好 binding，直接用它，這次產生的 alias 不寫入。
     * alias 撞號交給 allocator 換新值；binding 撞到則整個放棄，交給 awaitWinner。
     */
    private ClientUser insertWithNewAlias(Client client, User user, String aliasEmail) {
        Optional<ClientUser> winner = bindings.findByClientIdAndUserId(client.getId(), user.getId());
        if (winner.isPresent()) {
            log.debug("binding for client {} user {} created concurrently, reuse it", client.getId(), user.getId());
            return winner.get();
        }
        Alias alias = aliases.saveAndFlush(Alias.of(user.getId(), aliasEmail));
        ClientUser cu = saveBinding(ClientUser.of(client.getId(), user.getId(), DisclosureChannel.alias(alias.getId())));
        log.info("new binding {}: client {} sees alias {} of user {}",
                cu.getId(), client.getOauthClientId(), aliasEmail, user.getId());
        return cu;
    }

    private ClientUser insertRealEmail(Client client, User user) {
        ClientUser cu = tx.execute(status -> saveBinding(
                ClientUser.of(client.getId(), user.getId(), DisclosureChannel.realEmail())));
        log.info("new binding {}: client {} sees the real email of user {}",
                cu.getId(), client.getOauthClientId(), user.getId());
        return cu;
    }

    private ClientUser saveBinding(ClientUser cu) {
        try {
            return bindings.saveAndFlush(cu);
        } catch (DataAccessException e) {
            // 丟出非 DataIntegrityViolation，allocator 不會當成 alias 撞號重試
            throw new BindingConflictException(e);
        }
    }

    /** 贏家可能還沒 commit，等幾輪；一直讀不到就把原本的錯誤丟出去。 */
    private ClientUser awaitWinner(Client client, User user, BindingConflictException conflict) {
        for (int attempt = 1; attempt <= WINNER_FETCH_ATTEMPTS; attempt++) {
            Optional<ClientUser> winner = bindings.findByClientIdAndUserId(client.getId(), user.getId());
            if (winner.isPresent()) return winner.get();
            if (attempt == WINNER_FETCH_ATTEMPTS) break;
            try {
                Thread.sleep(WINNER_FETCH_BACKOFF_MS * attempt);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.warn("binding insert for client {} user {} failed and no winner appeared", client.getId(), user.getId());
        throw conflict.getCause();
    }

    /** binding 寫入失敗；transaction 已 rollback，cause 是原本的 DataAccessException。 */
    static class BindingConflictException extends RuntimeException {
        BindingConflictException(DataAccessException cause) {
            super(cause);
        }

        @Override
        public synchronized DataAccessException getCause() {
            return (DataAccessException) super.getCause();
        }
    }
}
