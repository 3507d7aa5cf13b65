package com.maskid.backend.idgen;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * 產生 + 寫入 當作一個原子單位：
 * 每次嘗試都在自己的 REQUIRES_NEW transaction 內執行 unitOfWork，
 * 若被 unique constraint 擋下（別人剛好搶先寫入同一值），整個嘗試 rollback 後換新值重來。
 * unitOfWork 內的其他寫入（例如同時寫 binding、消耗 code）一併 rollback。
 */
@Slf4j
@Component
public class IdentifierAllocator {

    private final IdentifierGenerator generator;
    private final TransactionTemplate tx;

    public IdentifierAllocator(IdentifierGenerator generator, PlatformTransactionManager txManager) {
        this.generator = generator;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public <T> T allocate(IdentifierKind kind, Function<String, T> unitOfWork) {
        return allocate(kind, null, unitOfWork);
    }

    public <T> T allocate(IdentifierKind kind, String seed, Function<String, T> unitOfWork) {
        int max = generator.maxAttempts();
        for (int attempt = 1; attempt <= max; attempt++) {
            String value = generator.generate(kind, seed);
            try {
                return tx.execute(status -> unitOfWork.apply(value));
            } catch (DataIntegrityViolationException e) {
                // 併發：查的時候沒人用，寫的時候被搶先
                // 例外訊息可能帶到值本身，secret 種類不印
                if (kind.secret()) {
                    log.warn("{} insert conflicted on attempt {}/{}, retry", kind, attempt, max);
                } else {
                    log.warn("{} insert conflicted on attempt {}/{}, retry: {}",
                            kind, attempt, max, e.getMostSpecificCause().getMessage());
                }
            }
        }
        log.error("{} allocation exhausted after {} conflicting inserts", kind, max);
        throw new GenerationExhaustedException(kind, max);
    }
}
