package com.maskid.backend.idgen;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;

class IdentifierAllocatorTest {

    static PlatformTransactionManager fakeTx() {
        PlatformTransactionManager tx = Mockito.mock(PlatformTransactionManager.class);
        Mockito.when(tx.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        return tx;
    }

    @Test
    void should_retry_with_new_value_when_insert_conflicts() {
        IdentifierGenerator gen = Mockito.mock(IdentifierGenerator.class);
        Mockito.when(gen.maxAttempts()).thenReturn(10);
        Mockito.when(gen.generate(IdentifierKind.ALIAS, null)).thenReturn("a_b001@maskid.io", "a_b002@maskid.io");
        PlatformTransactionManager tx = fakeTx();
        var allocator = new IdentifierAllocator(gen, tx);

        List<String> tried = new ArrayList<>();
        String saved = allocator.allocate(IdentifierKind.ALIAS, v -> {
            tried.add(v);
            if (v.equals("a_b001@maskid.io")) throw new DataIntegrityViolationException("Duplicate entry");
            return v;
        });

        assertEquals("a_b002@maskid.io", saved);
        assertEquals(List.of("a_b001@maskid.io", "a_b002@maskid.io"), tried);
        // 第一次 rollback、第二次 commit
        Mockito.verify(tx, Mockito.times(1)).rollback(any());
        Mockito.verify(tx, Mockito.times(1)).commit(any());
    }

    @Test
    void should_throw_generation_exhausted_when_every_insert_conflicts() {
        IdentifierGenerator gen = Mockito.mock(IdentifierGenerator.class);
        Mockito.when(gen.maxAttempts()).thenReturn(3);
        Mockito.when(gen.generate(IdentifierKind.ACCESS_TOKEN, null)).thenReturn("t");
        var allocator = new IdentifierAllocator(gen, fakeTx());

        var ex = assertThrows(GenerationExhaustedException.class,
                () -> allocator.allocate(IdentifierKind.ACCESS_TOKEN, v -> {
                    throw new DataIntegrityViolationException("Duplicate entry");
                }));
        assertEquals(3, ex.attempts());
    }

    @Test
    void should_not_retry_other_failures() {
        IdentifierGenerator gen = Mockito.mock(IdentifierGenerator.class);
        Mockito.when(gen.maxAttempts()).thenReturn(10);
        Mockito.when(gen.generate(IdentifierKind.AUTH_CODE, null)).thenReturn("c");
        var allocator = new IdentifierAllocator(gen, fakeTx());
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> allocator.allocate(IdentifierKind.AUTH_CODE, v -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }));
        assertEquals(1, calls.get());
    }

    /** 10k 個並行 alias：unique constraint（putIfAbsent）+ 重試後不會有重複 */
    @Test
    void concurrent_allocations_should_never_hand_out_duplicates() throws Exception {
        Set<String> store = ConcurrentHashMap.newKeySet();
        var gen = new IdentifierGenerator((k, c) -> store.contains(c), new WordList(), "maskid.io", 10);
        var allocator = new IdentifierAllocator(gen, fakeTx());

        int threads = 16;
        int perThread = 625;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    List<String> mine = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        mine.add(allocator.allocate(IdentifierKind.ALIAS, v -> {
                            if (!store.add(v)) throw new DataIntegrityViolationException("Duplicate entry " + v);
                            return v;
                        }));
                    }
                    return mine;
                }));
            }
            List<String> all = new ArrayList<>();
            for (var f : futures) all.addAll(f.get());

            assertEquals(threads * perThread, all.size());
            assertThat(Set.copyOf(all)).hasSize(threads * perThread);
            assertThat(store).hasSize(threads * perThread);
        } finally {
            pool.shutdownNow();
        }
    }
}
