package com.zzimage.dispatcher.store;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.DailyUsage;
import com.zzimage.dispatcher.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCredentialStoreTest {

    private MutableClock clock;
    private InMemoryCredentialStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-10-19T08:00:00Z");
        store = new InMemoryCredentialStore(clock);
    }

    @Test
    void listActive_orderedByLifetimeSuccessAscending() {
        Long a = store.create("a", "token-aaaaaaaa", null);
        Long b = store.create("b", "token-bbbbbbbb", null);
        Long c = store.create("c", "token-cccccccc", null);
        store.incrementSuccess(a);
        store.incrementSuccess(a);
        store.incrementSuccess(b);

        List<Long> ids = store.listActiveCredentials().stream().map(Credential::getId).toList();

        assertEquals(List.of(c, b, a), ids);
    }

    @Test
    void listActive_excludesInactive() {
        Long a = store.create("a", "token-aaaaaaaa", null);
        Long b = store.create("b", "token-bbbbbbbb", null);
        Credential disabled = store.get(b).orElseThrow();
        disabled.setActive(false);
        assertTrue(store.update(disabled));

        List<Long> ids = store.listActiveCredentials().stream().map(Credential::getId).toList();

        assertEquals(List.of(a), ids);
        assertEquals(2, store.listAll().size());
    }

    @Test
    void dailyUsage_staleDateReadsAsZeroForToday() {
        Long id = store.create("a", "token-aaaaaaaa", null);
        store.incrementSuccess(id);
        store.incrementSuccess(id);
        assertEquals(2, store.dailyUsage(id).getCount());

        clock.advance(Duration.ofDays(1));

        DailyUsage usage = store.dailyUsage(id);
        assertEquals(0, usage.getCount());
        assertEquals(LocalDate.of(2026, 10, 20), usage.getDate());
    }

    @Test
    void incrementSuccess_rollsWindowBeforeCounting() {
        Long id = store.create("a", "token-aaaaaaaa", null);
        store.incrementSuccess(id);
        store.incrementSuccess(id);
        clock.advance(Duration.ofDays(1));

        store.incrementSuccess(id);

        Credential credential = store.get(id).orElseThrow();
        assertEquals(1, credential.getDailyUsedCount());
        assertEquals(LocalDate.of(2026, 10, 20), credential.getDailyDate());
        assertEquals(3, credential.getLifetimeSuccessCount());
    }

    @Test
    void incrementFailure_doesNotConsumeQuota() {
        Long id = store.create("a", "token-aaaaaaaa", null);

        store.incrementFailure(id);

        Credential credential = store.get(id).orElseThrow();
        assertEquals(1, credential.getLifetimeErrorCount());
        assertEquals(0, store.dailyUsage(id).getCount());
        assertNotNull(credential.getLastUsedAt());
    }

    @Test
    void returnedCredentialsAreCopies() {
        Long id = store.create("a", "token-aaaaaaaa", null);
        store.get(id).orElseThrow().setLifetimeSuccessCount(999);

        assertEquals(0, store.get(id).orElseThrow().getLifetimeSuccessCount());
    }

    @Test
    void concurrentIncrements_areNotLost() throws Exception {
        Long id = store.create("a", "token-aaaaaaaa", null);
        int threads = 16;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.incrementSuccess(id);
                    store.incrementFailure(id);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        Credential credential = store.get(id).orElseThrow();
        assertEquals(threads * perThread, credential.getLifetimeSuccessCount());
        assertEquals(threads * perThread, credential.getLifetimeErrorCount());
        assertEquals(threads * perThread, store.dailyUsage(id).getCount());
    }

    @Test
    void updateAndDelete_unknownIdReturnFalse() {
        Credential ghost = Credential.builder().id(42L).label("ghost").secret("x").build();

        assertFalse(store.update(ghost));
        assertFalse(store.delete(42L));
        assertTrue(store.get(42L).isEmpty());
    }
}
