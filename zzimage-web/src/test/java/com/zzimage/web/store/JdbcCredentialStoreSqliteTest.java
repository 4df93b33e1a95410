package com.zzimage.web.store;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.DailyUsage;
import com.zzimage.web.repository.CredentialRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.jdbc.DataJdbcTest;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 在真实 SQLite 文件上执行 CredentialRepository 的计数 SQL。
 */
@DataJdbcTest(properties = "spring.sql.init.mode=always")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class JdbcCredentialStoreSqliteTest {

    private static final LocalDate DAY_1 = LocalDate.of(2026, 10, 19);
    private static final LocalDate DAY_2 = DAY_1.plusDays(1);
    private static final LocalDate DAY_3 = DAY_1.plusDays(2);

    @Autowired
    private CredentialRepository repository;

    @DynamicPropertySource
    static void sqliteFile(DynamicPropertyRegistry registry) {
        Path db;
        try {
            db = Files.createTempFile("zzimage-store-", ".db");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        db.toFile().deleteOnExit();
        registry.add("spring.datasource.url", () -> "jdbc:sqlite:" + db);
        registry.add("spring.datasource.driver-class-name", () -> "org.sqlite.JDBC");
        registry.add("spring.datasource.hikari.maximum-pool-size", () -> "1");
    }

    @Test
    void successCountRollsOverWithTheDay() {
        Long id = storeOn(DAY_1).create("alice", "token-alice-0001", null);

        storeOn(DAY_1).incrementSuccess(id);
        storeOn(DAY_1).incrementSuccess(id);
        assertEquals(new DailyUsage(2, DAY_1), storeOn(DAY_1).dailyUsage(id));

        assertEquals(new DailyUsage(0, DAY_2), storeOn(DAY_2).dailyUsage(id));

        storeOn(DAY_2).incrementSuccess(id);
        assertEquals(new DailyUsage(1, DAY_2), storeOn(DAY_2).dailyUsage(id));
        Credential credential = storeOn(DAY_2).get(id).orElseThrow();
        assertEquals(3, credential.getLifetimeSuccessCount());
        assertEquals(DAY_2, credential.getDailyDate());
        assertNotNull(credential.getLastUsedAt());
    }

    @Test
    void failureResetsStaleDayWithoutUsingQuota() {
        Long id = storeOn(DAY_1).create("alice", "token-alice-0001", null);
        storeOn(DAY_1).incrementSuccess(id);

        storeOn(DAY_1).incrementFailure(id);
        assertEquals(1, storeOn(DAY_1).dailyUsage(id).getCount(), "失败不占用当日额度");

        storeOn(DAY_3).incrementFailure(id);
        Credential credential = storeOn(DAY_3).get(id).orElseThrow();
        assertEquals(0, credential.getDailyUsedCount());
        assertEquals(DAY_3, credential.getDailyDate());
        assertEquals(2, credential.getLifetimeErrorCount());
        assertEquals(1, credential.getLifetimeSuccessCount());
    }

    @Test
    void activeCredentialsOrderedByLifetimeSuccess() {
        JdbcCredentialStore store = storeOn(DAY_1);
        Long alice = store.create("alice", "token-alice-0001", null);
        Long bob = store.create("bob", "token-bob-0000001", null);
        Long carol = store.create("carol", "token-carol-00001", null);
        Long dave = store.create("dave", "token-dave-000001", "socks5://127.0.0.1:1080");
        store.incrementSuccess(bob);
        store.incrementSuccess(bob);
        store.incrementSuccess(alice);

        Credential disabled = store.get(carol).orElseThrow();
        disabled.setActive(false);
        assertTrue(store.update(disabled));

        List<Long> order = store.listActiveCredentials().stream().map(Credential::getId).toList();
        assertEquals(List.of(dave, alice, bob), order);
        assertEquals("socks5://127.0.0.1:1080", store.get(dave).orElseThrow().getProxy());
    }

    @Test
    void updateKeepsCountersAndDeleteRemovesRow() {
        JdbcCredentialStore store = storeOn(DAY_1);
        Long id = store.create("alice", "token-alice-0001", null);
        store.incrementSuccess(id);

        Credential edited = store.get(id).orElseThrow();
        edited.setLabel("alice-renamed");
        edited.setLifetimeSuccessCount(999);
        assertTrue(store.update(edited));

        Credential reloaded = store.get(id).orElseThrow();
        assertEquals("alice-renamed", reloaded.getLabel());
        assertEquals(1, reloaded.getLifetimeSuccessCount());

        assertTrue(store.delete(id));
        assertFalse(store.delete(id));
        assertTrue(store.get(id).isEmpty());
    }

    private JdbcCredentialStore storeOn(LocalDate day) {
        Clock clock = Clock.fixed(Instant.parse(day + "T08:00:00Z"), ZoneOffset.UTC);
        return new JdbcCredentialStore(repository, clock);
    }
}
