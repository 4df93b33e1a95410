package com.zzimage.dispatcher.store;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.DailyUsage;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于内存的凭证存储。
 * <p>
 * 计数更新通过 {@link ConcurrentHashMap#computeIfPresent} 完成，对单个凭证原子执行；
 * 对外返回的都是副本，调用方修改不会影响存储。
 */
@Slf4j
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<Long, Credential> credentials = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();
    private final Clock clock;

    public InMemoryCredentialStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<Credential> listActiveCredentials() {
        return credentials.values().stream()
                .filter(Credential::isActive)
                .sorted(Comparator.comparingLong(Credential::getLifetimeSuccessCount)
                        .thenComparing(Credential::getId))
                .map(this::copy)
                .toList();
    }

    @Override
    public List<Credential> listAll() {
        return credentials.values().stream()
                .sorted(Comparator.comparing(Credential::getId).reversed())
                .map(this::copy)
                .toList();
    }

    @Override
    public Optional<Credential> get(Long id) {
        return Optional.ofNullable(credentials.get(id)).map(this::copy);
    }

    @Override
    public DailyUsage dailyUsage(Long id) {
        LocalDate today = LocalDate.now(clock);
        Credential credential = credentials.get(id);
        if (credential == null) {
            return DailyUsage.zero(today);
        }
        return new DailyUsage(credential.usedOn(today), today);
    }

    @Override
    public void incrementSuccess(Long id) {
        credentials.computeIfPresent(id, (key, current) -> {
            Credential updated = rollDailyWindow(current);
            LocalDateTime now = LocalDateTime.now(clock);
            updated.setLifetimeSuccessCount(updated.getLifetimeSuccessCount() + 1);
            updated.setDailyUsedCount(updated.getDailyUsedCount() + 1);
            updated.setLastUsedAt(now);
            updated.setUpdatedAt(now);
            return updated;
        });
    }

    @Override
    public void incrementFailure(Long id) {
        credentials.computeIfPresent(id, (key, current) -> {
            Credential updated = rollDailyWindow(current);
            LocalDateTime now = LocalDateTime.now(clock);
            updated.setLifetimeErrorCount(updated.getLifetimeErrorCount() + 1);
            updated.setLastUsedAt(now);
            updated.setUpdatedAt(now);
            return updated;
        });
    }

    @Override
    public Long create(String label, String secret, String proxy) {
        Long id = idSequence.incrementAndGet();
        LocalDateTime now = LocalDateTime.now(clock);
        credentials.put(id, Credential.builder()
                .id(id)
                .label(label)
                .secret(secret)
                .proxy(proxy)
                .active(true)
                .dailyDate(LocalDate.now(clock))
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("添加凭证: {} (ID: {})", label, id);
        return id;
    }

    @Override
    public boolean update(Credential credential) {
        Credential updated = credentials.computeIfPresent(credential.getId(), (key, current) -> current.toBuilder()
                .label(credential.getLabel())
                .secret(credential.getSecret())
                .proxy(credential.getProxy())
                .active(credential.isActive())
                .updatedAt(LocalDateTime.now(clock))
                .build());
        return updated != null;
    }

    @Override
    public boolean delete(Long id) {
        return credentials.remove(id) != null;
    }

    /**
     * 跨天时清零今日计数并推进日期，返回新对象。
     */
    private Credential rollDailyWindow(Credential current) {
        LocalDate today = LocalDate.now(clock);
        Credential copy = copy(current);
        if (!today.equals(copy.getDailyDate())) {
            copy.setDailyUsedCount(0);
            copy.setDailyDate(today);
        }
        return copy;
    }

    private Credential copy(Credential credential) {
        return credential.toBuilder().build();
    }
}
