package com.zzimage.dispatcher.pool;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.PoolStats;
import com.zzimage.dispatcher.config.DispatcherProperties;
import com.zzimage.dispatcher.store.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 凭证池轮询调度器。
 * <p>
 * 核心策略：
 * - 缓存激活凭证列表（按累计使用次数升序），过期或强制时从存储重新加载
 * - 从游标位置开始轮询，最多探测一整圈；每次探测都从存储读取当日用量，不信任缓存
 * - 缓存、游标、缓存时间由同一把锁保护，锁只覆盖选择/刷新，绝不跨越后端调用
 */
@Slf4j
@Component
public class CredentialPoolScheduler {

    private final CredentialStore store;
    private final DispatcherProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    /** 以下三个字段只在持有 lock 时读写 */
    private List<Credential> cache = List.of();
    private int cursor;
    private Instant cacheTime;

    public CredentialPoolScheduler(CredentialStore store, DispatcherProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 刷新激活凭证缓存。
     *
     * @param force true 时忽略缓存时间，立即重新加载
     */
    public void refresh(boolean force) {
        lock.lock();
        try {
            refreshLocked(force);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 轮询选出一个今日仍有额度的激活凭证。
     *
     * @return 空表示凭证池耗尽（无激活凭证或额度全部用完）
     */
    public Optional<Credential> selectCredential() {
        return selectCredential(Set.of());
    }

    /**
     * 轮询选出一个凭证，跳过本次请求中已经放弃的凭证。
     * 被跳过的凭证同样推进游标、消耗一次探测。
     */
    public Optional<Credential> selectCredential(Set<Long> excluded) {
        lock.lock();
        try {
            refreshLocked(false);

            if (cache.isEmpty()) {
                log.warn("没有可用的凭证");
                return Optional.empty();
            }

            int quota = properties.getDailyQuota();
            int probes = cache.size();
            for (int i = 0; i < probes; i++) {
                Credential candidate = cache.get(cursor);
                cursor = (cursor + 1) % cache.size();

                if (excluded.contains(candidate.getId())) {
                    continue;
                }

                int used = store.dailyUsage(candidate.getId()).getCount();
                if (used < quota) {
                    log.info("分配凭证: {} (ID: {}, 今日已用: {}/{})",
                            candidate.getLabel(), candidate.getId(), used, quota);
                    return Optional.of(candidate);
                }
                log.warn("凭证 {} 今日额度已用完 ({}/{})", candidate.getLabel(), used, quota);
            }

            log.error("所有凭证今日额度已用完或已在本次请求中失败");
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 记录一次凭证使用结果，并强制刷新缓存让后续选择尽快看到最新计数。
     */
    public void recordOutcome(Long id, boolean success) {
        if (success) {
            store.incrementSuccess(id);
        } else {
            store.incrementFailure(id);
            store.get(id)
                    .filter(c -> c.getLifetimeErrorCount() >= properties.getErrorWarnThreshold())
                    .ifPresent(c -> log.warn("凭证 {} 错误次数过多 ({})，建议检查",
                            c.getLabel(), c.getLifetimeErrorCount()));
        }
        refresh(true);
    }

    /**
     * 今日剩余额度，仅用于展示，选择时总是重新读取存储。
     */
    public int remainingQuota(Long id) {
        return Math.max(0, properties.getDailyQuota() - store.dailyUsage(id).getCount());
    }

    /**
     * 凭证池统计信息。
     */
    public PoolStats stats() {
        List<Credential> all = store.listAll();
        List<Credential> active = all.stream().filter(Credential::isActive).toList();

        long totalUses = all.stream().mapToLong(Credential::getLifetimeSuccessCount).sum();
        long totalErrors = all.stream().mapToLong(Credential::getLifetimeErrorCount).sum();
        long remaining = active.stream().mapToLong(c -> remainingQuota(c.getId())).sum();

        return PoolStats.builder()
                .total(all.size())
                .active(active.size())
                .inactive(all.size() - active.size())
                .totalUses(totalUses)
                .totalErrors(totalErrors)
                .errorRate(totalUses > 0 ? (double) totalErrors / totalUses : 0)
                .dailyQuota(properties.getDailyQuota())
                .remainingQuotaToday(remaining)
                .build();
    }

    /**
     * 当前缓存中的激活凭证数。
     */
    public int poolSize() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }

    private void refreshLocked(boolean force) {
        Instant now = clock.instant();
        boolean stale = cacheTime == null
                || Duration.between(cacheTime, now).getSeconds() > properties.getCacheTtlSeconds();
        if (!force && !cache.isEmpty() && !stale) {
            return;
        }

        cache = store.listActiveCredentials().stream()
                .sorted(Comparator.comparingLong(Credential::getLifetimeSuccessCount))
                .toList();
        cacheTime = now;
        if (cursor >= cache.size()) {
            cursor = 0;
        }
        log.debug("凭证缓存已刷新: {} 个激活凭证", cache.size());
    }
}
