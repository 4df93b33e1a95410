package com.zzimage.dispatcher.service;

import com.zzimage.common.dto.PoolStats;
import com.zzimage.dispatcher.config.DispatcherProperties;
import com.zzimage.dispatcher.pool.CredentialPoolScheduler;
import com.zzimage.dispatcher.store.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时任务：输出凭证池健康状况，提示错误过多的凭证和额度即将耗尽的情况。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialHealthReporter {

    private final CredentialPoolScheduler scheduler;
    private final CredentialStore store;
    private final DispatcherProperties properties;

    @Scheduled(fixedDelayString = "${zzimage.dispatcher.stats-report-interval-seconds:300}000")
    public void report() {
        PoolStats stats = scheduler.stats();
        if (stats.getTotal() == 0) {
            return;
        }

        log.info("凭证池状态: 总数 {}, 激活 {} (调度缓存 {}), 累计成功 {}, 累计失败 {}, 错误率 {}, 今日剩余额度 {}/{}",
                stats.getTotal(), stats.getActive(), scheduler.poolSize(), stats.getTotalUses(),
                stats.getTotalErrors(), String.format("%.2f%%", stats.getErrorRate() * 100),
                stats.getRemainingQuotaToday(), (long) stats.getActive() * stats.getDailyQuota());

        if (stats.getActive() > 0 && stats.getRemainingQuotaToday() == 0) {
            log.warn("所有激活凭证今日额度已用完，请添加凭证");
        }

        store.listActiveCredentials().stream()
                .filter(c -> c.getLifetimeErrorCount() >= properties.getErrorWarnThreshold())
                .forEach(c -> log.warn("凭证 {} (ID: {}) 累计失败 {} 次，建议检查",
                        c.getLabel(), c.getId(), c.getLifetimeErrorCount()));
    }
}
