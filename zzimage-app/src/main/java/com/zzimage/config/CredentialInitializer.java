package com.zzimage.config;

import com.zzimage.backend.client.ProxyResolver;
import com.zzimage.common.util.CredentialMasker;
import com.zzimage.dispatcher.pool.CredentialPoolScheduler;
import com.zzimage.dispatcher.store.CredentialStore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 启动时从配置加载初始凭证。
 * <p>
 * 配置格式（逗号分隔，每项 {@code 名称|令牌|代理}，代理可省略）：
 * zzimage.credentials=alice|token-a,bob|token-b|socks5://127.0.0.1:1080
 * <p>
 * 或通过环境变量：ZZIMAGE_CREDENTIALS
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialInitializer implements CommandLineRunner {

    private final CredentialStore store;
    private final CredentialPoolScheduler scheduler;

    @Value("${zzimage.credentials:}")
    private String credentialsConfig;

    @Override
    public void run(String... args) {
        if (credentialsConfig == null || credentialsConfig.isBlank()) {
            if (store.listAll().isEmpty()) {
                log.warn("==============================================");
                log.warn("  凭证池为空，且未配置初始凭证！");
                log.warn("  请在 application.yml 中设置:");
                log.warn("  zzimage.credentials: 名称|令牌|代理");
                log.warn("  或通过管理接口 POST /api/credentials 添加");
                log.warn("==============================================");
            }
            return;
        }

        List<SeedEntry> entries = parse(credentialsConfig);
        if (entries.isEmpty()) {
            log.warn("初始凭证配置为空");
            return;
        }

        // 仅在池为空时添加（避免重启时重复添加）
        int existing = store.listAll().size();
        if (existing > 0) {
            log.info("凭证池中已有 {} 个凭证，跳过初始化加载", existing);
            return;
        }

        for (SeedEntry entry : entries) {
            store.create(entry.getLabel(), entry.getSecret(), entry.getProxy());
            log.info("已加载凭证 {} ({})", entry.getLabel(), CredentialMasker.mask(entry.getSecret()));
        }
        scheduler.refresh(true);
        log.info("已加载 {} 个凭证到调度池", entries.size());
    }

    /**
     * 解析配置，格式错误的条目跳过并告警。
     */
    static List<SeedEntry> parse(String config) {
        List<SeedEntry> entries = new ArrayList<>();
        for (String raw : config.split(",")) {
            String item = raw.trim();
            if (item.isEmpty()) {
                continue;
            }
            List<String> parts = Arrays.stream(item.split("\\|", -1)).map(String::trim).toList();
            if (parts.size() < 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
                log.warn("忽略格式错误的凭证配置: {}", CredentialMasker.mask(item));
                continue;
            }
            String proxy = parts.size() > 2 && !parts.get(2).isEmpty() ? parts.get(2) : null;
            if (proxy != null) {
                try {
                    ProxyResolver.parse(proxy);
                } catch (IllegalArgumentException e) {
                    log.warn("凭证 {} 的代理无效，已跳过: {}", parts.get(0), e.getMessage());
                    continue;
                }
            }
            entries.add(new SeedEntry(parts.get(0), parts.get(1), proxy));
        }
        return entries;
    }

    @Getter
    @ToString
    @AllArgsConstructor
    static final class SeedEntry {
        private final String label;
        @ToString.Exclude
        private final String secret;
        private final String proxy;
    }
}
