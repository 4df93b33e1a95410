package com.zzimage.web.controller;

import com.zzimage.backend.client.ProxyResolver;
import com.zzimage.common.dto.ApiResponse;
import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.PoolStats;
import com.zzimage.common.exception.CredentialNotFoundException;
import com.zzimage.common.exception.ValidationException;
import com.zzimage.dispatcher.config.DispatcherProperties;
import com.zzimage.dispatcher.pool.CredentialPoolScheduler;
import com.zzimage.dispatcher.store.CredentialStore;
import com.zzimage.web.dto.CredentialForm;
import com.zzimage.web.dto.CredentialView;
import com.zzimage.web.entity.GenerationLogEntity;
import com.zzimage.web.repository.GenerationLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 凭证管理接口。每次修改后强制刷新调度器缓存。
 */
@Slf4j
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
public class CredentialController {

    private final CredentialStore store;
    private final CredentialPoolScheduler scheduler;
    private final GenerationLogRepository logRepository;
    private final DispatcherProperties properties;
    private final Clock clock;

    // ==================== 查询 ====================

    @GetMapping
    public ApiResponse<List<CredentialView>> list() {
        LocalDate today = LocalDate.now(clock);
        List<CredentialView> views = store.listAll().stream()
                .map(c -> CredentialView.of(c, today, scheduler.remainingQuota(c.getId())))
                .toList();
        return ApiResponse.ok(views);
    }

    @GetMapping("/{id}")
    public ApiResponse<CredentialView> get(@PathVariable Long id) {
        Credential credential = store.get(id).orElseThrow(() -> new CredentialNotFoundException(id));
        return ApiResponse.ok(CredentialView.of(credential, LocalDate.now(clock), scheduler.remainingQuota(id)));
    }

    @GetMapping("/stats")
    public ApiResponse<PoolStats> stats() {
        return ApiResponse.ok(scheduler.stats());
    }

    /**
     * 每个凭证的每日额度。
     */
    @GetMapping("/quota")
    public ApiResponse<Map<String, Integer>> quota() {
        return ApiResponse.ok(Map.of("daily_quota", properties.getDailyQuota()));
    }

    /**
     * 最近 50 条生成日志。
     */
    @GetMapping("/logs")
    public ApiResponse<List<GenerationLogEntity>> logs() {
        return ApiResponse.ok(logRepository.findRecent());
    }

    // ==================== 修改 ====================

    @PostMapping
    public ApiResponse<CredentialView> create(@RequestBody CredentialForm form) {
        if (isBlank(form.getLabel())) {
            throw new ValidationException("凭证名称不能为空");
        }
        if (isBlank(form.getSecret())) {
            throw new ValidationException("令牌不能为空");
        }
        String proxy = normalizeProxy(form.getProxy());

        Long id = store.create(form.getLabel().trim(), form.getSecret().trim(), proxy);
        if (Boolean.FALSE.equals(form.getActive())) {
            store.get(id).ifPresent(c -> {
                c.setActive(false);
                store.update(c);
            });
        }
        scheduler.refresh(true);
        log.info("管理端添加凭证: {} (ID: {})", form.getLabel(), id);
        return get(id);
    }

    @PutMapping("/{id}")
    public ApiResponse<CredentialView> update(@PathVariable Long id, @RequestBody CredentialForm form) {
        Credential credential = store.get(id).orElseThrow(() -> new CredentialNotFoundException(id));
        if (form.getLabel() != null) {
            if (form.getLabel().isBlank()) {
                throw new ValidationException("凭证名称不能为空");
            }
            credential.setLabel(form.getLabel().trim());
        }
        if (form.getSecret() != null) {
            if (form.getSecret().isBlank()) {
                throw new ValidationException("令牌不能为空");
            }
            credential.setSecret(form.getSecret().trim());
        }
        if (form.getProxy() != null) {
            credential.setProxy(normalizeProxy(form.getProxy()));
        }
        if (form.getActive() != null) {
            credential.setActive(form.getActive());
        }

        if (!store.update(credential)) {
            throw new CredentialNotFoundException(id);
        }
        scheduler.refresh(true);
        log.info("管理端更新凭证: {} (ID: {})", credential.getLabel(), id);
        return get(id);
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable Long id) {
        if (!store.delete(id)) {
            throw new CredentialNotFoundException(id);
        }
        scheduler.refresh(true);
        log.info("管理端删除凭证: ID {}", id);
        return ApiResponse.ok(null, "删除成功");
    }

    /**
     * 空串视为直连；非空时必须能被解析。
     */
    private static String normalizeProxy(String proxy) {
        if (isBlank(proxy)) {
            return null;
        }
        try {
            ProxyResolver.parse(proxy);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("代理地址无效: " + e.getMessage());
        }
        return proxy.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
