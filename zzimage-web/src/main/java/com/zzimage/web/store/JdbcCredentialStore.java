package com.zzimage.web.store;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.DailyUsage;
import com.zzimage.dispatcher.store.CredentialStore;
import com.zzimage.web.entity.CredentialEntity;
import com.zzimage.web.repository.CredentialRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * 基于 SQLite 的凭证存储，重启后计数不丢失。
 * <p>
 * 计数更新都是单条 UPDATE 语句，跨天判断在 SQL 的 CASE 中完成。
 */
@Slf4j
public class JdbcCredentialStore implements CredentialStore {

    static final DateTimeFormatter SQLITE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CredentialRepository repository;
    private final Clock clock;

    public JdbcCredentialStore(CredentialRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public List<Credential> listActiveCredentials() {
        return repository.findActive().stream().map(this::toCredential).toList();
    }

    @Override
    public List<Credential> listAll() {
        return repository.findAllNewestFirst().stream().map(this::toCredential).toList();
    }

    @Override
    public Optional<Credential> get(Long id) {
        return repository.findById(id).map(this::toCredential);
    }

    @Override
    public DailyUsage dailyUsage(Long id) {
        LocalDate today = today();
        return repository.findById(id)
                .map(entity -> new DailyUsage(toCredential(entity).usedOn(today), today))
                .orElseGet(() -> DailyUsage.zero(today));
    }

    @Override
    public void incrementSuccess(Long id) {
        if (repository.incrementSuccess(id, today().toString(), now()) == 0) {
            log.warn("记录成功失败，凭证不存在: {}", id);
        }
    }

    @Override
    public void incrementFailure(Long id) {
        if (repository.incrementFailure(id, today().toString(), now()) == 0) {
            log.warn("记录失败次数失败，凭证不存在: {}", id);
        }
    }

    @Override
    public Long create(String label, String secret, String proxy) {
        String now = now();
        CredentialEntity saved = repository.save(CredentialEntity.builder()
                .label(label)
                .secret(secret)
                .proxy(proxy)
                .dailyDate(today().toString())
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("添加凭证: {} (ID: {})", label, saved.getId());
        return saved.getId();
    }

    @Override
    public boolean update(Credential credential) {
        return repository.updateProfile(credential.getId(), credential.getLabel(), credential.getSecret(),
                credential.getProxy(), credential.isActive() ? 1 : 0, now()) > 0;
    }

    @Override
    public boolean delete(Long id) {
        if (!repository.existsById(id)) {
            return false;
        }
        repository.deleteById(id);
        return true;
    }

    // ==================== 转换 ====================

    Credential toCredential(CredentialEntity entity) {
        return Credential.builder()
                .id(entity.getId())
                .label(entity.getLabel())
                .secret(entity.getSecret())
                .proxy(entity.getProxy())
                .active(entity.getActive() != null && entity.getActive() == 1)
                .lifetimeSuccessCount(entity.getSuccessCount() == null ? 0 : entity.getSuccessCount())
                .lifetimeErrorCount(entity.getErrorCount() == null ? 0 : entity.getErrorCount())
                .dailyUsedCount(entity.getDailyUsed() == null ? 0 : entity.getDailyUsed())
                .dailyDate(entity.getDailyDate() == null ? null : LocalDate.parse(entity.getDailyDate()))
                .lastUsedAt(parseTime(entity.getLastUsedAt()))
                .createdAt(parseTime(entity.getCreatedAt()))
                .updatedAt(parseTime(entity.getUpdatedAt()))
                .build();
    }

    private static LocalDateTime parseTime(String value) {
        return value == null || value.isEmpty() ? null : LocalDateTime.parse(value, SQLITE_FMT);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private String now() {
        return LocalDateTime.now(clock).format(SQLITE_FMT);
    }
}
