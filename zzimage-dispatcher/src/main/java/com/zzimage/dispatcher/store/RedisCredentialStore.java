package com.zzimage.dispatcher.store;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.DailyUsage;
import com.zzimage.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的凭证存储，多实例共享同一个凭证池。
 * <p>
 * 数据布局：
 * <ul>
 *   <li>{@code {prefix}:ids}：凭证 ID 集合</li>
 *   <li>{@code {prefix}:seq}：ID 生成器</li>
 *   <li>{@code {prefix}:{id}}：凭证 Hash，累计计数用 HINCRBY 原子递增</li>
 *   <li>{@code {prefix}:{id}:daily:{yyyy-MM-dd}}：当日成功次数，INCR 递增并设置过期，跨天即换 key</li>
 * </ul>
 */
@Slf4j
public class RedisCredentialStore implements CredentialStore {

    static final String F_LABEL = "label";
    static final String F_SECRET = "secret";
    static final String F_PROXY = "proxy";
    static final String F_ACTIVE = "active";
    static final String F_SUCCESS = "successCount";
    static final String F_ERROR = "errorCount";
    static final String F_LAST_USED = "lastUsedAt";
    static final String F_CREATED = "createdAt";
    static final String F_UPDATED = "updatedAt";

    /** 当日计数 key 的保留时间，留出时区和时钟偏差的余量 */
    private static final Duration DAILY_KEY_TTL = Duration.ofDays(2);

    private final StringRedisTemplate redisTemplate;
    private final String prefix;
    private final Clock clock;

    public RedisCredentialStore(StringRedisTemplate redisTemplate, DispatcherProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.prefix = properties.getRedisKeyPrefix();
        this.clock = clock;
    }

    @Override
    public List<Credential> listActiveCredentials() {
        return loadAll().stream()
                .filter(Credential::isActive)
                .sorted(Comparator.comparingLong(Credential::getLifetimeSuccessCount)
                        .thenComparing(Credential::getId))
                .toList();
    }

    @Override
    public List<Credential> listAll() {
        return loadAll().stream()
                .sorted(Comparator.comparing(Credential::getId).reversed())
                .toList();
    }

    @Override
    public Optional<Credential> get(Long id) {
        Map<Object, Object> hash = redisTemplate.opsForHash().entries(credentialKey(id));
        if (hash.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toCredential(id, hash));
    }

    @Override
    public DailyUsage dailyUsage(Long id) {
        LocalDate today = LocalDate.now(clock);
        String value = redisTemplate.opsForValue().get(dailyKey(id, today));
        return new DailyUsage(value == null ? 0 : Integer.parseInt(value), today);
    }

    @Override
    public void incrementSuccess(Long id) {
        String key = credentialKey(id);
        if (!Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
            log.warn("凭证不存在，忽略成功计数: {}", id);
            return;
        }
        String dailyKey = dailyKey(id, LocalDate.now(clock));
        redisTemplate.opsForHash().increment(key, F_SUCCESS, 1);
        redisTemplate.opsForValue().increment(dailyKey);
        redisTemplate.expire(dailyKey, DAILY_KEY_TTL);
        touch(key);
    }

    @Override
    public void incrementFailure(Long id) {
        String key = credentialKey(id);
        if (!Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
            log.warn("凭证不存在，忽略失败计数: {}", id);
            return;
        }
        redisTemplate.opsForHash().increment(key, F_ERROR, 1);
        touch(key);
    }

    @Override
    public Long create(String label, String secret, String proxy) {
        Long id = redisTemplate.opsForValue().increment(prefix + ":seq");
        String now = LocalDateTime.now(clock).toString();

        Map<String, String> hash = new HashMap<>();
        hash.put(F_LABEL, label);
        hash.put(F_SECRET, secret);
        hash.put(F_PROXY, proxy == null ? "" : proxy);
        hash.put(F_ACTIVE, "1");
        hash.put(F_SUCCESS, "0");
        hash.put(F_ERROR, "0");
        hash.put(F_CREATED, now);
        hash.put(F_UPDATED, now);
        redisTemplate.opsForHash().putAll(credentialKey(id), hash);
        redisTemplate.opsForSet().add(idsKey(), String.valueOf(id));

        log.info("添加凭证: {} (ID: {})", label, id);
        return id;
    }

    @Override
    public boolean update(Credential credential) {
        String key = credentialKey(credential.getId());
        if (!Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
            return false;
        }
        Map<String, String> hash = new HashMap<>();
        hash.put(F_LABEL, credential.getLabel());
        hash.put(F_SECRET, credential.getSecret());
        hash.put(F_PROXY, credential.getProxy() == null ? "" : credential.getProxy());
        hash.put(F_ACTIVE, credential.isActive() ? "1" : "0");
        hash.put(F_UPDATED, LocalDateTime.now(clock).toString());
        redisTemplate.opsForHash().putAll(key, hash);
        return true;
    }

    @Override
    public boolean delete(Long id) {
        Boolean deleted = redisTemplate.delete(credentialKey(id));
        redisTemplate.opsForSet().remove(idsKey(), String.valueOf(id));
        return Boolean.TRUE.equals(deleted);
    }

    // ==================== 内部方法 ====================

    private List<Credential> loadAll() {
        Set<String> ids = redisTemplate.opsForSet().members(idsKey());
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return ids.stream()
                .map(Long::valueOf)
                .map(this::get)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .toList();
    }

    private Credential toCredential(Long id, Map<Object, Object> hash) {
        DailyUsage usage = dailyUsage(id);
        String proxy = str(hash.get(F_PROXY));
        return Credential.builder()
                .id(id)
                .label(str(hash.get(F_LABEL)))
                .secret(str(hash.get(F_SECRET)))
                .proxy(proxy == null || proxy.isEmpty() ? null : proxy)
                .active("1".equals(str(hash.get(F_ACTIVE))))
                .lifetimeSuccessCount(toLong(hash.get(F_SUCCESS)))
                .lifetimeErrorCount(toLong(hash.get(F_ERROR)))
                .dailyUsedCount(usage.getCount())
                .dailyDate(usage.getDate())
                .lastUsedAt(toDateTime(hash.get(F_LAST_USED)))
                .createdAt(toDateTime(hash.get(F_CREATED)))
                .updatedAt(toDateTime(hash.get(F_UPDATED)))
                .build();
    }

    private void touch(String key) {
        String now = LocalDateTime.now(clock).toString();
        redisTemplate.opsForHash().put(key, F_LAST_USED, now);
        redisTemplate.opsForHash().put(key, F_UPDATED, now);
    }

    String credentialKey(Long id) {
        return prefix + ":" + id;
    }

    String dailyKey(Long id, LocalDate date) {
        return prefix + ":" + id + ":daily:" + date;
    }

    private String idsKey() {
        return prefix + ":ids";
    }

    private static String str(Object value) {
        return value == null ? null : Objects.toString(value);
    }

    private static long toLong(Object value) {
        return value == null ? 0 : Long.parseLong(value.toString());
    }

    private static LocalDateTime toDateTime(Object value) {
        return value == null || value.toString().isEmpty() ? null : LocalDateTime.parse(value.toString());
    }
}
