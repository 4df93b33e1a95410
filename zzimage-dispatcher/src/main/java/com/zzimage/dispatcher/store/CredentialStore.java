package com.zzimage.dispatcher.store;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.DailyUsage;

import java.util.List;
import java.util.Optional;

/**
 * 凭证存储接口。
 * <p>
 * 提供三种实现：
 * - {@link InMemoryCredentialStore}：内存实现，适合测试与轻量部署
 * - {@link RedisCredentialStore}：Redis 实现，适合分布式多实例部署
 * - SQLite 实现位于 web 模块，重启后数据不丢失
 * <p>
 * 所有计数更新必须对单个凭证原子执行；"今天"以注入的 {@link java.time.Clock} 为准。
 */
public interface CredentialStore {

    /** 所有激活凭证，按累计成功次数升序 */
    List<Credential> listActiveCredentials();

    /** 所有凭证（管理视图），新建的在前 */
    List<Credential> listAll();

    Optional<Credential> get(Long id);

    /**
     * 今日使用量。记录的日期不是今天时返回 (0, 今天)。
     */
    DailyUsage dailyUsage(Long id);

    /** 累计成功 +1，今日使用 +1（跨天先清零） */
    void incrementSuccess(Long id);

    /** 累计失败 +1，不占用每日额度 */
    void incrementFailure(Long id);

    /** 新增凭证，返回 ID */
    Long create(String label, String secret, String proxy);

    /** 更新名称、令牌、代理、激活状态，不修改计数 */
    boolean update(Credential credential);

    boolean delete(Long id);
}
