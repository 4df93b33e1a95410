package com.zzimage.web.repository;

import com.zzimage.web.entity.CredentialEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface CredentialRepository extends CrudRepository<CredentialEntity, Long> {

    /** 激活凭证，按累计成功次数升序 */
    @Query("SELECT * FROM t_credential WHERE active = 1 ORDER BY success_count ASC, id ASC")
    List<CredentialEntity> findActive();

    @Query("SELECT * FROM t_credential ORDER BY id DESC")
    List<CredentialEntity> findAllNewestFirst();

    /**
     * 成功 +1。跨天时今日计数从 1 重新开始，单条 UPDATE 保证原子性。
     */
    @Modifying
    @Query("UPDATE t_credential SET success_count = success_count + 1, "
            + "daily_used = CASE WHEN daily_date = :today THEN daily_used + 1 ELSE 1 END, "
            + "daily_date = :today, last_used_at = :now, updated_at = :now WHERE id = :id")
    int incrementSuccess(Long id, String today, String now);

    /** 失败 +1，跨天时今日计数清零 */
    @Modifying
    @Query("UPDATE t_credential SET error_count = error_count + 1, "
            + "daily_used = CASE WHEN daily_date = :today THEN daily_used ELSE 0 END, "
            + "daily_date = :today, last_used_at = :now, updated_at = :now WHERE id = :id")
    int incrementFailure(Long id, String today, String now);

    /** 只更新资料字段，不覆盖计数 */
    @Modifying
    @Query("UPDATE t_credential SET label = :label, secret = :secret, proxy = :proxy, "
            + "active = :active, updated_at = :now WHERE id = :id")
    int updateProfile(Long id, String label, String secret, String proxy, int active, String now);
}
