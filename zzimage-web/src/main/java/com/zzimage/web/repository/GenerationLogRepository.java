package com.zzimage.web.repository;

import com.zzimage.web.entity.GenerationLogEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface GenerationLogRepository extends CrudRepository<GenerationLogEntity, Long> {

    /** 最近的生成日志 */
    @Query("SELECT * FROM t_generation_log ORDER BY id DESC LIMIT 50")
    List<GenerationLogEntity> findRecent();
}
