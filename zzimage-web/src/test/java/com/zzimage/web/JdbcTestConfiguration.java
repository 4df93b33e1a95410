package com.zzimage.web;

import com.zzimage.web.config.SqliteDialect;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.context.annotation.Bean;
import org.springframework.data.relational.core.dialect.Dialect;

/**
 * 持久层切片测试的启动配置：只注册 SQLite 方言，实体与仓库从本包向下扫描。
 */
@SpringBootConfiguration
@AutoConfigurationPackage
public class JdbcTestConfiguration {

    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }
}
