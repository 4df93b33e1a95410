package com.zzimage.web.config;

import com.zzimage.dispatcher.store.CredentialStore;
import com.zzimage.web.repository.CredentialRepository;
import com.zzimage.web.store.JdbcCredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;

import java.time.Clock;

/**
 * Web 模块配置：SQLite 方言与持久化凭证存储。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.zzimage.web")
public class WebModuleConfig {

    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }

    /**
     * SQLite 凭证存储，{@code zzimage.dispatcher.storage-type=jdbc} 时启用。
     */
    @Bean
    @ConditionalOnProperty(name = "zzimage.dispatcher.storage-type", havingValue = "jdbc")
    public CredentialStore jdbcCredentialStore(CredentialRepository repository, Clock clock) {
        log.info("使用 SQLite 凭证存储（持久化）");
        return new JdbcCredentialStore(repository, clock);
    }
}
