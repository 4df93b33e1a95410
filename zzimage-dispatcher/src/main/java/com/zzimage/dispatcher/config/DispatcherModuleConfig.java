package com.zzimage.dispatcher.config;

import com.zzimage.dispatcher.service.RetryPolicy;
import com.zzimage.dispatcher.service.RetrySleeper;
import com.zzimage.dispatcher.store.CredentialStore;
import com.zzimage.dispatcher.store.InMemoryCredentialStore;
import com.zzimage.dispatcher.store.RedisCredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * 调度模块自动配置。
 * <p>
 * 通过 {@code zzimage.dispatcher.storage-type} 切换凭证存储：
 * <ul>
 *   <li>{@code memory}（默认）：纯内存，重启丢失，适合测试与临时部署</li>
 *   <li>{@code jdbc}：SQLite，由 web 模块提供</li>
 *   <li>{@code redis}：Redis 实现，适合分布式多实例部署</li>
 * </ul>
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.zzimage.dispatcher")
@EnableConfigurationProperties({DispatcherProperties.class, GenerationProperties.class})
public class DispatcherModuleConfig {

    /** 判断"今天"的时钟 */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrySleeper retrySleeper() {
        return RetrySleeper.THREAD_SLEEP;
    }

    // ==================== 内存实现（默认） ====================

    @Bean
    @ConditionalOnProperty(name = "zzimage.dispatcher.storage-type", havingValue = "memory", matchIfMissing = true)
    public CredentialStore inMemoryCredentialStore(Clock clock) {
        log.info("使用内存凭证存储（重启后数据丢失）");
        return new InMemoryCredentialStore(clock);
    }

    // ==================== Redis 实现 ====================

    @Bean
    @ConditionalOnProperty(name = "zzimage.dispatcher.storage-type", havingValue = "redis")
    public CredentialStore redisCredentialStore(StringRedisTemplate redisTemplate,
                                                DispatcherProperties properties, Clock clock) {
        log.info("使用 Redis 凭证存储（分布式模式）");
        return new RedisCredentialStore(redisTemplate, properties, clock);
    }
}
