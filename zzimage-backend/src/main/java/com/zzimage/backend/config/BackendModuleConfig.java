package com.zzimage.backend.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 后端适配模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.zzimage.backend")
@EnableConfigurationProperties(BackendProperties.class)
public class BackendModuleConfig {

    /**
     * 共享的基础客户端；带代理的客户端由它派生，复用连接池和调度器。
     * 重试策略全部由编排器负责，这里关闭 OkHttp 的自动重连。
     */
    @Bean
    public OkHttpClient backendHttpClient(BackendProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .callTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .retryOnConnectionFailure(false)
                .build();
    }
}
