package com.zzimage.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度中心配置项。
 */
@Data
@ConfigurationProperties(prefix = "zzimage.dispatcher")
public class DispatcherProperties {

    /** 凭证存储类型: memory（内存） / jdbc（SQLite） / redis（分布式） */
    private String storageType = "memory";

    /** 每个凭证每天可成功使用的次数 */
    private int dailyQuota = 100;

    /** 激活凭证列表的缓存时间（秒） */
    private int cacheTtlSeconds = 30;

    /** 同一凭证上的最大尝试次数（限流、网络错误时重试） */
    private int maxRetries = 3;

    /** 重试基础间隔（毫秒），第 n 次重试前等待 n 倍 */
    private long retryDelayMillis = 1000;

    /** 单个请求最多尝试的凭证数 */
    private int maxCredentialRetries = 3;

    /** 累计失败次数达到该值时告警，提示检查凭证 */
    private int errorWarnThreshold = 10;

    /** 凭证池健康报告间隔（秒） */
    private int statsReportIntervalSeconds = 300;

    /** Redis 存储的 key 前缀 */
    private String redisKeyPrefix = "zzimage:credential";
}
