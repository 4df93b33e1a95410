package com.zzimage.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 凭证池中的一个凭证：后端访问令牌 + 可选出站代理 + 使用计数。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Credential {

    /** 凭证唯一标识 */
    private Long id;

    /** 显示名称，建议使用后端平台用户名 */
    private String label;

    /** Bearer Token，禁止出现在日志中 */
    @ToString.Exclude
    private String secret;

    /** 出站代理，如 socks5://host:port，为空表示直连 */
    private String proxy;

    @Builder.Default
    private boolean active = true;

    /** 累计成功次数 */
    private long lifetimeSuccessCount;

    /** 累计失败次数 */
    private long lifetimeErrorCount;

    /** dailyDate 当天的成功次数 */
    private int dailyUsedCount;

    /** dailyUsedCount 所属日期 */
    private LocalDate dailyDate;

    private LocalDateTime lastUsedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /**
     * 指定日期的已用次数；dailyDate 不是当天时视为 0。
     */
    public int usedOn(LocalDate today) {
        return today.equals(dailyDate) ? dailyUsedCount : 0;
    }

    public boolean hasProxy() {
        return proxy != null && !proxy.isBlank();
    }
}
