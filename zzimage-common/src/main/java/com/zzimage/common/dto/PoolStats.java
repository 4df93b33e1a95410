package com.zzimage.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 凭证池统计信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStats {

    private int total;
    private int active;
    private int inactive;
    private long totalUses;
    private long totalErrors;

    /** totalErrors / totalUses，无使用记录时为 0 */
    private double errorRate;

    /** 单个凭证每日额度 */
    private int dailyQuota;

    /** 所有激活凭证今日剩余额度之和 */
    private long remainingQuotaToday;
}
