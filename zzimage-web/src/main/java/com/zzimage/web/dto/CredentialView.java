package com.zzimage.web.dto;

import com.zzimage.common.dto.Credential;
import com.zzimage.common.util.CredentialMasker;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 管理端看到的凭证，令牌只展示脱敏前缀。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialView {

    private Long id;
    private String label;
    private String maskedSecret;
    private String proxy;
    private boolean active;
    private long successCount;
    private long errorCount;
    private int usedToday;
    private int remainingQuota;
    private LocalDateTime lastUsedAt;
    private LocalDateTime createdAt;

    public static CredentialView of(Credential credential, LocalDate today, int remainingQuota) {
        return CredentialView.builder()
                .id(credential.getId())
                .label(credential.getLabel())
                .maskedSecret(CredentialMasker.mask(credential.getSecret()))
                .proxy(credential.getProxy())
                .active(credential.isActive())
                .successCount(credential.getLifetimeSuccessCount())
                .errorCount(credential.getLifetimeErrorCount())
                .usedToday(credential.usedOn(today))
                .remainingQuota(remainingQuota)
                .lastUsedAt(credential.getLastUsedAt())
                .createdAt(credential.getCreatedAt())
                .build();
    }
}
