package com.zzimage.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 凭证表。时间列按 SQLite 文本格式存储，active 用 0/1 表示。
 */
@Table("t_credential")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialEntity {

    @Id
    private Long id;

    private String label;

    @ToString.Exclude
    private String secret;

    private String proxy;

    @Builder.Default
    private Integer active = 1;

    @Builder.Default
    private Long successCount = 0L;

    @Builder.Default
    private Long errorCount = 0L;

    @Builder.Default
    private Integer dailyUsed = 0;

    /** yyyy-MM-dd */
    private String dailyDate;

    private String lastUsedAt;
    private String createdAt;
    private String updatedAt;
}
