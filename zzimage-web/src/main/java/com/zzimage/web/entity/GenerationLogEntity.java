package com.zzimage.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 生成日志：每个凭证尝试一条。
 */
@Table("t_generation_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationLogEntity {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    @Id
    private Long id;

    private String prompt;
    private Integer width;
    private Integer height;
    private Long credentialId;

    /** success / failed */
    private String status;

    private String errorMessage;
    private String imageUrl;
    private Long latencyMs;
    private Integer backendCalls;
    private String createdAt;
}
