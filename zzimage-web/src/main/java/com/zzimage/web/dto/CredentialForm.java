package com.zzimage.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 新增/修改凭证的请求体。修改时为空的字段保持原值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialForm {

    private String label;

    @ToString.Exclude
    private String secret;

    /** 空字符串表示清除代理 */
    private String proxy;

    private Boolean active;
}
