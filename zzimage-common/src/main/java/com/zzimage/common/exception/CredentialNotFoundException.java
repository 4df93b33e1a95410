package com.zzimage.common.exception;

/**
 * 指定 ID 的凭证不存在。
 */
public class CredentialNotFoundException extends ZzImageException {

    public CredentialNotFoundException(Long id) {
        super("NOT_FOUND", "凭证不存在: " + id);
    }
}
