package com.zzimage.common.util;

/**
 * 凭证脱敏工具，日志与管理接口中只展示令牌前缀。
 */
public final class CredentialMasker {

    private static final int VISIBLE_PREFIX = 8;

    private CredentialMasker() {
    }

    public static String mask(String secret) {
        if (secret == null || secret.length() <= VISIBLE_PREFIX) return "***";
        return secret.substring(0, VISIBLE_PREFIX) + "***";
    }
}
