package com.zzimage.common.exception;

/**
 * 凭证池耗尽异常：没有激活的凭证，或所有凭证今日额度已用完。
 * <p>
 * 与后端错误区分开，方便运维判断是"需要补充凭证"还是"后端挂了"。
 */
public class PoolExhaustedException extends ZzImageException {

    public static final String CODE = "POOL_EXHAUSTED";

    public PoolExhaustedException(String message) {
        super(CODE, message);
    }
}
