package com.zzimage.common.exception;

/**
 * 故障转移次数用尽仍未成功，消息中携带最后一次失败的原因。
 */
public class GenerationFailedException extends ZzImageException {

    public static final String CODE = "GENERATION_FAILED";

    public GenerationFailedException(String message) {
        super(CODE, message);
    }

    public GenerationFailedException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
