package com.zzimage.common.exception;

/**
 * 请求参数越界（尺寸、提示词长度、步数等），在占用任何凭证之前抛出。
 */
public class ValidationException extends ZzImageException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }
}
