package com.zzimage.common.exception;

/**
 * 文生图后端单次调用失败，携带失败分类。
 */
public class BackendCallException extends ZzImageException {

    private final FailureKind kind;

    public BackendCallException(FailureKind kind, String message) {
        super("BACKEND_" + kind.name(), message);
        this.kind = kind;
    }

    public BackendCallException(FailureKind kind, String message, Throwable cause) {
        super("BACKEND_" + kind.name(), message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
