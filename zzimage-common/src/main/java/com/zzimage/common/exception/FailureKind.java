package com.zzimage.common.exception;

/**
 * 后端调用失败的分类，决定编排器的重试/故障转移动作。
 */
public enum FailureKind {

    /** 后端限流（HTTP 429），同一凭证等待后重试 */
    RATE_LIMITED,

    /** 凭证无效或已过期（HTTP 401/403），切换凭证 */
    AUTH_INVALID,

    /** 请求本身有误（HTTP 400），不重试也不切换 */
    BAD_REQUEST,

    /** 网络错误、超时、代理不可用 */
    TRANSPORT,

    /** 其他非 2xx 响应或响应体异常 */
    SERVER_ERROR
}
