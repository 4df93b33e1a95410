package com.zzimage.dispatcher.service;

import com.zzimage.common.exception.FailureKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * 失败分类到编排动作的映射表。
 *
 * <pre>
 * RATE_LIMITED  -> RETRY_SAME   同一凭证等待后重试
 * TRANSPORT     -> RETRY_SAME   同一凭证等待后重试
 * AUTH_INVALID  -> FAILOVER     记失败，换凭证
 * SERVER_ERROR  -> FAILOVER     记失败，换凭证
 * BAD_REQUEST   -> ABORT        记失败，直接返回错误
 * </pre>
 * RETRY_SAME 在同一凭证上次数用尽后按 FAILOVER 处理。
 */
public class RetryPolicy {

    public enum Action {
        /** 同一凭证上重试 */
        RETRY_SAME,
        /** 放弃当前凭证，换下一个 */
        FAILOVER,
        /** 请求本身有问题，终止整个请求 */
        ABORT
    }

    private final Map<FailureKind, Action> actions = new EnumMap<>(FailureKind.class);

    public RetryPolicy() {
        actions.put(FailureKind.RATE_LIMITED, Action.RETRY_SAME);
        actions.put(FailureKind.TRANSPORT, Action.RETRY_SAME);
        actions.put(FailureKind.AUTH_INVALID, Action.FAILOVER);
        actions.put(FailureKind.SERVER_ERROR, Action.FAILOVER);
        actions.put(FailureKind.BAD_REQUEST, Action.ABORT);
    }

    public Action actionFor(FailureKind kind) {
        return actions.getOrDefault(kind, Action.FAILOVER);
    }

    /**
     * 同一凭证上的尝试次数用尽后的动作。
     */
    public Action onRetriesExhausted(FailureKind kind) {
        Action action = actionFor(kind);
        return action == Action.RETRY_SAME ? Action.FAILOVER : action;
    }
}
