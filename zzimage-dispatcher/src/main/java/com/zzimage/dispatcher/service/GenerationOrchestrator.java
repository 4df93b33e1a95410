package com.zzimage.dispatcher.service;

import com.zzimage.backend.client.ImageBackend;
import com.zzimage.common.dto.Credential;
import com.zzimage.common.dto.GenerationRequest;
import com.zzimage.common.dto.GenerationResult;
import com.zzimage.common.dto.ImageRequest;
import com.zzimage.common.dto.ImageResult;
import com.zzimage.common.exception.BackendCallException;
import com.zzimage.common.exception.FailureKind;
import com.zzimage.common.exception.GenerationFailedException;
import com.zzimage.common.exception.PoolExhaustedException;
import com.zzimage.common.exception.ZzImageException;
import com.zzimage.dispatcher.config.DispatcherProperties;
import com.zzimage.dispatcher.pool.CredentialPoolScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 生成编排服务：一次生成请求 -> 若干次后端调用。
 * <p>
 * 两层循环：
 * - 外层：凭证故障转移，最多 maxCredentialRetries 个凭证，本次请求中放弃过的凭证不再选择
 * - 内层：同一凭证重试，最多 maxRetries 次，第 n 次重试前等待 n × retryDelayMillis
 * <p>
 * 失败分类对应的动作见 {@link RetryPolicy}。每个凭证尝试结束时恰好记录一次使用结果、写一条尝试日志；
 * 被内层吸收的限流/网络重试不单独记录。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationOrchestrator {

    private final CredentialPoolScheduler scheduler;
    private final ImageBackend backend;
    private final GenerationRequestValidator validator;
    private final RetryPolicy retryPolicy;
    private final RetrySleeper sleeper;
    private final List<AttemptLogger> attemptLoggers;
    private final DispatcherProperties properties;

    /**
     * 生成图片，所有业务失败都折叠为 {@link GenerationResult#failure}。
     */
    public GenerationResult generate(GenerationRequest request) {
        try {
            return GenerationResult.ok(generateOrThrow(request));
        } catch (ZzImageException e) {
            log.warn("生成失败: [{}] {}", e.getErrorCode(), e.getMessage());
            return GenerationResult.failure(e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * 生成图片，失败时抛出分类异常。
     *
     * @throws com.zzimage.common.exception.ValidationException 参数越界，未占用任何凭证
     * @throws PoolExhaustedException                           没有可用凭证
     * @throws BackendCallException                             请求被后端判定为参数错误
     * @throws GenerationFailedException                        所有凭证尝试均失败
     */
    public ImageResult generateOrThrow(GenerationRequest request) {
        ImageRequest imageRequest = validator.validate(request);

        int maxCredentials = Math.max(1, properties.getMaxCredentialRetries());
        Set<Long> abandoned = new HashSet<>();
        BackendCallException lastFailure = null;

        for (int round = 1; round <= maxCredentials; round++) {
            Optional<Credential> selected = scheduler.selectCredential(abandoned);
            if (selected.isEmpty()) {
                if (lastFailure == null) {
                    throw new PoolExhaustedException("没有可用的凭证，请添加凭证或等待额度重置");
                }
                log.warn("没有更多可切换的凭证 (已尝试 {} 个)", abandoned.size());
                break;
            }

            Credential credential = selected.get();
            CredentialAttempt attempt = attemptWith(credential, imageRequest);
            settle(credential, imageRequest, attempt);

            if (attempt.image != null) {
                return attempt.image;
            }

            lastFailure = attempt.failure;
            if (attempt.action == RetryPolicy.Action.ABORT) {
                throw attempt.failure;
            }

            abandoned.add(credential.getId());
            log.warn("凭证故障转移 {}/{}: {}", round, maxCredentials, lastFailure.getMessage());
        }

        throw new GenerationFailedException("所有凭证均失败: " + lastFailure.getMessage(), lastFailure);
    }

    /**
     * 内层循环：在同一个凭证上调用后端，直到成功或得到终止动作。
     */
    private CredentialAttempt attemptWith(Credential credential, ImageRequest imageRequest) {
        int maxRetries = Math.max(1, properties.getMaxRetries());
        long start = System.currentTimeMillis();

        for (int call = 1; ; call++) {
            BackendCallException failure;
            try {
                ImageResult image = backend.generate(credential, imageRequest);
                return CredentialAttempt.success(image, call, System.currentTimeMillis() - start);
            } catch (BackendCallException e) {
                failure = e;
            } catch (RuntimeException e) {
                log.error("后端调用出现未预期异常", e);
                failure = new BackendCallException(FailureKind.SERVER_ERROR, "内部错误: " + e.getMessage(), e);
            }

            long elapsed = System.currentTimeMillis() - start;
            RetryPolicy.Action action = retryPolicy.actionFor(failure.getKind());
            if (action != RetryPolicy.Action.RETRY_SAME) {
                return CredentialAttempt.failure(failure, action, call, elapsed);
            }
            if (call >= maxRetries) {
                log.warn("凭证 {} 重试 {} 次仍失败: {}", credential.getLabel(), call, failure.getMessage());
                return CredentialAttempt.failure(failure, retryPolicy.onRetriesExhausted(failure.getKind()), call, elapsed);
            }

            long delay = properties.getRetryDelayMillis() * call;
            log.warn("{}，{}ms 后重试 (尝试 {}/{})", failure.getMessage(), delay, call, maxRetries);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                BackendCallException interrupted = new BackendCallException(
                        FailureKind.TRANSPORT, "等待重试时被中断", e);
                return CredentialAttempt.failure(interrupted, RetryPolicy.Action.ABORT, call,
                        System.currentTimeMillis() - start);
            }
        }
    }

    /**
     * 记录凭证使用结果并写尝试日志。记账或日志失败不影响返回结果。
     */
    private void settle(Credential credential, ImageRequest imageRequest, CredentialAttempt attempt) {
        boolean success = attempt.image != null;
        try {
            scheduler.recordOutcome(credential.getId(), success);
        } catch (RuntimeException e) {
            log.error("记录凭证 {} 使用结果失败", credential.getId(), e);
        }

        AttemptRecord record = AttemptRecord.builder()
                .prompt(imageRequest.getPrompt())
                .width(imageRequest.getWidth())
                .height(imageRequest.getHeight())
                .credentialId(credential.getId())
                .success(success)
                .errorMessage(success ? null : attempt.failure.getMessage())
                .imageUrl(success ? attempt.image.getImageUrl() : null)
                .latencyMs(attempt.latencyMs)
                .backendCalls(attempt.calls)
                .build();
        for (AttemptLogger attemptLogger : attemptLoggers) {
            try {
                attemptLogger.record(record);
            } catch (RuntimeException e) {
                log.warn("尝试日志写入失败（不影响返回）: {}", e.getMessage());
            }
        }
    }

    /**
     * 单个凭证上的尝试结果：成功带图片，失败带异常和后续动作。
     */
    private static final class CredentialAttempt {

        private final ImageResult image;
        private final BackendCallException failure;
        private final RetryPolicy.Action action;
        private final int calls;
        private final long latencyMs;

        private CredentialAttempt(ImageResult image, BackendCallException failure,
                                  RetryPolicy.Action action, int calls, long latencyMs) {
            this.image = image;
            this.failure = failure;
            this.action = action;
            this.calls = calls;
            this.latencyMs = latencyMs;
        }

        static CredentialAttempt success(ImageResult image, int calls, long latencyMs) {
            return new CredentialAttempt(image, null, null, calls, latencyMs);
        }

        static CredentialAttempt failure(BackendCallException failure, RetryPolicy.Action action,
                                         int calls, long latencyMs) {
            return new CredentialAttempt(null, failure, action, calls, latencyMs);
        }
    }
}
