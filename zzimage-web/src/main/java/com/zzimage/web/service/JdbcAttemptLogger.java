package com.zzimage.web.service;

import com.zzimage.dispatcher.service.AttemptLogger;
import com.zzimage.dispatcher.service.AttemptRecord;
import com.zzimage.web.entity.GenerationLogEntity;
import com.zzimage.web.repository.GenerationLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 把每次凭证尝试写入 t_generation_log，供管理端查看。
 */
@Component
@RequiredArgsConstructor
public class JdbcAttemptLogger implements AttemptLogger {

    private static final DateTimeFormatter SQLITE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final GenerationLogRepository repository;
    private final Clock clock;

    @Override
    public void record(AttemptRecord record) {
        repository.save(GenerationLogEntity.builder()
                .prompt(record.getPrompt())
                .width(record.getWidth())
                .height(record.getHeight())
                .credentialId(record.getCredentialId())
                .status(record.isSuccess() ? GenerationLogEntity.STATUS_SUCCESS : GenerationLogEntity.STATUS_FAILED)
                .errorMessage(record.getErrorMessage())
                .imageUrl(record.getImageUrl())
                .latencyMs(record.getLatencyMs())
                .backendCalls(record.getBackendCalls())
                .createdAt(LocalDateTime.now(clock).format(SQLITE_FMT))
                .build());
    }
}
