package com.zzimage.dispatcher.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 把每次凭证尝试写成一行审计日志（logger 名称 zzimage.attempts，可单独输出到文件）。
 */
@Slf4j(topic = "zzimage.attempts")
@Component
public class LoggingAttemptLogger implements AttemptLogger {

    private static final int PROMPT_PREVIEW = 50;

    @Override
    public void record(AttemptRecord record) {
        if (record.isSuccess()) {
            log.info("status=success credential={} size={}x{} calls={} latency={}ms prompt=\"{}\"",
                    record.getCredentialId(), record.getWidth(), record.getHeight(),
                    record.getBackendCalls(), record.getLatencyMs(), preview(record.getPrompt()));
        } else {
            log.info("status=failed credential={} size={}x{} calls={} latency={}ms error=\"{}\"",
                    record.getCredentialId(), record.getWidth(), record.getHeight(),
                    record.getBackendCalls(), record.getLatencyMs(), record.getErrorMessage());
        }
    }

    private static String preview(String prompt) {
        if (prompt == null) return "";
        return prompt.length() > PROMPT_PREVIEW ? prompt.substring(0, PROMPT_PREVIEW) + "..." : prompt;
    }
}
