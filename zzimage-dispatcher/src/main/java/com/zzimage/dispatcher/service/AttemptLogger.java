package com.zzimage.dispatcher.service;

/**
 * 生成尝试日志接口。
 * <p>
 * 记录失败不得影响生成请求本身，编排器会捕获并忽略实现抛出的异常。
 */
public interface AttemptLogger {

    void record(AttemptRecord record);
}
