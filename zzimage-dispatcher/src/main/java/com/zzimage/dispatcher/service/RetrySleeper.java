package com.zzimage.dispatcher.service;

/**
 * 重试间隔的等待方式，测试中替换为不等待的实现。
 */
@FunctionalInterface
public interface RetrySleeper {

    RetrySleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
