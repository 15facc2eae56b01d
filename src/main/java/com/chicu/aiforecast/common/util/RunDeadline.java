package com.chicu.aiforecast.common.util;

import java.time.Duration;

/**
 * Дедлайн прогона. Кооперативная отмена: коннекторы проверяют его перед ретраями.
 */
public final class RunDeadline {

    private final long deadlineNanos;

    private RunDeadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static RunDeadline after(Duration timeout) {
        long nanos = Math.max(0L, timeout.toNanos());
        return new RunDeadline(System.nanoTime() + nanos);
    }

    public long remainingMs() {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? 0L : Duration.ofNanos(left).toMillis();
    }

    public boolean expired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * true, если прогон отменён: дедлайн вышел или поток прерван.
     */
    public boolean cancelled() {
        return expired() || Thread.currentThread().isInterrupted();
    }
}
