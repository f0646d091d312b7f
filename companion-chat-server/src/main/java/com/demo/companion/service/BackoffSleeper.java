package com.demo.companion.service;

import java.time.Duration;

/**
 * Waits between completion attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration delay) throws InterruptedException;

    static BackoffSleeper threadSleep() {
        return delay -> Thread.sleep(delay.toMillis());
    }
}
