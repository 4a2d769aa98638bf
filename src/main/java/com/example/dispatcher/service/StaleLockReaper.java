package com.example.dispatcher.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 崩溃恢复：解锁持有时间超过阈值的作业。只在显式要求时执行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleLockReaper {

    private final JobStore store;

    public int reap(long thresholdSeconds) {
        if (thresholdSeconds <= 0) {
            throw new IllegalArgumentException("Unlock threshold must be positive: " + thresholdSeconds);
        }
        int unlocked = store.unlockStale(thresholdSeconds);
        if (unlocked > 0) {
            log.warn("Unlocked {} job(s) locked for more than {}s", unlocked, thresholdSeconds);
        } else {
            log.info("No job locked for more than {}s", thresholdSeconds);
        }
        return unlocked;
    }
}
